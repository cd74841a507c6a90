package pxefleet.runner.fakes;

import pxefleet.runner.wake.WakeOnLanSender;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records MAC addresses instead of sending packets.
 */
public class FakeWakeOnLanSender implements WakeOnLanSender {

    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public FakeWakeOnLanSender failing() {
        this.failing = true;
        return this;
    }

    @Override
    public void send(String macAddress) throws IOException {
        if (failing) {
            throw new IOException("network unreachable");
        }
        sent.add(macAddress);
    }

    public List<String> sent() {
        return sent;
    }
}
