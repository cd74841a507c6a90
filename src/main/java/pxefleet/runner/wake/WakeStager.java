package pxefleet.runner.wake;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.model.Host;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort wake of an operation's hosts before dispatch. Whether a host
 * actually came up is only learned when its session connects.
 */
public class WakeStager {

    private static final Logger log = LoggerFactory.getLogger(WakeStager.class);

    private final WakeOnLanSender sender;

    public WakeStager(WakeOnLanSender sender) {
        this.sender = sender;
    }

    public WakeResult wake(List<Host> hosts) {
        int sent = 0;
        List<String> failed = new ArrayList<>();

        for (Host host : hosts) {
            if (!MagicPacket.isValidMac(host.macAddress())) {
                log.warn("Cannot wake {}: invalid MAC address '{}'", host.hostname(), host.macAddress());
                failed.add(host.hostname());
                continue;
            }
            try {
                sender.send(host.macAddress());
                sent++;
            } catch (IOException e) {
                log.warn("Cannot wake {}: {}", host.hostname(), e.getMessage());
                failed.add(host.hostname());
            }
        }

        log.info("Wake-on-LAN: {} sent, {} failed", sent, failed.size());
        return new WakeResult(sent, failed);
    }

    /** End of the wait window that starts now. */
    public Instant readyAt(Instant now, int delaySeconds) {
        return now.plus(Duration.ofSeconds(Math.max(0, delaySeconds)));
    }
}
