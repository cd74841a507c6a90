package pxefleet.runner.wake;

import java.io.IOException;

/**
 * Sends wake signals to hardware addresses.
 */
public interface WakeOnLanSender extends AutoCloseable {

    /**
     * Queue magic packets for one MAC address. Implementations must not block
     * on delivery; a whole room is woken from the coordinator thread.
     *
     * @param macAddress target hardware address
     * @throws IOException if the packets could not be queued
     */
    void send(String macAddress) throws IOException;

    @Override
    default void close() {
    }
}
