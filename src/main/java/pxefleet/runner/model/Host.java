package pxefleet.runner.model;

import java.util.Objects;

/**
 * Client machine as far as the runner needs it: identity, addresses, and the
 * room and group selectors used to resolve operation targets.
 */
public record Host(
        String id,
        String hostname,
        String macAddress,
        String ipAddress,
        String room,
        String group) {

    public Host {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(hostname, "hostname is required");
    }

    /** Address to open a remote channel to: the IP when known, else the hostname. */
    public String address() {
        return ipAddress != null && !ipAddress.isBlank() ? ipAddress : hostname;
    }
}
