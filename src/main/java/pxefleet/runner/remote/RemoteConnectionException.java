package pxefleet.runner.remote;

import java.io.IOException;

/**
 * The remote channel could not be opened: host unreachable, connect timeout
 * or authentication failure. No command was attempted.
 */
public class RemoteConnectionException extends IOException {

    private final String address;

    public RemoteConnectionException(String address, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    public RemoteConnectionException(String address, String message) {
        this(address, message, null);
    }

    public String address() {
        return address;
    }
}
