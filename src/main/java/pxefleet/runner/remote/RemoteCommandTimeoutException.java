package pxefleet.runner.remote;

import java.io.IOException;
import java.time.Duration;

/**
 * A remote command did not exit within its timeout.
 */
public class RemoteCommandTimeoutException extends IOException {

    private final Duration timeout;

    public RemoteCommandTimeoutException(String command, Duration timeout) {
        super("Command '" + command + "' timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
