package pxefleet.runner.wake;

import java.util.List;

/**
 * Outcome of waking a set of hosts. Delivery is not confirmed; {@code sent}
 * only means the packets were queued on the socket.
 *
 * @param sent        hosts whose packets were queued
 * @param failedHosts hostnames with a missing or invalid MAC, or a send error
 */
public record WakeResult(int sent, List<String> failedHosts) {

    public WakeResult {
        failedHosts = List.copyOf(failedHosts);
    }

    public int failed() {
        return failedHosts.size();
    }
}
