package pxefleet.runner.model;

/**
 * Dispatch options of an operation.
 *
 * @param wakeOnLan        send magic packets before dispatch
 * @param wakeDelaySeconds how long to wait after waking before dispatch
 * @param deferred         write onboot records instead of executing now
 */
public record OperationOptions(boolean wakeOnLan, int wakeDelaySeconds, boolean deferred) {

    public OperationOptions {
        if (wakeDelaySeconds < 0) {
            throw new ValidationException("wakeDelaySeconds must not be negative");
        }
    }

    public static OperationOptions immediate() {
        return new OperationOptions(false, 0, false);
    }
}
