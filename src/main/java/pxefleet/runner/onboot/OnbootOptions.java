package pxefleet.runner.onboot;

/**
 * Flags prepended to a deferred command string when not already present.
 *
 * @param noauto     skip the client's automatic functions
 * @param disablegui keep the client GUI disabled while commands run
 */
public record OnbootOptions(boolean noauto, boolean disablegui) {

    public static OnbootOptions none() {
        return new OnbootOptions(false, false);
    }
}
