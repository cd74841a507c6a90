package pxefleet.runner.remote;

/**
 * Progress callbacks from {@link RemoteExecutor}, invoked on the worker thread.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() {
    };

    /** Channel is open, commands are about to run. */
    default void onConnected() {
    }

    /**
     * A command exited successfully.
     *
     * @param index 1-based position among the instructions
     * @param total number of instructions
     */
    default void onCommandCompleted(int index, int total) {
    }
}
