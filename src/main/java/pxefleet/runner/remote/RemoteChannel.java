package pxefleet.runner.remote;

import java.io.IOException;
import java.time.Duration;

/**
 * An authenticated connection to one host that runs one command at a time.
 * {@link #close()} may be called from another thread to abort a running
 * command.
 */
public interface RemoteChannel extends AutoCloseable {

    /**
     * Run a command and wait for its exit status.
     *
     * @param command shell command line
     * @param timeout maximum time to wait for the exit status
     * @return exit status and captured output
     * @throws RemoteCommandTimeoutException if the command did not finish in time
     * @throws IOException                   if the channel broke or was closed
     */
    CommandResult run(String command, Duration timeout) throws IOException;

    @Override
    void close();
}
