package pxefleet.runner.remote;

/**
 * Opens secure remote-shell channels to client hosts.
 */
public interface RemoteShell {

    /**
     * Connect and authenticate to a host.
     *
     * @param address IP address or resolvable hostname
     * @return an open channel; the caller closes it
     * @throws RemoteConnectionException if the host is unreachable or rejects
     *                                   the credentials
     */
    RemoteChannel open(String address) throws RemoteConnectionException;
}
