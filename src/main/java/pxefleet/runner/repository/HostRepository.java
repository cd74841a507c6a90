package pxefleet.runner.repository;

import pxefleet.runner.model.Host;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the host records the runner resolves targets
 * against. Host management itself lives elsewhere; this view is read-mostly.
 */
public interface HostRepository {

    /**
     * Insert or replace a host.
     *
     * @param host the host to save
     */
    void save(Host host);

    /**
     * Find a host by ID.
     *
     * @param hostId the host ID
     * @return the host if found
     */
    Optional<Host> findById(String hostId);

    /**
     * Find a host by hostname.
     *
     * @param hostname the hostname
     * @return the host if found
     */
    Optional<Host> findByHostname(String hostname);

    /**
     * Find hosts by ID. Unknown IDs are skipped.
     *
     * @param hostIds the host IDs
     * @return hosts ordered by hostname
     */
    List<Host> findByIds(Collection<String> hostIds);

    /**
     * Find all hosts in a room.
     *
     * @param room the room name
     * @return hosts ordered by hostname
     */
    List<Host> findByRoom(String room);

    /**
     * Find all hosts in a group.
     *
     * @param group the group name
     * @return hosts ordered by hostname
     */
    List<Host> findByGroup(String group);
}
