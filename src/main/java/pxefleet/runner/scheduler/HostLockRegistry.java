package pxefleet.runner.scheduler;

import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process busy-host set: host id to the session currently holding it.
 * Shared by the coordinator, which claims, and the workers, which release.
 */
public final class HostLockRegistry {

    private final ConcurrentHashMap<String, String> holders = new ConcurrentHashMap<>();

    /**
     * Claim a free host.
     *
     * @return true if the host was free or already held by this session
     */
    public boolean tryClaim(String hostId, String sessionId) {
        String holder = holders.putIfAbsent(hostId, sessionId);
        return holder == null || holder.equals(sessionId);
    }

    /** Release only if this session still holds the host. */
    public boolean release(String hostId, String sessionId) {
        return holders.remove(hostId, sessionId);
    }

    public int size() {
        return holders.size();
    }
}
