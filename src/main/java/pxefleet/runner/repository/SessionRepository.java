package pxefleet.runner.repository;

import pxefleet.runner.model.Session;
import pxefleet.runner.model.SessionOutcome;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Session persistence.
 * A terminal session is never updated again; every write below is guarded by
 * the current status.
 */
public interface SessionRepository {

    /**
     * Save a new session.
     *
     * @param session the session to save
     */
    void save(Session session);

    /**
     * Find a session by ID.
     *
     * @param sessionId the session ID
     * @return the session if found
     */
    Optional<Session> findById(String sessionId);

    /**
     * Find all sessions of an operation.
     *
     * @param operationId the operation ID
     * @return sessions ordered by creation
     */
    List<Session> findByOperationId(String operationId);

    /**
     * Find the non-terminal session holding a host, if any.
     *
     * @param hostId the host ID
     * @return the active session for this host
     */
    Optional<Session> findActiveByHostId(String hostId);

    /**
     * Claim a PENDING session for execution: CONNECTING, start time and
     * heartbeat stamped.
     *
     * @param sessionId the session ID
     * @return true if the session was PENDING
     */
    boolean markConnecting(String sessionId);

    /**
     * Move a CONNECTING session to RUNNING.
     *
     * @param sessionId the session ID
     * @return true if updated
     */
    boolean markRunning(String sessionId);

    /**
     * Record per-command progress of a RUNNING session.
     *
     * @param sessionId the session ID
     * @param progress  0..100
     * @return true if updated
     */
    boolean updateProgress(String sessionId, int progress);

    /**
     * Refresh the heartbeat of sessions executing in this process.
     *
     * @param sessionIds in-flight session IDs
     * @return number of sessions touched
     */
    int touchHeartbeats(Collection<String> sessionIds);

    /**
     * Write a terminal outcome.
     *
     * @param sessionId the session ID
     * @param outcome   terminal outcome
     * @return true if the session was not yet terminal
     */
    boolean finish(String sessionId, SessionOutcome outcome);

    /**
     * Find CONNECTING or RUNNING sessions whose heartbeat is older than the
     * cutoff. Used by the reaper after crashes.
     *
     * @param heartbeatBefore sessions with an older heartbeat are stale
     * @return stale sessions
     */
    List<Session> findStale(Instant heartbeatBefore);

    /**
     * Cancel every session of an operation that has not started yet.
     *
     * @param operationId the operation ID
     * @return the sessions that were cancelled
     */
    List<Session> cancelNotStarted(String operationId);
}
