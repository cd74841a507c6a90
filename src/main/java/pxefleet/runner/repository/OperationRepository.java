package pxefleet.runner.repository;

import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationStats;
import pxefleet.runner.model.OperationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Operation persistence.
 * Status changes only ever move forward; every transition method is a no-op
 * (returning false) when the stored status does not allow it.
 */
public interface OperationRepository {

    /**
     * Save a new operation.
     *
     * @param operation the operation to save
     */
    void save(Operation operation);

    /**
     * Find an operation by ID.
     *
     * @param operationId the operation ID
     * @return the operation if found
     */
    Optional<Operation> findById(String operationId);

    /**
     * Find all non-terminal operations, oldest first.
     *
     * @return operations in PENDING, WAKING or RUNNING
     */
    List<Operation> findActive();

    /**
     * Find operations by status, newest first.
     *
     * @param status the status to filter by
     * @param limit  maximum number of results
     * @return list of operations
     */
    List<Operation> findByStatus(OperationStatus status, int limit);

    /**
     * Get recent operations for display.
     *
     * @param limit maximum results
     * @return operations ordered by creation time, newest first
     */
    List<Operation> findRecent(int limit);

    /**
     * Move an operation to WAKING and record when dispatch may begin.
     *
     * @param operationId the operation ID
     * @param wakeUntil   end of the wake window
     * @return true if the operation was PENDING and is now WAKING
     */
    boolean markWaking(String operationId, Instant wakeUntil);

    /**
     * Move an operation to RUNNING and stamp its start time.
     *
     * @param operationId the operation ID
     * @return true if the operation was PENDING or WAKING
     */
    boolean markRunning(String operationId);

    /**
     * Move an operation to a terminal status with its final accounting.
     *
     * @param operationId the operation ID
     * @param status      terminal status
     * @param stats       final per-host accounting
     * @return true if the operation was still active
     */
    boolean markFinished(String operationId, OperationStatus status, OperationStats stats);

    /**
     * Persist the current per-host accounting of an active operation.
     *
     * @param operationId the operation ID
     * @param stats       accounting derived from its sessions
     * @return true if updated
     */
    boolean updateProgress(String operationId, OperationStats stats);

    /**
     * Count one more poll in which at least one target host was busy.
     *
     * @param operationId the operation ID
     * @return the new busy-poll count
     */
    int incrementBusyPolls(String operationId);

    /**
     * Flag an active operation as cancelled by request.
     *
     * @param operationId the operation ID
     * @return true if the operation was active
     */
    boolean requestCancel(String operationId);
}
