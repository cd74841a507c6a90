package pxefleet.runner.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.command.CommandParser;
import pxefleet.runner.command.CommandPlan;
import pxefleet.runner.events.EventType;
import pxefleet.runner.events.ProgressBroadcaster;
import pxefleet.runner.events.ProgressEvent;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationOptions;
import pxefleet.runner.model.OperationStatus;
import pxefleet.runner.model.Session;
import pxefleet.runner.model.SessionStatus;
import pxefleet.runner.repository.OperationRepository;
import pxefleet.runner.repository.SessionRepository;
import pxefleet.runner.scheduler.SessionScheduler;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Business logic for operation intake: validation, target resolution,
 * lookup, cancellation and retry. Execution itself belongs to the
 * {@link SessionScheduler}.
 */
public class OperationService {

    private static final Logger log = LoggerFactory.getLogger(OperationService.class);

    private final OperationRepository operationRepository;
    private final SessionRepository sessionRepository;
    private final TargetResolver targetResolver;
    private final SessionScheduler scheduler;
    private final ProgressBroadcaster broadcaster;

    public OperationService(OperationRepository operationRepository, SessionRepository sessionRepository,
            TargetResolver targetResolver, SessionScheduler scheduler, ProgressBroadcaster broadcaster) {
        this.operationRepository = operationRepository;
        this.sessionRepository = sessionRepository;
        this.targetResolver = targetResolver;
        this.scheduler = scheduler;
        this.broadcaster = broadcaster;
    }

    /**
     * Validate and store a new operation in PENDING.
     *
     * @param request targets, command string and options
     * @return the created operation
     * @throws pxefleet.runner.model.ValidationException on a malformed command
     *                                                   string or an unknown target;
     *                                                   nothing is stored then
     */
    public Operation submit(OperationRequest request) {
        CommandPlan plan = CommandParser.parse(request.commands());
        OperationOptions options = request.toOptions();
        List<Host> targets = targetResolver.resolve(request);

        return create(targets.stream().map(Host::id).toList(), plan, options);
    }

    /**
     * Parse a command string without scheduling anything.
     *
     * @throws pxefleet.runner.command.InvalidCommandSyntaxException if invalid
     */
    public CommandPlan validate(String commands) {
        return CommandParser.parse(commands);
    }

    public Optional<Operation> findById(String operationId) {
        return operationRepository.findById(operationId);
    }

    /**
     * List operations, newest first.
     *
     * @param status optional status filter
     * @param limit  maximum results
     */
    public List<Operation> list(OperationStatus status, int limit) {
        if (status != null) {
            return operationRepository.findByStatus(status, limit);
        }
        return operationRepository.findRecent(limit);
    }

    public List<Session> getSessions(String operationId) {
        return sessionRepository.findByOperationId(operationId);
    }

    /**
     * Cancel an operation.
     *
     * @throws NoSuchElementException if not found
     * @throws IllegalStateException  if already finished
     */
    public Operation cancel(String operationId) {
        return scheduler.cancel(operationId);
    }

    /**
     * Create a new operation with the same commands and options, targeting
     * only the hosts whose sessions failed.
     *
     * @throws NoSuchElementException if not found
     * @throws IllegalStateException  if the operation is still active or none
     *                                of its failed hosts still exist
     */
    public Operation retry(String operationId) {
        Operation original = operationRepository.findById(operationId)
                .orElseThrow(() -> new NoSuchElementException("Operation not found: " + operationId));
        if (!original.isTerminal()) {
            throw new IllegalStateException("Operation " + operationId + " is still " + original.status().wireName());
        }

        List<String> failedHosts = sessionRepository.findByOperationId(operationId).stream()
                .filter(s -> s.status() == SessionStatus.FAILED)
                .map(Session::hostId)
                .distinct()
                .toList();
        if (failedHosts.isEmpty()) {
            throw new IllegalStateException("Operation " + operationId + " has no failed hosts");
        }

        List<String> known = targetResolver.existing(failedHosts).stream().map(Host::id).toList();
        if (known.isEmpty()) {
            throw new IllegalStateException("None of the failed hosts of operation " + operationId + " still exist");
        }
        if (known.size() < failedHosts.size()) {
            log.warn("Operation {}: skipping {} deleted hosts on retry", operationId,
                    failedHosts.size() - known.size());
        }

        Operation retry = create(known, original.plan(), original.options());
        log.info("Operation {} retries {} failed hosts of {}", retry.id(), known.size(), operationId);
        return retry;
    }

    private Operation create(List<String> hostIds, CommandPlan plan, OperationOptions options) {
        Operation operation = Operation.builder()
                .id(UUID.randomUUID().toString())
                .targetHosts(hostIds)
                .commands(plan.format())
                .options(options)
                .status(OperationStatus.PENDING)
                .createdAt(Instant.now())
                .build();

        operationRepository.save(operation);
        log.info("Created operation {} on {} hosts: {}{}", operation.id(), hostIds.size(), operation.commands(),
                options.deferred() ? " (onboot)" : "");
        broadcaster.publish(ProgressEvent.operation(EventType.OPERATION_CREATED, operation, operation.stats()));
        return operation;
    }
}
