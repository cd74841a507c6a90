package pxefleet.runner.model;

import pxefleet.runner.command.CommandParser;
import pxefleet.runner.command.CommandPlan;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model of one administrative request: a command string to
 * run on a fixed set of hosts.
 */
public final class Operation {
    private final String id;
    private final List<String> targetHosts; // host ids, resolved at submission
    private final String commands; // validated command string
    private final OperationOptions options;
    private final OperationStatus status;
    private final int progress;
    private final int completedSessions;
    private final int failedSessions;
    private final int cancelledSessions;
    private final boolean cancelRequested;
    private final int busyPolls;
    private final Instant wakeUntil;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Operation(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.targetHosts = List.copyOf(Objects.requireNonNull(builder.targetHosts, "targetHosts is required"));
        this.commands = Objects.requireNonNull(builder.commands, "commands is required");
        this.options = builder.options != null ? builder.options : OperationOptions.immediate();
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = builder.progress;
        this.completedSessions = builder.completedSessions;
        this.failedSessions = builder.failedSessions;
        this.cancelledSessions = builder.cancelledSessions;
        this.cancelRequested = builder.cancelRequested;
        this.busyPolls = builder.busyPolls;
        this.wakeUntil = builder.wakeUntil;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public List<String> targetHosts() {
        return targetHosts;
    }

    public String commands() {
        return commands;
    }

    public OperationOptions options() {
        return options;
    }

    public OperationStatus status() {
        return status;
    }

    public int progress() {
        return progress;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public int busyPolls() {
        return busyPolls;
    }

    public Instant wakeUntil() {
        return wakeUntil;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    /** Parsed form of {@link #commands()}. */
    public CommandPlan plan() {
        return CommandParser.parse(commands);
    }

    /** Last persisted per-host accounting. */
    public OperationStats stats() {
        int total = targetHosts.size();
        int pending = Math.max(0, total - completedSessions - failedSessions - cancelledSessions);
        return new OperationStats(total, completedSessions, failedSessions, cancelledSessions, pending);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this operation (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .targetHosts(targetHosts)
                .commands(commands)
                .options(options)
                .status(status)
                .progress(progress)
                .completedSessions(completedSessions)
                .failedSessions(failedSessions)
                .cancelledSessions(cancelledSessions)
                .cancelRequested(cancelRequested)
                .busyPolls(busyPolls)
                .wakeUntil(wakeUntil)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private List<String> targetHosts;
        private String commands;
        private OperationOptions options;
        private OperationStatus status = OperationStatus.PENDING;
        private int progress;
        private int completedSessions;
        private int failedSessions;
        private int cancelledSessions;
        private boolean cancelRequested;
        private int busyPolls;
        private Instant wakeUntil;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder targetHosts(List<String> targetHosts) {
            this.targetHosts = targetHosts;
            return this;
        }

        public Builder commands(String commands) {
            this.commands = commands;
            return this;
        }

        public Builder options(OperationOptions options) {
            this.options = options;
            return this;
        }

        public Builder status(OperationStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder completedSessions(int completedSessions) {
            this.completedSessions = completedSessions;
            return this;
        }

        public Builder failedSessions(int failedSessions) {
            this.failedSessions = failedSessions;
            return this;
        }

        public Builder cancelledSessions(int cancelledSessions) {
            this.cancelledSessions = cancelledSessions;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder busyPolls(int busyPolls) {
            this.busyPolls = busyPolls;
            return this;
        }

        public Builder wakeUntil(Instant wakeUntil) {
            this.wakeUntil = wakeUntil;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Operation build() {
            return new Operation(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Operation op))
            return false;
        return Objects.equals(id, op.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Operation{id='" + id + "', status=" + status + ", hosts=" + targetHosts.size()
                + ", commands='" + commands + "'}";
    }
}
