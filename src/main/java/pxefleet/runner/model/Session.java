package pxefleet.runner.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of one host's execution of an operation.
 * Terminal sessions are never changed again.
 */
public final class Session {
    private final String id;
    private final String operationId;
    private final String hostId;
    private final String hostname;
    private final String commands;
    private final SessionStatus status;
    private final int progress;
    private final ErrorKind errorKind;
    private final String errorMessage;
    private final Integer failedCommandIndex; // 1-based within the instruction list
    private final Integer exitCode;
    private final String logOutput;
    private final Instant heartbeatAt;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Session(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.operationId = Objects.requireNonNull(builder.operationId, "operationId is required");
        this.hostId = Objects.requireNonNull(builder.hostId, "hostId is required");
        this.hostname = builder.hostname;
        this.commands = Objects.requireNonNull(builder.commands, "commands is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = builder.progress;
        this.errorKind = builder.errorKind;
        this.errorMessage = builder.errorMessage;
        this.failedCommandIndex = builder.failedCommandIndex;
        this.exitCode = builder.exitCode;
        this.logOutput = builder.logOutput;
        this.heartbeatAt = builder.heartbeatAt;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String operationId() {
        return operationId;
    }

    public String hostId() {
        return hostId;
    }

    public String hostname() {
        return hostname;
    }

    public String commands() {
        return commands;
    }

    public SessionStatus status() {
        return status;
    }

    public int progress() {
        return progress;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Integer failedCommandIndex() {
        return failedCommandIndex;
    }

    public Integer exitCode() {
        return exitCode;
    }

    public String logOutput() {
        return logOutput;
    }

    public Instant heartbeatAt() {
        return heartbeatAt;
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

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True once a worker began connecting to the host. */
    public boolean wasStarted() {
        return startedAt != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .operationId(operationId)
                .hostId(hostId)
                .hostname(hostname)
                .commands(commands)
                .status(status)
                .progress(progress)
                .errorKind(errorKind)
                .errorMessage(errorMessage)
                .failedCommandIndex(failedCommandIndex)
                .exitCode(exitCode)
                .logOutput(logOutput)
                .heartbeatAt(heartbeatAt)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String operationId;
        private String hostId;
        private String hostname;
        private String commands;
        private SessionStatus status = SessionStatus.PENDING;
        private int progress;
        private ErrorKind errorKind;
        private String errorMessage;
        private Integer failedCommandIndex;
        private Integer exitCode;
        private String logOutput;
        private Instant heartbeatAt;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder operationId(String operationId) {
            this.operationId = operationId;
            return this;
        }

        public Builder hostId(String hostId) {
            this.hostId = hostId;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder commands(String commands) {
            this.commands = commands;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder errorKind(ErrorKind errorKind) {
            this.errorKind = errorKind;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder failedCommandIndex(Integer failedCommandIndex) {
            this.failedCommandIndex = failedCommandIndex;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder logOutput(String logOutput) {
            this.logOutput = logOutput;
            return this;
        }

        public Builder heartbeatAt(Instant heartbeatAt) {
            this.heartbeatAt = heartbeatAt;
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

        /** Apply a terminal outcome. */
        public Builder outcome(SessionOutcome outcome) {
            this.status = outcome.status();
            this.errorKind = outcome.errorKind();
            this.errorMessage = outcome.message();
            this.failedCommandIndex = outcome.failedCommandIndex();
            this.exitCode = outcome.exitCode();
            this.logOutput = outcome.log();
            this.progress = outcome.status() == SessionStatus.COMPLETED ? 100 : this.progress;
            return this;
        }

        public Session build() {
            return new Session(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Session session))
            return false;
        return Objects.equals(id, session.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Session{id='" + id + "', operationId='" + operationId + "', host='" + hostname
                + "', status=" + status + (errorKind != null ? ", errorKind=" + errorKind : "") + "}";
    }
}
