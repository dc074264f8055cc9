package bigo.conductor.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one pipeline run (or of a dry run preview).
 */
public final class RunResult {
    private final String taskId;
    private final ClassificationResult classification;
    private final Backend actualBackend;
    private final Backend fallbackBackend;
    private final boolean workerAvailable;
    private final ExecutionResult execution;
    private final TaskStatus status;
    private final String error;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final boolean validationRequired;
    private final boolean validationPending;
    private final int requiredValidators;
    private final int requiredApprovals;
    private final boolean dryRun;

    private RunResult(Builder builder) {
        this.taskId = builder.taskId;
        this.classification = builder.classification;
        this.actualBackend = builder.actualBackend;
        this.fallbackBackend = builder.fallbackBackend;
        this.workerAvailable = builder.workerAvailable;
        this.execution = builder.execution;
        this.status = builder.status;
        this.error = builder.error;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.validationRequired = builder.validationRequired;
        this.validationPending = builder.validationPending;
        this.requiredValidators = builder.requiredValidators;
        this.requiredApprovals = builder.requiredApprovals;
        this.dryRun = builder.dryRun;
    }

    /** Ledger id of the task, null for dry runs */
    public String taskId() {
        return taskId;
    }

    public ClassificationResult classification() {
        return classification;
    }

    /** Backend that executed (or would execute) the task, null if none resolved */
    public Backend actualBackend() {
        return actualBackend;
    }

    /** Dry runs only: backend the fallback chain would pick */
    public Backend fallbackBackend() {
        return fallbackBackend;
    }

    /** Dry runs only: whether the recommended backend is free */
    public boolean workerAvailable() {
        return workerAvailable;
    }

    public ExecutionResult execution() {
        return execution;
    }

    /** Terminal status of the run; null for dry runs */
    public TaskStatus status() {
        return status;
    }

    public String error() {
        return error;
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    public boolean validationRequired() {
        return validationRequired;
    }

    public boolean validationPending() {
        return validationPending;
    }

    public int requiredValidators() {
        return requiredValidators;
    }

    public int requiredApprovals() {
        return requiredApprovals;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private ClassificationResult classification;
        private Backend actualBackend;
        private Backend fallbackBackend;
        private boolean workerAvailable;
        private ExecutionResult execution;
        private TaskStatus status;
        private String error;
        private Instant startedAt;
        private Instant finishedAt;
        private boolean validationRequired;
        private boolean validationPending;
        private int requiredValidators;
        private int requiredApprovals;
        private boolean dryRun;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder classification(ClassificationResult classification) {
            this.classification = classification;
            return this;
        }

        public Builder actualBackend(Backend actualBackend) {
            this.actualBackend = actualBackend;
            return this;
        }

        public Builder fallbackBackend(Backend fallbackBackend) {
            this.fallbackBackend = fallbackBackend;
            return this;
        }

        public Builder workerAvailable(boolean workerAvailable) {
            this.workerAvailable = workerAvailable;
            return this;
        }

        public Builder execution(ExecutionResult execution) {
            this.execution = execution;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder validation(TierConfig tierConfig) {
            this.validationRequired = tierConfig.requiresValidation();
            this.requiredValidators = tierConfig.validatorCount();
            this.requiredApprovals = tierConfig.requiredApprovals();
            return this;
        }

        public Builder validationPending(boolean validationPending) {
            this.validationPending = validationPending;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public RunResult build() {
            return new RunResult(this);
        }
    }

    @Override
    public String toString() {
        return "RunResult{taskId='" + taskId + "', status=" + status + ", backend=" + actualBackend
                + (hasError() ? ", error='" + error + "'" : "") + "}";
    }
}
