package gpufleet.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a queued unit of GPU work.
 * Rows are produced outside this service; the orchestrator only reads them
 * and recovers the ones abandoned by dead workers.
 */
public final class Task {
    private final String id;
    private final String taskType;
    private final String params; // opaque JSON for the worker
    private final TaskStatus status;
    private final String workerId; // owning worker or null
    private final int attempts;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant generationStartedAt;
    private final Instant generationProcessedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.params = builder.params;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.workerId = builder.workerId;
        this.attempts = builder.attempts;
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt;
        this.generationStartedAt = builder.generationStartedAt;
        this.generationProcessedAt = builder.generationProcessedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String taskType() {
        return taskType;
    }

    public String params() {
        return params;
    }

    public TaskStatus status() {
        return status;
    }

    public String workerId() {
        return workerId;
    }

    public int attempts() {
        return attempts;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant generationStartedAt() {
        return generationStartedAt;
    }

    public Instant generationProcessedAt() {
        return generationProcessedAt;
    }

    /** Check if task may be put back on the queue under the given attempt cap */
    public boolean canRetry(int maxAttempts) {
        return attempts < maxAttempts;
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .taskType(taskType)
                .params(params)
                .status(status)
                .workerId(workerId)
                .attempts(attempts)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .generationStartedAt(generationStartedAt)
                .generationProcessedAt(generationProcessedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String taskType;
        private String params;
        private TaskStatus status = TaskStatus.QUEUED;
        private String workerId;
        private int attempts;
        private String errorMessage;
        private Instant createdAt;
        private Instant generationStartedAt;
        private Instant generationProcessedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder params(String params) {
            this.params = params;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder generationStartedAt(Instant generationStartedAt) {
            this.generationStartedAt = generationStartedAt;
            return this;
        }

        public Builder generationProcessedAt(Instant generationProcessedAt) {
            this.generationProcessedAt = generationProcessedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type=" + taskType + ", status=" + status + ", attempts=" + attempts + "}";
    }
}
