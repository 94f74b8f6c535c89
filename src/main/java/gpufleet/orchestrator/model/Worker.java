package gpufleet.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one GPU worker (one provider instance).
 * The worker id doubles as the instance name.
 */
public final class Worker {
    private final String id;
    private final WorkerStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant lastHeartbeat; // written by the worker itself
    private final WorkerMetadata metadata;
    private final long version;

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.metadata = builder.metadata != null ? builder.metadata : WorkerMetadata.empty();
        this.version = builder.version;
    }

    // Getters
    public String id() {
        return id;
    }

    public WorkerStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public WorkerMetadata metadata() {
        return metadata;
    }

    public long version() {
        return version;
    }

    public String instanceId() {
        return metadata.instanceId();
    }

    /**
     * Status used for classification. A row still INACTIVE falls back to the
     * status mirrored into its metadata.
     */
    public WorkerStatus effectiveStatus() {
        if (status == WorkerStatus.INACTIVE && metadata.orchestratorStatus() != null) {
            return metadata.orchestratorStatus();
        }
        return status;
    }

    /** Age relative to {@code now}; zero when the creation time is unknown. */
    public Duration age(Instant now) {
        return createdAt != null ? Duration.between(createdAt, now) : Duration.ZERO;
    }

    /** Create a builder from this worker (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .lastHeartbeat(lastHeartbeat)
                .metadata(metadata)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private WorkerStatus status = WorkerStatus.INACTIVE;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastHeartbeat;
        private WorkerMetadata metadata;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder metadata(WorkerMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Worker worker))
            return false;
        return Objects.equals(id, worker.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', status=" + status + ", instance=" + metadata.instanceId() + "}";
    }
}
