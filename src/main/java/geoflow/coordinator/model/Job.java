package geoflow.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of one user request's asynchronous execution.
 * Status and progress are derived from the job's workflow steps and work items.
 */
public final class Job {
    private final String id;
    private final String owner;
    private final String chain; // service chain name
    private final JobStatus status;
    private final int progress;
    private final int numInputGranules;
    private final String message;
    private final String advisory; // capacity advisory issued at creation, if any
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.owner = Objects.requireNonNull(builder.owner, "owner is required");
        this.chain = Objects.requireNonNull(builder.chain, "chain is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = builder.progress;
        this.numInputGranules = builder.numInputGranules;
        this.message = builder.message;
        this.advisory = builder.advisory;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String owner() {
        return owner;
    }

    public String chain() {
        return chain;
    }

    public JobStatus status() {
        return status;
    }

    public int progress() {
        return progress;
    }

    public int numInputGranules() {
        return numInputGranules;
    }

    public String message() {
        return message;
    }

    public String advisory() {
        return advisory;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .owner(owner)
                .chain(chain)
                .status(status)
                .progress(progress)
                .numInputGranules(numInputGranules)
                .message(message)
                .advisory(advisory)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String owner;
        private String chain;
        private JobStatus status = JobStatus.ACCEPTED;
        private int progress = 0;
        private int numInputGranules = 0;
        private String message;
        private String advisory;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder chain(String chain) {
            this.chain = chain;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder numInputGranules(int numInputGranules) {
            this.numInputGranules = numInputGranules;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder advisory(String advisory) {
            this.advisory = advisory;
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

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", chain='" + chain + '\'' +
                ", status=" + status +
                ", progress=" + progress +
                ", numInputGranules=" + numInputGranules +
                '}';
    }
}
