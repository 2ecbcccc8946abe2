package geoflow.coordinator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model of one dispatchable unit of work.
 *
 * <p>The id is a database sequence, assigned at insert and never changed.
 * {@code sortIndex} is the item's dense position within its step, also fixed at
 * creation; batches downstream are ordered by it.
 */
public final class WorkItem {
    private final long id;
    private final String jobId;
    private final int stepIndex;
    private final String serviceId;
    private final WorkItemStatus status;
    private final String subStatus;
    private final long sortIndex;
    private final Integer sourceIndex; // discovery items only
    private final String cursor; // discovery items only
    private final String inputLocation;
    private final String batchId;
    private final List<String> results;
    private final List<Long> outputItemSizes;
    private final Long durationMs;
    private final int retryCount;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant updatedAt;

    private WorkItem(Builder builder) {
        this.id = builder.id;
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.stepIndex = builder.stepIndex;
        this.serviceId = Objects.requireNonNull(builder.serviceId, "serviceId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.subStatus = builder.subStatus;
        this.sortIndex = builder.sortIndex;
        this.sourceIndex = builder.sourceIndex;
        this.cursor = builder.cursor;
        this.inputLocation = builder.inputLocation;
        this.batchId = builder.batchId;
        this.results = builder.results == null ? List.of() : List.copyOf(builder.results);
        this.outputItemSizes = builder.outputItemSizes == null ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(builder.outputItemSizes));
        this.durationMs = builder.durationMs;
        this.retryCount = builder.retryCount;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.updatedAt = builder.updatedAt;
    }

    public long id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public int stepIndex() {
        return stepIndex;
    }

    public String serviceId() {
        return serviceId;
    }

    public WorkItemStatus status() {
        return status;
    }

    public String subStatus() {
        return subStatus;
    }

    public long sortIndex() {
        return sortIndex;
    }

    public Integer sourceIndex() {
        return sourceIndex;
    }

    public String cursor() {
        return cursor;
    }

    public String inputLocation() {
        return inputLocation;
    }

    public String batchId() {
        return batchId;
    }

    public List<String> results() {
        return results;
    }

    public List<Long> outputItemSizes() {
        return outputItemSizes;
    }

    public Long durationMs() {
        return durationMs;
    }

    public int retryCount() {
        return retryCount;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isDiscovery() {
        return stepIndex == 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .stepIndex(stepIndex)
                .serviceId(serviceId)
                .status(status)
                .subStatus(subStatus)
                .sortIndex(sortIndex)
                .sourceIndex(sourceIndex)
                .cursor(cursor)
                .inputLocation(inputLocation)
                .batchId(batchId)
                .results(results)
                .outputItemSizes(outputItemSizes)
                .durationMs(durationMs)
                .retryCount(retryCount)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String jobId;
        private int stepIndex;
        private String serviceId;
        private WorkItemStatus status = WorkItemStatus.READY;
        private String subStatus;
        private long sortIndex;
        private Integer sourceIndex;
        private String cursor;
        private String inputLocation;
        private String batchId;
        private List<String> results;
        private List<Long> outputItemSizes;
        private Long durationMs;
        private int retryCount;
        private Instant createdAt;
        private Instant startedAt;
        private Instant updatedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder stepIndex(int stepIndex) {
            this.stepIndex = stepIndex;
            return this;
        }

        public Builder serviceId(String serviceId) {
            this.serviceId = serviceId;
            return this;
        }

        public Builder status(WorkItemStatus status) {
            this.status = status;
            return this;
        }

        public Builder subStatus(String subStatus) {
            this.subStatus = subStatus;
            return this;
        }

        public Builder sortIndex(long sortIndex) {
            this.sortIndex = sortIndex;
            return this;
        }

        public Builder sourceIndex(Integer sourceIndex) {
            this.sourceIndex = sourceIndex;
            return this;
        }

        public Builder cursor(String cursor) {
            this.cursor = cursor;
            return this;
        }

        public Builder inputLocation(String inputLocation) {
            this.inputLocation = inputLocation;
            return this;
        }

        public Builder batchId(String batchId) {
            this.batchId = batchId;
            return this;
        }

        public Builder results(List<String> results) {
            this.results = results;
            return this;
        }

        public Builder outputItemSizes(List<Long> outputItemSizes) {
            this.outputItemSizes = outputItemSizes;
            return this;
        }

        public Builder durationMs(Long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
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

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public WorkItem build() {
            return new WorkItem(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WorkItem that))
            return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "WorkItem{" +
                "id=" + id +
                ", jobId='" + jobId + '\'' +
                ", stepIndex=" + stepIndex +
                ", serviceId='" + serviceId + '\'' +
                ", status=" + status +
                ", sortIndex=" + sortIndex +
                ", retryCount=" + retryCount +
                '}';
    }
}
