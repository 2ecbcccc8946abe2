package geoflow.coordinator.model;

import java.util.Objects;

/**
 * One backend service in a job's linear chain. Step 0 is always granule discovery.
 *
 * <p>{@code batchCursor} and {@code openBatchId} only apply to batched steps:
 * the cursor is the sort index of the next upstream producer whose outputs have
 * not been placed into a batch, and the open batch collects placed outputs until
 * a threshold closes it.
 */
public final class WorkflowStep {
    private final String jobId;
    private final int stepIndex;
    private final String serviceId;
    private final DataOperation operation;
    private final boolean batched;
    private final Integer maxBatchInputs;
    private final Long maxBatchSizeBytes;
    private final int workItemCount;
    private final int completedWorkItemCount;
    private final boolean complete;
    private final long batchCursor;
    private final String openBatchId;

    private WorkflowStep(Builder builder) {
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.stepIndex = builder.stepIndex;
        this.serviceId = Objects.requireNonNull(builder.serviceId, "serviceId is required");
        this.operation = Objects.requireNonNull(builder.operation, "operation is required");
        this.batched = builder.batched;
        this.maxBatchInputs = builder.maxBatchInputs;
        this.maxBatchSizeBytes = builder.maxBatchSizeBytes;
        this.workItemCount = builder.workItemCount;
        this.completedWorkItemCount = builder.completedWorkItemCount;
        this.complete = builder.complete;
        this.batchCursor = builder.batchCursor;
        this.openBatchId = builder.openBatchId;
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

    public DataOperation operation() {
        return operation;
    }

    public boolean batched() {
        return batched;
    }

    public Integer maxBatchInputs() {
        return maxBatchInputs;
    }

    public Long maxBatchSizeBytes() {
        return maxBatchSizeBytes;
    }

    public int workItemCount() {
        return workItemCount;
    }

    public int completedWorkItemCount() {
        return completedWorkItemCount;
    }

    /** No more work items will be produced for this step and all produced ones succeeded. */
    public boolean complete() {
        return complete;
    }

    public long batchCursor() {
        return batchCursor;
    }

    public String openBatchId() {
        return openBatchId;
    }

    public boolean isDiscovery() {
        return stepIndex == 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .jobId(jobId)
                .stepIndex(stepIndex)
                .serviceId(serviceId)
                .operation(operation)
                .batched(batched)
                .maxBatchInputs(maxBatchInputs)
                .maxBatchSizeBytes(maxBatchSizeBytes)
                .workItemCount(workItemCount)
                .completedWorkItemCount(completedWorkItemCount)
                .complete(complete)
                .batchCursor(batchCursor)
                .openBatchId(openBatchId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String jobId;
        private int stepIndex;
        private String serviceId;
        private DataOperation operation;
        private boolean batched;
        private Integer maxBatchInputs;
        private Long maxBatchSizeBytes;
        private int workItemCount;
        private int completedWorkItemCount;
        private boolean complete;
        private long batchCursor;
        private String openBatchId;

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

        public Builder operation(DataOperation operation) {
            this.operation = operation;
            return this;
        }

        public Builder batched(boolean batched) {
            this.batched = batched;
            return this;
        }

        public Builder maxBatchInputs(Integer maxBatchInputs) {
            this.maxBatchInputs = maxBatchInputs;
            return this;
        }

        public Builder maxBatchSizeBytes(Long maxBatchSizeBytes) {
            this.maxBatchSizeBytes = maxBatchSizeBytes;
            return this;
        }

        public Builder workItemCount(int workItemCount) {
            this.workItemCount = workItemCount;
            return this;
        }

        public Builder completedWorkItemCount(int completedWorkItemCount) {
            this.completedWorkItemCount = completedWorkItemCount;
            return this;
        }

        public Builder complete(boolean complete) {
            this.complete = complete;
            return this;
        }

        public Builder batchCursor(long batchCursor) {
            this.batchCursor = batchCursor;
            return this;
        }

        public Builder openBatchId(String openBatchId) {
            this.openBatchId = openBatchId;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(this);
        }
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
                "jobId='" + jobId + '\'' +
                ", stepIndex=" + stepIndex +
                ", serviceId='" + serviceId + '\'' +
                ", batched=" + batched +
                ", workItemCount=" + workItemCount +
                ", completed=" + completedWorkItemCount +
                ", complete=" + complete +
                '}';
    }
}
