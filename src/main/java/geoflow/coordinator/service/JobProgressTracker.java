package geoflow.coordinator.service;

import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.WorkflowStep;

import java.util.List;

/**
 * Derives job progress from the workflow step counters.
 *
 * <p>Progress is {@code floor(100 * completed / expected)} over the last step's work items.
 * The expected count is exact once the step before the last one is complete and estimated
 * from the granule count before that. Progress stays at or below 99 until the job succeeds
 * and never drops below the stored value.
 */
public class JobProgressTracker {

    public static final int COMPLETE = 100;

    private final int catalogPageSize;

    public JobProgressTracker(int catalogPageSize) {
        this.catalogPageSize = Math.max(1, catalogPageSize);
    }

    public int progress(Job job, List<WorkflowStep> steps) {
        WorkflowStep last = steps.get(steps.size() - 1);
        if (last.complete()) {
            return COMPLETE;
        }

        int completed = last.completedWorkItemCount();
        long expected = Math.max(expectedFinalItems(job, steps), Math.max(completed, last.workItemCount()));
        if (expected <= 0) {
            return job.progress();
        }

        int computed = (int) Math.min(99, (100L * completed) / expected);
        return Math.max(job.progress(), computed);
    }

    long expectedFinalItems(Job job, List<WorkflowStep> steps) {
        int lastIndex = steps.size() - 1;
        WorkflowStep last = steps.get(lastIndex);
        if (lastIndex > 0 && steps.get(lastIndex - 1).complete()) {
            return last.workItemCount();
        }

        long granules = job.numInputGranules();
        if (lastIndex == 0) {
            return ceilDiv(granules, catalogPageSize);
        }
        for (int i = 1; i < lastIndex; i++) {
            if (steps.get(i).batched()) {
                return last.workItemCount() + 1L;
            }
        }
        if (!last.batched()) {
            return granules;
        }
        if (last.maxBatchInputs() != null && last.maxBatchSizeBytes() == null) {
            return ceilDiv(granules, last.maxBatchInputs());
        }
        return last.workItemCount() + 1L;
    }

    private static long ceilDiv(long value, long divisor) {
        return (value + divisor - 1) / divisor;
    }
}
