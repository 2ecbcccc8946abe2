package geoflow.coordinator.tracking;

import geoflow.coordinator.repository.WorkItemRepository;

/**
 * Tracker used when no external workflow engine is configured: a job's run is
 * active while it still has non-terminal work items, and absent otherwise.
 */
public class WorkItemExecutionTracker implements ExecutionTracker {

    private final WorkItemRepository workItemRepository;

    public WorkItemExecutionTracker(WorkItemRepository workItemRepository) {
        this.workItemRepository = workItemRepository;
    }

    @Override
    public RunStatus getRunStatus(String jobId) {
        return workItemRepository.hasNonTerminal(jobId) ? RunStatus.of(RunPhase.ACTIVE) : RunStatus.ABSENT;
    }
}
