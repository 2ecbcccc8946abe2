package geoflow.coordinator.tracking;

/**
 * External executor that knows whether a job is still actually running.
 */
public interface ExecutionTracker {

    /**
     * @throws TrackerException when the tracker cannot be reached; callers must not
     *                          treat that as an absent run
     */
    RunStatus getRunStatus(String jobId);
}
