package geoflow.coordinator.tracking;

/**
 * What the execution tracker knows about one job's run.
 *
 * @param exists false when the executor has no record of the run
 * @param phase  run phase, null when the run does not exist
 */
public record RunStatus(boolean exists, RunPhase phase) {

    public static final RunStatus ABSENT = new RunStatus(false, null);

    public static RunStatus of(RunPhase phase) {
        return new RunStatus(true, phase);
    }

    /** True when the job should no longer be considered running. */
    public boolean isAbsentOrFailed() {
        return !exists || phase == RunPhase.FAILED;
    }
}
