package geoflow.coordinator.tracking;

/**
 * Coarse state of a job's run in the external executor.
 */
public enum RunPhase {
    ACTIVE,
    SUCCEEDED,
    FAILED
}
