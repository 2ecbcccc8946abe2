package geoflow.coordinator.model;

/**
 * Outcome of applying a worker's completion update.
 */
public enum WorkItemUpdateResult {
    /** Terminal status recorded and downstream work scheduled */
    APPLIED,

    /** Failure recorded, item re-queued as READY for another attempt */
    RETRIED,

    /** Failure with no retries left, the job was failed */
    JOB_FAILED,

    /** Worker gave up on the item; it was recorded as CANCELED and the job canceled */
    JOB_CANCELED,

    /** Item was already terminal - idempotent no-op */
    ALREADY_TERMINAL,

    /** Item is not RUNNING (late update from an earlier attempt) - ignored */
    NOT_RUNNING,

    /** Job already finished or was canceled, the item was canceled */
    JOB_TERMINAL,

    /** Work item not found */
    NOT_FOUND
}
