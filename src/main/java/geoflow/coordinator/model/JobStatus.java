package geoflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Job lifecycle status.
 */
public enum JobStatus {
    /** Request accepted, no work item claimed yet */
    ACCEPTED,
    /** At least one work item has been claimed */
    RUNNING,
    /** Dispatching suspended by the owner */
    PAUSED,
    /** Every step exhausted and every work item succeeded */
    SUCCESSFUL,
    /** A work item failed after exhausting its retries */
    FAILED,
    /** Canceled by the owner or by the job reaper */
    CANCELED;

    public boolean isTerminal() {
        return this == SUCCESSFUL || this == FAILED || this == CANCELED;
    }

    /** Work items of active jobs may be claimed. */
    public boolean isActive() {
        return this == ACCEPTED || this == RUNNING;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
