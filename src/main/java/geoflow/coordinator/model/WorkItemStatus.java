package geoflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import geoflow.coordinator.error.RequestValidationException;

import java.util.Locale;

/**
 * Work item status.
 *
 * <pre>
 * READY -> QUEUED -> RUNNING -> SUCCESSFUL | FAILED | CANCELED | WARNING
 * </pre>
 *
 * READY may also be claimed straight into RUNNING, and a failed attempt with
 * retries left goes back to READY.
 */
public enum WorkItemStatus {
    READY,
    QUEUED,
    RUNNING,
    SUCCESSFUL,
    FAILED,
    CANCELED,
    /** Finished with output and a diagnostic in subStatus */
    WARNING;

    public boolean isTerminal() {
        return this == SUCCESSFUL || this == FAILED || this == CANCELED || this == WARNING;
    }

    /** Terminal states whose outputs flow downstream. */
    public boolean isSuccess() {
        return this == SUCCESSFUL || this == WARNING;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkItemStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new RequestValidationException("status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RequestValidationException("Unknown work item status: " + value);
        }
    }
}
