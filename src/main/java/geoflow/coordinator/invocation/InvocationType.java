package geoflow.coordinator.invocation;

import java.util.Locale;

/**
 * How a backend service receives its work.
 */
public enum InvocationType {
    /** Run in-process by the coordinator's own executor */
    DIRECT,
    /** Left READY for remote workers polling GET /work */
    PULL_QUEUE;

    public static InvocationType parse(String value) {
        if (value == null || value.isBlank()) {
            return PULL_QUEUE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "direct" -> DIRECT;
            case "pull", "pull_queue", "queue" -> PULL_QUEUE;
            default -> throw new IllegalArgumentException("Unknown invocation type: " + value);
        };
    }
}
