package geoflow.coordinator.model;

/**
 * Which candidate cap produced the effective granule limit.
 */
public enum GranuleLimitReason {
    SYSTEM,
    MAX_RESULTS,
    SERVICE,
    COLLECTION,
    /** The service declares no granule limit */
    NONE
}
