package geoflow.coordinator.model;

/**
 * A claimed work item together with what the worker needs to run it.
 *
 * @param workItem           the claimed item, now RUNNING (or QUEUED when reserved)
 * @param operation          operation snapshot of the item's step
 * @param maxCatalogPageSize page limit for discovery items, null otherwise
 */
public record WorkAssignment(WorkItem workItem, DataOperation operation, Integer maxCatalogPageSize) {
}
