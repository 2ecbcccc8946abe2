package geoflow.coordinator.invocation;

import geoflow.coordinator.model.WorkAssignment;
import geoflow.coordinator.model.WorkItemUpdate;

/**
 * In-process implementation of a direct service.
 */
@FunctionalInterface
public interface LocalWorkHandler {

    /**
     * Run one work item. Failures are reported as a failed update rather than thrown.
     */
    WorkItemUpdate handle(WorkAssignment assignment);
}
