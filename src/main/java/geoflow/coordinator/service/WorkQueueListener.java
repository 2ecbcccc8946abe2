package geoflow.coordinator.service;

/**
 * Notified after a transaction commits new READY work items for a service.
 */
@FunctionalInterface
public interface WorkQueueListener {

    WorkQueueListener NONE = serviceId -> {
    };

    void workAvailable(String serviceId);
}
