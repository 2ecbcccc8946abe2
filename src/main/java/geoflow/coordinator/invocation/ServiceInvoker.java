package geoflow.coordinator.invocation;

/**
 * Capability to get a service working on its READY work items.
 */
public interface ServiceInvoker {

    InvocationHandle invoke(String serviceId);
}
