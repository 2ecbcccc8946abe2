package geoflow.coordinator.invocation;

import geoflow.coordinator.config.ServiceStepConfig;
import geoflow.coordinator.config.ServicesConfig;
import geoflow.coordinator.service.WorkQueueListener;

/**
 * Selects the invoker for each service from its configured invocation type and
 * invokes it whenever new work becomes ready.
 */
public class ServiceInvokers implements WorkQueueListener {

    private final ServicesConfig servicesConfig;
    private final DirectInvoker directInvoker;
    private final PullQueueInvoker pullQueueInvoker;

    public ServiceInvokers(ServicesConfig servicesConfig, DirectInvoker directInvoker,
            PullQueueInvoker pullQueueInvoker) {
        this.servicesConfig = servicesConfig;
        this.directInvoker = directInvoker;
        this.pullQueueInvoker = pullQueueInvoker;
    }

    public ServiceInvoker invokerFor(String serviceId) {
        InvocationType type = servicesConfig.service(serviceId)
                .map(ServiceStepConfig::invocation)
                .orElse(InvocationType.PULL_QUEUE);
        return type == InvocationType.DIRECT ? directInvoker : pullQueueInvoker;
    }

    @Override
    public void workAvailable(String serviceId) {
        invokerFor(serviceId).invoke(serviceId);
    }

    /** Re-invoke every direct service. */
    public void kickDirectServices() {
        for (ServiceStepConfig service : servicesConfig.services()) {
            if (service.invocation() == InvocationType.DIRECT) {
                directInvoker.invoke(service.serviceId());
            }
        }
    }
}
