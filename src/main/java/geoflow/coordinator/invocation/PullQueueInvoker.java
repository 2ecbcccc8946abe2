package geoflow.coordinator.invocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invocation for services whose workers poll {@code GET /work}. Ready items are
 * already visible to them, so invoking only records the event.
 */
public class PullQueueInvoker implements ServiceInvoker {

    private static final Logger log = LoggerFactory.getLogger(PullQueueInvoker.class);

    @Override
    public InvocationHandle invoke(String serviceId) {
        log.debug("Work available for pull-queue service {}", serviceId);
        return InvocationHandle.polled(serviceId);
    }
}
