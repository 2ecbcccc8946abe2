package geoflow.coordinator.invocation;

import java.util.concurrent.CompletableFuture;

/**
 * Result of asking a service to pick up its ready work.
 *
 * @param serviceId service invoked
 * @param type      how the service is invoked
 * @param accepted  false when the invocation was deferred (no free worker slot)
 * @param processed completes with the number of work items handled by this invocation;
 *                  already complete for pull-queue services, whose workers poll on their own
 */
public record InvocationHandle(String serviceId, InvocationType type, boolean accepted,
        CompletableFuture<Integer> processed) {

    public static InvocationHandle polled(String serviceId) {
        return new InvocationHandle(serviceId, InvocationType.PULL_QUEUE, true, CompletableFuture.completedFuture(0));
    }

    public static InvocationHandle deferred(String serviceId) {
        return new InvocationHandle(serviceId, InvocationType.DIRECT, false, CompletableFuture.completedFuture(0));
    }
}
