package geoflow.coordinator.invocation;

import geoflow.coordinator.model.WorkAssignment;
import geoflow.coordinator.model.WorkItemUpdate;
import geoflow.coordinator.service.WorkItemService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs direct services in-process on a bounded pool. Each invocation drains the
 * service's READY items: reserve (READY -> QUEUED), start (QUEUED -> RUNNING), run the
 * local handler, then report through {@link WorkItemService#update} like a remote worker.
 */
public class DirectInvoker implements ServiceInvoker, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DirectInvoker.class);

    private final WorkItemService workItemService;
    private final Map<String, LocalWorkHandler> handlers;
    private final ExecutorService executor;
    private final Semaphore slots;

    private volatile boolean closed = false;

    public DirectInvoker(WorkItemService workItemService, Map<String, LocalWorkHandler> handlers, int threads) {
        this.workItemService = workItemService;
        this.handlers = Map.copyOf(handlers);
        this.slots = new Semaphore(threads);
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "geoflow-direct-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public InvocationHandle invoke(String serviceId) {
        LocalWorkHandler handler = handlers.get(serviceId);
        if (handler == null) {
            log.warn("No local handler for direct service {}", serviceId);
            return InvocationHandle.deferred(serviceId);
        }
        if (closed || !slots.tryAcquire()) {
            // the periodic kick picks this up once a slot frees
            return InvocationHandle.deferred(serviceId);
        }
        try {
            CompletableFuture<Integer> processed = CompletableFuture.supplyAsync(() -> {
                try {
                    return drain(serviceId, handler);
                } finally {
                    slots.release();
                }
            }, executor);
            return new InvocationHandle(serviceId, InvocationType.DIRECT, true, processed);
        } catch (RejectedExecutionException e) {
            slots.release();
            log.warn("Direct invocation of {} rejected: {}", serviceId, e.getMessage());
            return InvocationHandle.deferred(serviceId);
        }
    }

    private int drain(String serviceId, LocalWorkHandler handler) {
        int processed = 0;
        while (!closed) {
            Optional<WorkAssignment> reserved;
            try {
                reserved = workItemService.reserve(serviceId);
            } catch (RuntimeException e) {
                log.error("Failed to reserve work for {}", serviceId, e);
                break;
            }
            if (reserved.isEmpty()) {
                break;
            }
            long id = reserved.get().workItem().id();
            if (!workItemService.start(id)) {
                continue;
            }

            WorkItemUpdate update;
            try {
                update = handler.handle(reserved.get());
            } catch (RuntimeException e) {
                log.error("Local handler for {} failed on work item {}", serviceId, id, e);
                update = WorkItemUpdate.failed("Unexpected error: " + e.getMessage());
            }
            workItemService.update(id, update);
            processed++;
        }
        if (processed > 0) {
            log.debug("Direct service {} processed {} work items", serviceId, processed);
        }
        return processed;
    }

    @Override
    public void close() {
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Direct invoker forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
