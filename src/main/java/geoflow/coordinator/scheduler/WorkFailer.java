package geoflow.coordinator.scheduler;

import geoflow.coordinator.config.ServiceStepConfig;
import geoflow.coordinator.config.ServicesConfig;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemUpdateResult;
import geoflow.coordinator.repository.WorkItemRepository;
import geoflow.coordinator.service.WorkItemService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Background task that fails work items stuck in flight.
 *
 * The timeout for an item is twice the longest successful duration seen for its job
 * and service when duration-based timeouts are on and such a duration exists, otherwise
 * the service's configured timeout or the default. Timed-out items go through the normal
 * update path, so they are retried until the retry limit fails the job.
 */
public class WorkFailer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkFailer.class);

    private static final int BATCH_SIZE = 1000;

    private final WorkItemRepository workItemRepository;
    private final WorkItemService workItemService;
    private final ServicesConfig servicesConfig;
    private final Duration failableAge;
    private final Duration defaultTimeout;
    private final boolean durationBasedTimeout;

    public WorkFailer(WorkItemRepository workItemRepository, WorkItemService workItemService,
            ServicesConfig servicesConfig, Duration failableAge, Duration defaultTimeout,
            boolean durationBasedTimeout) {
        this.workItemRepository = workItemRepository;
        this.workItemService = workItemService;
        this.servicesConfig = servicesConfig;
        this.failableAge = failableAge;
        this.defaultTimeout = defaultTimeout;
        this.durationBasedTimeout = durationBasedTimeout;
    }

    @Override
    public void run() {
        try {
            failStuckWork();
        } catch (Exception e) {
            log.error("Work failer error", e);
        }
    }

    /**
     * @return number of work items failed
     */
    public int failStuckWork() {
        Instant now = Instant.now();
        List<WorkItem> candidates = workItemRepository.findInFlightNotUpdatedSince(now.minus(failableAge), BATCH_SIZE);
        if (candidates.isEmpty()) {
            log.debug("No in-flight work items old enough to check");
            return 0;
        }

        Map<String, Long> thresholds = new HashMap<>();
        int failed = 0;
        for (WorkItem item : candidates) {
            long threshold = thresholds.computeIfAbsent(item.jobId() + "|" + item.serviceId(), k -> thresholdMs(item));
            Instant since = item.startedAt() != null ? item.startedAt() : item.updatedAt();
            long elapsed = Duration.between(since, now).toMillis();
            if (elapsed <= threshold) {
                continue;
            }

            String message = "Work item " + item.id() + " has exceeded the " + threshold + " ms duration threshold.";
            try {
                WorkItemUpdateResult result = workItemService.expire(item, message);
                if (result == WorkItemUpdateResult.RETRIED || result == WorkItemUpdateResult.JOB_FAILED) {
                    failed++;
                    log.warn("Work item {} of job {} timed out after {} ms ({})",
                            item.id(), item.jobId(), elapsed, result);
                }
            } catch (Exception e) {
                log.error("Failed to time out work item {}", item.id(), e);
            }
        }

        log.info("Work failer: {} failed, {} checked", failed, candidates.size());
        return failed;
    }

    long thresholdMs(WorkItem item) {
        if (durationBasedTimeout) {
            Long longest = workItemRepository.maxSuccessfulDuration(item.jobId(), item.serviceId()).orElse(null);
            if (longest != null && longest > 0) {
                return 2 * longest;
            }
        }
        return servicesConfig.service(item.serviceId())
                .map(ServiceStepConfig::timeout)
                .orElse(defaultTimeout)
                .toMillis();
    }
}
