package geoflow.coordinator.config;

import geoflow.coordinator.invocation.InvocationType;

import java.time.Duration;

/**
 * Static configuration of one backend service.
 *
 * @param serviceId         identifier workers poll with
 * @param invocation        direct or pull-queue
 * @param batched           whether upstream outputs are grouped into batches for this service
 * @param maxBatchInputs    count threshold, null when not configured
 * @param maxBatchSizeBytes byte threshold, null when not configured
 * @param timeout           work item timeout for the work failer, null for the default
 */
public record ServiceStepConfig(
        String serviceId,
        InvocationType invocation,
        boolean batched,
        Integer maxBatchInputs,
        Long maxBatchSizeBytes,
        Duration timeout) {

    public static ServiceStepConfig pull(String serviceId) {
        return new ServiceStepConfig(serviceId, InvocationType.PULL_QUEUE, false, null, null, null);
    }
}
