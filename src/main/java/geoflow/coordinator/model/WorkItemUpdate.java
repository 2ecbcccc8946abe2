package geoflow.coordinator.model;

import geoflow.coordinator.error.RequestValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Completion report for a running work item.
 *
 * @param status          final status reported by the worker
 * @param results         output locations
 * @param outputItemSizes byte size per result, parallel to results; entries may be null
 * @param subStatus       optional diagnostic
 * @param durationMs      worker-measured duration, may be null
 * @param hits            discovery only: total hits the catalog reported
 * @param cursor          discovery only: cursor to continue paging from
 */
public record WorkItemUpdate(
        WorkItemStatus status,
        List<String> results,
        List<Long> outputItemSizes,
        String subStatus,
        Long durationMs,
        Integer hits,
        String cursor) {

    public WorkItemUpdate {
        results = results == null ? List.of() : List.copyOf(results);
        // sizes may contain nulls for unknown entries
        outputItemSizes = outputItemSizes == null ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(outputItemSizes));
    }

    public static WorkItemUpdate successful(List<String> results, List<Long> sizes) {
        return new WorkItemUpdate(WorkItemStatus.SUCCESSFUL, results, sizes, null, null, null, null);
    }

    public static WorkItemUpdate failed(String message) {
        return new WorkItemUpdate(WorkItemStatus.FAILED, List.of(), List.of(), message, null, null, null);
    }

    public WorkItemUpdate withPaging(Integer totalHits, String nextCursor) {
        return new WorkItemUpdate(status, results, outputItemSizes, subStatus, durationMs, totalHits, nextCursor);
    }

    public WorkItemUpdate withSizes(List<Long> sizes) {
        return new WorkItemUpdate(status, results, sizes, subStatus, durationMs, hits, cursor);
    }

    public void validate() {
        if (status == null) {
            throw new RequestValidationException("status is required");
        }
        if (!status.isTerminal()) {
            throw new RequestValidationException("status must be one of successful, failed, canceled, warning");
        }
        if (!outputItemSizes.isEmpty() && outputItemSizes.size() != results.size()) {
            throw new RequestValidationException("outputItemSizes must have one entry per result");
        }
        for (String result : results) {
            if (result == null || result.isBlank()) {
                throw new RequestValidationException("results must not contain blank locations");
            }
        }
        if (durationMs != null && durationMs < 0) {
            throw new RequestValidationException("duration must be non-negative");
        }
    }
}
