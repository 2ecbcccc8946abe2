package geoflow.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import geoflow.coordinator.model.WorkItem;

import java.time.Instant;

/**
 * Work item row as shown to the job owner.
 * GET /api/v1/jobs/{jobId}/work-items
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkItemSummaryResponse(
        @JsonProperty("id") long id,
        @JsonProperty("serviceID") String serviceId,
        @JsonProperty("stepIndex") int stepIndex,
        @JsonProperty("status") String status,
        @JsonProperty("subStatus") String subStatus,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("durationMs") Long durationMs,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static WorkItemSummaryResponse from(WorkItem item) {
        return new WorkItemSummaryResponse(
                item.id(),
                item.serviceId(),
                item.stepIndex(),
                item.status().value(),
                item.subStatus(),
                item.retryCount(),
                item.durationMs(),
                item.createdAt(),
                item.updatedAt());
    }
}
