package geoflow.coordinator.api.internal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import geoflow.coordinator.error.RequestValidationException;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.model.WorkItemUpdate;

import java.util.List;

/**
 * Request DTO for a worker's completion report.
 * PUT /work/{workItemId}
 */
public record WorkItemUpdateRequest(
        @JsonProperty("status") WorkItemStatus status,
        @JsonProperty("results") List<String> results,
        @JsonProperty("outputItemSizes") List<Long> outputItemSizes,
        @JsonProperty("subStatus") String subStatus,
        @JsonProperty("duration") Long duration,
        @JsonProperty("hits") Integer hits,
        @JsonProperty("scrollID") String cursor) {

    public WorkItemUpdate toUpdate() {
        if (status == null) {
            throw new RequestValidationException("status is required");
        }
        return new WorkItemUpdate(status, results, outputItemSizes, subStatus, duration, hits, cursor);
    }
}
