package geoflow.coordinator.api.internal.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import geoflow.coordinator.model.WorkAssignment;

/**
 * Response DTO for a successful poll.
 * GET /work?serviceID=...
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkItemResponse(
        @JsonProperty("workItem") WorkItemView workItem,
        @JsonProperty("maxCatalogPageSize") Integer maxCatalogPageSize) {

    public static WorkItemResponse from(WorkAssignment assignment) {
        return new WorkItemResponse(
                WorkItemView.from(assignment.workItem(), assignment.operation()),
                assignment.maxCatalogPageSize());
    }
}
