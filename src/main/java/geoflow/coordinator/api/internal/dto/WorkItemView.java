package geoflow.coordinator.api.internal.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.WorkItem;

/**
 * Work item as handed to a worker, with the operation snapshot of its step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkItemView(
        @JsonProperty("id") long id,
        @JsonProperty("jobID") String jobId,
        @JsonProperty("serviceID") String serviceId,
        @JsonProperty("stepIndex") int stepIndex,
        @JsonProperty("status") String status,
        @JsonProperty("sortIndex") long sortIndex,
        @JsonProperty("sourceIndex") Integer sourceIndex,
        @JsonProperty("scrollID") String cursor,
        @JsonProperty("stacCatalogLocation") String inputLocation,
        @JsonProperty("batchID") String batchId,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("operation") DataOperation operation) {

    public static WorkItemView from(WorkItem item, DataOperation operation) {
        return new WorkItemView(
                item.id(),
                item.jobId(),
                item.serviceId(),
                item.stepIndex(),
                item.status().value(),
                item.sortIndex(),
                item.sourceIndex(),
                item.cursor(),
                item.inputLocation(),
                item.batchId(),
                item.retryCount(),
                operation);
    }
}
