package geoflow.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import geoflow.coordinator.model.DataOperation;

/**
 * Request DTO for creating a new job.
 * POST /api/v1/jobs
 */
public record CreateJobRequest(
        @JsonProperty("owner") String owner,
        @JsonProperty("chain") String chain,
        @JsonProperty("operation") DataOperation operation) {

    /** Validate the request envelope; the operation validates itself in the service. */
    public void validate() {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
        if (chain == null || chain.isBlank()) {
            throw new IllegalArgumentException("chain is required");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation is required");
        }
    }
}
