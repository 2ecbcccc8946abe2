package geoflow.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobLink;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobID") String jobId,
        @JsonProperty("owner") String owner,
        @JsonProperty("chain") String chain,
        @JsonProperty("status") String status,
        @JsonProperty("progress") int progress,
        @JsonProperty("numInputGranules") int numInputGranules,
        @JsonProperty("message") String message,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("links") List<JobLink> links) {

    /** Compact version for list responses */
    public static JobResponse from(Job job) {
        return from(job, null);
    }

    public static JobResponse from(Job job, List<JobLink> links) {
        return new JobResponse(
                job.id(),
                job.owner(),
                job.chain(),
                job.status().value(),
                job.progress(),
                job.numInputGranules(),
                job.message(),
                job.createdAt(),
                job.updatedAt(),
                links);
    }
}
