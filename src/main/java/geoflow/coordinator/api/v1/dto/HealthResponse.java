package geoflow.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Body of GET /api/v1/health. Only {@code status} and {@code reason} are set when the
 * coordinator is unhealthy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        String status,
        String reason,
        Long uptimeSeconds,
        Integer jobs,
        Map<String, Integer> workItems,
        Boolean schedulerRunning) {

    public static HealthResponse healthy(long uptimeSeconds, int jobs, Map<String, Integer> workItems,
            boolean schedulerRunning) {
        return new HealthResponse("healthy", null, uptimeSeconds, jobs, workItems, schedulerRunning);
    }

    public static HealthResponse unhealthy(String reason) {
        return new HealthResponse("unhealthy", reason, null, null, null, null);
    }
}
