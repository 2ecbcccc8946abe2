package geoflow.coordinator.api.internal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /metrics/ready-count?serviceID=...
 */
public record ReadyCountResponse(@JsonProperty("availableWorkItems") int availableWorkItems) {
}
