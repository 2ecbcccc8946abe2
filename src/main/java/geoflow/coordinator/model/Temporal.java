package geoflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Temporal range of a subset, either end may be open.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Temporal(
        @JsonProperty("start") Instant start,
        @JsonProperty("end") Instant end) {
}
