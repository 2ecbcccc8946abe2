package geoflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Spatial, temporal and shape constraints of a request.
 *
 * @param bbox     west, south, east, north in degrees
 * @param shape    object store location of a normalized GeoJSON shape
 * @param temporal time range
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Subset(
        @JsonProperty("bbox") List<Double> bbox,
        @JsonProperty("shape") String shape,
        @JsonProperty("temporal") Temporal temporal) {

    public Subset {
        bbox = bbox == null ? null : List.copyOf(bbox);
    }

    public static Subset none() {
        return new Subset(null, null, null);
    }
}
