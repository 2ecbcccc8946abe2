package geoflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import geoflow.coordinator.error.RequestValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable description of what a job computes. Each workflow step holds its own
 * snapshot; the {@code with*} methods return a new snapshot and never modify this one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataOperation(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("sources") List<Source> sources,
        @JsonProperty("subset") Subset subset,
        @JsonProperty("format") String outputFormat,
        @JsonProperty("shouldAggregate") boolean shouldAggregate,
        @JsonProperty("accessToken") String accessToken,
        @JsonProperty("maxResults") Integer maxResults) {

    public DataOperation {
        sources = sources == null ? List.of() : List.copyOf(sources);
        subset = subset == null ? Subset.none() : subset;
    }

    /**
     * Check request shape.
     *
     * @throws RequestValidationException describing the first problem found
     */
    public void validate() {
        if (sources.isEmpty()) {
            throw new RequestValidationException("At least one source collection is required");
        }
        for (Source source : sources) {
            if (source == null || source.collectionId() == null || source.collectionId().isBlank()) {
                throw new RequestValidationException("Every source must name a collection");
            }
        }
        if (maxResults != null && maxResults < 1) {
            throw new RequestValidationException("maxResults must be a positive integer");
        }
        List<Double> bbox = subset.bbox();
        if (bbox != null) {
            if (subset.shape() != null) {
                throw new RequestValidationException("Cannot specify both a bounding box and a shape");
            }
            if (bbox.size() != 4) {
                throw new RequestValidationException("bbox must have exactly 4 values: west, south, east, north");
            }
            double south = bbox.get(1);
            double north = bbox.get(3);
            if (south < -90 || north > 90 || south > north) {
                throw new RequestValidationException("bbox latitudes must satisfy -90 <= south <= north <= 90");
            }
            if (Math.abs(bbox.get(0)) > 180 || Math.abs(bbox.get(2)) > 180) {
                throw new RequestValidationException("bbox longitudes must be within [-180, 180]");
            }
        }
        Temporal temporal = subset.temporal();
        if (temporal != null && temporal.start() != null && temporal.end() != null
                && temporal.start().isAfter(temporal.end())) {
            throw new RequestValidationException("Temporal start must not be after temporal end");
        }
    }

    public DataOperation withSources(List<Source> newSources) {
        return new DataOperation(requestId, newSources, subset, outputFormat, shouldAggregate, accessToken, maxResults);
    }

    public DataOperation withSourceGranuleCount(int sourceIndex, int granuleCount) {
        List<Source> updated = new ArrayList<>(sources);
        updated.set(sourceIndex, sources.get(sourceIndex).withGranuleCount(granuleCount));
        return withSources(updated);
    }

    public DataOperation withAccessToken(String token) {
        return new DataOperation(requestId, sources, subset, outputFormat, shouldAggregate, token, maxResults);
    }

    /** Total granules across sources, counting only sources with a derived count. */
    public int granuleCount() {
        return sources.stream()
                .map(Source::granuleCount)
                .filter(c -> c != null)
                .mapToInt(Integer::intValue)
                .sum();
    }
}
