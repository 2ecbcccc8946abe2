package geoflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One collection to draw granules from, with the variables requested from it.
 * {@code granuleCount} is derived at job creation: the number of granules that
 * will be processed for this source after limiting.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Source(
        @JsonProperty("collection") String collectionId,
        @JsonProperty("variables") List<String> variables,
        @JsonProperty("granuleCount") Integer granuleCount) {

    public Source {
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public Source(String collectionId, List<String> variables) {
        this(collectionId, variables, null);
    }

    public Source withGranuleCount(int count) {
        return new Source(collectionId, variables, count);
    }
}
