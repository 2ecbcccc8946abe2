package geoflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference to a result artifact of a job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobLink(
        @JsonProperty("href") String href,
        @JsonProperty("rel") String rel,
        @JsonProperty("title") String title) {

    public static JobLink data(String href) {
        String title = href.substring(href.lastIndexOf('/') + 1);
        return new JobLink(href, "data", title);
    }
}
