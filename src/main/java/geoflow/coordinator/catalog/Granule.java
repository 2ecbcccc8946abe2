package geoflow.coordinator.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Granule metadata returned by a catalog search.
 *
 * @param sizeBytes total size of the granule's data files, null when unknown
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Granule(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("collection") String collectionId,
        @JsonProperty("dataLinks") List<String> dataLinks,
        @JsonProperty("sizeBytes") Long sizeBytes) {

    public Granule {
        dataLinks = dataLinks == null ? List.of() : List.copyOf(dataLinks);
    }
}
