package geoflow.coordinator.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal STAC catalog document: an id, a description and item links.
 * Workers receive one of these as the input location of a work item.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StacCatalog(
        @JsonProperty("stac_version") String stacVersion,
        @JsonProperty("type") String type,
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("links") List<Link> links) {

    public static final String STAC_VERSION = "1.0.0";

    public StacCatalog {
        links = links == null ? List.of() : List.copyOf(links);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Link(
            @JsonProperty("rel") String rel,
            @JsonProperty("href") String href,
            @JsonProperty("type") String type,
            @JsonProperty("title") String title) {
    }

    /** Catalog listing {@code hrefs} as item links. */
    public static StacCatalog ofItems(String id, String description, List<String> hrefs) {
        List<Link> links = new ArrayList<>();
        for (String href : hrefs) {
            links.add(new Link("item", href, "application/json", null));
        }
        return new StacCatalog(STAC_VERSION, "Catalog", id, null, description, links);
    }

    /** Catalog for one granule, linking its data files. */
    public static StacCatalog ofGranule(String id, String title, List<String> dataHrefs) {
        List<Link> links = new ArrayList<>();
        for (String href : dataHrefs) {
            links.add(new Link("data", href, null, null));
        }
        return new StacCatalog(STAC_VERSION, "Catalog", id, title, "Granule " + id, links);
    }

    /** Item hrefs in link order. */
    public List<String> itemHrefs() {
        return links.stream().filter(l -> "item".equals(l.rel())).map(Link::href).toList();
    }
}
