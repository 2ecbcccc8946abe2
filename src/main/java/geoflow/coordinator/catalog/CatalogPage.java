package geoflow.coordinator.catalog;

import java.util.List;

/**
 * One page of catalog search results.
 *
 * @param totalHits  total granules matching the query
 * @param items      granules of this page
 * @param nextCursor opaque cursor for the next page, null when exhausted
 */
public record CatalogPage(int totalHits, List<Granule> items, String nextCursor) {

    public CatalogPage {
        items = List.copyOf(items);
    }
}
