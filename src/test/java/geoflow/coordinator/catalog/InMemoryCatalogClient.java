package geoflow.coordinator.catalog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catalog fake serving fixed granule lists per collection. Cursors are "mem:&lt;offset&gt;".
 */
public class InMemoryCatalogClient implements CatalogClient {

    private final Map<String, List<Granule>> granules = new HashMap<>();
    private final Map<String, Integer> reportedHits = new HashMap<>();
    private final AtomicInteger searches = new AtomicInteger();

    /** Add {@code count} granules of 10 bytes each to a collection. */
    public InMemoryCatalogClient withGranules(String collectionId, int count) {
        List<Granule> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String id = collectionId + "-G" + i;
            list.add(new Granule(id, "granule " + i, collectionId,
                    List.of("https://data.example.org/" + collectionId + "/" + id + ".nc"), 10L));
        }
        granules.put(collectionId, list);
        return this;
    }

    /** Report a different total hit count than the granules actually served. */
    public InMemoryCatalogClient reportingHits(String collectionId, int hits) {
        reportedHits.put(collectionId, hits);
        return this;
    }

    public int searchCount() {
        return searches.get();
    }

    @Override
    public CatalogPage search(CatalogQuery query, String cursor, int pageLimit) {
        searches.incrementAndGet();
        List<Granule> all = granules.getOrDefault(query.collectionId(), List.of());
        int hits = reportedHits.getOrDefault(query.collectionId(), all.size());

        int offset = cursor == null ? 0 : Integer.parseInt(cursor.substring("mem:".length()));
        int end = Math.min(all.size(), offset + Math.max(0, pageLimit));
        List<Granule> page = all.subList(Math.min(offset, all.size()), end);
        String next = end < all.size() && pageLimit > 0 ? "mem:" + end : null;
        return new CatalogPage(hits, page, next);
    }
}
