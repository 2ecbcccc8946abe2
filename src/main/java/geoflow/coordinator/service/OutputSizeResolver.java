package geoflow.coordinator.service;

import geoflow.coordinator.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fills in output sizes a worker did not report: first from the object store,
 * then from the configured fallback.
 */
public class OutputSizeResolver {

    private static final Logger log = LoggerFactory.getLogger(OutputSizeResolver.class);

    private final ObjectStore objectStore;
    private final long unknownItemSizeBytes;

    public OutputSizeResolver(ObjectStore objectStore, long unknownItemSizeBytes) {
        this.objectStore = objectStore;
        this.unknownItemSizeBytes = Math.max(1, unknownItemSizeBytes);
    }

    /**
     * @param reported sizes parallel to {@code results}, possibly empty or with null entries
     * @return one positive size per result
     */
    public List<Long> resolve(List<String> results, List<Long> reported) {
        List<Long> sizes = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            Long size = i < reported.size() ? reported.get(i) : null;
            if (size == null || size <= 0) {
                size = lookup(results.get(i));
            }
            sizes.add(size);
        }
        return sizes;
    }

    private long lookup(String location) {
        Optional<Long> stored = Optional.empty();
        try {
            stored = objectStore.size(location);
        } catch (RuntimeException e) {
            log.warn("Size lookup failed for {}: {}", location, e.getMessage());
        }
        return stored.filter(s -> s > 0).orElse(unknownItemSizeBytes);
    }
}
