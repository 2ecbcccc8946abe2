package geoflow.coordinator.service;

import geoflow.coordinator.config.CoordinatorConfig;
import geoflow.coordinator.config.ServiceChainConfig;
import geoflow.coordinator.model.GranuleLimit;
import geoflow.coordinator.model.GranuleLimitReason;

/**
 * Computes the effective granule cap for one source of a request.
 *
 * <p>Candidates are considered in the order system, maxResults, service, collection.
 * A candidate replaces the running minimum only when strictly smaller, so ties keep
 * the earlier reason.
 */
public class GranuleLimiter {

    private final int systemLimit;

    public GranuleLimiter(CoordinatorConfig config) {
        this(config.maxGranuleLimit());
    }

    public GranuleLimiter(int systemLimit) {
        this.systemLimit = systemLimit;
    }

    public GranuleLimit limitFor(ServiceChainConfig chain, String collectionId, Integer maxResults) {
        if (!chain.hasGranuleLimit()) {
            return GranuleLimit.UNLIMITED;
        }

        GranuleLimit limit = new GranuleLimit(systemLimit, GranuleLimitReason.SYSTEM);
        limit = lower(limit, maxResults, GranuleLimitReason.MAX_RESULTS);
        limit = lower(limit, chain.granuleLimit(), GranuleLimitReason.SERVICE);
        limit = lower(limit, chain.collectionLimit(collectionId), GranuleLimitReason.COLLECTION);
        return limit;
    }

    private static GranuleLimit lower(GranuleLimit current, Integer candidate, GranuleLimitReason reason) {
        if (candidate != null && candidate < current.maxGranules()) {
            return new GranuleLimit(candidate, reason);
        }
        return current;
    }
}
