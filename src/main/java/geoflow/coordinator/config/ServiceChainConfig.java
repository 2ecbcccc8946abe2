package geoflow.coordinator.config;

import java.util.List;
import java.util.Map;

/**
 * A fixed linear chain of services. The first step is always granule discovery.
 *
 * @param name             chain name requested by clients
 * @param steps            services in execution order
 * @param hasGranuleLimit  false disables granule limiting entirely
 * @param granuleLimit     service-wide cap, null when not configured
 * @param collectionLimits per-collection caps keyed by collection id
 */
public record ServiceChainConfig(
        String name,
        List<ServiceStepConfig> steps,
        boolean hasGranuleLimit,
        Integer granuleLimit,
        Map<String, Integer> collectionLimits) {

    public ServiceChainConfig {
        steps = List.copyOf(steps);
        collectionLimits = collectionLimits == null ? Map.of() : Map.copyOf(collectionLimits);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Service chain " + name + " has no steps");
        }
    }

    public Integer collectionLimit(String collectionId) {
        return collectionLimits.get(collectionId);
    }

    public ServiceStepConfig discoveryStep() {
        return steps.get(0);
    }
}
