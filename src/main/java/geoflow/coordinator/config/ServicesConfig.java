package geoflow.coordinator.config;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All configured services and service chains.
 */
public final class ServicesConfig {

    private final Map<String, ServiceStepConfig> services;
    private final Map<String, ServiceChainConfig> chains;

    public ServicesConfig(Map<String, ServiceStepConfig> services, Map<String, ServiceChainConfig> chains) {
        this.services = new LinkedHashMap<>(services);
        this.chains = new LinkedHashMap<>(chains);
    }

    public Optional<ServiceChainConfig> chain(String name) {
        return Optional.ofNullable(chains.get(name));
    }

    public Optional<ServiceStepConfig> service(String serviceId) {
        return Optional.ofNullable(services.get(serviceId));
    }

    public Collection<ServiceStepConfig> services() {
        return services.values();
    }

    public Collection<ServiceChainConfig> chains() {
        return chains.values();
    }
}
