package geoflow.coordinator.config;

import geoflow.coordinator.invocation.InvocationType;
import org.ini4j.Config;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads service and service chain definitions from an INI file.
 *
 * <pre>
 * [service:geoflow/query-catalog]
 * invocation = direct
 *
 * [service:example/concise]
 * invocation = pull
 * is_batched = true
 * max_batch_inputs = 100
 * timeout_seconds = 900
 *
 * [chain:concise]
 * steps = geoflow/query-catalog, example/concise
 * granule_limit = 500
 * collection.C1234-PROV.granule_limit = 50
 * </pre>
 */
public final class ServiceConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ServiceConfigLoader.class);

    public static final String BUNDLED_RESOURCE = "/services.ini";

    private static final String SERVICE_PREFIX = "service:";
    private static final String CHAIN_PREFIX = "chain:";
    private static final String COLLECTION_PREFIX = "collection.";
    private static final String COLLECTION_SUFFIX = ".granule_limit";

    private ServiceConfigLoader() {
    }

    /**
     * Load from the configured path, or from the bundled classpath resource when no path is set.
     */
    public static ServicesConfig load(CoordinatorConfig config) {
        String path = config.servicesConfigPath();
        if (path == null) {
            try (InputStream in = ServiceConfigLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Bundled services configuration not found: " + BUNDLED_RESOURCE);
                }
                return load(new InputStreamReader(in, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read bundled services configuration", e);
            }
        }
        try (Reader reader = Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read services configuration: " + path, e);
        }
    }

    public static ServicesConfig load(Reader reader) throws IOException {
        Ini ini = new Ini();
        Config iniConfig = Config.getGlobal().clone();
        iniConfig.setTree(false); // service ids contain '/'
        ini.setConfig(iniConfig);
        ini.load(reader);

        Map<String, ServiceStepConfig> services = new LinkedHashMap<>();
        for (String name : ini.keySet()) {
            if (name.startsWith(SERVICE_PREFIX)) {
                String serviceId = name.substring(SERVICE_PREFIX.length()).trim();
                services.put(serviceId, parseService(serviceId, ini.get(name)));
            }
        }

        Map<String, ServiceChainConfig> chains = new LinkedHashMap<>();
        for (String name : ini.keySet()) {
            if (name.startsWith(CHAIN_PREFIX)) {
                String chainName = name.substring(CHAIN_PREFIX.length()).trim();
                chains.put(chainName, parseChain(chainName, ini.get(name), services));
            }
        }

        log.info("Loaded {} services and {} service chains", services.size(), chains.size());
        return new ServicesConfig(services, chains);
    }

    private static ServiceStepConfig parseService(String serviceId, Profile.Section section) {
        InvocationType invocation = InvocationType.parse(opt(section, "invocation"));
        Integer maxInputs = optInt(section, "max_batch_inputs");
        Long maxBytes = optLong(section, "max_batch_size_bytes");
        boolean batched = Boolean.parseBoolean(opt(section, "is_batched"));
        if (!batched && (maxInputs != null || maxBytes != null)) {
            log.warn("Service {} declares batch thresholds but is_batched is not true, ignoring them", serviceId);
            maxInputs = null;
            maxBytes = null;
        }
        Long timeoutSeconds = optLong(section, "timeout_seconds");
        Duration timeout = timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds);
        return new ServiceStepConfig(serviceId, invocation, batched, maxInputs, maxBytes, timeout);
    }

    private static ServiceChainConfig parseChain(String chainName, Profile.Section section,
            Map<String, ServiceStepConfig> services) {
        String stepList = opt(section, "steps");
        if (stepList == null) {
            throw new IllegalStateException("Service chain " + chainName + " declares no steps");
        }

        List<ServiceStepConfig> steps = new ArrayList<>();
        for (String raw : stepList.split(",")) {
            String serviceId = raw.trim();
            if (serviceId.isEmpty()) {
                continue;
            }
            ServiceStepConfig step = services.get(serviceId);
            if (step == null) {
                throw new IllegalStateException("Service chain " + chainName + " references unknown service " + serviceId);
            }
            steps.add(step);
        }
        if (steps.size() > 1 && steps.get(0).batched()) {
            throw new IllegalStateException("Discovery step of chain " + chainName + " cannot be batched");
        }

        String hasLimit = opt(section, "has_granule_limit");
        boolean hasGranuleLimit = hasLimit == null || Boolean.parseBoolean(hasLimit);

        Map<String, Integer> collectionLimits = new HashMap<>();
        for (String key : section.keySet()) {
            if (key.startsWith(COLLECTION_PREFIX) && key.endsWith(COLLECTION_SUFFIX)) {
                String collectionId = key.substring(COLLECTION_PREFIX.length(), key.length() - COLLECTION_SUFFIX.length());
                collectionLimits.put(collectionId, Integer.parseInt(section.get(key).trim()));
            }
        }

        return new ServiceChainConfig(chainName, steps, hasGranuleLimit, optInt(section, "granule_limit"),
                collectionLimits);
    }

    private static String opt(Profile.Section section, String key) {
        String value = section.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Integer optInt(Profile.Section section, String key) {
        String value = opt(section, key);
        return value == null ? null : Integer.valueOf(value);
    }

    private static Long optLong(Profile.Section section, String key) {
        String value = opt(section, key);
        return value == null ? null : Long.valueOf(value);
    }
}
