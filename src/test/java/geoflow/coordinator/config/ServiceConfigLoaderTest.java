package geoflow.coordinator.config;

import geoflow.coordinator.invocation.InvocationType;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ServiceConfigLoaderTest {

    @Test
    void parsesServicesAndChains() throws Exception {
        ServicesConfig config = ServiceConfigLoader.load(new StringReader("""
                [service:geoflow/query-catalog]
                invocation = direct

                [service:example/concise]
                invocation = pull
                is_batched = true
                max_batch_inputs = 100
                max_batch_size_bytes = 2048
                timeout_seconds = 900

                [chain:concise]
                steps = geoflow/query-catalog, example/concise
                granule_limit = 500
                collection.C1234-PROV.granule_limit = 50
                """));

        ServiceStepConfig discovery = config.service("geoflow/query-catalog").orElseThrow();
        assertEquals(InvocationType.DIRECT, discovery.invocation());
        assertFalse(discovery.batched());

        ServiceStepConfig concise = config.service("example/concise").orElseThrow();
        assertEquals(InvocationType.PULL_QUEUE, concise.invocation());
        assertTrue(concise.batched());
        assertEquals(100, concise.maxBatchInputs());
        assertEquals(2048L, concise.maxBatchSizeBytes());
        assertEquals(Duration.ofSeconds(900), concise.timeout());

        ServiceChainConfig chain = config.chain("concise").orElseThrow();
        assertEquals(2, chain.steps().size());
        assertEquals("geoflow/query-catalog", chain.discoveryStep().serviceId());
        assertTrue(chain.hasGranuleLimit());
        assertEquals(500, chain.granuleLimit());
        assertEquals(50, chain.collectionLimit("C1234-PROV"));
        assertNull(chain.collectionLimit("other"));
    }

    @Test
    void thresholdsWithoutBatchingAreIgnored() throws Exception {
        ServicesConfig config = ServiceConfigLoader.load(new StringReader("""
                [service:a]
                max_batch_inputs = 10
                """));

        ServiceStepConfig service = config.service("a").orElseThrow();
        assertFalse(service.batched());
        assertNull(service.maxBatchInputs());
    }

    @Test
    void unknownServiceInChainFails() {
        assertThrows(IllegalStateException.class, () -> ServiceConfigLoader.load(new StringReader("""
                [service:a]
                [chain:broken]
                steps = a, missing
                """)));
    }

    @Test
    void batchedDiscoveryStepFails() {
        assertThrows(IllegalStateException.class, () -> ServiceConfigLoader.load(new StringReader("""
                [service:a]
                is_batched = true
                [service:b]
                [chain:broken]
                steps = a, b
                """)));
    }

    @Test
    void granuleLimitCanBeDisabled() throws Exception {
        ServicesConfig config = ServiceConfigLoader.load(new StringReader("""
                [service:a]
                [chain:open]
                steps = a
                has_granule_limit = false
                """));

        assertFalse(config.chain("open").orElseThrow().hasGranuleLimit());
    }

    @Test
    void bundledConfigurationLoads() {
        ServicesConfig config = ServiceConfigLoader.load(CoordinatorConfig.defaults());

        assertTrue(config.service("geoflow/query-catalog").isPresent());
        assertFalse(config.chains().isEmpty());
    }
}
