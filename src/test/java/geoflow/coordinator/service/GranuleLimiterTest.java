package geoflow.coordinator.service;

import geoflow.coordinator.config.ServiceChainConfig;
import geoflow.coordinator.config.ServiceStepConfig;
import geoflow.coordinator.model.GranuleLimit;
import geoflow.coordinator.model.GranuleLimitReason;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GranuleLimiterTest {

    private final GranuleLimiter limiter = new GranuleLimiter(2100);

    @Test
    void systemLimitAppliesByDefault() {
        GranuleLimit limit = limiter.limitFor(chain(null, Map.of()), "C1", null);

        assertEquals(2100, limit.maxGranules());
        assertEquals(GranuleLimitReason.SYSTEM, limit.reason());
    }

    @Test
    void smallestCandidateWins() {
        ServiceChainConfig chain = chain(500, Map.of("C1", 50));

        assertEquals(new GranuleLimit(50, GranuleLimitReason.COLLECTION), limiter.limitFor(chain, "C1", 100));
        assertEquals(new GranuleLimit(100, GranuleLimitReason.MAX_RESULTS), limiter.limitFor(chain, "C2", 100));
        assertEquals(new GranuleLimit(500, GranuleLimitReason.SERVICE), limiter.limitFor(chain, "C2", 1000));
    }

    @Test
    void tiesKeepTheEarlierReason() {
        ServiceChainConfig chain = chain(100, Map.of("C1", 100));

        assertEquals(GranuleLimitReason.MAX_RESULTS, limiter.limitFor(chain, "C1", 100).reason());
        assertEquals(GranuleLimitReason.SYSTEM, limiter.limitFor(chain(2100, Map.of()), "C1", 2100).reason());
    }

    @Test
    void chainWithoutGranuleLimitIsUnlimited() {
        ServiceChainConfig chain = new ServiceChainConfig("open", List.of(ServiceStepConfig.pull("s")),
                false, 10, Map.of());

        GranuleLimit limit = limiter.limitFor(chain, "C1", 5);
        assertEquals(GranuleLimit.UNLIMITED, limit);
        assertNull(limit.advisoryMessage(1_000_000, "C1", "open", 5));
    }

    @Test
    void advisoryNamesTheLimitingCandidate() {
        assertEquals("CMR query identified 300 granules, but the request has been limited to process only "
                        + "the first 100 granules because you requested 100 maxResults.",
                new GranuleLimit(100, GranuleLimitReason.MAX_RESULTS).advisoryMessage(300, "C1", "svc", 100));

        assertEquals("CMR query identified 300 granules, but the request has been limited to process only "
                        + "the first 50 granules because collection C1 is limited to 50 for the svc service.",
                new GranuleLimit(50, GranuleLimitReason.COLLECTION).advisoryMessage(300, "C1", "svc", null));

        assertTrue(new GranuleLimit(2100, GranuleLimitReason.SYSTEM).advisoryMessage(3000, "C1", "svc", null)
                .endsWith("because of system constraints."));
    }

    @Test
    void noAdvisoryWhenHitsFitTheLimit() {
        assertNull(new GranuleLimit(100, GranuleLimitReason.SERVICE).advisoryMessage(100, "C1", "svc", null));
    }

    private static ServiceChainConfig chain(Integer serviceLimit, Map<String, Integer> collectionLimits) {
        return new ServiceChainConfig("svc", List.of(ServiceStepConfig.pull("s")), true, serviceLimit,
                collectionLimits);
    }
}
