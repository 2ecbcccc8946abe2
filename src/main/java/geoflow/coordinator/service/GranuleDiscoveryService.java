package geoflow.coordinator.service;

import geoflow.coordinator.catalog.CatalogClient;
import geoflow.coordinator.catalog.CatalogPage;
import geoflow.coordinator.catalog.CatalogQuery;
import geoflow.coordinator.config.ServiceChainConfig;
import geoflow.coordinator.error.RequestValidationException;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.GranuleLimit;
import geoflow.coordinator.model.Source;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.model.WorkItemUpdate;
import geoflow.coordinator.model.WorkflowStep;
import geoflow.coordinator.repository.WorkItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Granule counting and paging for the discovery step.
 *
 * <p>At job creation every source is counted against the catalog and capped by its
 * granule limit. Discovery then runs as a sequence of step-0 work items: one page at a
 * time per source, sources in order, each page item carrying the cursor the previous
 * page returned.
 */
public class GranuleDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(GranuleDiscoveryService.class);

    private final CatalogClient catalogClient;
    private final GranuleLimiter granuleLimiter;
    private final WorkItemRepository workItemRepository;
    private final int catalogPageSize;

    public GranuleDiscoveryService(CatalogClient catalogClient, GranuleLimiter granuleLimiter,
            WorkItemRepository workItemRepository, int catalogPageSize) {
        this.catalogClient = catalogClient;
        this.granuleLimiter = granuleLimiter;
        this.workItemRepository = workItemRepository;
        this.catalogPageSize = catalogPageSize;
    }

    /**
     * Granule counts decided at job creation.
     *
     * @param operation        the operation with every source's granule count set
     * @param numInputGranules total granules that will be processed
     * @param advisory         capacity advisory, null when nothing was limited
     */
    public record DiscoveryPlan(DataOperation operation, int numInputGranules, String advisory) {
    }

    /**
     * Count matching granules per source and cap each count by its limit.
     *
     * @param accessToken plaintext token used for the counting queries
     * @throws RequestValidationException when no source matches any granule
     */
    public DiscoveryPlan plan(ServiceChainConfig chain, DataOperation operation, String accessToken) {
        DataOperation planned = operation;
        List<String> advisories = new ArrayList<>();
        int totalHits = 0;
        int total = 0;

        for (int i = 0; i < operation.sources().size(); i++) {
            Source source = operation.sources().get(i);
            GranuleLimit limit = granuleLimiter.limitFor(chain, source.collectionId(), operation.maxResults());

            CatalogPage page = catalogClient.search(CatalogQuery.of(operation, source, accessToken), null, 0);
            int hits = page.totalHits();
            int count = Math.min(hits, limit.maxGranules());

            String advisory = limit.advisoryMessage(hits, source.collectionId(), chain.name(),
                    operation.maxResults());
            if (advisory != null) {
                advisories.add(advisory);
            }

            log.debug("Source {} ({}): {} hits, limit {} ({}), processing {}",
                    i, source.collectionId(), hits, limit.maxGranules(), limit.reason(), count);
            planned = planned.withSourceGranuleCount(i, count);
            totalHits += hits;
            total += count;
        }

        if (totalHits == 0) {
            throw new RequestValidationException("No matching granules found.");
        }
        return new DiscoveryPlan(planned, total, advisories.isEmpty() ? null : String.join(" ", advisories));
    }

    /** Index of the first source at or after {@code from} with granules to process, or -1. */
    public static int nextSourceWithGranules(DataOperation operation, int from) {
        for (int i = from; i < operation.sources().size(); i++) {
            Integer count = operation.sources().get(i).granuleCount();
            if (count != null && count > 0) {
                return i;
            }
        }
        return -1;
    }

    /** Granules of the source still to be discovered. */
    public int remaining(Connection conn, String jobId, DataOperation operation, int sourceIndex)
            throws SQLException {
        Integer count = operation.sources().get(sourceIndex).granuleCount();
        int expected = count != null ? count : 0;
        return Math.max(0, expected - workItemRepository.sumDiscoveryOutputs(conn, jobId, sourceIndex));
    }

    /** Page limit handed to the worker running a discovery item. */
    public int maxCatalogPageSize(Connection conn, WorkItem item, DataOperation operation) throws SQLException {
        return Math.min(catalogPageSize, remaining(conn, item.jobId(), operation, item.sourceIndex()));
    }

    /**
     * Lower a source's granule count when the catalog reports fewer hits than counted at creation.
     *
     * @return the corrected operation, or empty when no correction is needed
     */
    public Optional<DataOperation> correctHits(DataOperation operation, int sourceIndex, Integer hits) {
        Integer count = operation.sources().get(sourceIndex).granuleCount();
        if (hits == null || count == null || hits >= count) {
            return Optional.empty();
        }
        log.info("Catalog now reports {} hits for source {}, lowering granule count from {}",
                hits, sourceIndex, count);
        return Optional.of(operation.withSourceGranuleCount(sourceIndex, hits));
    }

    /**
     * The discovery item to queue after {@code finished} completed successfully: the next
     * page of the same source, else the first page of the next source with granules.
     * The finished item's outputs must already be recorded.
     *
     * @param discovery the discovery step, with its operation already hit-corrected
     */
    public Optional<WorkItem> nextItem(Connection conn, WorkflowStep discovery, WorkItem finished,
            WorkItemUpdate update) throws SQLException {
        DataOperation operation = discovery.operation();
        int sourceIndex = finished.sourceIndex() != null ? finished.sourceIndex() : 0;

        int remaining = remaining(conn, finished.jobId(), operation, sourceIndex);
        if (remaining > 0 && !update.results().isEmpty() && update.cursor() != null) {
            return Optional.of(discoveryItem(discovery, sourceIndex, update.cursor()));
        }
        if (remaining > 0) {
            log.warn("Discovery for source {} of job {} ended {} granules short",
                    sourceIndex, finished.jobId(), remaining);
        }

        int next = nextSourceWithGranules(operation, sourceIndex + 1);
        return next < 0 ? Optional.empty() : Optional.of(discoveryItem(discovery, next, null));
    }

    /** Unsaved discovery item taking the step's next sort index. */
    public static WorkItem discoveryItem(WorkflowStep discovery, int sourceIndex, String cursor) {
        return WorkItem.builder()
                .jobId(discovery.jobId())
                .stepIndex(discovery.stepIndex())
                .serviceId(discovery.serviceId())
                .status(WorkItemStatus.READY)
                .sortIndex(discovery.workItemCount())
                .sourceIndex(sourceIndex)
                .cursor(cursor)
                .build();
    }
}
