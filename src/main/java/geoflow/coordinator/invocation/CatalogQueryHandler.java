package geoflow.coordinator.invocation;

import geoflow.coordinator.catalog.CatalogClient;
import geoflow.coordinator.catalog.CatalogException;
import geoflow.coordinator.catalog.CatalogPage;
import geoflow.coordinator.catalog.CatalogQuery;
import geoflow.coordinator.catalog.Granule;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Source;
import geoflow.coordinator.model.WorkAssignment;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemUpdate;
import geoflow.coordinator.service.AccessTokenCipher;
import geoflow.coordinator.storage.ObjectStore;
import geoflow.coordinator.storage.StacCatalog;
import geoflow.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The bundled discovery service: fetches one catalog page for a discovery work item
 * and writes one single-granule catalog per granule.
 */
public class CatalogQueryHandler implements LocalWorkHandler {

    private static final Logger log = LoggerFactory.getLogger(CatalogQueryHandler.class);

    /** Service id of the bundled discovery service. */
    public static final String SERVICE_ID = "geoflow/query-catalog";

    static final String FAILURE_PREFIX = "Failed to query the catalog for granule information: ";

    private final CatalogClient catalogClient;
    private final ObjectStore objectStore;
    private final AccessTokenCipher tokenCipher;

    public CatalogQueryHandler(CatalogClient catalogClient, ObjectStore objectStore, AccessTokenCipher tokenCipher) {
        this.catalogClient = catalogClient;
        this.objectStore = objectStore;
        this.tokenCipher = tokenCipher;
    }

    @Override
    public WorkItemUpdate handle(WorkAssignment assignment) {
        WorkItem item = assignment.workItem();
        DataOperation operation = assignment.operation();
        int sourceIndex = item.sourceIndex() != null ? item.sourceIndex() : 0;
        Integer pageLimit = assignment.maxCatalogPageSize();

        if (pageLimit == null || pageLimit <= 0) {
            return WorkItemUpdate.successful(List.of(), List.of());
        }

        try {
            Source source = operation.sources().get(sourceIndex);
            String token = tokenCipher.decrypt(operation.accessToken());
            CatalogPage page = catalogClient.search(CatalogQuery.of(operation, source, token), item.cursor(), pageLimit);

            List<Granule> granules = page.items().size() > pageLimit
                    ? page.items().subList(0, pageLimit)
                    : page.items();
            List<String> results = new ArrayList<>(granules.size());
            List<Long> sizes = new ArrayList<>(granules.size());
            for (int i = 0; i < granules.size(); i++) {
                Granule granule = granules.get(i);
                StacCatalog catalog = StacCatalog.ofGranule(granule.id(), granule.title(), granule.dataLinks());
                String path = item.jobId() + "/" + item.id() + "/outputs/catalog" + i + ".json";
                results.add(objectStore.put(path, Json.write(catalog).getBytes(StandardCharsets.UTF_8)));
                sizes.add(granule.sizeBytes());
            }

            log.debug("Discovery item {} (source {}): {} granules of {} hits",
                    item.id(), sourceIndex, results.size(), page.totalHits());
            return WorkItemUpdate.successful(results, sizes).withPaging(page.totalHits(), page.nextCursor());
        } catch (CatalogException e) {
            log.warn("Catalog query for work item {} failed: {}", item.id(), e.getMessage());
            return WorkItemUpdate.failed(FAILURE_PREFIX + e.getMessage());
        }
    }
}
