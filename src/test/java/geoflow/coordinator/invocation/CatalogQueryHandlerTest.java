package geoflow.coordinator.invocation;

import geoflow.coordinator.catalog.CatalogClient;
import geoflow.coordinator.catalog.CatalogException;
import geoflow.coordinator.catalog.InMemoryCatalogClient;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Source;
import geoflow.coordinator.model.WorkAssignment;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.model.WorkItemUpdate;
import geoflow.coordinator.service.AccessTokenCipher;
import geoflow.coordinator.storage.FileObjectStore;
import geoflow.coordinator.storage.StacCatalog;
import geoflow.coordinator.util.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CatalogQueryHandlerTest {

    @TempDir
    Path root;

    private FileObjectStore store;
    private AccessTokenCipher cipher;

    @BeforeEach
    void setUp() {
        store = new FileObjectStore(root);
        cipher = new AccessTokenCipher("test-secret");
    }

    @Test
    void writesOneCatalogPerGranule() {
        CatalogQueryHandler handler = new CatalogQueryHandler(
                new InMemoryCatalogClient().withGranules("C1", 5), store, cipher);

        WorkItemUpdate update = handler.handle(assignment(null, 2));

        assertEquals(WorkItemStatus.SUCCESSFUL, update.status());
        assertEquals(2, update.results().size());
        assertEquals(List.of(10L, 10L), update.outputItemSizes());
        assertEquals(5, update.hits());
        assertEquals("mem:2", update.cursor());

        StacCatalog first = Json.read(new String(store.get(update.results().get(0)), StandardCharsets.UTF_8),
                StacCatalog.class);
        assertEquals("C1-G0", first.id());
        assertEquals("https://data.example.org/C1/C1-G0.nc", first.links().get(0).href());
    }

    @Test
    void continuesFromCursor() {
        CatalogQueryHandler handler = new CatalogQueryHandler(
                new InMemoryCatalogClient().withGranules("C1", 5), store, cipher);

        WorkItemUpdate update = handler.handle(assignment("mem:4", 2));

        assertEquals(1, update.results().size());
        assertNull(update.cursor());
    }

    @Test
    void zeroPageLimitSucceedsEmptyWithoutQuerying() {
        InMemoryCatalogClient catalog = new InMemoryCatalogClient().withGranules("C1", 5);
        CatalogQueryHandler handler = new CatalogQueryHandler(catalog, store, cipher);

        WorkItemUpdate update = handler.handle(assignment(null, 0));

        assertEquals(WorkItemStatus.SUCCESSFUL, update.status());
        assertTrue(update.results().isEmpty());
        assertEquals(0, catalog.searchCount());
    }

    @Test
    void catalogErrorsBecomeFailedUpdates() {
        CatalogClient catalog = mock(CatalogClient.class);
        when(catalog.search(any(), any(), anyInt()))
                .thenThrow(new CatalogException("Catalog search failed after 3 attempts", false));
        CatalogQueryHandler handler = new CatalogQueryHandler(catalog, store, cipher);

        WorkItemUpdate update = handler.handle(assignment(null, 2));

        assertEquals(WorkItemStatus.FAILED, update.status());
        assertEquals("Failed to query the catalog for granule information: Catalog search failed after 3 attempts",
                update.subStatus());
    }

    private WorkAssignment assignment(String cursor, int pageSize) {
        WorkItem item = WorkItem.builder()
                .id(42)
                .jobId("job-1")
                .stepIndex(0)
                .serviceId(CatalogQueryHandler.SERVICE_ID)
                .status(WorkItemStatus.RUNNING)
                .sourceIndex(0)
                .cursor(cursor)
                .build();
        DataOperation operation = new DataOperation("req", List.of(new Source("C1", List.of())),
                null, null, false, cipher.encrypt("token"), null);
        return new WorkAssignment(item, operation, pageSize);
    }
}
