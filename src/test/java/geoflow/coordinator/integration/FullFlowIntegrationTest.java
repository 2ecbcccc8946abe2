package geoflow.coordinator.integration;

import geoflow.coordinator.TestDatabases;
import geoflow.coordinator.catalog.InMemoryCatalogClient;
import geoflow.coordinator.config.CoordinatorConfig;
import geoflow.coordinator.config.Dependencies;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobLink;
import geoflow.coordinator.model.JobStatus;
import geoflow.coordinator.model.Source;
import geoflow.coordinator.model.WorkAssignment;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemUpdate;
import geoflow.coordinator.model.WorkItemUpdateResult;
import geoflow.coordinator.service.WorkItemService;
import geoflow.coordinator.storage.StacCatalog;
import geoflow.coordinator.util.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Whole-job flows: discovery paging, batching into the aggregating step, progress and
 * result links, plus the in-process discovery service.
 */
class FullFlowIntegrationTest {

    @TempDir
    Path objectRoot;

    private Dependencies deps;
    private WorkItemService work;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(TestDatabases.uniqueUrl("flow"))
                .withObjectStoreRoot(objectRoot.toString())
                .withCatalogPageSize(2)
                .withSharedSecret("flow-secret");
        deps = Dependencies.create(config, new InMemoryCatalogClient().withGranules("C1", 10), null);
        work = deps.workItemService();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    @DisplayName("Seven granules paged by two are concatenated in batches of three")
    void pagedDiscoveryFeedsBatches() {
        // 1. Create job limited to 7 granules
        Job job = deps.jobService().createJob("alice", "concatenate", operation(7));
        assertEquals(7, job.numInputGranules());
        assertNotNull(job.advisory());

        // 2. Act as the discovery worker: pages of 2, 2, 2, 1
        List<String> discovered = new ArrayList<>();
        List<Integer> pageSizes = new ArrayList<>();
        WorkAssignment page;
        int offset = 0;
        while ((page = work.claim("test/discovery").orElse(null)) != null) {
            int size = page.maxCatalogPageSize();
            pageSizes.add(size);
            List<String> results = new ArrayList<>();
            for (int i = offset; i < offset + size; i++) {
                results.add("s3://discovery/C1-G" + i + ".json");
            }
            offset += size;
            discovered.addAll(results);
            WorkItemUpdate update = WorkItemUpdate.successful(results, Collections.nCopies(size, 10L))
                    .withPaging(10, "mem:" + offset);
            assertEquals(WorkItemUpdateResult.APPLIED, work.update(page.workItem().id(), update));
        }
        assertEquals(List.of(2, 2, 2, 1), pageSizes);

        // 3. Three batches exist, in order, covering every discovered granule
        List<WorkItem> batches = deps.jobService().workItems(job.id(), 100).stream()
                .filter(i -> i.stepIndex() == 1)
                .toList();
        assertEquals(3, batches.size());
        List<String> batched = new ArrayList<>();
        for (WorkItem batch : batches) {
            StacCatalog catalog = Json.read(
                    new String(deps.objectStore().get(batch.inputLocation()), StandardCharsets.UTF_8),
                    StacCatalog.class);
            batched.addAll(catalog.itemHrefs());
        }
        assertEquals(discovered, batched);
        assertEquals(3, catalogSize(batches.get(0)));
        assertEquals(1, catalogSize(batches.get(2)));

        // 4. Complete the batches; progress follows the last step
        List<Integer> progress = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            WorkAssignment batch = work.claim("test/concatenator").orElseThrow();
            work.update(batch.workItem().id(),
                    WorkItemUpdate.successful(List.of("s3://out/concat-" + i + ".nc"), List.of(100L)));
            progress.add(deps.jobService().findById(job.id()).orElseThrow().progress());
        }
        assertEquals(List.of(33, 66, 100), progress);

        // 5. Job is done with one link per output
        Job done = deps.jobService().findById(job.id()).orElseThrow();
        assertEquals(JobStatus.SUCCESSFUL, done.status());
        List<String> hrefs = deps.jobService().links(job.id()).stream().map(JobLink::href).toList();
        assertEquals(List.of("s3://out/concat-0.nc", "s3://out/concat-1.nc", "s3://out/concat-2.nc"), hrefs);
    }

    @Test
    @DisplayName("In-process discovery queues every granule for the next step")
    void directDiscoveryRunsInProcess() throws Exception {
        Job job = deps.jobService().createJob("alice", "direct-subset", operation(5));

        // the direct invoker drains discovery on its own threads
        long deadline = System.currentTimeMillis() + 10_000;
        while (work.readyCount("test/subsetter") < 5 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertEquals(5, work.readyCount("test/subsetter"));

        for (int i = 0; i < 5; i++) {
            WorkAssignment item = work.claim("test/subsetter").orElseThrow();
            assertTrue(item.workItem().inputLocation().startsWith("file:"));
            work.update(item.workItem().id(),
                    WorkItemUpdate.successful(List.of("s3://out/subset-" + i + ".nc"), List.of(1L)));
        }

        Job done = deps.jobService().findById(job.id()).orElseThrow();
        assertEquals(JobStatus.SUCCESSFUL, done.status());
        assertEquals(5, deps.jobService().links(job.id()).size());
    }

    private int catalogSize(WorkItem batch) {
        return Json.read(new String(deps.objectStore().get(batch.inputLocation()), StandardCharsets.UTF_8),
                StacCatalog.class).itemHrefs().size();
    }

    private static DataOperation operation(Integer maxResults) {
        return new DataOperation("req-flow", List.of(new Source("C1", List.of("sst"))),
                null, "application/x-netcdf4", true, "user-token", maxResults);
    }
}
