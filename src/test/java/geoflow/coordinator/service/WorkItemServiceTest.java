package geoflow.coordinator.service;

import geoflow.coordinator.TestDatabases;
import geoflow.coordinator.catalog.InMemoryCatalogClient;
import geoflow.coordinator.config.CoordinatorConfig;
import geoflow.coordinator.config.Dependencies;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobStatus;
import geoflow.coordinator.model.Source;
import geoflow.coordinator.model.WorkAssignment;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.model.WorkItemUpdate;
import geoflow.coordinator.model.WorkItemUpdateResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dispatcher behavior against a real H2 database: claims, completions, retries and failure propagation.
 */
class WorkItemServiceTest {

    private static final String DISCOVERY = "test/discovery";
    private static final String SUBSETTER = "test/subsetter";

    @TempDir
    Path objectRoot;

    private Dependencies deps;
    private InMemoryCatalogClient catalog;
    private WorkItemService service;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryCatalogClient().withGranules("C1", 10);
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(TestDatabases.uniqueUrl("work"))
                .withObjectStoreRoot(objectRoot.toString())
                .withCatalogPageSize(4)
                .withWorkItemRetryLimit(1)
                .withSharedSecret("test-secret");
        deps = Dependencies.create(config, catalog, null);
        service = deps.workItemService();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    @DisplayName("Discovery item carries the page size and completion is idempotent")
    void discoveryCompletionIsIdempotent() {
        Job job = createJob("subset", null);

        WorkAssignment assignment = service.claim(DISCOVERY).orElseThrow();
        assertEquals(4, assignment.maxCatalogPageSize());
        assertEquals(0, assignment.workItem().sourceIndex());
        assertEquals("test-token", deps.tokenCipher().decrypt(assignment.operation().accessToken()));
        assertEquals(JobStatus.RUNNING, deps.jobService().findById(job.id()).orElseThrow().status());

        WorkItemUpdate update = page(0, 4, 10, "mem:4");
        assertEquals(WorkItemUpdateResult.APPLIED, service.update(assignment.workItem().id(), update));
        assertEquals(WorkItemUpdateResult.ALREADY_TERMINAL, service.update(assignment.workItem().id(), update));

        assertEquals(4, service.readyCount(SUBSETTER));
        assertEquals(1, service.readyCount(DISCOVERY));

        WorkAssignment next = service.claim(DISCOVERY).orElseThrow();
        assertEquals("mem:4", next.workItem().cursor());
        assertEquals(1, next.workItem().sortIndex());
    }

    @Test
    void lastDiscoveryPageIsLimitedToRemainingGranules() {
        createJob("subset", null);

        completeDiscovery(0, 4, "mem:4");
        completeDiscovery(4, 4, "mem:8");

        WorkAssignment last = service.claim(DISCOVERY).orElseThrow();
        assertEquals(2, last.maxCatalogPageSize());
        service.update(last.workItem().id(), page(8, 2, 10, null));

        assertTrue(service.claim(DISCOVERY).isEmpty());
        assertEquals(10, service.readyCount(SUBSETTER));
    }

    @Test
    void fewerHitsLowerTheGranuleCount() {
        Job job = createJob("subset", null);
        assertEquals(10, job.numInputGranules());

        WorkAssignment assignment = service.claim(DISCOVERY).orElseThrow();
        service.update(assignment.workItem().id(), page(0, 3, 3, "mem:3"));

        assertEquals(3, deps.jobService().findById(job.id()).orElseThrow().numInputGranules());
        assertTrue(service.claim(DISCOVERY).isEmpty(), "no further page once the corrected count is reached");
    }

    @Test
    @DisplayName("Concurrent claims never hand out the same work item twice")
    void concurrentClaimsAreExclusive() throws Exception {
        createJob("unlimited", null);
        WorkAssignment discovery = service.claim(DISCOVERY).orElseThrow();
        service.update(discovery.workItem().id(), page(0, 4, 10, null));
        assertEquals(4, service.readyCount(SUBSETTER));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Long> claimed = Collections.synchronizedList(new ArrayList<>());
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                Optional<WorkAssignment> a;
                while ((a = service.claim(SUBSETTER)).isPresent()) {
                    claimed.add(a.get().workItem().id());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(4, claimed.size());
        assertEquals(4, new HashSet<>(claimed).size());
    }

    @Test
    void failedItemIsRetriedThenFailsTheJob() {
        Job job = createJob("subset", null);
        completeDiscovery(0, 4, "mem:4");

        WorkAssignment first = service.claim(SUBSETTER).orElseThrow();
        long id = first.workItem().id();
        assertEquals(WorkItemUpdateResult.RETRIED, service.update(id, WorkItemUpdate.failed("boom")));

        WorkItem retried = deps.workItemRepository().findById(id).orElseThrow();
        assertEquals(WorkItemStatus.READY, retried.status());
        assertEquals(1, retried.retryCount());

        WorkAssignment again = service.claim(SUBSETTER).orElseThrow();
        assertEquals(id, again.workItem().id(), "oldest ready item is claimed first");
        assertEquals(WorkItemUpdateResult.JOB_FAILED, service.update(id, WorkItemUpdate.failed("boom")));

        Job failed = deps.jobService().findById(job.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals("WorkItem failed: boom", failed.message());

        for (WorkItem item : deps.jobService().workItems(job.id(), 100)) {
            assertTrue(item.isTerminal(), "item " + item.id() + " left " + item.status());
        }
        assertTrue(service.claim(SUBSETTER).isEmpty());
        assertTrue(service.claim(DISCOVERY).isEmpty());
    }

    @Test
    void canceledReportIsTerminalAndNotRetried() {
        Job job = createJob("subset", null);
        completeDiscovery(0, 4, "mem:4");

        long id = service.claim(SUBSETTER).orElseThrow().workItem().id();
        WorkItemUpdate canceled = new WorkItemUpdate(
                WorkItemStatus.CANCELED, List.of(), List.of(), "worker shutting down", null, null, null);
        assertEquals(WorkItemUpdateResult.JOB_CANCELED, service.update(id, canceled));

        WorkItem item = deps.workItemRepository().findById(id).orElseThrow();
        assertEquals(WorkItemStatus.CANCELED, item.status());
        assertEquals(0, item.retryCount());
        assertEquals("worker shutting down", item.subStatus());

        Job after = deps.jobService().findById(job.id()).orElseThrow();
        assertEquals(JobStatus.CANCELED, after.status());
        assertEquals("Canceled by worker: worker shutting down", after.message());
        assertTrue(service.claim(SUBSETTER).isEmpty());

        assertEquals(WorkItemUpdateResult.ALREADY_TERMINAL, service.update(id, canceled));
    }

    @Test
    void discoveryFailureUsesItsOwnMessage() {
        Job job = createJob("subset", null);
        String reason = "Failed to query the catalog for granule information: 503";

        long id = service.claim(DISCOVERY).orElseThrow().workItem().id();
        service.update(id, WorkItemUpdate.failed(reason));
        service.claim(DISCOVERY).orElseThrow();
        assertEquals(WorkItemUpdateResult.JOB_FAILED, service.update(id, WorkItemUpdate.failed(reason)));

        assertEquals(reason, deps.jobService().findById(job.id()).orElseThrow().message());
    }

    @Test
    void updatesForUnknownOrNotRunningItems() {
        createJob("subset", null);

        assertEquals(WorkItemUpdateResult.NOT_FOUND,
                service.update(999_999L, WorkItemUpdate.successful(List.of(), List.of())));

        WorkItem ready = deps.workItemRepository().findByJob(
                deps.jobService().findRecent(null, 1).get(0).id(), 10).get(0);
        assertEquals(WorkItemUpdateResult.NOT_RUNNING,
                service.update(ready.id(), WorkItemUpdate.successful(List.of(), List.of())));
    }

    @Test
    void updateAfterCancelCancelsTheItem() {
        Job job = createJob("subset", null);
        long id = service.claim(DISCOVERY).orElseThrow().workItem().id();

        deps.jobService().cancel(job.id());

        WorkItemUpdateResult result = service.update(id, page(0, 4, 10, "mem:4"));
        assertTrue(result == WorkItemUpdateResult.ALREADY_TERMINAL || result == WorkItemUpdateResult.JOB_TERMINAL);
        assertEquals(WorkItemStatus.CANCELED, deps.workItemRepository().findById(id).orElseThrow().status());
        assertEquals(0, service.readyCount(SUBSETTER));
    }

    @Test
    void pausedJobsAreNotClaimed() {
        Job job = createJob("subset", null);

        deps.jobService().pause(job.id());
        assertTrue(service.claim(DISCOVERY).isEmpty());
        assertEquals(0, service.readyCount(DISCOVERY));

        deps.jobService().resume(job.id());
        assertTrue(service.claim(DISCOVERY).isPresent());
    }

    @Test
    void unbatchedChainSucceedsWithLinks() {
        Job job = createJob("subset", 2);
        WorkAssignment discovery = service.claim(DISCOVERY).orElseThrow();
        assertEquals(2, discovery.maxCatalogPageSize());
        service.update(discovery.workItem().id(), page(0, 2, 10, "mem:2"));

        for (int i = 0; i < 2; i++) {
            WorkAssignment item = service.claim(SUBSETTER).orElseThrow();
            service.update(item.workItem().id(),
                    WorkItemUpdate.successful(List.of("s3://out/part-" + i + ".nc"), List.of(5L)));
        }

        Job done = deps.jobService().findById(job.id()).orElseThrow();
        assertEquals(JobStatus.SUCCESSFUL, done.status());
        assertEquals(100, done.progress());
        assertTrue(done.message().startsWith("The job has completed successfully. CMR query identified 10 granules"));
        assertEquals(2, deps.jobService().links(job.id()).size());
    }

    private Job createJob(String chain, Integer maxResults) {
        DataOperation operation = new DataOperation("req-1", List.of(new Source("C1", List.of("sst"))),
                null, "application/x-netcdf4", false, "test-token", maxResults);
        return deps.jobService().createJob("alice", chain, operation);
    }

    private void completeDiscovery(int offset, int count, String cursor) {
        WorkAssignment assignment = service.claim(DISCOVERY).orElseThrow();
        assertEquals(WorkItemUpdateResult.APPLIED,
                service.update(assignment.workItem().id(), page(offset, count, 10, cursor)));
    }

    private static WorkItemUpdate page(int offset, int count, int hits, String cursor) {
        List<String> results = new ArrayList<>();
        for (int i = offset; i < offset + count; i++) {
            results.add("s3://bucket/C1-G" + i + ".json");
        }
        return WorkItemUpdate.successful(results, Collections.nCopies(count, 10L)).withPaging(hits, cursor);
    }
}
