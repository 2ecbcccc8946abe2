package geoflow.coordinator.service;

import geoflow.coordinator.TestDatabases;
import geoflow.coordinator.catalog.InMemoryCatalogClient;
import geoflow.coordinator.config.CoordinatorConfig;
import geoflow.coordinator.config.Dependencies;
import geoflow.coordinator.error.ConflictException;
import geoflow.coordinator.error.RequestValidationException;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobStatus;
import geoflow.coordinator.model.Source;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.model.WorkflowStep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    @TempDir
    Path objectRoot;

    private Dependencies deps;
    private JobService jobService;

    @BeforeEach
    void setUp() {
        InMemoryCatalogClient catalog = new InMemoryCatalogClient()
                .withGranules("C1", 10)
                .withGranules("C2", 3)
                .withGranules("C-SMALL", 4);
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(TestDatabases.uniqueUrl("jobs"))
                .withObjectStoreRoot(objectRoot.toString())
                .withSharedSecret("test-secret");
        deps = Dependencies.create(config, catalog, null);
        jobService = deps.jobService();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    @DisplayName("Creating a job stores its steps and queues the first discovery item")
    void createJobBuildsWorkflow() {
        Job job = jobService.createJob("alice", "subset-stitch", operation(null, "C1"));

        assertEquals(JobStatus.ACCEPTED, job.status());
        assertEquals(0, job.progress());
        assertEquals(10, job.numInputGranules());
        assertNull(job.advisory());

        List<WorkflowStep> steps = jobService.steps(job.id());
        assertEquals(3, steps.size());
        assertEquals("test/discovery", steps.get(0).serviceId());
        assertFalse(steps.get(1).batched());
        assertTrue(steps.get(2).batched());
        assertEquals(100L, steps.get(2).maxBatchSizeBytes());
        assertEquals(1, steps.get(0).workItemCount());

        // token is stored encrypted
        String stored = steps.get(0).operation().accessToken();
        assertNotEquals("secret-token", stored);
        assertEquals("secret-token", deps.tokenCipher().decrypt(stored));

        List<WorkItem> items = jobService.workItems(job.id(), 10);
        assertEquals(1, items.size());
        assertEquals(WorkItemStatus.READY, items.get(0).status());
        assertEquals(0, items.get(0).sourceIndex());
        assertNull(items.get(0).cursor());
    }

    @Test
    void unknownChainIsRejected() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> jobService.createJob("alice", "nope", operation(null, "C1")));
        assertEquals("Unknown service chain: nope", e.getMessage());
    }

    @Test
    void requestWithoutGranulesCreatesNoJob() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> jobService.createJob("alice", "subset", operation(null, "C-EMPTY")));
        assertEquals("No matching granules found.", e.getMessage());
        assertEquals(0, deps.jobRepository().count());
    }

    @Test
    void missingOwnerIsRejected() {
        assertThrows(RequestValidationException.class,
                () -> jobService.createJob(" ", "subset", operation(null, "C1")));
    }

    @Test
    void sourcesWithoutGranulesAreSkipped() {
        Job job = jobService.createJob("alice", "subset", operation(null, "C-EMPTY", "C2", "C1"));

        assertEquals(13, job.numInputGranules());
        WorkItem first = jobService.workItems(job.id(), 10).get(0);
        assertEquals(1, first.sourceIndex());
    }

    @Test
    void collectionLimitProducesAdvisory() {
        Job job = jobService.createJob("alice", "limited", operation(null, "C-SMALL"));

        assertEquals(2, job.numInputGranules());
        assertEquals("CMR query identified 4 granules, but the request has been limited to process only the "
                + "first 2 granules because collection C-SMALL is limited to 2 for the limited service.",
                job.message());
        assertEquals(job.message(), job.advisory());
    }

    @Test
    void serviceLimitAppliesPerSource() {
        Job job = jobService.createJob("alice", "limited", operation(null, "C1", "C2"));

        // C1 capped at 5, C2 untouched
        assertEquals(8, job.numInputGranules());
        assertTrue(job.advisory().endsWith("because the service limited is limited to 5."));
    }

    @Test
    void maxResultsBelowServiceLimitWins() {
        Job job = jobService.createJob("alice", "limited", operation(3, "C1"));

        assertEquals(3, job.numInputGranules());
        assertTrue(job.advisory().endsWith("because you requested 3 maxResults."));
    }

    @Test
    void cancelStopsAllWork() {
        Job job = jobService.createJob("alice", "subset", operation(null, "C1"));

        Job canceled = jobService.cancel(job.id()).orElseThrow();
        assertEquals(JobStatus.CANCELED, canceled.status());
        assertEquals("Canceled by user", canceled.message());
        jobService.workItems(job.id(), 10)
                .forEach(item -> assertEquals(WorkItemStatus.CANCELED, item.status()));

        ConflictException e = assertThrows(ConflictException.class, () -> jobService.cancel(job.id()));
        assertEquals("Job " + job.id() + " is already canceled", e.getMessage());
        assertThrows(ConflictException.class, () -> jobService.pause(job.id()));
    }

    @Test
    void unknownJobIsEmpty() {
        assertTrue(jobService.cancel("missing").isEmpty());
        assertTrue(jobService.pause("missing").isEmpty());
        assertTrue(jobService.resume("missing").isEmpty());
        assertTrue(jobService.findById("missing").isEmpty());
    }

    @Test
    void pauseAndResume() {
        Job job = jobService.createJob("alice", "subset", operation(null, "C1"));

        assertThrows(ConflictException.class, () -> jobService.resume(job.id()));
        assertEquals(JobStatus.PAUSED, jobService.pause(job.id()).orElseThrow().status());
        assertThrows(ConflictException.class, () -> jobService.pause(job.id()));
        assertEquals(JobStatus.RUNNING, jobService.resume(job.id()).orElseThrow().status());
    }

    @Test
    void recentJobsFilterByOwner() {
        jobService.createJob("alice", "subset", operation(null, "C1"));
        jobService.createJob("bob", "subset", operation(null, "C2"));

        assertEquals(2, jobService.findRecent(null, 10).size());
        List<Job> bobs = jobService.findRecent("bob", 10);
        assertEquals(1, bobs.size());
        assertEquals("bob", bobs.get(0).owner());
    }

    private static DataOperation operation(Integer maxResults, String... collections) {
        List<Source> sources = Arrays.stream(collections)
                .map(c -> new Source(c, List.of()))
                .toList();
        return new DataOperation("req-1", sources, null, "image/tiff", false, "secret-token", maxResults);
    }
}
