package geoflow.coordinator.scheduler;

import geoflow.coordinator.TestDatabases;
import geoflow.coordinator.catalog.InMemoryCatalogClient;
import geoflow.coordinator.config.CoordinatorConfig;
import geoflow.coordinator.config.Dependencies;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobStatus;
import geoflow.coordinator.model.Source;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkReaperTest {

    @TempDir
    Path objectRoot;

    private Dependencies deps;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(TestDatabases.uniqueUrl("work-reaper"))
                .withObjectStoreRoot(objectRoot.toString());
        deps = Dependencies.create(config, new InMemoryCatalogClient().withGranules("C1", 3), null);
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    void terminalJobsLoseTheirWorkflowStateButKeepTheJob() {
        Job canceled = createJob();
        Job active = createJob();
        deps.jobService().cancel(canceled.id());

        WorkReaper reaper = new WorkReaper(deps.database(), deps.jobRepository(), deps.stepRepository(),
                deps.workItemRepository(), deps.batchRepository(), Duration.ofSeconds(-5), 1);
        assertEquals(1, reaper.reapOldWork());

        assertTrue(deps.jobService().workItems(canceled.id(), 10).isEmpty());
        assertTrue(deps.jobService().steps(canceled.id()).isEmpty());
        assertEquals(JobStatus.CANCELED, deps.jobService().findById(canceled.id()).orElseThrow().status());

        assertEquals(1, deps.jobService().workItems(active.id(), 10).size());
        assertEquals(2, deps.jobService().steps(active.id()).size());

        // nothing left to delete
        assertEquals(0, reaper.reapOldWork());
    }

    @Test
    void recentTerminalJobsAreRetained() {
        Job job = createJob();
        deps.jobService().cancel(job.id());

        WorkReaper reaper = new WorkReaper(deps.database(), deps.jobRepository(), deps.stepRepository(),
                deps.workItemRepository(), deps.batchRepository(), Duration.ofDays(1), 100);
        assertEquals(0, reaper.reapOldWork());
        assertEquals(1, deps.jobService().workItems(job.id(), 10).size());
    }

    private Job createJob() {
        DataOperation operation = new DataOperation("req", List.of(new Source("C1", List.of())),
                null, null, false, null, null);
        return deps.jobService().createJob("alice", "subset", operation);
    }
}
