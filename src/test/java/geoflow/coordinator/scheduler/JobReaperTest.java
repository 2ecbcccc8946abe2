package geoflow.coordinator.scheduler;

import geoflow.coordinator.TestDatabases;
import geoflow.coordinator.catalog.InMemoryCatalogClient;
import geoflow.coordinator.config.CoordinatorConfig;
import geoflow.coordinator.config.Dependencies;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobStatus;
import geoflow.coordinator.model.Source;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.tracking.ExecutionTracker;
import geoflow.coordinator.tracking.RunPhase;
import geoflow.coordinator.tracking.RunStatus;
import geoflow.coordinator.tracking.TrackerException;
import geoflow.coordinator.tracking.WorkItemExecutionTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobReaperTest {

    // cutoff in the future, so every job counts as stale
    private static final Duration ALL_STALE = Duration.ofSeconds(-5);

    @TempDir
    Path objectRoot;

    @Mock
    ExecutionTracker tracker;

    private Dependencies deps;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(TestDatabases.uniqueUrl("job-reaper"))
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
    void absentRunIsCanceled() {
        Job job = createJob();
        when(tracker.getRunStatus(job.id())).thenReturn(RunStatus.ABSENT);

        assertEquals(1, reaper(tracker, ALL_STALE).reapOrphanedJobs());

        Job reaped = deps.jobService().findById(job.id()).orElseThrow();
        assertEquals(JobStatus.CANCELED, reaped.status());
        assertEquals(JobReaper.REAPER_MESSAGE, reaped.message());
        deps.jobService().workItems(job.id(), 10)
                .forEach(item -> assertEquals(WorkItemStatus.CANCELED, item.status()));
    }

    @Test
    void failedRunIsCanceled() {
        Job job = createJob();
        when(tracker.getRunStatus(job.id())).thenReturn(RunStatus.of(RunPhase.FAILED));

        assertEquals(1, reaper(tracker, ALL_STALE).reapOrphanedJobs());
    }

    @Test
    void activeRunIsKept() {
        Job job = createJob();
        when(tracker.getRunStatus(job.id())).thenReturn(RunStatus.of(RunPhase.ACTIVE));

        assertEquals(0, reaper(tracker, ALL_STALE).reapOrphanedJobs());
        assertEquals(JobStatus.ACCEPTED, deps.jobService().findById(job.id()).orElseThrow().status());
    }

    @Test
    void unreachableTrackerSkipsTheJob() {
        Job job = createJob();
        when(tracker.getRunStatus(job.id())).thenThrow(new TrackerException("connection refused"));

        assertEquals(0, reaper(tracker, ALL_STALE).reapOrphanedJobs());
        assertEquals(JobStatus.ACCEPTED, deps.jobService().findById(job.id()).orElseThrow().status());
    }

    @Test
    void recentJobsAreNotChecked() {
        createJob();

        assertEquals(0, reaper(tracker, Duration.ofHours(1)).reapOrphanedJobs());
        verify(tracker, never()).getRunStatus(anyString());
    }

    @Test
    void pausedJobsAreNotChecked() {
        Job paused = createJob();
        deps.jobService().pause(paused.id());

        assertEquals(0, reaper(tracker, ALL_STALE).reapOrphanedJobs());
        verify(tracker, never()).getRunStatus(anyString());
    }

    @Test
    void localTrackerKeepsJobsWithOpenWork() {
        Job job = createJob();

        JobReaper reaper = reaper(new WorkItemExecutionTracker(deps.workItemRepository()), ALL_STALE);
        assertEquals(0, reaper.reapOrphanedJobs());
        assertEquals(JobStatus.ACCEPTED, deps.jobService().findById(job.id()).orElseThrow().status());
    }

    private JobReaper reaper(ExecutionTracker executionTracker, Duration age) {
        return new JobReaper(deps.jobRepository(), deps.jobService(), executionTracker, age);
    }

    private Job createJob() {
        DataOperation operation = new DataOperation("req", List.of(new Source("C1", List.of())),
                null, null, false, null, null);
        return deps.jobService().createJob("alice", "subset", operation);
    }
}
