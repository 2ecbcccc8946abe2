package geoflow.coordinator.scheduler;

import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobStatus;
import geoflow.coordinator.repository.JobRepository;
import geoflow.coordinator.service.JobService;
import geoflow.coordinator.tracking.ExecutionTracker;
import geoflow.coordinator.tracking.RunStatus;
import geoflow.coordinator.tracking.TrackerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Background task that cancels orphaned jobs.
 *
 * Jobs that are accepted or running but have not been updated within the reapable
 * age are checked against the execution tracker. When the tracker has no run for the
 * job, or reports the run failed, the job is canceled. Paused jobs are left alone.
 */
public class JobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    public static final String REAPER_MESSAGE = "Canceled by job reaper";
    private static final int BATCH_SIZE = 500;

    private final JobRepository jobRepository;
    private final JobService jobService;
    private final ExecutionTracker executionTracker;
    private final Duration reapableAge;

    public JobReaper(JobRepository jobRepository, JobService jobService, ExecutionTracker executionTracker,
            Duration reapableAge) {
        this.jobRepository = jobRepository;
        this.jobService = jobService;
        this.executionTracker = executionTracker;
        this.reapableAge = reapableAge;
    }

    @Override
    public void run() {
        try {
            reapOrphanedJobs();
        } catch (Exception e) {
            log.error("Job reaper error", e);
        }
    }

    /**
     * @return number of jobs canceled
     */
    public int reapOrphanedJobs() {
        Instant cutoff = Instant.now().minus(reapableAge);
        List<Job> stale = jobRepository.findNotUpdatedSince(
                EnumSet.of(JobStatus.ACCEPTED, JobStatus.RUNNING), cutoff, BATCH_SIZE);

        if (stale.isEmpty()) {
            log.debug("No stale jobs found");
            return 0;
        }

        int reaped = 0;
        for (Job job : stale) {
            RunStatus status;
            try {
                status = executionTracker.getRunStatus(job.id());
            } catch (TrackerException e) {
                log.warn("Skipping job {}: {}", job.id(), e.getMessage());
                continue;
            }
            if (!status.isAbsentOrFailed()) {
                continue;
            }
            if (jobService.cancelOrphan(job.id(), REAPER_MESSAGE)) {
                reaped++;
                log.warn("Job {} canceled by reaper (run {}, last update {})",
                        job.id(), status.exists() ? status.phase() : "absent", job.updatedAt());
            }
        }

        log.info("Job reaper: {} canceled, {} stale checked", reaped, stale.size());
        return reaped;
    }
}
