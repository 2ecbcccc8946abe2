package geoflow.coordinator.scheduler;

import geoflow.coordinator.repository.BatchRepository;
import geoflow.coordinator.repository.JobRepository;
import geoflow.coordinator.repository.WorkItemRepository;
import geoflow.coordinator.repository.WorkflowStepRepository;
import geoflow.coordinator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that deletes the work items, batch items and workflow steps of
 * terminal jobs once they are older than the retention window. Job rows and links stay.
 */
public class WorkReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkReaper.class);

    private static final int MAX_BATCHES_PER_RUN = 20;

    private final Database db;
    private final JobRepository jobRepository;
    private final WorkflowStepRepository stepRepository;
    private final WorkItemRepository workItemRepository;
    private final BatchRepository batchRepository;
    private final Duration retention;
    private final int batchSize;

    public WorkReaper(Database db, JobRepository jobRepository, WorkflowStepRepository stepRepository,
            WorkItemRepository workItemRepository, BatchRepository batchRepository, Duration retention,
            int batchSize) {
        this.db = db;
        this.jobRepository = jobRepository;
        this.stepRepository = stepRepository;
        this.workItemRepository = workItemRepository;
        this.batchRepository = batchRepository;
        this.retention = retention;
        this.batchSize = batchSize;
    }

    @Override
    public void run() {
        try {
            reapOldWork();
        } catch (Exception e) {
            log.error("Work reaper error", e);
        }
    }

    /**
     * @return number of jobs whose workflow state was deleted
     */
    public int reapOldWork() {
        Instant cutoff = Instant.now().minus(retention);
        int jobs = 0;
        for (int batch = 0; batch < MAX_BATCHES_PER_RUN; batch++) {
            List<String> jobIds = jobRepository.findTerminalIdsNotUpdatedSince(cutoff, batchSize);
            if (jobIds.isEmpty()) {
                break;
            }
            int items = db.inTransaction("delete work of " + jobIds.size() + " jobs", conn -> {
                batchRepository.deleteByJobIds(conn, jobIds);
                int deleted = workItemRepository.deleteByJobIds(conn, jobIds);
                stepRepository.deleteByJobIds(conn, jobIds);
                return deleted;
            });
            jobs += jobIds.size();
            log.info("Work reaper deleted {} work items of {} jobs", items, jobIds.size());
            if (jobIds.size() < batchSize) {
                break;
            }
        }
        return jobs;
    }
}
