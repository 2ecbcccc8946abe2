package geoflow.coordinator.service;

import geoflow.coordinator.error.RequestValidationException;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobLink;
import geoflow.coordinator.model.JobStatus;
import geoflow.coordinator.model.WorkAssignment;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.model.WorkItemUpdate;
import geoflow.coordinator.model.WorkItemUpdateResult;
import geoflow.coordinator.model.WorkflowStep;
import geoflow.coordinator.repository.JobRepository;
import geoflow.coordinator.repository.WorkItemRepository;
import geoflow.coordinator.repository.WorkflowStepRepository;
import geoflow.coordinator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Work item dispatcher: the only way workers change work item state.
 *
 * <p>Claims lock a single work item row. Completions lock the job row, then the work
 * item row, then every step row of the job in step order, and run batching, discovery
 * paging, step completion and progress inside that one transaction.
 */
public class WorkItemService {

    private static final Logger log = LoggerFactory.getLogger(WorkItemService.class);

    private static final int MAX_CLAIM_ATTEMPTS = 5;
    static final String SUCCESS_MESSAGE = "The job has completed successfully";
    static final String WORKER_CANCEL_MESSAGE = "Canceled by worker";

    private final Database db;
    private final JobRepository jobRepository;
    private final WorkflowStepRepository stepRepository;
    private final WorkItemRepository workItemRepository;
    private final BatchScheduler batchScheduler;
    private final GranuleDiscoveryService discoveryService;
    private final JobProgressTracker progressTracker;
    private final OutputSizeResolver sizeResolver;
    private final int retryLimit;

    private volatile WorkQueueListener listener = WorkQueueListener.NONE;

    public WorkItemService(Database db, JobRepository jobRepository, WorkflowStepRepository stepRepository,
            WorkItemRepository workItemRepository, BatchScheduler batchScheduler,
            GranuleDiscoveryService discoveryService, JobProgressTracker progressTracker,
            OutputSizeResolver sizeResolver, int retryLimit) {
        this.db = db;
        this.jobRepository = jobRepository;
        this.stepRepository = stepRepository;
        this.workItemRepository = workItemRepository;
        this.batchScheduler = batchScheduler;
        this.discoveryService = discoveryService;
        this.progressTracker = progressTracker;
        this.sizeResolver = sizeResolver;
        this.retryLimit = retryLimit;
    }

    public void setListener(WorkQueueListener listener) {
        this.listener = listener != null ? listener : WorkQueueListener.NONE;
    }

    // ---- claims ----

    /**
     * Claim the next READY item of the service for a polling worker (READY -> RUNNING).
     * Items of paused or terminal jobs are never handed out.
     */
    public Optional<WorkAssignment> claim(String serviceId) {
        requireServiceId(serviceId);
        Optional<WorkAssignment> claimed = db.inTransaction("claim work for " + serviceId,
                conn -> take(conn, serviceId, WorkItemStatus.READY, WorkItemStatus.RUNNING));
        claimed.ifPresent(a -> {
            markJobRunning(a.workItem().jobId());
            log.debug("Work item {} claimed for {}", a.workItem().id(), serviceId);
        });
        return claimed;
    }

    /**
     * Reserve the next READY item for an in-process handler (READY -> QUEUED).
     */
    public Optional<WorkAssignment> reserve(String serviceId) {
        requireServiceId(serviceId);
        return db.inTransaction("reserve work for " + serviceId,
                conn -> take(conn, serviceId, WorkItemStatus.READY, WorkItemStatus.QUEUED));
    }

    /**
     * Start a reserved item (QUEUED -> RUNNING).
     *
     * @return false when the item was no longer queued
     */
    public boolean start(long workItemId) {
        Optional<WorkItem> started = db.inTransaction("start work item " + workItemId, conn -> {
            Instant now = Instant.now();
            if (!workItemRepository.transition(conn, workItemId, WorkItemStatus.QUEUED, WorkItemStatus.RUNNING, now)) {
                return Optional.empty();
            }
            return workItemRepository.findById(conn, workItemId);
        });
        started.ifPresent(item -> markJobRunning(item.jobId()));
        return started.isPresent();
    }

    public int readyCount(String serviceId) {
        requireServiceId(serviceId);
        return workItemRepository.countReady(serviceId);
    }

    private Optional<WorkAssignment> take(Connection conn, String serviceId, WorkItemStatus from, WorkItemStatus to)
            throws SQLException {
        for (int attempt = 0; attempt < MAX_CLAIM_ATTEMPTS; attempt++) {
            Optional<WorkItem> candidate = workItemRepository.lockNextForService(conn, serviceId, from);
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            WorkItem item = candidate.get();
            Instant now = Instant.now();
            // guard against a row another transaction moved while we waited for the lock
            if (workItemRepository.transition(conn, item.id(), from, to, now)) {
                WorkItem claimed = item.toBuilder()
                        .status(to)
                        .startedAt(to == WorkItemStatus.RUNNING ? now : item.startedAt())
                        .updatedAt(now)
                        .build();
                return Optional.of(assignment(conn, claimed));
            }
        }
        log.warn("Gave up claiming work for {} after {} contended attempts", serviceId, MAX_CLAIM_ATTEMPTS);
        return Optional.empty();
    }

    private WorkAssignment assignment(Connection conn, WorkItem item) throws SQLException {
        WorkflowStep step = stepRepository.find(conn, item.jobId(), item.stepIndex())
                .orElseThrow(() -> new IllegalStateException(
                        "No step " + item.stepIndex() + " for job " + item.jobId()));
        Integer maxPageSize = item.isDiscovery()
                ? discoveryService.maxCatalogPageSize(conn, item, step.operation())
                : null;
        return new WorkAssignment(item, step.operation(), maxPageSize);
    }

    private void markJobRunning(String jobId) {
        db.inTransaction("mark job " + jobId + " running", conn -> jobRepository.markRunning(conn, jobId));
    }

    // ---- completion ----

    /**
     * Apply a worker's completion report. Reports for items that are already terminal
     * are accepted as no-ops.
     */
    public WorkItemUpdateResult update(long workItemId, WorkItemUpdate update) {
        update.validate();

        Optional<WorkItem> existing = workItemRepository.findById(workItemId);
        if (existing.isEmpty()) {
            return WorkItemUpdateResult.NOT_FOUND;
        }
        String jobId = existing.get().jobId();

        WorkItemUpdate resolved = update.status().isSuccess()
                ? update.withSizes(sizeResolver.resolve(update.results(), update.outputItemSizes()))
                : update;

        Set<String> readyServices = new LinkedHashSet<>();
        WorkItemUpdateResult result = db.inTransaction("update work item " + workItemId,
                conn -> apply(conn, jobId, workItemId, resolved, readyServices));

        switch (result) {
            case APPLIED -> log.debug("Work item {} finished as {}", workItemId, update.status());
            case RETRIED -> log.info("Work item {} failed ({}), requeued", workItemId, update.subStatus());
            case JOB_FAILED -> log.warn("Work item {} failed permanently, job {} failed", workItemId, jobId);
            case JOB_CANCELED -> log.warn("Work item {} canceled by its worker, job {} canceled", workItemId, jobId);
            case ALREADY_TERMINAL -> log.debug("Work item {} already terminal (idempotent)", workItemId);
            default -> log.warn("Update of work item {} not applied: {}", workItemId, result);
        }

        readyServices.forEach(this::notifyListener);
        return result;
    }

    /**
     * Fail an item that is stuck in flight, through the normal retry path.
     * A QUEUED item is started first so the update applies.
     */
    public WorkItemUpdateResult expire(WorkItem item, String message) {
        if (item.status() == WorkItemStatus.QUEUED) {
            db.inTransaction("start expired work item " + item.id(), conn -> workItemRepository.transition(
                    conn, item.id(), WorkItemStatus.QUEUED, WorkItemStatus.RUNNING, Instant.now()));
        }
        return update(item.id(), WorkItemUpdate.failed(message));
    }

    private WorkItemUpdateResult apply(Connection conn, String jobId, long workItemId, WorkItemUpdate update,
            Set<String> readyServices) throws SQLException {
        Optional<Job> lockedJob = jobRepository.lockById(conn, jobId);
        Optional<WorkItem> lockedItem = workItemRepository.lockById(conn, workItemId);
        if (lockedJob.isEmpty() || lockedItem.isEmpty()) {
            return WorkItemUpdateResult.NOT_FOUND;
        }
        Job job = lockedJob.get();
        WorkItem item = lockedItem.get();

        if (item.isTerminal()) {
            return WorkItemUpdateResult.ALREADY_TERMINAL;
        }
        if (item.status() != WorkItemStatus.RUNNING) {
            return WorkItemUpdateResult.NOT_RUNNING;
        }

        Instant now = Instant.now();
        if (job.isTerminal()) {
            workItemRepository.transition(conn, workItemId, WorkItemStatus.RUNNING, WorkItemStatus.CANCELED, now);
            return WorkItemUpdateResult.JOB_TERMINAL;
        }

        if (update.status() == WorkItemStatus.CANCELED) {
            return applyCancel(conn, job, item, update, now);
        }
        if (!update.status().isSuccess()) {
            return applyFailure(conn, job, item, update, now, readyServices);
        }
        applySuccess(conn, job, item, update, now, readyServices);
        return WorkItemUpdateResult.APPLIED;
    }

    /** CANCELED is terminal: never retried, and the job cannot finish without the item. */
    private WorkItemUpdateResult applyCancel(Connection conn, Job job, WorkItem item, WorkItemUpdate update,
            Instant now) throws SQLException {
        workItemRepository.finish(conn, item.toBuilder()
                .status(WorkItemStatus.CANCELED)
                .subStatus(update.subStatus())
                .results(List.of())
                .outputItemSizes(List.of())
                .durationMs(duration(item, update, now))
                .build());

        String message = update.subStatus() != null
                ? WORKER_CANCEL_MESSAGE + ": " + update.subStatus()
                : WORKER_CANCEL_MESSAGE;
        jobRepository.updateStatus(conn, job.id(), JobStatus.CANCELED, message);
        int canceled = workItemRepository.cancelNonTerminal(conn, job.id(), now);
        log.info("Job {} canceled after work item {} was canceled ({} work items canceled)",
                job.id(), item.id(), canceled);
        return WorkItemUpdateResult.JOB_CANCELED;
    }

    private WorkItemUpdateResult applyFailure(Connection conn, Job job, WorkItem item, WorkItemUpdate update,
            Instant now, Set<String> readyServices) throws SQLException {
        String reason = update.subStatus() != null ? update.subStatus() : "no reason given";

        if (item.retryCount() < retryLimit) {
            workItemRepository.requeue(conn, item.id(), item.retryCount() + 1, reason, now);
            readyServices.add(item.serviceId());
            return WorkItemUpdateResult.RETRIED;
        }

        workItemRepository.finish(conn, item.toBuilder()
                .status(WorkItemStatus.FAILED)
                .subStatus(reason)
                .results(List.of())
                .outputItemSizes(List.of())
                .durationMs(duration(item, update, now))
                .build());

        String message = item.isDiscovery() ? reason : "WorkItem failed: " + reason;
        jobRepository.updateStatus(conn, job.id(), JobStatus.FAILED, message);
        int canceled = workItemRepository.cancelNonTerminal(conn, job.id(), now);
        log.info("Job {} failed: {} ({} work items canceled)", job.id(), message, canceled);
        return WorkItemUpdateResult.JOB_FAILED;
    }

    private void applySuccess(Connection conn, Job job, WorkItem item, WorkItemUpdate update, Instant now,
            Set<String> readyServices) throws SQLException {
        WorkItem finished = item.toBuilder()
                .status(update.status())
                .subStatus(update.subStatus())
                .results(update.results())
                .outputItemSizes(update.outputItemSizes())
                .durationMs(duration(item, update, now))
                .build();
        workItemRepository.finish(conn, finished);

        List<WorkflowStep> steps = new ArrayList<>(stepRepository.lockAll(conn, job.id()));
        int index = item.stepIndex();
        WorkflowStep step = steps.get(index);
        step = step.toBuilder().completedWorkItemCount(step.completedWorkItemCount() + 1).build();

        if (step.isDiscovery()) {
            int sourceIndex = item.sourceIndex() != null ? item.sourceIndex() : 0;
            Optional<DataOperation> corrected = discoveryService.correctHits(
                    step.operation(), sourceIndex, update.hits());
            if (corrected.isPresent()) {
                step = step.toBuilder().operation(corrected.get()).build();
                job = job.toBuilder().numInputGranules(corrected.get().granuleCount()).build();
                jobRepository.updateNumInputGranules(conn, job.id(), job.numInputGranules());
            }
            Optional<WorkItem> next = discoveryService.nextItem(conn, step, finished, update);
            if (next.isPresent()) {
                workItemRepository.insert(conn, next.get());
                step = step.toBuilder().workItemCount(step.workItemCount() + 1).build();
                readyServices.add(step.serviceId());
            }
        }
        steps.set(index, step);

        if (index + 1 < steps.size()) {
            steps.set(index + 1, feedDownstream(conn, steps.get(index + 1), finished, readyServices));
        } else if (!finished.results().isEmpty()) {
            jobRepository.addLinks(conn, job.id(), finished.results().stream().map(JobLink::data).toList());
        }

        advance(conn, steps, readyServices);
        for (WorkflowStep s : steps) {
            stepRepository.update(conn, s);
        }

        if (steps.get(steps.size() - 1).complete()) {
            String message = job.advisory() != null ? SUCCESS_MESSAGE + ". " + job.advisory() : SUCCESS_MESSAGE;
            jobRepository.updateProgress(conn, job.id(), JobProgressTracker.COMPLETE);
            jobRepository.updateStatus(conn, job.id(), JobStatus.SUCCESSFUL, message);
            log.info("Job {} completed successfully", job.id());
            return;
        }

        int progress = progressTracker.progress(job, steps);
        if (progress != job.progress()) {
            jobRepository.updateProgress(conn, job.id(), progress);
        }
        if (job.status() == JobStatus.ACCEPTED) {
            jobRepository.markRunning(conn, job.id());
        }
    }

    /** Hand the finished item's outputs to the next step. */
    private WorkflowStep feedDownstream(Connection conn, WorkflowStep downstream, WorkItem finished,
            Set<String> readyServices) throws SQLException {
        if (downstream.batched()) {
            batchScheduler.recordOutputs(conn, downstream, finished, finished.results(), finished.outputItemSizes());
            return downstream;
        }

        int count = downstream.workItemCount();
        for (String result : finished.results()) {
            workItemRepository.insert(conn, WorkItem.builder()
                    .jobId(downstream.jobId())
                    .stepIndex(downstream.stepIndex())
                    .serviceId(downstream.serviceId())
                    .status(WorkItemStatus.READY)
                    .sortIndex(count++)
                    .inputLocation(result)
                    .build());
        }
        if (count > downstream.workItemCount()) {
            readyServices.add(downstream.serviceId());
        }
        return downstream.toBuilder().workItemCount(count).build();
    }

    /**
     * Close batches and mark steps complete, left to right. A step is complete once the
     * step before it is complete and every item it created has succeeded.
     */
    private void advance(Connection conn, List<WorkflowStep> steps, Set<String> readyServices)
            throws SQLException {
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            if (step.complete()) {
                continue;
            }
            boolean upstreamComplete = i == 0 || steps.get(i - 1).complete();

            if (step.batched() && i > 0) {
                BatchScheduler.Outcome outcome = batchScheduler.schedule(conn, step, upstreamComplete);
                step = outcome.step();
                if (!outcome.created().isEmpty()) {
                    readyServices.add(step.serviceId());
                }
            }
            if (upstreamComplete && step.completedWorkItemCount() >= step.workItemCount()) {
                step = step.toBuilder().complete(true).build();
                log.debug("Step {} of job {} complete ({} work items)",
                        step.stepIndex(), step.jobId(), step.workItemCount());
            }
            steps.set(i, step);
        }
    }

    private static long duration(WorkItem item, WorkItemUpdate update, Instant now) {
        long reported = update.durationMs() != null ? update.durationMs() : 0L;
        long measured = item.startedAt() != null ? Duration.between(item.startedAt(), now).toMillis() : 0L;
        return Math.max(reported, Math.max(0L, measured));
    }

    private void notifyListener(String serviceId) {
        try {
            listener.workAvailable(serviceId);
        } catch (RuntimeException e) {
            log.error("Work listener failed for {}", serviceId, e);
        }
    }

    private static void requireServiceId(String serviceId) {
        if (serviceId == null || serviceId.isBlank()) {
            throw new RequestValidationException("serviceID is required");
        }
    }
}
