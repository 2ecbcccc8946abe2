package geoflow.coordinator.service;

import geoflow.coordinator.config.CoordinatorConfig;
import geoflow.coordinator.config.ServiceChainConfig;
import geoflow.coordinator.config.ServiceStepConfig;
import geoflow.coordinator.config.ServicesConfig;
import geoflow.coordinator.error.ConflictException;
import geoflow.coordinator.error.RequestValidationException;
import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobLink;
import geoflow.coordinator.model.JobStatus;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.model.WorkflowStep;
import geoflow.coordinator.repository.JobRepository;
import geoflow.coordinator.repository.WorkItemRepository;
import geoflow.coordinator.repository.WorkflowStepRepository;
import geoflow.coordinator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Business logic for Job management: creation, lookup and user-driven state changes.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final String PROCESSING_MESSAGE = "The job is being processed";
    static final String USER_CANCEL_MESSAGE = "Canceled by user";

    private final Database db;
    private final JobRepository jobRepository;
    private final WorkflowStepRepository stepRepository;
    private final WorkItemRepository workItemRepository;
    private final ServicesConfig servicesConfig;
    private final GranuleDiscoveryService discoveryService;
    private final AccessTokenCipher tokenCipher;
    private final CoordinatorConfig config;

    private volatile WorkQueueListener listener = WorkQueueListener.NONE;

    public JobService(Database db, JobRepository jobRepository, WorkflowStepRepository stepRepository,
            WorkItemRepository workItemRepository, ServicesConfig servicesConfig,
            GranuleDiscoveryService discoveryService, AccessTokenCipher tokenCipher, CoordinatorConfig config) {
        this.db = db;
        this.jobRepository = jobRepository;
        this.stepRepository = stepRepository;
        this.workItemRepository = workItemRepository;
        this.servicesConfig = servicesConfig;
        this.discoveryService = discoveryService;
        this.tokenCipher = tokenCipher;
        this.config = config;
    }

    public void setListener(WorkQueueListener listener) {
        this.listener = listener != null ? listener : WorkQueueListener.NONE;
    }

    /**
     * Create a job for the named service chain: count granules, create the workflow
     * steps and queue the first discovery item.
     *
     * @throws RequestValidationException for a malformed request, an unknown chain or no matching granules
     */
    public Job createJob(String owner, String chainName, DataOperation operation) {
        if (owner == null || owner.isBlank()) {
            throw new RequestValidationException("owner is required");
        }
        if (operation == null) {
            throw new RequestValidationException("operation is required");
        }
        operation.validate();
        ServiceChainConfig chain = servicesConfig.chain(chainName)
                .orElseThrow(() -> new RequestValidationException("Unknown service chain: " + chainName));

        GranuleDiscoveryService.DiscoveryPlan plan = discoveryService.plan(chain, operation, operation.accessToken());
        DataOperation stored = plan.operation().withAccessToken(tokenCipher.encrypt(operation.accessToken()));

        int firstSource = GranuleDiscoveryService.nextSourceWithGranules(stored, 0);
        if (firstSource < 0) {
            throw new RequestValidationException("No matching granules found.");
        }

        String jobId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        Job job = Job.builder()
                .id(jobId)
                .owner(owner)
                .chain(chain.name())
                .status(JobStatus.ACCEPTED)
                .progress(0)
                .numInputGranules(plan.numInputGranules())
                .message(plan.advisory() != null ? plan.advisory() : PROCESSING_MESSAGE)
                .advisory(plan.advisory())
                .createdAt(now)
                .updatedAt(now)
                .build();

        List<WorkflowStep> steps = buildSteps(jobId, chain, stored);
        WorkflowStep discovery = steps.get(0);
        WorkItem firstItem = GranuleDiscoveryService.discoveryItem(discovery, firstSource, null);
        steps.set(0, discovery.toBuilder().workItemCount(1).build());

        db.inTransaction("create job " + jobId, conn -> {
            jobRepository.insert(conn, job);
            stepRepository.insertAll(conn, steps);
            workItemRepository.insert(conn, firstItem);
            return null;
        });

        log.info("Created job {} on chain {} for {}: {} input granules in {} steps",
                jobId, chain.name(), owner, plan.numInputGranules(), steps.size());
        listener.workAvailable(discovery.serviceId());
        return job;
    }

    private List<WorkflowStep> buildSteps(String jobId, ServiceChainConfig chain, DataOperation operation) {
        List<WorkflowStep> steps = new ArrayList<>();
        for (int i = 0; i < chain.steps().size(); i++) {
            ServiceStepConfig service = chain.steps().get(i);
            boolean batched = service.batched() && i > 0;
            Integer maxInputs = batched ? service.maxBatchInputs() : null;
            Long maxBytes = batched ? service.maxBatchSizeBytes() : null;
            if (batched && maxInputs == null && maxBytes == null) {
                maxInputs = config.defaultMaxBatchInputs();
                maxBytes = config.defaultMaxBatchSizeBytes();
            }
            steps.add(WorkflowStep.builder()
                    .jobId(jobId)
                    .stepIndex(i)
                    .serviceId(service.serviceId())
                    .operation(operation)
                    .batched(batched)
                    .maxBatchInputs(maxInputs)
                    .maxBatchSizeBytes(maxBytes)
                    .build());
        }
        return steps;
    }

    // ---- queries ----

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> findRecent(String owner, int limit) {
        return jobRepository.findRecent(owner, limit);
    }

    public List<WorkflowStep> steps(String jobId) {
        return stepRepository.findByJob(jobId);
    }

    public List<WorkItem> workItems(String jobId, int limit) {
        return workItemRepository.findByJob(jobId, limit);
    }

    public List<JobLink> links(String jobId) {
        return jobRepository.findLinks(jobId);
    }

    // ---- state changes ----

    /**
     * Cancel a job on behalf of its owner.
     *
     * @throws ConflictException when the job is already terminal
     */
    public Optional<Job> cancel(String jobId) {
        return db.inTransaction("cancel job " + jobId, conn -> {
            Optional<Job> locked = jobRepository.lockById(conn, jobId);
            if (locked.isEmpty()) {
                return Optional.<Job>empty();
            }
            Job job = locked.get();
            if (job.isTerminal()) {
                throw new ConflictException("Job " + jobId + " is already " + job.status().value());
            }
            jobRepository.updateStatus(conn, jobId, JobStatus.CANCELED, USER_CANCEL_MESSAGE);
            int canceled = workItemRepository.cancelNonTerminal(conn, jobId, Instant.now());
            log.info("Job {} canceled by user ({} work items canceled)", jobId, canceled);
            return jobRepository.findById(conn, jobId);
        });
    }

    /**
     * Cancel a job whose run the execution tracker no longer knows about.
     *
     * @return false when the job had meanwhile become terminal or paused
     */
    public boolean cancelOrphan(String jobId, String message) {
        return db.inTransaction("cancel orphaned job " + jobId, conn -> {
            Optional<Job> locked = jobRepository.lockById(conn, jobId);
            if (locked.isEmpty() || !locked.get().status().isActive()) {
                return false;
            }
            jobRepository.updateStatus(conn, jobId, JobStatus.CANCELED, message);
            workItemRepository.cancelNonTerminal(conn, jobId, Instant.now());
            return true;
        });
    }

    /**
     * Stop handing out work for a job. Running items may still report.
     *
     * @throws ConflictException unless the job is accepted or running
     */
    public Optional<Job> pause(String jobId) {
        return db.inTransaction("pause job " + jobId, conn -> {
            Optional<Job> locked = jobRepository.lockById(conn, jobId);
            if (locked.isEmpty()) {
                return Optional.<Job>empty();
            }
            Job job = locked.get();
            if (!job.status().isActive()) {
                throw new ConflictException("Job " + jobId + " cannot be paused while " + job.status().value());
            }
            jobRepository.updateStatus(conn, jobId, JobStatus.PAUSED, job.message());
            log.info("Job {} paused", jobId);
            return jobRepository.findById(conn, jobId);
        });
    }

    /**
     * @throws ConflictException unless the job is paused
     */
    public Optional<Job> resume(String jobId) {
        Optional<Job> resumed = db.inTransaction("resume job " + jobId, conn -> {
            Optional<Job> locked = jobRepository.lockById(conn, jobId);
            if (locked.isEmpty()) {
                return Optional.<Job>empty();
            }
            Job job = locked.get();
            if (job.status() != JobStatus.PAUSED) {
                throw new ConflictException("Job " + jobId + " is not paused");
            }
            jobRepository.updateStatus(conn, jobId, JobStatus.RUNNING, job.message());
            log.info("Job {} resumed", jobId);
            return jobRepository.findById(conn, jobId);
        });

        if (resumed.isPresent()) {
            Set<String> services = new LinkedHashSet<>();
            for (WorkItem item : workItemRepository.findByJob(jobId, Integer.MAX_VALUE)) {
                if (item.status() == WorkItemStatus.READY) {
                    services.add(item.serviceId());
                }
            }
            services.forEach(listener::workAvailable);
        }
        return resumed;
    }
}
