package geoflow.coordinator.config;

import geoflow.coordinator.api.internal.MetricsController;
import geoflow.coordinator.api.internal.WorkController;
import geoflow.coordinator.api.v1.HealthController;
import geoflow.coordinator.api.v1.JobController;
import geoflow.coordinator.catalog.CatalogClient;
import geoflow.coordinator.catalog.HttpCatalogClient;
import geoflow.coordinator.catalog.RetryingCatalogClient;
import geoflow.coordinator.invocation.CatalogQueryHandler;
import geoflow.coordinator.invocation.DirectInvoker;
import geoflow.coordinator.invocation.PullQueueInvoker;
import geoflow.coordinator.invocation.ServiceInvokers;
import geoflow.coordinator.repository.BatchRepository;
import geoflow.coordinator.repository.JobRepository;
import geoflow.coordinator.repository.WorkItemRepository;
import geoflow.coordinator.repository.WorkflowStepRepository;
import geoflow.coordinator.scheduler.JobReaper;
import geoflow.coordinator.scheduler.Scheduler;
import geoflow.coordinator.scheduler.WorkFailer;
import geoflow.coordinator.scheduler.WorkReaper;
import geoflow.coordinator.server.RouterHandler;
import geoflow.coordinator.service.AccessTokenCipher;
import geoflow.coordinator.service.BatchScheduler;
import geoflow.coordinator.service.GranuleDiscoveryService;
import geoflow.coordinator.service.GranuleLimiter;
import geoflow.coordinator.service.JobProgressTracker;
import geoflow.coordinator.service.JobService;
import geoflow.coordinator.service.OutputSizeResolver;
import geoflow.coordinator.service.WorkItemService;
import geoflow.coordinator.storage.FileObjectStore;
import geoflow.coordinator.storage.ObjectStore;
import geoflow.coordinator.store.Database;
import geoflow.coordinator.store.JdbcBatchRepository;
import geoflow.coordinator.store.JdbcJobRepository;
import geoflow.coordinator.store.JdbcWorkItemRepository;
import geoflow.coordinator.store.JdbcWorkflowStepRepository;
import geoflow.coordinator.tracking.ExecutionTracker;
import geoflow.coordinator.tracking.HttpExecutionTracker;
import geoflow.coordinator.tracking.WorkItemExecutionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // start background tasks
 * JobService jobService = deps.jobService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final ServicesConfig servicesConfig;

    // Collaborators
    private final ObjectStore objectStore;
    private final CatalogClient catalogClient;
    private final ExecutionTracker executionTracker;

    // Repositories
    private final JobRepository jobRepository;
    private final WorkflowStepRepository stepRepository;
    private final WorkItemRepository workItemRepository;
    private final BatchRepository batchRepository;

    // Services
    private final AccessTokenCipher tokenCipher;
    private final GranuleDiscoveryService discoveryService;
    private final WorkItemService workItemService;
    private final JobService jobService;

    // Invocation
    private final DirectInvoker directInvoker;
    private final ServiceInvokers serviceInvokers;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;
    private final WorkController workController;
    private final MetricsController metricsController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private volatile Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, CatalogClient catalogClient, ExecutionTracker executionTracker) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.servicesConfig = ServiceConfigLoader.load(config);
        this.objectStore = new FileObjectStore(Path.of(config.objectStoreRoot()));

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.stepRepository = new JdbcWorkflowStepRepository(database);
        this.workItemRepository = new JdbcWorkItemRepository(database);
        this.batchRepository = new JdbcBatchRepository();

        this.catalogClient = catalogClient != null ? catalogClient : defaultCatalogClient(config);
        this.executionTracker = executionTracker != null ? executionTracker : defaultTracker(config, workItemRepository);

        // Services
        this.tokenCipher = new AccessTokenCipher(config.sharedSecret());
        this.discoveryService = new GranuleDiscoveryService(catalogClient(), new GranuleLimiter(config),
                workItemRepository, config.catalogPageSize());
        this.workItemService = new WorkItemService(database, jobRepository, stepRepository, workItemRepository,
                new BatchScheduler(batchRepository, workItemRepository, objectStore),
                discoveryService,
                new JobProgressTracker(config.catalogPageSize()),
                new OutputSizeResolver(objectStore, config.unknownItemSizeBytes()),
                config.workItemRetryLimit());
        this.jobService = new JobService(database, jobRepository, stepRepository, workItemRepository,
                servicesConfig, discoveryService, tokenCipher, config);

        // Invocation
        this.directInvoker = new DirectInvoker(workItemService,
                Map.of(CatalogQueryHandler.SERVICE_ID,
                        new CatalogQueryHandler(this.catalogClient, objectStore, tokenCipher)),
                config.directWorkerThreads());
        this.serviceInvokers = new ServiceInvokers(servicesConfig, directInvoker, new PullQueueInvoker());
        workItemService.setListener(serviceInvokers);
        jobService.setListener(serviceInvokers);

        // Controllers (public API)
        this.healthController = new HealthController(database, jobRepository, workItemRepository,
                () -> scheduler != null && scheduler.isRunning());
        this.jobController = new JobController(jobService);

        // Controllers (worker API)
        this.workController = new WorkController(workItemService);
        this.metricsController = new MetricsController(workItemService);

        log.info("Dependencies initialized successfully");
    }

    private static CatalogClient defaultCatalogClient(CoordinatorConfig config) {
        return new RetryingCatalogClient(new HttpCatalogClient(config.catalogUrl()),
                config.catalogRetryAttempts(), config.catalogRetryBackoff(), config.catalogRetryMaxBackoff());
    }

    private static ExecutionTracker defaultTracker(CoordinatorConfig config, WorkItemRepository workItemRepository) {
        if (config.executionTrackerUrl() != null) {
            return new HttpExecutionTracker(config.executionTrackerUrl());
        }
        return new WorkItemExecutionTracker(workItemRepository);
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, null, null);
    }

    /**
     * Create dependencies with replaced collaborators; null keeps the configured default.
     */
    public static Dependencies create(CoordinatorConfig config, CatalogClient catalogClient,
            ExecutionTracker executionTracker) {
        return new Dependencies(config, catalogClient, executionTracker);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ServicesConfig servicesConfig() {
        return servicesConfig;
    }

    public ObjectStore objectStore() {
        return objectStore;
    }

    public CatalogClient catalogClient() {
        return catalogClient;
    }

    public ExecutionTracker executionTracker() {
        return executionTracker;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public WorkflowStepRepository stepRepository() {
        return stepRepository;
    }

    public WorkItemRepository workItemRepository() {
        return workItemRepository;
    }

    public BatchRepository batchRepository() {
        return batchRepository;
    }

    public AccessTokenCipher tokenCipher() {
        return tokenCipher;
    }

    public WorkItemService workItemService() {
        return workItemService;
    }

    public JobService jobService() {
        return jobService;
    }

    public ServiceInvokers serviceInvokers() {
        return serviceInvokers;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(jobController)
                    .registerController(workController)
                    .registerController(metricsController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            JobReaper jobReaper = new JobReaper(jobRepository, jobService, executionTracker,
                    config.reapableJobAge());
            WorkFailer workFailer = new WorkFailer(workItemRepository, workItemService, servicesConfig,
                    config.failableWorkAge(), config.defaultWorkItemTimeout(), config.durationBasedTimeout());
            WorkReaper workReaper = new WorkReaper(database, jobRepository, stepRepository, workItemRepository,
                    batchRepository, config.workRetention(), config.workReaperBatchSize());
            scheduler = new Scheduler(jobReaper, workFailer, workReaper, serviceInvokers::kickDirectServices,
                    new Scheduler.Intervals(config.jobReaperInterval(), config.workFailerInterval(),
                            config.workReaperInterval(), config.directKickInterval()));
        }
        return scheduler;
    }

    /**
     * Start the background scheduler for reaping, failing stuck work and re-invoking direct services.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        directInvoker.close();

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
