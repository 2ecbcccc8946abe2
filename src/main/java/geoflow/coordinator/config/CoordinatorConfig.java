package geoflow.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults and can be overridden from GEOFLOW_* environment variables.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/geoflow;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Granule discovery
    private int maxGranuleLimit = 2100;
    private int catalogPageSize = 2000;
    private String catalogUrl = "https://cmr.earthdata.nasa.gov";
    private int catalogRetryAttempts = 3;
    private Duration catalogRetryBackoff = Duration.ofMillis(500);
    private Duration catalogRetryMaxBackoff = Duration.ofSeconds(10);

    // Work items and batching
    private int workItemRetryLimit = 3;
    private int defaultMaxBatchInputs = 100;
    private long defaultMaxBatchSizeBytes = 1024L * 1024 * 1024;
    private long unknownItemSizeBytes = 1;

    // Work failer
    private Duration workFailerInterval = Duration.ofMinutes(1);
    private Duration failableWorkAge = Duration.ofMinutes(1);
    private Duration defaultWorkItemTimeout = Duration.ofHours(1);
    private boolean durationBasedTimeout = true;

    // Job reaper
    private Duration jobReaperInterval = Duration.ofMinutes(5);
    private Duration reapableJobAge = Duration.ofMinutes(60);

    // Work reaper
    private Duration workReaperInterval = Duration.ofHours(1);
    private Duration workRetention = Duration.ofDays(14);
    private int workReaperBatchSize = 1000;

    // Collaborators
    private String objectStoreRoot = "./data/objects";
    private String executionTrackerUrl = null; // in-process tracking when unset
    private String servicesConfigPath = null; // bundled services.ini when unset
    private String sharedSecret = null;

    // Direct invocation
    private int directWorkerThreads = 2;
    private Duration directKickInterval = Duration.ofSeconds(30);

    // Auth settings (optional)
    private String workerKey = null; // If set, workers must provide X-Geoflow-Key header

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = env("GEOFLOW_DB_URL");
        if (dbUrl != null) {
            config.databaseUrl = dbUrl;
        }

        String port = env("GEOFLOW_PORT");
        if (port != null) {
            config.serverPort = Integer.parseInt(port);
        }

        String workerKey = env("GEOFLOW_WORKER_KEY");
        if (workerKey != null) {
            config.workerKey = workerKey;
        }

        String granuleLimit = env("GEOFLOW_MAX_GRANULE_LIMIT");
        if (granuleLimit != null) {
            config.maxGranuleLimit = Integer.parseInt(granuleLimit);
        }

        String pageSize = env("GEOFLOW_CATALOG_PAGE_SIZE");
        if (pageSize != null) {
            config.catalogPageSize = Integer.parseInt(pageSize);
        }

        String catalogUrl = env("GEOFLOW_CATALOG_URL");
        if (catalogUrl != null) {
            config.catalogUrl = catalogUrl;
        }

        String retryLimit = env("GEOFLOW_WORK_ITEM_RETRY_LIMIT");
        if (retryLimit != null) {
            config.workItemRetryLimit = Integer.parseInt(retryLimit);
        }

        String batchInputs = env("GEOFLOW_MAX_BATCH_INPUTS");
        if (batchInputs != null) {
            config.defaultMaxBatchInputs = Integer.parseInt(batchInputs);
        }

        String batchBytes = env("GEOFLOW_MAX_BATCH_SIZE_BYTES");
        if (batchBytes != null) {
            config.defaultMaxBatchSizeBytes = Long.parseLong(batchBytes);
        }

        String unknownSize = env("GEOFLOW_UNKNOWN_ITEM_SIZE_BYTES");
        if (unknownSize != null) {
            config.unknownItemSizeBytes = Long.parseLong(unknownSize);
        }

        String timeout = env("GEOFLOW_DEFAULT_WORK_ITEM_TIMEOUT_SECONDS");
        if (timeout != null) {
            config.defaultWorkItemTimeout = Duration.ofSeconds(Long.parseLong(timeout));
        }

        String reapableAge = env("GEOFLOW_REAPABLE_JOB_AGE_MINUTES");
        if (reapableAge != null) {
            config.reapableJobAge = Duration.ofMinutes(Long.parseLong(reapableAge));
        }

        String retention = env("GEOFLOW_WORK_RETENTION_DAYS");
        if (retention != null) {
            config.workRetention = Duration.ofDays(Long.parseLong(retention));
        }

        String objectRoot = env("GEOFLOW_OBJECT_STORE_ROOT");
        if (objectRoot != null) {
            config.objectStoreRoot = objectRoot;
        }

        String trackerUrl = env("GEOFLOW_EXECUTION_TRACKER_URL");
        if (trackerUrl != null) {
            config.executionTrackerUrl = trackerUrl;
        }

        String servicesPath = env("GEOFLOW_SERVICES_CONFIG");
        if (servicesPath != null) {
            config.servicesConfigPath = servicesPath;
        }

        String secret = env("GEOFLOW_SHARED_SECRET");
        if (secret != null) {
            config.sharedSecret = secret;
        }

        String threads = env("GEOFLOW_DIRECT_WORKER_THREADS");
        if (threads != null) {
            config.directWorkerThreads = Integer.parseInt(threads);
        }

        return config;
    }

    private static String env(String name) {
        String value = System.getenv(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int maxGranuleLimit() {
        return maxGranuleLimit;
    }

    public int catalogPageSize() {
        return catalogPageSize;
    }

    public String catalogUrl() {
        return catalogUrl;
    }

    public int catalogRetryAttempts() {
        return catalogRetryAttempts;
    }

    public Duration catalogRetryBackoff() {
        return catalogRetryBackoff;
    }

    public Duration catalogRetryMaxBackoff() {
        return catalogRetryMaxBackoff;
    }

    public int workItemRetryLimit() {
        return workItemRetryLimit;
    }

    public int defaultMaxBatchInputs() {
        return defaultMaxBatchInputs;
    }

    public long defaultMaxBatchSizeBytes() {
        return defaultMaxBatchSizeBytes;
    }

    public long unknownItemSizeBytes() {
        return unknownItemSizeBytes;
    }

    public Duration workFailerInterval() {
        return workFailerInterval;
    }

    public Duration failableWorkAge() {
        return failableWorkAge;
    }

    public Duration defaultWorkItemTimeout() {
        return defaultWorkItemTimeout;
    }

    public boolean durationBasedTimeout() {
        return durationBasedTimeout;
    }

    public Duration jobReaperInterval() {
        return jobReaperInterval;
    }

    public Duration reapableJobAge() {
        return reapableJobAge;
    }

    public Duration workReaperInterval() {
        return workReaperInterval;
    }

    public Duration workRetention() {
        return workRetention;
    }

    public int workReaperBatchSize() {
        return workReaperBatchSize;
    }

    public String objectStoreRoot() {
        return objectStoreRoot;
    }

    public String executionTrackerUrl() {
        return executionTrackerUrl;
    }

    public String servicesConfigPath() {
        return servicesConfigPath;
    }

    public String sharedSecret() {
        return sharedSecret;
    }

    public int directWorkerThreads() {
        return directWorkerThreads;
    }

    public Duration directKickInterval() {
        return directKickInterval;
    }

    public String workerKey() {
        return workerKey;
    }

    public boolean hasWorkerKey() {
        return workerKey != null && !workerKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withWorkerKey(String key) {
        this.workerKey = key;
        return this;
    }

    public CoordinatorConfig withMaxGranuleLimit(int limit) {
        this.maxGranuleLimit = limit;
        return this;
    }

    public CoordinatorConfig withCatalogPageSize(int pageSize) {
        this.catalogPageSize = pageSize;
        return this;
    }

    public CoordinatorConfig withCatalogRetry(int attempts, Duration backoff) {
        this.catalogRetryAttempts = attempts;
        this.catalogRetryBackoff = backoff;
        return this;
    }

    public CoordinatorConfig withWorkItemRetryLimit(int limit) {
        this.workItemRetryLimit = limit;
        return this;
    }

    public CoordinatorConfig withUnknownItemSizeBytes(long size) {
        this.unknownItemSizeBytes = size;
        return this;
    }

    public CoordinatorConfig withDefaultWorkItemTimeout(Duration timeout) {
        this.defaultWorkItemTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withFailableWorkAge(Duration age) {
        this.failableWorkAge = age;
        return this;
    }

    public CoordinatorConfig withDurationBasedTimeout(boolean enabled) {
        this.durationBasedTimeout = enabled;
        return this;
    }

    public CoordinatorConfig withReapableJobAge(Duration age) {
        this.reapableJobAge = age;
        return this;
    }

    public CoordinatorConfig withWorkRetention(Duration retention) {
        this.workRetention = retention;
        return this;
    }

    public CoordinatorConfig withObjectStoreRoot(String root) {
        this.objectStoreRoot = root;
        return this;
    }

    public CoordinatorConfig withExecutionTrackerUrl(String url) {
        this.executionTrackerUrl = url;
        return this;
    }

    public CoordinatorConfig withServicesConfigPath(String path) {
        this.servicesConfigPath = path;
        return this;
    }

    public CoordinatorConfig withSharedSecret(String secret) {
        this.sharedSecret = secret;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", maxGranuleLimit=" + maxGranuleLimit +
                ", catalogPageSize=" + catalogPageSize +
                ", workItemRetryLimit=" + workItemRetryLimit +
                ", objectStoreRoot='" + objectStoreRoot + '\'' +
                ", workerKeySet=" + hasWorkerKey() +
                '}';
    }
}
