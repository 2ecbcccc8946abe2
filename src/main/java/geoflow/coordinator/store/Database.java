package geoflow.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import geoflow.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    /**
     * Unit of work executed inside one transaction.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("geoflow-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Run {@code work} in a single transaction: commit on success, roll back on any failure.
     *
     * @param description what the work does, used in the wrapping exception message
     */
    public <T> T inTransaction(String description, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + description, e);
        }
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            owner               VARCHAR(256) NOT NULL,
                            chain               VARCHAR(128) NOT NULL,
                            status              VARCHAR(20) NOT NULL,
                            progress            INT DEFAULT 0,
                            num_input_granules  INT DEFAULT 0,
                            message             VARCHAR(4096),
                            advisory            VARCHAR(4096),
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- WORKFLOW STEPS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workflow_steps (
                            job_id                      VARCHAR(64) NOT NULL,
                            step_index                  INT NOT NULL,
                            service_id                  VARCHAR(256) NOT NULL,
                            operation                   CLOB NOT NULL,
                            is_batched                  BOOLEAN DEFAULT FALSE,
                            max_batch_inputs            INT,
                            max_batch_size_bytes        BIGINT,
                            work_item_count             INT DEFAULT 0,
                            completed_work_item_count   INT DEFAULT 0,
                            is_complete                 BOOLEAN DEFAULT FALSE,
                            batch_cursor                BIGINT DEFAULT 0,
                            open_batch_id               VARCHAR(64),
                            PRIMARY KEY (job_id, step_index)
                        );
                    """);

            // ---------- WORK ITEMS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS work_items (
                            id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id              VARCHAR(64) NOT NULL,
                            step_index          INT NOT NULL,
                            service_id          VARCHAR(256) NOT NULL,
                            status              VARCHAR(20) NOT NULL,
                            sub_status          VARCHAR(4096),
                            sort_index          BIGINT NOT NULL,
                            source_index        INT,
                            scroll_cursor       VARCHAR(2048),
                            input_location      VARCHAR(2048),
                            batch_id            VARCHAR(64),
                            results             CLOB,
                            output_item_sizes   CLOB,
                            output_count        INT DEFAULT 0,
                            duration_ms         BIGINT,
                            retry_count         INT DEFAULT 0,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at          TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            UNIQUE (job_id, step_index, sort_index)
                        );
                    """);

            // ---------- BATCH ITEMS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS batch_items (
                            job_id          VARCHAR(64) NOT NULL,
                            step_index      INT NOT NULL,
                            producer_index  BIGINT NOT NULL,
                            output_index    INT NOT NULL,
                            location        VARCHAR(2048),
                            size_bytes      BIGINT DEFAULT 0,
                            batch_id        VARCHAR(64),
                            PRIMARY KEY (job_id, step_index, producer_index, output_index)
                        );
                    """);

            // ---------- JOB LINKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_links (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id      VARCHAR(64) NOT NULL,
                            href        VARCHAR(2048) NOT NULL,
                            rel         VARCHAR(64) NOT NULL,
                            title       VARCHAR(512),
                            created_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_work_items_service_status ON work_items(service_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_work_items_job_step ON work_items(job_id, step_index);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_work_items_status_started ON work_items(status, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_batch_items_batch ON batch_items(job_id, step_index, batch_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_links_job ON job_links(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status_updated ON jobs(status, updated_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_owner ON jobs(owner, created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
