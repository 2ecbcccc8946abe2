package geoflow.coordinator.store;

import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobLink;
import geoflow.coordinator.model.JobStatus;
import geoflow.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static geoflow.coordinator.store.JdbcSupport.getInstant;
import static geoflow.coordinator.store.JdbcSupport.placeholders;
import static geoflow.coordinator.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void insert(Connection conn, Job job) throws SQLException {
        String sql = """
                    INSERT INTO jobs (id, owner, chain, status, progress, num_input_granules, message, advisory,
                                      created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant now = Instant.now();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, job.id());
            ps.setString(2, job.owner());
            ps.setString(3, job.chain());
            ps.setString(4, job.status().name());
            ps.setInt(5, job.progress());
            ps.setInt(6, job.numInputGranules());
            ps.setString(7, job.message());
            ps.setString(8, job.advisory());
            setTimestamp(ps, 9, job.createdAt() != null ? job.createdAt() : now);
            setTimestamp(ps, 10, job.updatedAt() != null ? job.updatedAt() : now);
            ps.executeUpdate();
        }
        log.debug("Inserted job: {}", job.id());
    }

    @Override
    public Optional<Job> findById(String jobId) {
        try (Connection conn = db.getConnection()) {
            return findById(conn, jobId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public Optional<Job> findById(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Job> lockById(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE id = ? FOR UPDATE")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Job> findRecent(String owner, int limit) {
        String sql = owner == null
                ? "SELECT * FROM jobs ORDER BY created_at DESC LIMIT ?"
                : "SELECT * FROM jobs WHERE owner = ? ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            if (owner != null) {
                ps.setString(idx++, owner);
            }
            ps.setInt(idx, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent jobs", e);
        }
    }

    @Override
    public void updateStatus(Connection conn, String jobId, JobStatus status, String message) throws SQLException {
        String sql = "UPDATE jobs SET status = ?, message = ?, updated_at = ? WHERE id = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, status.name());
            ps.setString(2, message);
            setTimestamp(ps, 3, Instant.now());
            ps.setString(4, jobId);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean markRunning(Connection conn, String jobId) throws SQLException {
        String sql = "UPDATE jobs SET status = 'RUNNING', updated_at = ? WHERE id = ? AND status = 'ACCEPTED'";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setTimestamp(ps, 1, Instant.now());
            ps.setString(2, jobId);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public void updateProgress(Connection conn, String jobId, int progress) throws SQLException {
        String sql = "UPDATE jobs SET progress = ?, updated_at = ? WHERE id = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, progress);
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, jobId);
            ps.executeUpdate();
        }
    }

    @Override
    public void updateNumInputGranules(Connection conn, String jobId, int numInputGranules) throws SQLException {
        String sql = "UPDATE jobs SET num_input_granules = ?, updated_at = ? WHERE id = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, numInputGranules);
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, jobId);
            ps.executeUpdate();
        }
    }

    @Override
    public List<Job> findNotUpdatedSince(Collection<JobStatus> statuses, Instant updatedBefore, int limit) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT * FROM jobs WHERE status IN (" + placeholders(statuses) + ")"
                + " AND updated_at < ? ORDER BY updated_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            for (JobStatus status : statuses) {
                ps.setString(idx++, status.name());
            }
            setTimestamp(ps, idx++, updatedBefore);
            ps.setInt(idx, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs not updated since " + updatedBefore, e);
        }
    }

    @Override
    public List<String> findTerminalIdsNotUpdatedSince(Instant updatedBefore, int limit) {
        String sql = """
                    SELECT id FROM jobs
                    WHERE status IN ('SUCCESSFUL', 'FAILED', 'CANCELED') AND updated_at < ?
                      AND EXISTS (SELECT 1 FROM workflow_steps s WHERE s.job_id = jobs.id)
                    ORDER BY updated_at
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, updatedBefore);
            ps.setInt(2, limit);
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("id"));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find terminal jobs", e);
        }
    }

    @Override
    public void addLinks(Connection conn, String jobId, List<JobLink> links) throws SQLException {
        if (links.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO job_links (job_id, href, rel, title, created_at) VALUES (?, ?, ?, ?, ?)";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            Instant now = Instant.now();
            for (JobLink link : links) {
                ps.setString(1, jobId);
                ps.setString(2, link.href());
                ps.setString(3, link.rel());
                ps.setString(4, link.title());
                setTimestamp(ps, 5, now);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public List<JobLink> findLinks(String jobId) {
        String sql = "SELECT href, rel, title FROM job_links WHERE job_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            List<JobLink> links = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    links.add(new JobLink(rs.getString("href"), rs.getString("rel"), rs.getString("title")));
                }
            }
            return links;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find links of job: " + jobId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM jobs");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs", e);
        }
    }

    // ---- helpers ----

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .owner(rs.getString("owner"))
                .chain(rs.getString("chain"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .progress(rs.getInt("progress"))
                .numInputGranules(rs.getInt("num_input_granules"))
                .message(rs.getString("message"))
                .advisory(rs.getString("advisory"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
