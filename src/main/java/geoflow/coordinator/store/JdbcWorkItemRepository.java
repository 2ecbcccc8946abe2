package geoflow.coordinator.store;

import com.fasterxml.jackson.core.type.TypeReference;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.repository.WorkItemRepository;
import geoflow.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static geoflow.coordinator.store.JdbcSupport.getInstant;
import static geoflow.coordinator.store.JdbcSupport.getIntOrNull;
import static geoflow.coordinator.store.JdbcSupport.getLongOrNull;
import static geoflow.coordinator.store.JdbcSupport.placeholders;
import static geoflow.coordinator.store.JdbcSupport.setIntOrNull;
import static geoflow.coordinator.store.JdbcSupport.setLongOrNull;
import static geoflow.coordinator.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of WorkItemRepository.
 */
public class JdbcWorkItemRepository implements WorkItemRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkItemRepository.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<Long>> LONG_LIST = new TypeReference<>() {
    };

    private static final String ACTIVE_JOBS = "SELECT id FROM jobs WHERE status IN ('ACCEPTED', 'RUNNING')";

    private final Database db;

    public JdbcWorkItemRepository(Database db) {
        this.db = db;
    }

    @Override
    public WorkItem insert(Connection conn, WorkItem item) throws SQLException {
        String sql = """
                    INSERT INTO work_items (job_id, step_index, service_id, status, sub_status, sort_index,
                                            source_index, scroll_cursor, input_location, batch_id, retry_count,
                                            created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant now = Instant.now();
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, item.jobId());
            ps.setInt(2, item.stepIndex());
            ps.setString(3, item.serviceId());
            ps.setString(4, item.status().name());
            ps.setString(5, item.subStatus());
            ps.setLong(6, item.sortIndex());
            setIntOrNull(ps, 7, item.sourceIndex());
            ps.setString(8, item.cursor());
            ps.setString(9, item.inputLocation());
            ps.setString(10, item.batchId());
            ps.setInt(11, item.retryCount());
            setTimestamp(ps, 12, now);
            setTimestamp(ps, 13, now);
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for work item of job " + item.jobId());
                }
                WorkItem saved = item.toBuilder().id(keys.getLong(1)).createdAt(now).updatedAt(now).build();
                log.debug("Inserted work item {} (job {}, step {}, sortIndex {})",
                        saved.id(), saved.jobId(), saved.stepIndex(), saved.sortIndex());
                return saved;
            }
        }
    }

    @Override
    public Optional<WorkItem> findById(long id) {
        try (Connection conn = db.getConnection()) {
            return findById(conn, id);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find work item: " + id, e);
        }
    }

    @Override
    public Optional<WorkItem> findById(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM work_items WHERE id = ?")) {
            ps.setLong(1, id);
            return first(ps);
        }
    }

    @Override
    public Optional<WorkItem> lockById(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM work_items WHERE id = ? FOR UPDATE")) {
            ps.setLong(1, id);
            return first(ps);
        }
    }

    @Override
    public Optional<WorkItem> lockNextForService(Connection conn, String serviceId, WorkItemStatus status)
            throws SQLException {
        String sql = """
                    SELECT * FROM work_items
                    WHERE service_id = ? AND status = ? AND job_id IN (%s)
                    ORDER BY id
                    LIMIT 1
                    FOR UPDATE
                """.formatted(ACTIVE_JOBS);

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, serviceId);
            ps.setString(2, status.name());
            return first(ps);
        }
    }

    @Override
    public boolean transition(Connection conn, long id, WorkItemStatus from, WorkItemStatus to, Instant now)
            throws SQLException {
        String sql = to == WorkItemStatus.RUNNING
                ? "UPDATE work_items SET status = ?, started_at = ?, updated_at = ? WHERE id = ? AND status = ?"
                : "UPDATE work_items SET status = ?, updated_at = ? WHERE id = ? AND status = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            ps.setString(idx++, to.name());
            if (to == WorkItemStatus.RUNNING) {
                setTimestamp(ps, idx++, now);
            }
            setTimestamp(ps, idx++, now);
            ps.setLong(idx++, id);
            ps.setString(idx, from.name());
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public void finish(Connection conn, WorkItem finished) throws SQLException {
        String sql = """
                    UPDATE work_items
                    SET status = ?, sub_status = ?, results = ?, output_item_sizes = ?, output_count = ?,
                        duration_ms = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, finished.status().name());
            ps.setString(2, finished.subStatus());
            ps.setString(3, Json.write(finished.results()));
            ps.setString(4, Json.write(finished.outputItemSizes()));
            ps.setInt(5, finished.results().size());
            setLongOrNull(ps, 6, finished.durationMs());
            setTimestamp(ps, 7, Instant.now());
            ps.setLong(8, finished.id());
            ps.executeUpdate();
        }
    }

    @Override
    public void requeue(Connection conn, long id, int retryCount, String subStatus, Instant now) throws SQLException {
        String sql = """
                    UPDATE work_items
                    SET status = 'READY', retry_count = ?, sub_status = ?, started_at = NULL, updated_at = ?
                    WHERE id = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, retryCount);
            ps.setString(2, subStatus);
            setTimestamp(ps, 3, now);
            ps.setLong(4, id);
            ps.executeUpdate();
        }
    }

    @Override
    public int cancelNonTerminal(Connection conn, String jobId, Instant now) throws SQLException {
        String sql = """
                    UPDATE work_items SET status = 'CANCELED', updated_at = ?
                    WHERE job_id = ? AND status IN ('READY', 'QUEUED', 'RUNNING')
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setTimestamp(ps, 1, now);
            ps.setString(2, jobId);
            return ps.executeUpdate();
        }
    }

    @Override
    public int countReady(String serviceId) {
        String sql = "SELECT COUNT(*) FROM work_items WHERE service_id = ? AND status = 'READY' AND job_id IN ("
                + ACTIVE_JOBS + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, serviceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count ready work items for " + serviceId, e);
        }
    }

    @Override
    public int countByStatus(WorkItemStatus status) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM work_items WHERE status = ?")) {
            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count work items by status", e);
        }
    }

    @Override
    public List<WorkItem> findByJob(String jobId, int limit) {
        String sql = "SELECT * FROM work_items WHERE job_id = ? ORDER BY step_index, sort_index LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find work items of job: " + jobId, e);
        }
    }

    @Override
    public List<WorkItem> findInFlightNotUpdatedSince(Instant updatedBefore, int limit) {
        String sql = """
                    SELECT * FROM work_items
                    WHERE status IN ('RUNNING', 'QUEUED') AND updated_at < ?
                      AND job_id IN (SELECT id FROM jobs WHERE status IN ('ACCEPTED', 'RUNNING', 'PAUSED'))
                    ORDER BY updated_at
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            setTimestamp(ps, 1, updatedBefore);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find in-flight work items", e);
        }
    }

    @Override
    public Optional<Long> maxSuccessfulDuration(String jobId, String serviceId) {
        String sql = """
                    SELECT MAX(duration_ms) FROM work_items
                    WHERE job_id = ? AND service_id = ? AND status IN ('SUCCESSFUL', 'WARNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ps.setString(2, serviceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long value = rs.getLong(1);
                    return rs.wasNull() ? Optional.empty() : Optional.of(value);
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find max duration for job " + jobId, e);
        }
    }

    @Override
    public int sumDiscoveryOutputs(Connection conn, String jobId, int sourceIndex) throws SQLException {
        String sql = """
                    SELECT COALESCE(SUM(output_count), 0) FROM work_items
                    WHERE job_id = ? AND step_index = 0 AND source_index = ? AND status IN ('SUCCESSFUL', 'WARNING')
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ps.setInt(2, sourceIndex);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    @Override
    public boolean hasNonTerminal(String jobId) {
        String sql = """
                    SELECT COUNT(*) FROM work_items
                    WHERE job_id = ? AND status IN ('READY', 'QUEUED', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check work items of job: " + jobId, e);
        }
    }

    @Override
    public int deleteByJobIds(Connection conn, Collection<String> jobIds) throws SQLException {
        if (jobIds.isEmpty()) {
            return 0;
        }
        String sql = "DELETE FROM work_items WHERE job_id IN (" + placeholders(jobIds) + ")";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            for (String jobId : jobIds) {
                ps.setString(idx++, jobId);
            }
            return ps.executeUpdate();
        }
    }

    // ---- helpers ----

    private Optional<WorkItem> first(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
        }
    }

    private List<WorkItem> executeQuery(PreparedStatement ps) throws SQLException {
        List<WorkItem> items = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                items.add(mapRow(rs));
            }
        }
        return items;
    }

    private WorkItem mapRow(ResultSet rs) throws SQLException {
        String results = rs.getString("results");
        String sizes = rs.getString("output_item_sizes");
        return WorkItem.builder()
                .id(rs.getLong("id"))
                .jobId(rs.getString("job_id"))
                .stepIndex(rs.getInt("step_index"))
                .serviceId(rs.getString("service_id"))
                .status(WorkItemStatus.valueOf(rs.getString("status")))
                .subStatus(rs.getString("sub_status"))
                .sortIndex(rs.getLong("sort_index"))
                .sourceIndex(getIntOrNull(rs, "source_index"))
                .cursor(rs.getString("scroll_cursor"))
                .inputLocation(rs.getString("input_location"))
                .batchId(rs.getString("batch_id"))
                .results(results != null ? Json.read(results, STRING_LIST) : List.of())
                .outputItemSizes(sizes != null ? Json.read(sizes, LONG_LIST) : List.of())
                .durationMs(getLongOrNull(rs, "duration_ms"))
                .retryCount(rs.getInt("retry_count"))
                .createdAt(getInstant(rs, "created_at"))
                .startedAt(getInstant(rs, "started_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
