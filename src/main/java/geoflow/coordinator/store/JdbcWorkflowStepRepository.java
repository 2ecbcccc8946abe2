package geoflow.coordinator.store;

import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.WorkflowStep;
import geoflow.coordinator.repository.WorkflowStepRepository;
import geoflow.coordinator.util.Json;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static geoflow.coordinator.store.JdbcSupport.getIntOrNull;
import static geoflow.coordinator.store.JdbcSupport.getLongOrNull;
import static geoflow.coordinator.store.JdbcSupport.placeholders;
import static geoflow.coordinator.store.JdbcSupport.setIntOrNull;
import static geoflow.coordinator.store.JdbcSupport.setLongOrNull;

/**
 * JDBC implementation of WorkflowStepRepository.
 */
public class JdbcWorkflowStepRepository implements WorkflowStepRepository {

    private final Database db;

    public JdbcWorkflowStepRepository(Database db) {
        this.db = db;
    }

    @Override
    public void insertAll(Connection conn, List<WorkflowStep> steps) throws SQLException {
        String sql = """
                    INSERT INTO workflow_steps (job_id, step_index, service_id, operation, is_batched,
                                                max_batch_inputs, max_batch_size_bytes, work_item_count,
                                                completed_work_item_count, is_complete, batch_cursor, open_batch_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (WorkflowStep step : steps) {
                ps.setString(1, step.jobId());
                ps.setInt(2, step.stepIndex());
                ps.setString(3, step.serviceId());
                ps.setString(4, Json.write(step.operation()));
                ps.setBoolean(5, step.batched());
                setIntOrNull(ps, 6, step.maxBatchInputs());
                setLongOrNull(ps, 7, step.maxBatchSizeBytes());
                ps.setInt(8, step.workItemCount());
                ps.setInt(9, step.completedWorkItemCount());
                ps.setBoolean(10, step.complete());
                ps.setLong(11, step.batchCursor());
                ps.setString(12, step.openBatchId());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public List<WorkflowStep> findByJob(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT * FROM workflow_steps WHERE job_id = ? ORDER BY step_index")) {

            ps.setString(1, jobId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find workflow steps of job: " + jobId, e);
        }
    }

    @Override
    public Optional<WorkflowStep> find(Connection conn, String jobId, int stepIndex) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM workflow_steps WHERE job_id = ? AND step_index = ?")) {
            ps.setString(1, jobId);
            ps.setInt(2, stepIndex);
            List<WorkflowStep> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        }
    }

    @Override
    public List<WorkflowStep> lockAll(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM workflow_steps WHERE job_id = ? ORDER BY step_index FOR UPDATE")) {
            ps.setString(1, jobId);
            return executeQuery(ps);
        }
    }

    @Override
    public void update(Connection conn, WorkflowStep step) throws SQLException {
        String sql = """
                    UPDATE workflow_steps
                    SET operation = ?, work_item_count = ?, completed_work_item_count = ?, is_complete = ?,
                        batch_cursor = ?, open_batch_id = ?
                    WHERE job_id = ? AND step_index = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Json.write(step.operation()));
            ps.setInt(2, step.workItemCount());
            ps.setInt(3, step.completedWorkItemCount());
            ps.setBoolean(4, step.complete());
            ps.setLong(5, step.batchCursor());
            ps.setString(6, step.openBatchId());
            ps.setString(7, step.jobId());
            ps.setInt(8, step.stepIndex());
            ps.executeUpdate();
        }
    }

    @Override
    public int deleteByJobIds(Connection conn, Collection<String> jobIds) throws SQLException {
        if (jobIds.isEmpty()) {
            return 0;
        }
        String sql = "DELETE FROM workflow_steps WHERE job_id IN (" + placeholders(jobIds) + ")";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            for (String jobId : jobIds) {
                ps.setString(idx++, jobId);
            }
            return ps.executeUpdate();
        }
    }

    private List<WorkflowStep> executeQuery(PreparedStatement ps) throws SQLException {
        List<WorkflowStep> steps = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                steps.add(mapRow(rs));
            }
        }
        return steps;
    }

    private WorkflowStep mapRow(ResultSet rs) throws SQLException {
        return WorkflowStep.builder()
                .jobId(rs.getString("job_id"))
                .stepIndex(rs.getInt("step_index"))
                .serviceId(rs.getString("service_id"))
                .operation(Json.read(rs.getString("operation"), DataOperation.class))
                .batched(rs.getBoolean("is_batched"))
                .maxBatchInputs(getIntOrNull(rs, "max_batch_inputs"))
                .maxBatchSizeBytes(getLongOrNull(rs, "max_batch_size_bytes"))
                .workItemCount(rs.getInt("work_item_count"))
                .completedWorkItemCount(rs.getInt("completed_work_item_count"))
                .complete(rs.getBoolean("is_complete"))
                .batchCursor(rs.getLong("batch_cursor"))
                .openBatchId(rs.getString("open_batch_id"))
                .build();
    }
}
