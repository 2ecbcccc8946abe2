package geoflow.coordinator.store;

import geoflow.coordinator.model.BatchItem;
import geoflow.coordinator.repository.BatchRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static geoflow.coordinator.store.JdbcSupport.placeholders;

/**
 * JDBC implementation of BatchRepository.
 * The primary key (job, step, producer, output) rejects a second insert of the same output.
 */
public class JdbcBatchRepository implements BatchRepository {

    @Override
    public void insertAll(Connection conn, List<BatchItem> items) throws SQLException {
        if (items.isEmpty()) {
            return;
        }
        String sql = """
                    INSERT INTO batch_items (job_id, step_index, producer_index, output_index, location, size_bytes)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (BatchItem item : items) {
                ps.setString(1, item.jobId());
                ps.setInt(2, item.stepIndex());
                ps.setLong(3, item.producerIndex());
                ps.setInt(4, item.outputIndex());
                ps.setString(5, item.location());
                ps.setLong(6, item.sizeBytes());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public List<BatchItem> findUnassigned(Connection conn, String jobId, int stepIndex) throws SQLException {
        String sql = """
                    SELECT * FROM batch_items
                    WHERE job_id = ? AND step_index = ? AND batch_id IS NULL
                    ORDER BY producer_index, output_index
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ps.setInt(2, stepIndex);
            return executeQuery(ps);
        }
    }

    @Override
    public List<BatchItem> findMembers(Connection conn, String jobId, int stepIndex, String batchId)
            throws SQLException {
        String sql = """
                    SELECT * FROM batch_items
                    WHERE job_id = ? AND step_index = ? AND batch_id = ? AND location IS NOT NULL
                    ORDER BY producer_index, output_index
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ps.setInt(2, stepIndex);
            ps.setString(3, batchId);
            return executeQuery(ps);
        }
    }

    @Override
    public void assign(Connection conn, BatchItem item, String batchId) throws SQLException {
        String sql = """
                    UPDATE batch_items SET batch_id = ?
                    WHERE job_id = ? AND step_index = ? AND producer_index = ? AND output_index = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, batchId);
            ps.setString(2, item.jobId());
            ps.setInt(3, item.stepIndex());
            ps.setLong(4, item.producerIndex());
            ps.setInt(5, item.outputIndex());
            ps.executeUpdate();
        }
    }

    @Override
    public int deleteByJobIds(Connection conn, Collection<String> jobIds) throws SQLException {
        if (jobIds.isEmpty()) {
            return 0;
        }
        String sql = "DELETE FROM batch_items WHERE job_id IN (" + placeholders(jobIds) + ")";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            for (String jobId : jobIds) {
                ps.setString(idx++, jobId);
            }
            return ps.executeUpdate();
        }
    }

    private List<BatchItem> executeQuery(PreparedStatement ps) throws SQLException {
        List<BatchItem> items = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                items.add(new BatchItem(
                        rs.getString("job_id"),
                        rs.getInt("step_index"),
                        rs.getLong("producer_index"),
                        rs.getInt("output_index"),
                        rs.getString("location"),
                        rs.getLong("size_bytes"),
                        rs.getString("batch_id")));
            }
        }
        return items;
    }
}
