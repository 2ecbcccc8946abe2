package geoflow.coordinator.repository;

import geoflow.coordinator.model.BatchItem;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/**
 * Repository for the outputs accumulated by batched steps.
 */
public interface BatchRepository {

    void insertAll(Connection conn, List<BatchItem> items) throws SQLException;

    /** Unassigned items of a step, ordered by producer index then output index. */
    List<BatchItem> findUnassigned(Connection conn, String jobId, int stepIndex) throws SQLException;

    /** Members of a batch (open or closed), placeholders excluded, in order. */
    List<BatchItem> findMembers(Connection conn, String jobId, int stepIndex, String batchId) throws SQLException;

    void assign(Connection conn, BatchItem item, String batchId) throws SQLException;

    int deleteByJobIds(Connection conn, Collection<String> jobIds) throws SQLException;
}
