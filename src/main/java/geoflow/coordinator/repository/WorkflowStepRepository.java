package geoflow.coordinator.repository;

import geoflow.coordinator.model.WorkflowStep;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowStep persistence.
 */
public interface WorkflowStepRepository {

    void insertAll(Connection conn, List<WorkflowStep> steps) throws SQLException;

    List<WorkflowStep> findByJob(String jobId);

    Optional<WorkflowStep> find(Connection conn, String jobId, int stepIndex) throws SQLException;

    /** Lock every step of the job in ascending step order and return them in that order. */
    List<WorkflowStep> lockAll(Connection conn, String jobId) throws SQLException;

    /** Persist counters, batching state, completion flag and operation snapshot. */
    void update(Connection conn, WorkflowStep step) throws SQLException;

    int deleteByJobIds(Connection conn, Collection<String> jobIds) throws SQLException;
}
