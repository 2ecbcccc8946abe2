package geoflow.coordinator.repository;

import geoflow.coordinator.model.Job;
import geoflow.coordinator.model.JobLink;
import geoflow.coordinator.model.JobStatus;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Job persistence.
 * Methods taking a {@link Connection} run inside the caller's transaction.
 */
public interface JobRepository {

    void insert(Connection conn, Job job) throws SQLException;

    Optional<Job> findById(String jobId);

    Optional<Job> findById(Connection conn, String jobId) throws SQLException;

    /** Lock the job row until the caller's transaction ends. */
    Optional<Job> lockById(Connection conn, String jobId) throws SQLException;

    /** Most recent jobs, optionally restricted to one owner. */
    List<Job> findRecent(String owner, int limit);

    /** Set status and message unconditionally (caller holds the row lock). */
    void updateStatus(Connection conn, String jobId, JobStatus status, String message) throws SQLException;

    /** ACCEPTED -> RUNNING; no-op for any other status. */
    boolean markRunning(Connection conn, String jobId) throws SQLException;

    void updateProgress(Connection conn, String jobId, int progress) throws SQLException;

    void updateNumInputGranules(Connection conn, String jobId, int numInputGranules) throws SQLException;

    /** Jobs in any of {@code statuses} not updated since {@code updatedBefore}. */
    List<Job> findNotUpdatedSince(Collection<JobStatus> statuses, Instant updatedBefore, int limit);

    /** Ids of terminal jobs not updated since {@code updatedBefore} that still have workflow state. */
    List<String> findTerminalIdsNotUpdatedSince(Instant updatedBefore, int limit);

    void addLinks(Connection conn, String jobId, List<JobLink> links) throws SQLException;

    List<JobLink> findLinks(String jobId);

    int count();
}
