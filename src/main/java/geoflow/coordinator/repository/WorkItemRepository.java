package geoflow.coordinator.repository;

import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemStatus;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkItem persistence.
 */
public interface WorkItemRepository {

    /** Insert and return the item with its generated id. */
    WorkItem insert(Connection conn, WorkItem item) throws SQLException;

    Optional<WorkItem> findById(long id);

    Optional<WorkItem> findById(Connection conn, long id) throws SQLException;

    Optional<WorkItem> lockById(Connection conn, long id) throws SQLException;

    /**
     * Lock the oldest item in {@code status} for the service whose job is active.
     */
    Optional<WorkItem> lockNextForService(Connection conn, String serviceId, WorkItemStatus status)
            throws SQLException;

    /**
     * Conditional transition: only applies when the item is currently in {@code from}.
     * Entering RUNNING stamps started_at.
     *
     * @return true if the row changed
     */
    boolean transition(Connection conn, long id, WorkItemStatus from, WorkItemStatus to, Instant now)
            throws SQLException;

    /** Record a terminal outcome with results, sizes, duration and diagnostic. */
    void finish(Connection conn, WorkItem finished) throws SQLException;

    /** Put a failed attempt back to READY with an incremented retry count. */
    void requeue(Connection conn, long id, int retryCount, String subStatus, Instant now) throws SQLException;

    /** Cancel every non-terminal item of the job. */
    int cancelNonTerminal(Connection conn, String jobId, Instant now) throws SQLException;

    /** READY items for the service whose job is active. */
    int countReady(String serviceId);

    int countByStatus(WorkItemStatus status);

    List<WorkItem> findByJob(String jobId, int limit);

    /** RUNNING or QUEUED items of non-terminal jobs last changed before {@code updatedBefore}. */
    List<WorkItem> findInFlightNotUpdatedSince(Instant updatedBefore, int limit);

    /** Longest duration of a successful item of this job and service, if any. */
    Optional<Long> maxSuccessfulDuration(String jobId, String serviceId);

    /** Outputs produced so far by successful discovery items of one source. */
    int sumDiscoveryOutputs(Connection conn, String jobId, int sourceIndex) throws SQLException;

    boolean hasNonTerminal(String jobId);

    int deleteByJobIds(Connection conn, Collection<String> jobIds) throws SQLException;
}
