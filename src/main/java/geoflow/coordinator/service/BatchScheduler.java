package geoflow.coordinator.service;

import geoflow.coordinator.model.BatchItem;
import geoflow.coordinator.model.WorkItem;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.model.WorkflowStep;
import geoflow.coordinator.repository.BatchRepository;
import geoflow.coordinator.repository.WorkItemRepository;
import geoflow.coordinator.storage.ObjectStore;
import geoflow.coordinator.storage.StacCatalog;
import geoflow.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Groups upstream outputs into batches for a batched step.
 *
 * <p>Outputs are consumed strictly in producer order: the step's batch cursor names the
 * next producer (upstream sort index) to consume, and consumption stops at the first
 * producer that has not reported yet. Batch membership therefore depends only on the set
 * of completed producers, never on the order their completions arrived in.
 *
 * <p>Must be called inside the completion transaction with the job's step rows locked.
 */
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    /** Batch id given to placeholders so they count as consumed without joining a batch. */
    static final String SKIPPED = "-";

    private final BatchRepository batchRepository;
    private final WorkItemRepository workItemRepository;
    private final ObjectStore objectStore;

    public BatchScheduler(BatchRepository batchRepository, WorkItemRepository workItemRepository,
            ObjectStore objectStore) {
        this.batchRepository = batchRepository;
        this.workItemRepository = workItemRepository;
        this.objectStore = objectStore;
    }

    /**
     * Result of one scheduling pass.
     *
     * @param step    the step with updated cursor, open batch and work item count; not yet persisted
     * @param created downstream work items created for closed batches
     */
    public record Outcome(WorkflowStep step, List<WorkItem> created) {
    }

    /**
     * Record the outputs of one successful upstream item. An item without results
     * records a placeholder so later producers are not held back.
     */
    public void recordOutputs(Connection conn, WorkflowStep step, WorkItem producer, List<String> results,
            List<Long> sizes) throws SQLException {
        List<BatchItem> items = new ArrayList<>();
        if (results.isEmpty()) {
            items.add(BatchItem.placeholder(step.jobId(), step.stepIndex(), producer.sortIndex()));
        } else {
            for (int i = 0; i < results.size(); i++) {
                items.add(BatchItem.output(step.jobId(), step.stepIndex(), producer.sortIndex(), i,
                        results.get(i), sizes.get(i)));
            }
        }
        batchRepository.insertAll(conn, items);
    }

    /**
     * Consume every contiguous pending output and close batches whose thresholds are reached.
     *
     * @param upstreamExhausted true when the upstream step will produce nothing more; the
     *                          open batch is then closed even if undersized
     */
    public Outcome schedule(Connection conn, WorkflowStep step, boolean upstreamExhausted) throws SQLException {
        Pass pass = new Pass(conn, step);
        pass.load();

        List<BatchItem> pending = batchRepository.findUnassigned(conn, step.jobId(), step.stepIndex());
        int i = 0;
        while (i < pending.size()) {
            long producer = pending.get(i).producerIndex();
            if (producer != pass.cursor) {
                break;
            }
            while (i < pending.size() && pending.get(i).producerIndex() == producer) {
                pass.place(pending.get(i));
                i++;
            }
            pass.cursor++;
        }

        if (upstreamExhausted) {
            if (i < pending.size()) {
                log.warn("Step {} of job {} has {} outputs beyond producer {} at exhaustion",
                        step.stepIndex(), step.jobId(), pending.size() - i, pass.cursor);
            }
            if (!pass.members.isEmpty()) {
                pass.close();
            } else {
                pass.openBatchId = null;
            }
        }

        return new Outcome(pass.toStep(), pass.created);
    }

    /** Mutable state of one scheduling pass over a step. */
    private final class Pass {

        private final Connection conn;
        private final WorkflowStep step;
        private final Integer maxInputs;
        private final Long maxBytes;

        private long cursor;
        private String openBatchId;
        private int workItemCount;
        private final List<BatchItem> members = new ArrayList<>();
        private long bytes;
        private final List<WorkItem> created = new ArrayList<>();

        Pass(Connection conn, WorkflowStep step) {
            this.conn = conn;
            this.step = step;
            this.maxInputs = step.maxBatchInputs();
            this.maxBytes = step.maxBatchSizeBytes();
            this.cursor = step.batchCursor();
            this.openBatchId = step.openBatchId();
            this.workItemCount = step.workItemCount();
        }

        void load() throws SQLException {
            if (openBatchId == null) {
                return;
            }
            for (BatchItem member : batchRepository.findMembers(conn, step.jobId(), step.stepIndex(), openBatchId)) {
                members.add(member);
                bytes += member.sizeBytes();
            }
        }

        void place(BatchItem item) throws SQLException {
            if (item.isPlaceholder()) {
                batchRepository.assign(conn, item, SKIPPED);
                return;
            }
            if (!members.isEmpty() && maxBytes != null && bytes + item.sizeBytes() > maxBytes) {
                close();
            }
            if (openBatchId == null) {
                openBatchId = UUID.randomUUID().toString();
            }
            batchRepository.assign(conn, item, openBatchId);
            members.add(item);
            bytes += item.sizeBytes();

            boolean countReached = maxInputs != null && members.size() >= maxInputs;
            boolean bytesReached = maxBytes != null && bytes >= maxBytes;
            if (countReached || bytesReached) {
                close();
            }
        }

        void close() throws SQLException {
            String batchId = openBatchId;
            List<String> hrefs = members.stream().map(BatchItem::location).toList();
            StacCatalog catalog = StacCatalog.ofItems(batchId,
                    "Batch of " + hrefs.size() + " items for step " + step.stepIndex(), hrefs);
            String path = step.jobId() + "/batches/" + step.stepIndex() + "/" + batchId + "/catalog.json";
            String location = objectStore.put(path, Json.write(catalog).getBytes(StandardCharsets.UTF_8));

            WorkItem item = workItemRepository.insert(conn, WorkItem.builder()
                    .jobId(step.jobId())
                    .stepIndex(step.stepIndex())
                    .serviceId(step.serviceId())
                    .status(WorkItemStatus.READY)
                    .sortIndex(workItemCount++)
                    .inputLocation(location)
                    .batchId(batchId)
                    .build());
            created.add(item);

            log.debug("Closed batch {} of step {} (job {}): {} items, {} bytes",
                    batchId, step.stepIndex(), step.jobId(), members.size(), bytes);

            openBatchId = null;
            members.clear();
            bytes = 0;
        }

        WorkflowStep toStep() {
            return step.toBuilder()
                    .batchCursor(cursor)
                    .openBatchId(openBatchId)
                    .workItemCount(workItemCount)
                    .build();
        }
    }
}
