package geoflow.coordinator.api.v1;

import geoflow.coordinator.api.Controller;
import geoflow.coordinator.api.v1.dto.HealthResponse;
import geoflow.coordinator.model.WorkItemStatus;
import geoflow.coordinator.repository.JobRepository;
import geoflow.coordinator.repository.WorkItemRepository;
import geoflow.coordinator.store.Database;
import geoflow.coordinator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * GET /api/v1/health: database reachability plus a snapshot of the work queue.
 * Answers 503 when the database cannot be reached.
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private static final WorkItemStatus[] QUEUE_STATES = {
            WorkItemStatus.READY, WorkItemStatus.QUEUED, WorkItemStatus.RUNNING };

    private final Database database;
    private final JobRepository jobRepository;
    private final WorkItemRepository workItemRepository;
    private final BooleanSupplier schedulerRunning;

    public HealthController(Database database, JobRepository jobRepository, WorkItemRepository workItemRepository,
            BooleanSupplier schedulerRunning) {
        this.database = database;
        this.jobRepository = jobRepository;
        this.workItemRepository = workItemRepository;
        this.schedulerRunning = schedulerRunning;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return HttpMethod.GET.equals(method) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!database.isHealthy()) {
            return unavailable("database connection failed");
        }
        try {
            Map<String, Integer> queue = new LinkedHashMap<>();
            for (WorkItemStatus status : QUEUE_STATES) {
                queue.put(status.name().toLowerCase(Locale.ROOT), workItemRepository.countByStatus(status));
            }
            long uptimeSeconds = ManagementFactory.getRuntimeMXBean().getUptime() / 1000;
            return ControllerResponse.json(Json.write(HealthResponse.healthy(
                    uptimeSeconds, jobRepository.count(), queue, schedulerRunning.getAsBoolean())));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return unavailable(e.getMessage());
        }
    }

    private static ControllerResponse unavailable(String reason) {
        return ControllerResponse.unavailable(Json.write(HealthResponse.unhealthy(reason)));
    }
}
