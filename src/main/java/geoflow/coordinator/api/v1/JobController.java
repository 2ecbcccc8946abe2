package geoflow.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import geoflow.coordinator.api.Controller;
import geoflow.coordinator.api.v1.dto.CreateJobRequest;
import geoflow.coordinator.api.v1.dto.JobResponse;
import geoflow.coordinator.api.v1.dto.WorkItemSummaryResponse;
import geoflow.coordinator.catalog.CatalogException;
import geoflow.coordinator.error.ConflictException;
import geoflow.coordinator.model.Job;
import geoflow.coordinator.service.JobService;
import geoflow.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for Job management (public API).
 *
 * POST /api/v1/jobs - Create a new job
 * GET /api/v1/jobs?owner={owner}&limit={n} - List recent jobs
 * GET /api/v1/jobs/{jobId} - Get job status and result links
 * GET /api/v1/jobs/{jobId}/work-items - List the job's work items
 * POST /api/v1/jobs/{jobId}/cancel|pause|resume - Change job state
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final int DEFAULT_LIST_LIMIT = 50;
    private static final int DEFAULT_WORK_ITEM_LIMIT = 1000;

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs/?$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_WORK_ITEMS_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/work-items$");
    private static final Pattern JOB_ACTION_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/(cancel|pause|resume)$");

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches()
                    || JOB_BY_ID_PATTERN.matcher(path).matches()
                    || JOB_WORK_ITEMS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            boolean post = req.method().equals(HttpMethod.POST);

            if (JOBS_PATTERN.matcher(path).matches()) {
                return post ? handleCreateJob(req) : handleListJobs(req);
            }

            Matcher actionMatcher = JOB_ACTION_PATTERN.matcher(path);
            if (post && actionMatcher.matches()) {
                return handleAction(actionMatcher.group(1), actionMatcher.group(2));
            }

            Matcher itemsMatcher = JOB_WORK_ITEMS_PATTERN.matcher(path);
            if (itemsMatcher.matches()) {
                return handleGetWorkItems(req, itemsMatcher.group(1));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                return handleGetJob(jobMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("Invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (ConflictException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (CatalogException e) {
            log.warn("Catalog unavailable while creating job: {}", e.getMessage());
            return ControllerResponse.error("Failed to query the catalog for granule information: " + e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/jobs - Create a new job
     */
    private ControllerResponse handleCreateJob(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateJobRequest request = Json.mapper().readValue(body, CreateJobRequest.class);

        request.validate();

        Job job = jobService.createJob(request.owner(), request.chain(), request.operation());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                Json.mapper().writeValueAsString(JobResponse.from(job)));
    }

    /**
     * GET /api/v1/jobs?owner={owner}&limit={n}
     */
    private ControllerResponse handleListJobs(FullHttpRequest req) throws Exception {
        String owner = Controller.queryParam(req, "owner");
        int limit = parseLimit(Controller.queryParam(req, "limit"), DEFAULT_LIST_LIMIT);

        List<JobResponse> jobs = jobService.findRecent(owner, limit).stream()
                .map(JobResponse::from)
                .toList();

        Map<String, Object> response = Map.of("count", jobs.size(), "jobs", jobs);
        return ControllerResponse.json(Json.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<Job> jobOpt = jobService.findById(jobId);

        if (jobOpt.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }

        JobResponse response = JobResponse.from(jobOpt.get(), jobService.links(jobId));
        return ControllerResponse.json(Json.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs/{jobId}/work-items
     */
    private ControllerResponse handleGetWorkItems(FullHttpRequest req, String jobId) throws Exception {
        if (jobService.findById(jobId).isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }

        int limit = parseLimit(Controller.queryParam(req, "limit"), DEFAULT_WORK_ITEM_LIMIT);
        List<WorkItemSummaryResponse> items = jobService.workItems(jobId, limit).stream()
                .map(WorkItemSummaryResponse::from)
                .toList();

        Map<String, Object> response = Map.of("jobID", jobId, "count", items.size(), "workItems", items);
        return ControllerResponse.json(Json.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/jobs/{jobId}/{action}
     */
    private ControllerResponse handleAction(String jobId, String action) throws Exception {
        Optional<Job> changed = switch (action) {
            case "cancel" -> jobService.cancel(jobId);
            case "pause" -> jobService.pause(jobId);
            case "resume" -> jobService.resume(jobId);
            default -> throw new IllegalArgumentException("unknown action: " + action);
        };

        if (changed.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.json(Json.mapper().writeValueAsString(JobResponse.from(changed.get())));
    }

    private static int parseLimit(String value, int defaultLimit) {
        if (value == null) {
            return defaultLimit;
        }
        int limit;
        try {
            limit = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return limit;
    }
}
