package geoflow.coordinator.api.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import geoflow.coordinator.api.Controller;
import geoflow.coordinator.api.internal.dto.WorkItemResponse;
import geoflow.coordinator.api.internal.dto.WorkItemUpdateRequest;
import geoflow.coordinator.model.WorkAssignment;
import geoflow.coordinator.model.WorkItemUpdateResult;
import geoflow.coordinator.service.WorkItemService;
import geoflow.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the worker poll/update protocol.
 * GET /work?serviceID={id} - Claim the next ready work item
 * PUT /work/{workItemId} - Report completion (idempotent)
 */
public class WorkController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkController.class);

    private static final Pattern WORK_PATTERN = Pattern.compile("^/work/?$");
    private static final Pattern WORK_ITEM_PATTERN = Pattern.compile("^/work/(\\d+)$");

    private final WorkItemService workItemService;

    public WorkController(WorkItemService workItemService) {
        this.workItemService = workItemService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return WORK_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.PUT)) {
            return WORK_ITEM_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.GET)) {
                return handleClaim(req);
            }

            Matcher itemMatcher = WORK_ITEM_PATTERN.matcher(path);
            if (itemMatcher.matches()) {
                return handleUpdate(req, Long.parseLong(itemMatcher.group(1)));
            }

            return ControllerResponse.notFound("unknown work endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("Invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Work controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * GET /work?serviceID={id}
     */
    private ControllerResponse handleClaim(FullHttpRequest req) throws Exception {
        String serviceId = Controller.queryParam(req, "serviceID");
        Optional<WorkAssignment> claimed = workItemService.claim(serviceId);

        if (claimed.isEmpty()) {
            return ControllerResponse.notFound("no work available for " + serviceId);
        }
        return ControllerResponse.json(Json.mapper().writeValueAsString(WorkItemResponse.from(claimed.get())));
    }

    /**
     * PUT /work/{workItemId}
     */
    private ControllerResponse handleUpdate(FullHttpRequest req, long workItemId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        WorkItemUpdateRequest request = Json.mapper().readValue(body, WorkItemUpdateRequest.class);

        WorkItemUpdateResult result = workItemService.update(workItemId, request.toUpdate());

        return switch (result) {
            case NOT_FOUND -> ControllerResponse.notFound("work item " + workItemId + " not found");
            case NOT_RUNNING -> ControllerResponse.conflict("work item " + workItemId + " is not running");
            default -> ControllerResponse.json(Json.mapper().writeValueAsString(
                    Map.of("workItemID", workItemId, "result", result.name().toLowerCase(Locale.ROOT))));
        };
    }
}
