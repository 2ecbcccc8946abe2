package geoflow.coordinator.api.internal;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import geoflow.coordinator.api.Controller;
import geoflow.coordinator.api.internal.dto.ReadyCountResponse;
import geoflow.coordinator.service.WorkItemService;
import geoflow.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue depth for autoscaling worker pools.
 * GET /metrics/ready-count?serviceID={id}
 */
public class MetricsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);

    private final WorkItemService workItemService;

    public MetricsController(WorkItemService workItemService) {
        this.workItemService = workItemService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/metrics/ready-count".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            int ready = workItemService.readyCount(Controller.queryParam(req, "serviceID"));
            return ControllerResponse.json(Json.mapper().writeValueAsString(new ReadyCountResponse(ready)));
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Metrics controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
