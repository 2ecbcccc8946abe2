package geoflow.coordinator.server;

import geoflow.coordinator.api.Controller;
import geoflow.coordinator.api.Controller.ControllerResponse;
import geoflow.coordinator.config.CoordinatorConfig;
import geoflow.coordinator.error.ConflictException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.CONFLICT;
import static io.netty.handler.codec.http.HttpResponseStatus.FORBIDDEN;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches requests to the registered controllers.
 *
 * Endpoints:
 * - /api/v1/* (public job API)
 * - /work, /metrics/* (worker API, guarded by X-Geoflow-Key when a worker key is configured)
 *
 * Anything else is a 404. Stateless, so one instance serves every channel.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    static final String WORKER_KEY_HEADER = "X-Geoflow-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final CoordinatorConfig config;

    public RouterHandler(CoordinatorConfig config) {
        this.config = config;
    }

    /**
     * Controllers are consulted in registration order.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        long started = System.nanoTime();
        String uri = req.uri();
        int query = uri.indexOf('?');
        String path = query >= 0 ? uri.substring(0, query) : uri;

        ControllerResponse response = dispatch(ctx, req, path);
        write(ctx, req, response);

        log.debug("{} {} -> {} in {} ms", req.method(), path, response.status().code(),
                (System.nanoTime() - started) / 1_000_000);
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (isWorkerPath(path) && !workerKeyAccepted(req)) {
            log.warn("Rejected {} {} without a valid worker key", req.method(), path);
            return ControllerResponse.failure(FORBIDDEN, "forbidden");
        }
        try {
            for (Controller controller : controllers) {
                if (controller.matches(req.method(), path)) {
                    return controller.handle(ctx, req, path);
                }
            }
            return ControllerResponse.failure(NOT_FOUND, "not found");
        } catch (IllegalArgumentException e) {
            log.warn("Bad request {} {}: {}", req.method(), path, e.getMessage());
            return ControllerResponse.failure(BAD_REQUEST, e.getMessage());
        } catch (ConflictException e) {
            return ControllerResponse.failure(CONFLICT, e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", req.method(), path, e);
            return ControllerResponse.failure(INTERNAL_SERVER_ERROR, e.toString());
        }
    }

    private static boolean isWorkerPath(String path) {
        return path.equals("/work") || path.startsWith("/work/") || path.startsWith("/metrics/");
    }

    private boolean workerKeyAccepted(FullHttpRequest req) {
        return !config.hasWorkerKey() || config.workerKey().equals(req.headers().get(WORKER_KEY_HEADER));
    }

    private void write(ChannelHandlerContext ctx, FullHttpRequest req, ControllerResponse response) {
        byte[] bytes = (response.body() == null ? "" : response.body()).getBytes(StandardCharsets.UTF_8);
        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                Unpooled.wrappedBuffer(bytes));
        http.headers().set(HttpHeaderNames.CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);

        if (HttpUtil.isKeepAlive(req)) {
            http.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(http);
        } else {
            ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        byte[] bytes = Controller.errorBody("channel error").getBytes(StandardCharsets.UTF_8);
        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                Unpooled.wrappedBuffer(bytes));
        http.headers().set(HttpHeaderNames.CONTENT_TYPE, Controller.JSON + "; charset=utf-8");
        http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
    }
}
