package geoflow.coordinator.api;

import geoflow.coordinator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;
import java.util.Map;

/**
 * One group of coordinator endpoints. The router asks each registered controller in
 * turn whether it {@link #matches} a request and lets the first match {@link #handle} it.
 * Every body is JSON; failures carry {@code {"error": message}}.
 */
public interface Controller {

    String JSON = "application/json";

    /**
     * @param path request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * @param path request path without the query string
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * First value of a query parameter, or null.
     */
    static String queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /** Error document written for every non-2xx response. */
    static String errorBody(String message) {
        return Json.write(Map.of("error", message == null ? "" : message));
    }

    record ControllerResponse(HttpResponseStatus status, String contentType, String body) {

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        public static ControllerResponse failure(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, JSON, errorBody(message));
        }

        public static ControllerResponse notFound(String message) {
            return failure(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return failure(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse conflict(String message) {
            return failure(HttpResponseStatus.CONFLICT, message);
        }

        public static ControllerResponse error(String message) {
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse unavailable(String body) {
            return json(HttpResponseStatus.SERVICE_UNAVAILABLE, body);
        }
    }
}
