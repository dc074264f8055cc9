package bigo.conductor.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * A routable piece of the conductor's HTTP API. The router asks every
 * registered controller in turn and hands the request to the first match.
 */
public interface Controller {

    /** Whether this controller owns {@code method} on {@code path} (query string stripped). */
    boolean matches(HttpMethod method, String path);

    /**
     * Runs on the handler executor group, never on the I/O loop, so it may block
     * on the conductor pipeline.
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /** A JSON response. Errors carry {@code {"error": "..."}}. */
    record ControllerResponse(HttpResponseStatus status, String contentType, String body) {

        private static final String JSON = "application/json";

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        public static ControllerResponse failure(HttpResponseStatus status, String message) {
            String body = JsonNodeFactory.instance.objectNode()
                    .put("error", message == null ? "" : message)
                    .toString();
            return new ControllerResponse(status, JSON, body);
        }

        public static ControllerResponse notFound(String message) {
            return failure(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return failure(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }
    }
}
