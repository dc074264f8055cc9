package bigo.conductor.server;

import bigo.conductor.api.Controller;
import bigo.conductor.api.Controller.ControllerResponse;
import bigo.conductor.exception.InvalidStateTransitionException;
import bigo.conductor.exception.NotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.CONFLICT;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches /api/v1/* requests to the registered controllers.
 *
 * Runs on a separate executor group because task runs block until the worker answers.
 * The handler keeps no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    /**
     * Register a controller. Controllers are checked in order of registration.
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
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeError(ctx, NOT_FOUND, "not found");

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            writeError(ctx, BAD_REQUEST, e.getMessage());
        } catch (NotFoundException e) {
            writeError(ctx, NOT_FOUND, e.getMessage());
        } catch (InvalidStateTransitionException e) {
            log.warn("Rejected transition: {}", e.getMessage());
            writeError(ctx, CONFLICT, e.getMessage());
        } catch (Throwable t) {
            log.error("Handler error: {} {}", method, path, t);
            writeError(ctx, INTERNAL_SERVER_ERROR, "internal error: " + t.getMessage());
        }
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        ControllerResponse response = ControllerResponse.failure(status, message);
        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    /**
     * Writes the response, falling back to a bare 500 and finally to closing the channel.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            try {
                byte[] errorBytes = "{\"error\":\"failed to write response\"}".getBytes(StandardCharsets.UTF_8);
                FullHttpResponse errorResponse = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                        Unpooled.wrappedBuffer(errorBytes));
                errorResponse.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
                errorResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, errorBytes.length);
                ctx.writeAndFlush(errorResponse);
            } catch (Throwable t2) {
                log.error("Complete failure writing error response", t2);
                ctx.close();
            }
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeError(ctx, INTERNAL_SERVER_ERROR, "channel error: " + cause.getMessage());
        } finally {
            ctx.close();
        }
    }

    /**
     * Shared ObjectMapper for request and response bodies.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
