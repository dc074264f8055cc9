package bigo.conductor.api.v1;

import bigo.conductor.api.Controller;
import bigo.conductor.api.v1.dto.WorkerResponse;
import bigo.conductor.server.RouterHandler;
import bigo.conductor.worker.WorkerRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/workers - registered backends and whether each is free.
 */
public class WorkerController implements Controller {

    private final WorkerRegistry registry;

    public WorkerController(WorkerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/workers".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        List<WorkerResponse> workers = registry.snapshot().stream().map(WorkerResponse::from).toList();
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("workers", workers, "count", workers.size())));
        } catch (JsonProcessingException e) {
            return ControllerResponse.error("failed to serialize workers");
        }
    }
}
