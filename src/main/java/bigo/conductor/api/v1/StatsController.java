package bigo.conductor.api.v1;

import bigo.conductor.api.Controller;
import bigo.conductor.api.v1.dto.StatsResponse;
import bigo.conductor.server.RouterHandler;
import bigo.conductor.service.LedgerService;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /api/v1/stats - ledger statistics and estimated savings.
 */
public class StatsController implements Controller {

    private final LedgerService ledger;

    public StatsController(LedgerService ledger) {
        this.ledger = ledger;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/stats".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    StatsResponse.from(ledger.getStats())));
        } catch (JsonProcessingException e) {
            return ControllerResponse.error("failed to serialize stats");
        }
    }
}
