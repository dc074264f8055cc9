package bigo.conductor.api.v1;

import bigo.conductor.api.Controller;
import bigo.conductor.api.v1.dto.HealthResponse;
import bigo.conductor.server.RouterHandler;
import bigo.conductor.service.LedgerService;
import bigo.conductor.store.Database;
import bigo.conductor.worker.WorkerRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    static final String VERSION = "0.3.0";

    private final Database database;
    private final LedgerService ledger;
    private final WorkerRegistry registry;

    public HealthController(Database database, LedgerService ledger, WorkerRegistry registry) {
        this.database = database;
        this.ledger = ledger;
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, registry.size(), ledger.getStats().pendingTasks());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(e.getMessage())));
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
