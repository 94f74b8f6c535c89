package gpufleet.orchestrator.api.v1;

import gpufleet.orchestrator.api.Controller;
import gpufleet.orchestrator.api.v1.dto.HealthResponse;
import gpufleet.orchestrator.server.RouterHandler;
import gpufleet.orchestrator.service.CycleSummary;
import gpufleet.orchestrator.service.OrchestratorContext;
import gpufleet.orchestrator.store.Database;
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

    private final Database database;
    private final OrchestratorContext context;

    public HealthController(Database database, OrchestratorContext context) {
        this.database = database;
        this.context = context;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
            }

            CycleSummary last = context.lastSummary();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), context.cycleCount(), last != null ? last.error() : null,
                    context.lastScaleUpAt(), context.lastScaleDownAt());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
