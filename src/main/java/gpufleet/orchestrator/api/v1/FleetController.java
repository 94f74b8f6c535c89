package gpufleet.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import gpufleet.orchestrator.api.Controller;
import gpufleet.orchestrator.server.RouterHandler;
import gpufleet.orchestrator.service.CycleSummary;
import gpufleet.orchestrator.service.FleetStatusService;
import gpufleet.orchestrator.service.OrchestratorContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Fleet status endpoints.
 * GET /api/v1/fleet        - current snapshot
 * GET /api/v1/cycles/last  - summary of the most recent cycle
 */
public class FleetController implements Controller {

    private final FleetStatusService statusService;
    private final OrchestratorContext context;

    public FleetController(FleetStatusService statusService, OrchestratorContext context) {
        this.statusService = statusService;
        this.context = context;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && ("/api/v1/fleet".equals(path) || "/api/v1/cycles/last".equals(path));
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if ("/api/v1/fleet".equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(statusService.snapshot()));
            }
            CycleSummary last = context.lastSummary();
            if (last == null) {
                return ControllerResponse.notFound("no cycle has run yet");
            }
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(last));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response for " + path, e);
        }
    }
}
