package gpufleet.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("cycles") Long cycles,
        @JsonProperty("lastCycleError") String lastCycleError,
        @JsonProperty("lastScaleUp") Instant lastScaleUp,
        @JsonProperty("lastScaleDown") Instant lastScaleDown) {

    public static HealthResponse healthy(String uptime, long cycles, String lastCycleError,
            Instant lastScaleUp, Instant lastScaleDown) {
        return new HealthResponse("healthy", "ok", uptime, cycles, lastCycleError, lastScaleUp, lastScaleDown);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null);
    }
}
