package bigo.conductor.api.v1.dto;

import bigo.conductor.worker.WorkerRegistry.WorkerStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for one registered worker.
 * GET /api/v1/workers
 */
public record WorkerResponse(
        @JsonProperty("backend") String backend,
        @JsonProperty("backendClass") String backendClass,
        @JsonProperty("busy") boolean busy,
        @JsonProperty("available") boolean available) {

    public static WorkerResponse from(WorkerStatus status) {
        return new WorkerResponse(
                status.backend().id(),
                status.backend().backendClass().prefix(),
                status.busy(),
                status.available());
    }
}
