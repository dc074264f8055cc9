package bigo.conductor.api.v1.dto;

import bigo.conductor.model.Execution;
import bigo.conductor.model.Task;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a ledger task.
 * GET /api/v1/tasks/{id} (with executions), GET /api/v1/tasks (without)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("tier") String tier,
        @JsonProperty("status") String status,
        @JsonProperty("backend") String backend,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("executions") List<ExecutionResponse> executions) {

    public static TaskResponse from(Task task) {
        return from(task, null);
    }

    public static TaskResponse from(Task task, List<Execution> executions) {
        return new TaskResponse(
                task.id(),
                task.title(),
                task.description(),
                task.tier().label(),
                task.status().dbValue(),
                task.backend() != null ? task.backend().id() : null,
                task.createdAt(),
                task.updatedAt(),
                executions != null ? executions.stream().map(ExecutionResponse::from).toList() : null);
    }
}
