package bigo.conductor.api.v1.dto;

import bigo.conductor.model.Execution;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One execution attempt of a task.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
        @JsonProperty("id") String id,
        @JsonProperty("backend") String backend,
        @JsonProperty("status") String status,
        @JsonProperty("tokensUsed") int tokensUsed,
        @JsonProperty("costUsd") double costUsd,
        @JsonProperty("durationMs") long durationMs,
        @JsonProperty("error") String error,
        @JsonProperty("output") String output,
        @JsonProperty("createdAt") Instant createdAt) {

    public static ExecutionResponse from(Execution e) {
        return new ExecutionResponse(
                e.id(),
                e.backend(),
                e.status().dbValue(),
                e.tokensUsed(),
                e.costUsd(),
                e.durationMs(),
                e.errorMessage(),
                e.output(),
                e.createdAt());
    }
}
