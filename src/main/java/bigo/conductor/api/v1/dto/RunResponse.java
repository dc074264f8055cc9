package bigo.conductor.api.v1.dto;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ExecutionResult;
import bigo.conductor.model.RunResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a run or a dry run.
 * POST /api/v1/tasks, POST /api/v1/tasks/dry-run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("dryRun") boolean dryRun,
        @JsonProperty("classification") ClassificationResponse classification,
        @JsonProperty("actualBackend") String actualBackend,
        @JsonProperty("fallbackBackend") String fallbackBackend,
        @JsonProperty("workerAvailable") Boolean workerAvailable,
        @JsonProperty("output") String output,
        @JsonProperty("tokensUsed") Integer tokensUsed,
        @JsonProperty("costUsd") Double costUsd,
        @JsonProperty("durationMs") long durationMs,
        @JsonProperty("error") String error,
        @JsonProperty("validationRequired") boolean validationRequired,
        @JsonProperty("validationPending") boolean validationPending,
        @JsonProperty("requiredValidators") int requiredValidators,
        @JsonProperty("requiredApprovals") int requiredApprovals) {

    public static RunResponse from(RunResult r) {
        ExecutionResult exec = r.execution();
        return new RunResponse(
                r.taskId(),
                r.status() != null ? r.status().dbValue() : null,
                r.dryRun(),
                ClassificationResponse.from(r.classification()),
                id(r.actualBackend()),
                id(r.fallbackBackend()),
                r.dryRun() ? r.workerAvailable() : null,
                exec != null ? exec.output() : null,
                exec != null ? exec.tokensUsed() : null,
                exec != null ? exec.costUsd() : null,
                r.duration().toMillis(),
                r.hasError() ? r.error() : null,
                r.validationRequired(),
                r.validationPending(),
                r.requiredValidators(),
                r.requiredApprovals());
    }

    private static String id(Backend backend) {
        return backend != null ? backend.id() : null;
    }
}
