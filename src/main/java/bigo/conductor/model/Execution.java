package bigo.conductor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Ledger record of one attempt to run a task on a backend.
 */
public record Execution(
        String id,
        String taskId,
        String workerId,
        String backend,
        String inputHash,
        String output,
        int tokensUsed,
        double costUsd,
        long durationMs,
        ExecutionStatus status,
        String errorMessage,
        Instant createdAt) {

    public Execution {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(taskId, "taskId is required");
        Objects.requireNonNull(backend, "backend is required");
        Objects.requireNonNull(status, "status is required");
    }

    public boolean isCompleted() {
        return status == ExecutionStatus.COMPLETED;
    }
}
