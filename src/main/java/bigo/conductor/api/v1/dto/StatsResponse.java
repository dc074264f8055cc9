package bigo.conductor.api.v1.dto;

import bigo.conductor.model.LedgerStats;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for ledger statistics.
 * GET /api/v1/stats
 */
public record StatsResponse(
        @JsonProperty("totalTasks") int totalTasks,
        @JsonProperty("pendingTasks") int pendingTasks,
        @JsonProperty("completedTasks") int completedTasks,
        @JsonProperty("totalExecutions") int totalExecutions,
        @JsonProperty("local") BackendClassStats local,
        @JsonProperty("claude") BackendClassStats claude,
        @JsonProperty("gemini") BackendClassStats gemini,
        @JsonProperty("estimatedSavingsUsd") double estimatedSavingsUsd,
        @JsonProperty("savingsPercent") double savingsPercent) {

    public record BackendClassStats(
            @JsonProperty("executions") int executions,
            @JsonProperty("costUsd") double costUsd) {
    }

    public static StatsResponse from(LedgerStats s) {
        return new StatsResponse(
                s.totalTasks(),
                s.pendingTasks(),
                s.completedTasks(),
                s.totalExecutions(),
                new BackendClassStats(s.localExecutions(), s.localCost()),
                new BackendClassStats(s.claudeExecutions(), s.claudeCost()),
                new BackendClassStats(s.geminiExecutions(), s.geminiCost()),
                s.estimatedSavings(),
                s.savingsPercent());
    }
}
