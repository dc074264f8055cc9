package bigo.conductor.model;

/**
 * Aggregate ledger statistics.
 */
public record LedgerStats(
        int totalTasks,
        int pendingTasks,
        int completedTasks,
        int totalExecutions,
        int localExecutions,
        double localCost,
        int claudeExecutions,
        double claudeCost,
        int geminiExecutions,
        double geminiCost,
        double estimatedSavings,
        double savingsPercent) {
}
