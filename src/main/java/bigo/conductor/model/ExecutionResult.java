package bigo.conductor.model;

/**
 * What a worker reports back for one execute call.
 * {@code success == false} is a business failure reported by the backend,
 * as opposed to a transport failure which surfaces as an exception.
 */
public record ExecutionResult(
        String taskId,
        Backend backend,
        boolean success,
        String output,
        int tokensUsed,
        double costUsd,
        long durationMs,
        String error) {

    public static ExecutionResult success(String taskId, Backend backend, String output, int tokensUsed,
            double costUsd, long durationMs) {
        return new ExecutionResult(taskId, backend, true, output, tokensUsed, costUsd, durationMs, null);
    }

    public static ExecutionResult failure(String taskId, Backend backend, String error, long durationMs) {
        return new ExecutionResult(taskId, backend, false, null, 0, 0.0, durationMs, error);
    }
}
