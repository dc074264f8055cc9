package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ExecutionResult;
import bigo.conductor.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Claude through the local CLI: {@code <cli> --print --model <model>} with the prompt on stdin.
 * The CLI reports no usage, so tokens and cost are estimated from text length.
 */
public class ClaudeWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(ClaudeWorker.class);

    private static final List<String> QUOTA_MARKERS = List.of("credit", "quota", "balance", "payment");

    private final Backend backend;
    private final String cliPath;
    private final String model;
    private final Duration timeout;

    public ClaudeWorker(Backend backend, String cliPath, String model, Duration timeout) {
        this.backend = backend;
        this.cliPath = cliPath == null || cliPath.isBlank() ? "claude" : cliPath;
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public Backend backend() {
        return backend;
    }

    @Override
    public boolean available() {
        return true;
    }

    @Override
    public ExecutionResult execute(ExecutionContext ctx, Task task) throws WorkerException {
        long start = System.nanoTime();
        String prompt = PromptBuilder.cliPrompt(task);

        ProcessOutput out = run(List.of(cliPath, "--print", "--model", model), prompt, ctx.timeoutOr(timeout), false);
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        if (out.exitCode() != 0) {
            return ExecutionResult.failure(task.id(), backend,
                    "claude exited with code %d: %s".formatted(out.exitCode(), out.stderr().trim()), durationMs);
        }

        int tokens = CostEstimator.estimateTokens(prompt.length() + out.stdout().length());
        double cost = CostEstimator.claudeCost(backend, prompt.length(), out.stdout().length());
        log.debug("Claude {} answered in {} ms (~{} tokens)", model, durationMs, tokens);
        return ExecutionResult.success(task.id(), backend, out.stdout(), tokens, cost, durationMs);
    }

    /**
     * Runs a one-word prompt; credit, quota, balance or payment messages mean the account cannot take work.
     */
    @Override
    public void checkQuota(ExecutionContext ctx) throws WorkerException {
        ProcessOutput out = run(List.of(cliPath, "--print", "--model", model, "hi"), null,
                ctx.timeoutOr(timeout), true);
        if (out.exitCode() == 0) {
            return;
        }
        String text = out.stdout().toLowerCase(Locale.ROOT);
        for (String marker : QUOTA_MARKERS) {
            if (text.contains(marker)) {
                throw new QuotaExceededException("quota exceeded or payment required (exit " + out.exitCode() + ")");
            }
        }
        throw new WorkerException("quota check failed (exit %d): %s".formatted(out.exitCode(), out.stdout().trim()));
    }

    private record ProcessOutput(int exitCode, String stdout, String stderr) {
    }

    private ProcessOutput run(List<String> command, String stdin, Duration limit, boolean mergeStderr)
            throws WorkerException {
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(mergeStderr).start();
        } catch (IOException e) {
            throw new WorkerException("Failed to start " + cliPath, e);
        }

        CompletableFuture<String> stdout = readAsync(process.getInputStream());
        CompletableFuture<String> stderr = mergeStderr
                ? CompletableFuture.completedFuture("")
                : readAsync(process.getErrorStream());

        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new WorkerException("Failed to send prompt to " + cliPath, e);
        }

        try {
            if (!process.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new WorkerException(cliPath + " timed out after " + limit.toSeconds() + "s");
            }
            return new ProcessOutput(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted while waiting for " + cliPath, e);
        } catch (ExecutionException e) {
            throw new WorkerException("Failed to read output of " + cliPath, e.getCause());
        }
    }

    private static CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream s = stream) {
                return new String(s.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }
}
