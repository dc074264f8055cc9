package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ExecutionResult;
import bigo.conductor.model.Task;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the adapter with small shell scripts standing in for the claude CLI.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ClaudeWorkerTest {

    @TempDir
    Path dir;

    private String script(String body) throws IOException {
        Path file = dir.resolve("claude-" + System.nanoTime());
        Files.writeString(file, "#!/bin/sh\n" + body + "\n");
        assertTrue(file.toFile().setExecutable(true));
        return file.toString();
    }

    private static Task task() {
        return Task.builder().id("task-1").title("explain the build").description("briefly").build();
    }

    @Test
    void stdinPromptAndStdoutResult() throws Exception {
        // echo the prompt back, prefixed with the model flag value
        String cli = script("read first; echo \"$3:$first\"");
        ClaudeWorker worker = new ClaudeWorker(Backend.CLAUDE_SONNET, cli, "claude-sonnet-4-20250514",
                Duration.ofSeconds(10));

        ExecutionResult result = worker.execute(ExecutionContext.background(), task());

        assertTrue(result.success(), result.error());
        assertEquals("claude-sonnet-4-20250514:explain the build\n", result.output());
        assertTrue(result.tokensUsed() > 0);
        assertTrue(result.costUsd() > 0);
    }

    @Test
    void nonZeroExitIsABusinessFailure() throws Exception {
        String cli = script("cat > /dev/null; echo 'rate limited' >&2; exit 3");
        ClaudeWorker worker = new ClaudeWorker(Backend.CLAUDE_HAIKU, cli, "m", Duration.ofSeconds(10));

        ExecutionResult result = worker.execute(ExecutionContext.background(), task());

        assertFalse(result.success());
        assertEquals("claude exited with code 3: rate limited", result.error());
    }

    @Test
    void hangingCliTimesOut() throws Exception {
        String cli = script("cat > /dev/null; exec sleep 10");
        ClaudeWorker worker = new ClaudeWorker(Backend.CLAUDE_HAIKU, cli, "m", Duration.ofMillis(300));

        assertThrows(WorkerException.class, () -> worker.execute(ExecutionContext.background(), task()));
    }

    @Test
    void missingBinaryThrows() {
        ClaudeWorker worker = new ClaudeWorker(Backend.CLAUDE_HAIKU,
                dir.resolve("does-not-exist").toString(), "m", Duration.ofSeconds(1));
        assertThrows(WorkerException.class, () -> worker.execute(ExecutionContext.background(), task()));
    }

    @Test
    void creditMessageIsAQuotaFailure() throws Exception {
        String cli = script("echo 'Credit balance is too low'; exit 1");
        ClaudeWorker worker = new ClaudeWorker(Backend.CLAUDE_OPUS, cli, "m", Duration.ofSeconds(10));

        assertThrows(QuotaExceededException.class, () -> worker.checkQuota(ExecutionContext.background()));
    }

    @Test
    void otherProbeFailureIsPlainWorkerException() throws Exception {
        String cli = script("echo 'not logged in'; exit 1");
        ClaudeWorker worker = new ClaudeWorker(Backend.CLAUDE_OPUS, cli, "m", Duration.ofSeconds(10));

        WorkerException e = assertThrows(WorkerException.class,
                () -> worker.checkQuota(ExecutionContext.background()));
        assertFalse(e instanceof QuotaExceededException);
    }
}
