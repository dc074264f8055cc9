package bigo.conductor.config;

import bigo.conductor.model.BackendClass;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void appliesEverySection() throws IOException {
        Path file = dir.resolve("bigo.ini");
        Files.writeString(file, """
                [ledger]
                url = jdbc:h2:mem:ini
                pool_size = 3

                [server]
                host = 127.0.0.1
                port = 9000

                [conductor]
                run_timeout_sec = 120
                probe_timeout_sec = 4
                assumed_hosted_task_cost_usd = 0.08
                routing_file = /etc/bigo/routing.ini

                [ollama]
                endpoint = http://gpu-box:11434
                model.fast = llama3.2:1b
                model.reasoning =

                [claude]
                enabled = false
                cli_path = /opt/claude/bin/claude

                [gemini]
                enabled = true
                api_key = abc
                timeout_sec = 30
                """);

        ConductorConfig config = ConfigLoader.load(file.toFile());

        assertEquals("jdbc:h2:mem:ini", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
        assertEquals("127.0.0.1", config.serverHost());
        assertEquals(9000, config.serverPort());
        assertEquals(Duration.ofMinutes(2), config.runTimeout());
        assertEquals(Duration.ofSeconds(4), config.probeTimeout());
        assertEquals(0.08, config.assumedHostedTaskCostUsd(), 1e-9);
        assertEquals("routing.ini", config.routingFile().getName());

        BackendSettings ollama = config.backend(BackendClass.LOCAL);
        assertEquals("http://gpu-box:11434", ollama.endpoint());
        assertEquals("llama3.2:1b", ollama.models().get("fast"));
        assertFalse(ollama.models().containsKey("reasoning"));
        assertEquals("qwen3:8b", ollama.models().get("default"));

        assertFalse(config.isBackendEnabled(BackendClass.CLAUDE));
        assertEquals("/opt/claude/bin/claude", config.backend(BackendClass.CLAUDE).cliPath());

        BackendSettings gemini = config.backend(BackendClass.GEMINI);
        assertTrue(gemini.enabled());
        assertEquals("abc", gemini.apiKey());
        assertEquals(Duration.ofSeconds(30), gemini.timeout());
    }

    @Test
    void missingFileFails() {
        assertThrows(IllegalStateException.class, () -> ConfigLoader.load(dir.resolve("nope.ini").toFile()));
    }
}
