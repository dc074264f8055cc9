package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ExecutionResult;
import bigo.conductor.model.Task;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GeminiWorkerTest {

    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String reply = """
            {"candidates":[{"content":{"parts":[{"text":"patched"}]}}],
             "usageMetadata":{"totalTokenCount":2000000}}
            """;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1beta/models/", exchange -> {
            lastQuery.set(exchange.getRequestURI().getRawPath() + "?" + exchange.getRequestURI().getRawQuery());
            exchange.getRequestBody().readAllBytes();
            respond(exchange, status, reply);
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private GeminiWorker worker(Backend backend) {
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1beta";
        return new GeminiWorker(backend, endpoint, "gemini-1.5-pro", "k3y", Duration.ofSeconds(5));
    }

    @Test
    void executeReadsFirstCandidate() throws Exception {
        Task task = Task.builder().id("task-1").title("summarize the diff").build();

        ExecutionResult result = worker(Backend.GEMINI_PRO).execute(ExecutionContext.background(), task);

        assertTrue(result.success());
        assertEquals("patched", result.output());
        assertEquals(2_000_000, result.tokensUsed());
        assertEquals(14.0, result.costUsd(), 1e-9);
        assertEquals("/v1beta/models/gemini-1.5-pro:generateContent?key=k3y", lastQuery.get());
    }

    @Test
    void rateLimitedProbeIsAQuotaFailure() {
        status = 429;
        reply = "{\"error\":{\"status\":\"RESOURCE_EXHAUSTED\"}}";
        assertThrows(QuotaExceededException.class,
                () -> worker(Backend.GEMINI_FLASH).checkQuota(ExecutionContext.background()));
    }

    @Test
    void otherProbeErrorIsNotAQuotaFailure() {
        status = 400;
        reply = "{\"error\":{\"message\":\"API key not valid\"}}";
        WorkerException e = assertThrows(WorkerException.class,
                () -> worker(Backend.GEMINI_FLASH).checkQuota(ExecutionContext.background()));
        assertFalse(e instanceof QuotaExceededException);
    }

    @Test
    void apiKeyIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new GeminiWorker(Backend.GEMINI_FLASH,
                "http://localhost", "gemini-1.5-flash", " ", Duration.ofSeconds(1)));
    }
}
