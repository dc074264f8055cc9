package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ExecutionResult;
import bigo.conductor.model.Task;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OllamaWorkerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String reply = "{\"response\":\"done\",\"eval_count\":30,\"prompt_eval_count\":12}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/generate", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, status, reply);
        });
        server.createContext("/api/tags", exchange -> respond(exchange, status, "{\"models\":[]}"));
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

    private OllamaWorker worker() {
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new OllamaWorker(Backend.OLLAMA_FAST, endpoint, "phi3:mini-16k", Duration.ofSeconds(5));
    }

    private static Task task() {
        return Task.builder().id("task-1").title("fix the typo").description("in README").build();
    }

    @Test
    void executeSendsModelAndPrompt() throws Exception {
        ExecutionResult result = worker().execute(ExecutionContext.background(), task());

        assertTrue(result.success());
        assertEquals("done", result.output());
        assertEquals(42, result.tokensUsed());
        assertEquals(0.0, result.costUsd());

        JsonNode sent = mapper.readTree(lastBody.get());
        assertEquals("phi3:mini-16k", sent.get("model").asText());
        assertFalse(sent.get("stream").asBoolean());
        assertTrue(sent.get("prompt").asText().contains("## Task\nfix the typo"));
        assertTrue(sent.get("prompt").asText().contains("## Details\nin README"));
    }

    @Test
    void non200IsABusinessFailure() throws Exception {
        status = 500;
        reply = "model not loaded";

        ExecutionResult result = worker().execute(ExecutionContext.background(), task());

        assertFalse(result.success());
        assertEquals("Ollama returned status 500: model not loaded", result.error());
    }

    @Test
    void unreachableEndpointThrows() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        OllamaWorker worker = new OllamaWorker(Backend.OLLAMA_FAST, "http://127.0.0.1:" + port,
                "phi3:mini-16k", Duration.ofSeconds(2));
        assertThrows(WorkerException.class, () -> worker.execute(ExecutionContext.background(), task()));
    }

    @Test
    void probeChecksReachability() throws Exception {
        worker().checkQuota(ExecutionContext.background());

        status = 503;
        assertThrows(WorkerException.class, () -> worker().checkQuota(ExecutionContext.background()));
    }
}
