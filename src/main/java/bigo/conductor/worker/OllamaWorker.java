package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ExecutionResult;
import bigo.conductor.model.Task;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Local model served by an Ollama endpoint ({@code POST /api/generate}). Free of charge.
 */
public class OllamaWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(OllamaWorker.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Backend backend;
    private final String endpoint;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;

    public OllamaWorker(Backend backend, String endpoint, String model, Duration timeout) {
        this.backend = backend;
        this.endpoint = stripTrailingSlash(endpoint);
        this.model = model;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
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

        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", model);
        body.put("prompt", PromptBuilder.taskPrompt(task));
        body.put("stream", false);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint + "/api/generate"))
                .timeout(ctx.timeoutOr(timeout))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        HttpResponse<String> response = send(request);
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        if (response.statusCode() != 200) {
            return ExecutionResult.failure(task.id(), backend,
                    "Ollama returned status %d: %s".formatted(response.statusCode(), response.body()), durationMs);
        }

        JsonNode json;
        try {
            json = MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new WorkerException("Failed to decode Ollama response", e);
        }
        int tokens = json.path("eval_count").asInt(0) + json.path("prompt_eval_count").asInt(0);
        log.debug("Ollama {} answered in {} ms ({} tokens)", model, durationMs, tokens);
        return ExecutionResult.success(task.id(), backend, json.path("response").asText(""), tokens, 0.0, durationMs);
    }

    /** Reachability probe: local models have no quota. */
    @Override
    public void checkQuota(ExecutionContext ctx) throws WorkerException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint + "/api/tags"))
                .timeout(ctx.timeoutOr(timeout))
                .GET()
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() != 200) {
            throw new WorkerException("Ollama endpoint returned status " + response.statusCode());
        }
    }

    private HttpResponse<String> send(HttpRequest request) throws WorkerException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new WorkerException("Ollama request timed out: " + request.uri(), e);
        } catch (IOException e) {
            throw new WorkerException("Ollama endpoint unreachable: " + endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted while calling Ollama", e);
        }
    }

    static String stripTrailingSlash(String url) {
        if (url == null) {
            throw new IllegalArgumentException("endpoint is required");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
