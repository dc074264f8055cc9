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
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Google Gemini over the {@code generateContent} REST call.
 */
public class GeminiWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(GeminiWorker.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Backend backend;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;

    public GeminiWorker(Backend backend, String endpoint, String model, String apiKey, Duration timeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("Gemini API key is required");
        }
        this.backend = backend;
        this.endpoint = OllamaWorker.stripTrailingSlash(endpoint);
        this.model = model;
        this.apiKey = apiKey;
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
        String prompt = PromptBuilder.taskPrompt(task);

        HttpResponse<String> response = generate(prompt, ctx.timeoutOr(timeout));
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        if (response.statusCode() != 200) {
            return ExecutionResult.failure(task.id(), backend,
                    "Gemini returned status %d: %s".formatted(response.statusCode(), response.body()), durationMs);
        }

        JsonNode json;
        try {
            json = MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new WorkerException("Failed to decode Gemini response", e);
        }

        String output = json.path("candidates").path(0).path("content").path("parts").path(0).path("text").asText("");
        int tokens = json.path("usageMetadata").path("totalTokenCount").asInt(0);
        if (tokens <= 0) {
            tokens = CostEstimator.estimateTokens(prompt.length() + output.length());
        }
        log.debug("Gemini {} answered in {} ms ({} tokens)", model, durationMs, tokens);
        return ExecutionResult.success(task.id(), backend, output, tokens,
                CostEstimator.geminiCost(backend, tokens), durationMs);
    }

    /**
     * Minimal generation; HTTP 429 or a quota message means the key is out of quota.
     */
    @Override
    public void checkQuota(ExecutionContext ctx) throws WorkerException {
        HttpResponse<String> response = generate("hi", ctx.timeoutOr(timeout));
        if (response.statusCode() == 200) {
            return;
        }
        String body = response.body() == null ? "" : response.body().toLowerCase(Locale.ROOT);
        String message = "Gemini returned status " + response.statusCode();
        if (response.statusCode() == 429 || body.contains("quota") || body.contains("resource exhausted")
                || body.contains("resource_exhausted")) {
            throw new QuotaExceededException("Gemini quota exceeded: " + message);
        }
        throw new WorkerException("Gemini quota check failed: " + message);
    }

    private HttpResponse<String> generate(String prompt, Duration requestTimeout) throws WorkerException {
        ObjectNode body = MAPPER.createObjectNode();
        body.putArray("contents").addObject().putArray("parts").addObject().put("text", prompt);

        String url = endpoint + "/models/" + model + ":generateContent?key="
                + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new WorkerException("Gemini request timed out", e);
        } catch (IOException e) {
            throw new WorkerException("Gemini request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted while calling Gemini", e);
        }
    }
}
