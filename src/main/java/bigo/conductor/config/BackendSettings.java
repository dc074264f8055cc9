package bigo.conductor.config;

import bigo.conductor.model.BackendClass;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of one backend class: whether it is enabled, the model name behind
 * each variant, and how to reach it.
 */
public final class BackendSettings {

    private final BackendClass backendClass;
    private volatile boolean enabled;
    private final Map<String, String> models = new LinkedHashMap<>();
    private String endpoint;
    private String cliPath;
    private String apiKey;
    private Duration timeout;

    private BackendSettings(BackendClass backendClass, boolean enabled, Duration timeout) {
        this.backendClass = Objects.requireNonNull(backendClass, "backendClass");
        this.enabled = enabled;
        this.timeout = timeout;
    }

    public static BackendSettings defaults(BackendClass backendClass) {
        return switch (backendClass) {
            case LOCAL -> new BackendSettings(backendClass, true, Duration.ofMinutes(5))
                    .withEndpoint("http://localhost:11434")
                    .withModel("default", "qwen3:8b")
                    .withModel("fast", "phi3:mini-16k")
                    .withModel("reasoning", "qwen3:8b-8k");
            case CLAUDE -> new BackendSettings(backendClass, true, Duration.ofMinutes(10))
                    .withCliPath("claude")
                    .withModel("opus", "claude-opus-4-5-20251101")
                    .withModel("sonnet", "claude-sonnet-4-20250514")
                    .withModel("haiku", "claude-haiku-3-5-20241022");
            // needs an API key, see ConductorConfig.fromEnv
            case GEMINI -> new BackendSettings(backendClass, false, Duration.ofMinutes(5))
                    .withEndpoint("https://generativelanguage.googleapis.com/v1beta")
                    .withModel("flash", "gemini-1.5-flash")
                    .withModel("pro", "gemini-1.5-pro");
        };
    }

    public BackendClass backendClass() {
        return backendClass;
    }

    public boolean enabled() {
        return enabled;
    }

    /** Variant -> backend model name, in declaration order. */
    public Map<String, String> models() {
        return Collections.unmodifiableMap(models);
    }

    public String endpoint() {
        return endpoint;
    }

    public String cliPath() {
        return cliPath;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Duration timeout() {
        return timeout;
    }

    /** Turn the backend off for the rest of the process. */
    public void disable() {
        this.enabled = false;
    }

    public BackendSettings withEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public BackendSettings withModel(String variant, String model) {
        if (model == null || model.isBlank()) {
            models.remove(variant);
        } else {
            models.put(variant, model.trim());
        }
        return this;
    }

    public BackendSettings withEndpoint(String endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    public BackendSettings withCliPath(String cliPath) {
        this.cliPath = cliPath;
        return this;
    }

    public BackendSettings withApiKey(String apiKey) {
        this.apiKey = apiKey;
        return this;
    }

    public BackendSettings withTimeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return backendClass.prefix() + "{enabled=" + enabled + ", models=" + models.keySet()
                + (endpoint != null ? ", endpoint='" + endpoint + "'" : "")
                + (cliPath != null ? ", cli='" + cliPath + "'" : "")
                + ", apiKeySet=" + hasApiKey() + "}";
    }
}
