package bigo.conductor.worker;

import bigo.conductor.config.BackendSettings;
import bigo.conductor.model.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds one adapter per configured model variant of a backend class.
 */
public class WorkerFactory {

    private static final Logger log = LoggerFactory.getLogger(WorkerFactory.class);

    public List<Worker> create(BackendSettings settings) {
        List<Worker> workers = new ArrayList<>();
        for (Map.Entry<String, String> entry : settings.models().entrySet()) {
            Backend backend;
            try {
                backend = Backend.of(settings.backendClass(), entry.getKey());
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring model '{}': {}", entry.getValue(), e.getMessage());
                continue;
            }
            workers.add(create(backend, entry.getValue(), settings));
        }
        return workers;
    }

    protected Worker create(Backend backend, String model, BackendSettings settings) {
        return switch (backend.backendClass()) {
            case LOCAL -> new OllamaWorker(backend, settings.endpoint(), model, settings.timeout());
            case CLAUDE -> new ClaudeWorker(backend, settings.cliPath(), model, settings.timeout());
            case GEMINI -> new GeminiWorker(backend, settings.endpoint(), model, settings.apiKey(), settings.timeout());
        };
    }
}
