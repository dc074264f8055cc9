package bigo.conductor.config;

import bigo.conductor.model.BackendClass;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Applies an INI configuration file on top of a {@link ConductorConfig}.
 * Supports sections [ledger], [server], [conductor], [ollama], [claude], [gemini];
 * every section and key is optional.
 *
 * <pre>
 * [ollama]
 * enabled = true
 * endpoint = http://gpu-box:11434
 * model.fast = phi3:mini-16k
 * </pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String MODEL_PREFIX = "model.";

    private ConfigLoader() {
    }

    public static ConductorConfig load(File file) {
        return apply(ConductorConfig.defaults(), file);
    }

    public static ConductorConfig apply(ConductorConfig config, File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file " + file, e);
        }

        Profile.Section ledger = ini.get("ledger");
        if (ledger != null) {
            String url = opt(ledger, "url");
            if (url != null) config.withDatabaseUrl(url);
            String pool = opt(ledger, "pool_size");
            if (pool != null) config.withDatabasePoolSize(Integer.parseInt(pool));
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            String host = opt(server, "host");
            if (host != null) config.withServerHost(host);
            String port = opt(server, "port");
            if (port != null) config.withServerPort(Integer.parseInt(port));
            String threads = opt(server, "executor_threads");
            if (threads != null) config.withExecutorThreads(Integer.parseInt(threads));
        }

        Profile.Section conductor = ini.get("conductor");
        if (conductor != null) {
            String timeout = opt(conductor, "run_timeout_sec");
            if (timeout != null) config.withRunTimeout(Duration.ofSeconds(Long.parseLong(timeout)));
            String probe = opt(conductor, "probe_timeout_sec");
            if (probe != null) config.withProbeTimeout(Duration.ofSeconds(Long.parseLong(probe)));
            String cost = opt(conductor, "assumed_hosted_task_cost_usd");
            if (cost != null) config.withAssumedHostedTaskCostUsd(Double.parseDouble(cost));
            String routing = opt(conductor, "routing_file");
            if (routing != null) config.withRoutingFile(new File(routing));
        }

        for (BackendClass backendClass : BackendClass.values()) {
            Profile.Section section = ini.get(backendClass.prefix());
            if (section != null) {
                applyBackend(config.backend(backendClass), section);
            }
        }

        log.info("Loaded configuration from {}", file);
        return config;
    }

    private static void applyBackend(BackendSettings settings, Profile.Section section) {
        String enabled = opt(section, "enabled");
        if (enabled != null) settings.withEnabled(Boolean.parseBoolean(enabled));
        String endpoint = opt(section, "endpoint");
        if (endpoint != null) settings.withEndpoint(endpoint);
        String cli = opt(section, "cli_path");
        if (cli != null) settings.withCliPath(cli);
        String apiKey = opt(section, "api_key");
        if (apiKey != null) settings.withApiKey(apiKey);
        String timeout = opt(section, "timeout_sec");
        if (timeout != null) settings.withTimeout(Duration.ofSeconds(Long.parseLong(timeout)));

        for (String key : section.keySet()) {
            if (key.startsWith(MODEL_PREFIX)) {
                settings.withModel(key.substring(MODEL_PREFIX.length()), section.get(key));
            }
        }
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
