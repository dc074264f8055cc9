package bigo.conductor.config;

import bigo.conductor.model.BackendClass;

import java.io.File;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration holder for the conductor.
 * All settings have sensible defaults.
 */
public final class ConductorConfig {

    // Ledger settings
    private String databaseUrl = "jdbc:h2:file:./.bigo/ledger;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private int executorThreads = 8;

    // Conductor settings
    private Duration runTimeout = Duration.ofMinutes(15);
    private Duration probeTimeout = Duration.ofSeconds(10);
    private double assumedHostedTaskCostUsd = 0.05;
    private File routingFile = null; // null -> classpath routing table

    private final Map<BackendClass, BackendSettings> backends = new EnumMap<>(BackendClass.class);

    private ConductorConfig() {
        for (BackendClass backendClass : BackendClass.values()) {
            backends.put(backendClass, BackendSettings.defaults(backendClass));
        }
    }

    public static ConductorConfig defaults() {
        return new ConductorConfig();
    }

    /**
     * Defaults, then the INI file named by {@code BIGO_CONFIG}, then single-value
     * environment overrides.
     */
    public static ConductorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static ConductorConfig fromEnv(Map<String, String> env) {
        ConductorConfig config = new ConductorConfig();

        String configFile = env.get("BIGO_CONFIG");
        if (configFile != null && !configFile.isBlank()) {
            ConfigLoader.apply(config, new File(configFile));
        }

        String dbUrl = env.get("BIGO_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = env.get("BIGO_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String timeout = env.get("BIGO_RUN_TIMEOUT_SEC");
        if (timeout != null && !timeout.isBlank()) {
            config.runTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
        }

        String ollamaEndpoint = env.get("BIGO_OLLAMA_ENDPOINT");
        if (ollamaEndpoint != null && !ollamaEndpoint.isBlank()) {
            config.backend(BackendClass.LOCAL).withEndpoint(ollamaEndpoint.trim());
        }

        String geminiKey = env.get("GEMINI_API_KEY");
        if (geminiKey != null && !geminiKey.isBlank()) {
            config.backend(BackendClass.GEMINI).withApiKey(geminiKey.trim()).withEnabled(true);
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int executorThreads() {
        return executorThreads;
    }

    public Duration runTimeout() {
        return runTimeout;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public double assumedHostedTaskCostUsd() {
        return assumedHostedTaskCostUsd;
    }

    public File routingFile() {
        return routingFile;
    }

    public BackendSettings backend(BackendClass backendClass) {
        return backends.get(backendClass);
    }

    public boolean isBackendEnabled(BackendClass backendClass) {
        return backends.get(backendClass).enabled();
    }

    /**
     * Quota circuit-breaker: the backend class stays off until restart.
     */
    public void disableBackend(BackendClass backendClass) {
        backends.get(backendClass).disable();
    }

    // Fluent setters for testing/customization
    public ConductorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public ConductorConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public ConductorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public ConductorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public ConductorConfig withExecutorThreads(int threads) {
        this.executorThreads = threads;
        return this;
    }

    public ConductorConfig withRunTimeout(Duration timeout) {
        this.runTimeout = timeout;
        return this;
    }

    public ConductorConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public ConductorConfig withAssumedHostedTaskCostUsd(double cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("assumed hosted task cost must not be negative");
        }
        this.assumedHostedTaskCostUsd = cost;
        return this;
    }

    public ConductorConfig withRoutingFile(File file) {
        this.routingFile = file;
        return this;
    }

    @Override
    public String toString() {
        return "ConductorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", runTimeout=" + runTimeout +
                ", routing=" + (routingFile != null ? routingFile : "classpath") +
                ", backends=" + backends.values() +
                '}';
    }
}
