package bigo.conductor.model;

/**
 * Execution backend identity. The string id is what gets persisted.
 */
public enum Backend {
    OLLAMA_FAST("ollama:fast", BackendClass.LOCAL, "fast"),
    OLLAMA_DEFAULT("ollama:default", BackendClass.LOCAL, "default"),
    OLLAMA_REASONING("ollama:reasoning", BackendClass.LOCAL, "reasoning"),
    CLAUDE_HAIKU("claude:haiku", BackendClass.CLAUDE, "haiku"),
    CLAUDE_SONNET("claude:sonnet", BackendClass.CLAUDE, "sonnet"),
    CLAUDE_OPUS("claude:opus", BackendClass.CLAUDE, "opus"),
    GEMINI_FLASH("gemini:flash", BackendClass.GEMINI, "flash"),
    GEMINI_PRO("gemini:pro", BackendClass.GEMINI, "pro");

    private final String id;
    private final BackendClass backendClass;
    private final String variant;

    Backend(String id, BackendClass backendClass, String variant) {
        this.id = id;
        this.backendClass = backendClass;
        this.variant = variant;
    }

    public String id() {
        return id;
    }

    public BackendClass backendClass() {
        return backendClass;
    }

    /** Model variant within the class ("fast", "sonnet", "pro"...). */
    public String variant() {
        return variant;
    }

    public boolean isLocal() {
        return backendClass == BackendClass.LOCAL;
    }

    public static Backend fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("backend id is required");
        }
        String trimmed = id.trim();
        for (Backend b : values()) {
            if (b.id.equalsIgnoreCase(trimmed)) {
                return b;
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + id);
    }

    public static Backend of(BackendClass backendClass, String variant) {
        for (Backend b : values()) {
            if (b.backendClass == backendClass && b.variant.equalsIgnoreCase(variant)) {
                return b;
            }
        }
        throw new IllegalArgumentException("Unknown " + backendClass.prefix() + " variant: " + variant);
    }

    @Override
    public String toString() {
        return id;
    }
}
