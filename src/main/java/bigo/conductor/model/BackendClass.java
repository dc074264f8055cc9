package bigo.conductor.model;

/**
 * Cost class of a backend, used for ledger statistics.
 */
public enum BackendClass {
    /** Free local models */
    LOCAL("ollama"),
    /** Most capable and most expensive hosted backend */
    CLAUDE("claude"),
    /** Low-cost hosted backend */
    GEMINI("gemini");

    private final String prefix;

    BackendClass(String prefix) {
        this.prefix = prefix;
    }

    /** Identity prefix shared by all backends of this class, e.g. "ollama". */
    public String prefix() {
        return prefix;
    }

    /** SQL LIKE pattern matching backend identities of this class. */
    public String likePattern() {
        return prefix + ":%";
    }
}
