package bigo.conductor.model;

import java.util.Locale;

/**
 * Outcome of one execution attempt.
 */
public enum ExecutionStatus {
    COMPLETED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExecutionStatus fromDb(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return dbValue();
    }
}
