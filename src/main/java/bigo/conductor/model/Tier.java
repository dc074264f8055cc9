package bigo.conductor.model;

import java.util.Locale;

/**
 * Task complexity tier. Declaration order is severity order.
 */
public enum Tier {
    /** Simple edits, formatting, boilerplate */
    TRIVIAL,
    /** Straightforward changes with clear patterns */
    SIMPLE,
    /** Feature work, refactoring, most tasks */
    STANDARD,
    /** Architecture, multi-file changes */
    COMPLEX,
    /** Security, core logic, breaking changes */
    CRITICAL;

    /** Numeric level as persisted in the ledger (0..4). */
    public int level() {
        return ordinal();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBelow(Tier other) {
        return compareTo(other) < 0;
    }

    public boolean isAbove(Tier other) {
        return compareTo(other) > 0;
    }

    public static Tier fromLevel(int level) {
        Tier[] tiers = values();
        if (level < 0 || level >= tiers.length) {
            throw new IllegalArgumentException("Unknown tier level: " + level);
        }
        return tiers[level];
    }

    /**
     * Parse a tier from its name ("critical", "CRITICAL") or level ("4", "T4").
     */
    public static Tier parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("tier is required");
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.startsWith("T") && v.length() == 2 && Character.isDigit(v.charAt(1))) {
            return fromLevel(v.charAt(1) - '0');
        }
        if (v.length() == 1 && Character.isDigit(v.charAt(0))) {
            return fromLevel(v.charAt(0) - '0');
        }
        try {
            return valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tier: " + value);
        }
    }
}
