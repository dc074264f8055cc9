package bigo.conductor.classifier;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Named classification signal with a positive weight.
 */
public record WeightedPattern(String name, Pattern regex, double weight) {

    public WeightedPattern {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(regex, "regex is required");
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be positive: " + name);
        }
    }

    public static WeightedPattern of(String name, String regex, double weight) {
        return new WeightedPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), weight);
    }

    public boolean matches(String text) {
        return regex.matcher(text).find();
    }
}
