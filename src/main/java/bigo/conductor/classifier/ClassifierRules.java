package bigo.conductor.classifier;

import bigo.conductor.model.Tier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable pattern set used by the {@link Classifier}, one ordered list per tier.
 * Built once at startup and shared.
 */
public final class ClassifierRules {

    private final Map<Tier, List<WeightedPattern>> patterns;

    private ClassifierRules(Map<Tier, List<WeightedPattern>> patterns) {
        EnumMap<Tier, List<WeightedPattern>> copy = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            copy.put(tier, List.copyOf(patterns.getOrDefault(tier, List.of())));
        }
        this.patterns = Collections.unmodifiableMap(copy);
    }

    public static ClassifierRules of(Map<Tier, List<WeightedPattern>> patterns) {
        return new ClassifierRules(patterns);
    }

    public List<WeightedPattern> patternsFor(Tier tier) {
        return patterns.get(tier);
    }

    /**
     * The default signal set.
     */
    public static ClassifierRules defaults() {
        Map<Tier, List<WeightedPattern>> p = new EnumMap<>(Tier.class);

        // simple edits, formatting, typos
        p.put(Tier.TRIVIAL, List.of(
                WeightedPattern.of("typo", "\\b(typo|spelling|spelt|misspell)", 0.9),
                WeightedPattern.of("format", "\\b(format|indent|whitespace|spacing)\\b", 0.8),
                WeightedPattern.of("comment", "\\b(add|update|fix)\\s+(a\\s+)?comment", 0.8),
                WeightedPattern.of("rename_local", "\\brename\\s+(the\\s+)?(variable|param|local)", 0.7),
                WeightedPattern.of("simple_string", "\\b(change|update)\\s+(the\\s+)?(string|text|message|label)", 0.6),
                WeightedPattern.of("import", "\\b(add|remove|fix)\\s+(an?\\s+)?import", 0.7)));

        p.put(Tier.SIMPLE, List.of(
                WeightedPattern.of("add_function", "\\badd\\s+(a\\s+)?(simple\\s+)?(function|method|helper)", 0.7),
                WeightedPattern.of("fix_bug_obvious", "\\bfix\\s+(the\\s+)?(bug|issue|error|crash)\\s+(in|where|when)", 0.6),
                WeightedPattern.of("update_config", "\\b(update|change|modify)\\s+(the\\s+)?config", 0.7),
                WeightedPattern.of("add_field", "\\badd\\s+(a\\s+)?(new\\s+)?(field|property|attribute)", 0.6),
                WeightedPattern.of("simple_validation", "\\badd\\s+(simple\\s+)?validation", 0.6),
                WeightedPattern.of("update_constant", "\\b(update|change)\\s+(the\\s+)?(constant|value|default)", 0.7)));

        p.put(Tier.STANDARD, List.of(
                WeightedPattern.of("new_feature", "\\b(implement|create|build|add)\\s+(a\\s+)?(new\\s+)?feature", 0.7),
                WeightedPattern.of("refactor", "\\brefactor\\b", 0.6),
                WeightedPattern.of("add_tests", "\\b(add|write|create)\\s+(unit\\s+)?tests?", 0.6),
                WeightedPattern.of("api_endpoint", "\\b(add|create|implement)\\s+(an?\\s+)?(api\\s+)?endpoint", 0.7),
                WeightedPattern.of("component", "\\b(create|build|add)\\s+(a\\s+)?(new\\s+)?component", 0.6),
                WeightedPattern.of("integration", "\\bintegrat(e|ion)\\b", 0.5)));

        // multi-system changes
        p.put(Tier.COMPLEX, List.of(
                WeightedPattern.of("architecture", "\\b(architect|redesign|restructure)", 0.8),
                WeightedPattern.of("migration", "\\b(migrat|data\\s+migration)", 0.8),
                WeightedPattern.of("cross_cutting", "\\b(across|throughout|all)\\s+(the\\s+)?(codebase|project|system)", 0.7),
                WeightedPattern.of("api_breaking", "\\bbreaking\\s+change", 0.8),
                WeightedPattern.of("multiple_services", "\\bmultiple\\s+(service|system|component)s", 0.7),
                WeightedPattern.of("database_schema", "\\b(database|db)\\s+schema", 0.7)));

        // high-risk changes
        p.put(Tier.CRITICAL, List.of(
                WeightedPattern.of("security",
                        "\\b(security|vulnerab|exploit|injection|xss|csrf|auth(entication|orization)?)\\b", 0.9),
                WeightedPattern.of("payments", "\\b(payment|billing|transaction|money|financial)", 0.9),
                WeightedPattern.of("encryption", "\\b(encrypt|decrypt|crypto|hash|secret|credential)", 0.8),
                WeightedPattern.of("core_algorithm", "\\bcore\\s+(algorithm|logic|system)", 0.8),
                WeightedPattern.of("production_data", "\\bproduction\\s+(data|database|system)", 0.9),
                WeightedPattern.of("user_data", "\\b(user|customer|personal)\\s+data", 0.8)));

        return new ClassifierRules(p);
    }
}
