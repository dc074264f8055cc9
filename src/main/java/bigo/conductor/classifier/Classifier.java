package bigo.conductor.classifier;

import bigo.conductor.model.ClassificationResult;
import bigo.conductor.model.Tier;
import bigo.conductor.policy.TierPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Assigns a tier to free-form task text.
 * Pure and deterministic: the same text always yields the same result.
 */
public class Classifier {

    static final double BASE_CONFIDENCE = 0.5;
    static final double CONFIDENCE_PER_WEIGHT = 0.15;
    static final double MAX_CONFIDENCE = 0.95;

    private final ClassifierRules rules;
    private final ScopeEstimator scopeEstimator;
    private final TierPolicy policy;

    public Classifier(ClassifierRules rules, TierPolicy policy) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.scopeEstimator = new ScopeEstimator();
    }

    public Classifier(TierPolicy policy) {
        this(ClassifierRules.defaults(), policy);
    }

    public ClassificationResult classify(String title, String description) {
        String text = ((title == null ? "" : title) + " " + (description == null ? "" : description))
                .toLowerCase(Locale.ROOT);

        Tier winner = Tier.STANDARD;
        List<String> winnerPatterns = List.of();
        double maxScore = 0.0;

        // ascending severity with a strict comparison: ties keep the lower tier
        for (Tier tier : Tier.values()) {
            double score = 0.0;
            List<String> matched = new ArrayList<>();
            for (WeightedPattern p : rules.patternsFor(tier)) {
                if (p.matches(text)) {
                    score += p.weight();
                    matched.add(p.name());
                }
            }
            if (score > maxScore) {
                maxScore = score;
                winner = tier;
                winnerPatterns = matched;
            }
        }

        double confidence = maxScore > 0
                ? Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + maxScore * CONFIDENCE_PER_WEIGHT)
                : BASE_CONFIDENCE;

        ScopeEstimator.Estimate scope = scopeEstimator.estimate(text);
        Tier tier = adjustByScope(winner, scope.lines(), scope.files());

        return new ClassificationResult(
                tier,
                confidence,
                policy.primaryBackend(tier),
                reasoning(tier, winnerPatterns, scope),
                winnerPatterns,
                scope.lines(),
                scope.files());
    }

    /**
     * Copy of the result pinned to the given tier, routed to that tier's primary backend.
     */
    public ClassificationResult forceTier(ClassificationResult result, Tier tier) {
        return result.forceTier(tier, policy.primaryBackend(tier));
    }

    static Tier adjustByScope(Tier tier, int lines, int files) {
        if ((lines > 500 || files > 10) && tier.isBelow(Tier.COMPLEX)) {
            return Tier.COMPLEX;
        }
        if ((lines > 200 || files > 5) && tier.isBelow(Tier.STANDARD)) {
            return Tier.STANDARD;
        }
        if (lines < 10 && files == 1 && tier.isAbove(Tier.SIMPLE)) {
            return Tier.SIMPLE;
        }
        return tier;
    }

    private static String reasoning(Tier tier, List<String> patterns, ScopeEstimator.Estimate scope) {
        StringBuilder sb = new StringBuilder("Tier: ").append(tier.name());
        if (!patterns.isEmpty()) {
            sb.append(". Matched patterns: ").append(String.join(", ", patterns));
        }
        sb.append(". Estimated scope: ~").append(scope.lines())
                .append(" lines across ").append(scope.files()).append(" file(s)");
        return sb.toString();
    }
}
