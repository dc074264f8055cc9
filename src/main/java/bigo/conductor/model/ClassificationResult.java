package bigo.conductor.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of the task classifier. Never persisted as-is; tier and
 * recommended backend seed the task record.
 *
 * @param tier               resolved tier after scope adjustment
 * @param confidence         0.5..0.95, a function of the winning score only
 * @param recommendedBackend primary backend of the tier
 * @param reasoning          human-readable summary, not used for decisions
 * @param patterns           names of the matched patterns of the winning tier
 * @param estimatedLines     estimated changed lines
 * @param estimatedFiles     estimated touched files
 */
public record ClassificationResult(
        Tier tier,
        double confidence,
        Backend recommendedBackend,
        String reasoning,
        List<String> patterns,
        int estimatedLines,
        int estimatedFiles) {

    public ClassificationResult {
        Objects.requireNonNull(tier, "tier is required");
        Objects.requireNonNull(recommendedBackend, "recommendedBackend is required");
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    /**
     * Copy pinned to an operator-chosen tier.
     */
    public ClassificationResult forceTier(Tier forced, Backend backend) {
        if (forced == tier) {
            return this;
        }
        String note = "Tier forced to " + forced.name() + " (classified as " + tier.name() + "). " + reasoning;
        return new ClassificationResult(forced, 1.0, backend, note, patterns, estimatedLines, estimatedFiles);
    }
}
