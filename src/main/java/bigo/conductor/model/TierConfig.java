package bigo.conductor.model;

import java.util.Objects;

/**
 * Routing and validation settings of one tier.
 *
 * @param primaryBackend    backend preferred for execution
 * @param validatorBackend  backend used by validators, null when none
 * @param validatorCount    validators required for the tier
 * @param requiredApprovals approvals needed for acceptance
 */
public record TierConfig(
        Backend primaryBackend,
        Backend validatorBackend,
        int validatorCount,
        int requiredApprovals) {

    public TierConfig {
        Objects.requireNonNull(primaryBackend, "primaryBackend is required");
        if (validatorCount < 0 || requiredApprovals < 0) {
            throw new IllegalArgumentException("validator counts must not be negative");
        }
        if (requiredApprovals > validatorCount) {
            throw new IllegalArgumentException(
                    "requiredApprovals " + requiredApprovals + " exceeds validatorCount " + validatorCount);
        }
        if (validatorCount > 0 && validatorBackend == null) {
            throw new IllegalArgumentException("validatorBackend is required when validators are configured");
        }
    }

    public boolean requiresValidation() {
        return validatorCount > 0;
    }
}
