package bigo.conductor.policy;

import bigo.conductor.model.Backend;
import bigo.conductor.model.Tier;
import bigo.conductor.model.TierConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TierPolicyTest {

    private final TierPolicy policy = TierPolicy.defaults();

    @Test
    void defaultPrimaries() {
        assertEquals(Backend.OLLAMA_FAST, policy.primaryBackend(Tier.TRIVIAL));
        assertEquals(Backend.OLLAMA_DEFAULT, policy.primaryBackend(Tier.SIMPLE));
        assertEquals(Backend.CLAUDE_SONNET, policy.primaryBackend(Tier.STANDARD));
        assertEquals(Backend.CLAUDE_SONNET, policy.primaryBackend(Tier.COMPLEX));
        assertEquals(Backend.CLAUDE_OPUS, policy.primaryBackend(Tier.CRITICAL));
    }

    @Test
    void defaultValidation() {
        assertFalse(policy.config(Tier.TRIVIAL).requiresValidation());
        assertNull(policy.config(Tier.TRIVIAL).validatorBackend());

        TierConfig critical = policy.config(Tier.CRITICAL);
        assertEquals(5, critical.validatorCount());
        assertEquals(4, critical.requiredApprovals());
        assertEquals(Backend.CLAUDE_SONNET, critical.validatorBackend());
    }

    @Test
    void highTiersNeverFallBackToLocal() {
        for (Tier tier : List.of(Tier.COMPLEX, Tier.CRITICAL)) {
            assertTrue(policy.fallbacks(tier).stream().noneMatch(Backend::isLocal), tier.label());
        }
        assertEquals(List.of(Backend.OLLAMA_DEFAULT, Backend.OLLAMA_FAST, Backend.CLAUDE_HAIKU),
                policy.fallbacks(Tier.TRIVIAL));
    }

    @Test
    void builderRequiresEveryTier() {
        TierPolicy.Builder builder = TierPolicy.builder()
                .tier(Tier.TRIVIAL, new TierConfig(Backend.OLLAMA_FAST, null, 0, 0), List.of());
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void builderRejectsDuplicateTier() {
        TierConfig config = new TierConfig(Backend.OLLAMA_FAST, null, 0, 0);
        TierPolicy.Builder builder = TierPolicy.builder().tier(Tier.TRIVIAL, config, List.of());
        assertThrows(IllegalStateException.class, () -> builder.tier(Tier.TRIVIAL, config, List.of()));
    }

    @Test
    void tierConfigRejectsMoreApprovalsThanValidators() {
        assertThrows(IllegalArgumentException.class,
                () -> new TierConfig(Backend.CLAUDE_SONNET, Backend.CLAUDE_SONNET, 1, 2));
        assertThrows(IllegalArgumentException.class,
                () -> new TierConfig(Backend.CLAUDE_SONNET, null, 1, 1));
    }
}
