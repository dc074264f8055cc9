package bigo.conductor.policy;

import bigo.conductor.model.Backend;
import bigo.conductor.model.Tier;
import bigo.conductor.model.TierConfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable routing table: one {@link TierConfig} and one ordered fallback
 * chain per tier. Built once at startup, usually by {@link RoutingConfigLoader}.
 */
public final class TierPolicy {

    private final Map<Tier, TierConfig> configs;
    private final Map<Tier, List<Backend>> fallbacks;

    private TierPolicy(Map<Tier, TierConfig> configs, Map<Tier, List<Backend>> fallbacks) {
        EnumMap<Tier, TierConfig> c = new EnumMap<>(Tier.class);
        EnumMap<Tier, List<Backend>> f = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            TierConfig config = configs.get(tier);
            if (config == null) {
                throw new IllegalStateException("No routing entry for tier " + tier.label());
            }
            c.put(tier, config);
            f.put(tier, List.copyOf(fallbacks.getOrDefault(tier, List.of())));
        }
        this.configs = Collections.unmodifiableMap(c);
        this.fallbacks = Collections.unmodifiableMap(f);
    }

    /** Routing table shipped on the classpath. */
    public static TierPolicy defaults() {
        return RoutingConfigLoader.loadDefault();
    }

    public TierConfig config(Tier tier) {
        return configs.get(Objects.requireNonNull(tier, "tier"));
    }

    public Backend primaryBackend(Tier tier) {
        return config(tier).primaryBackend();
    }

    /** Fallback chain of the tier, in preference order. */
    public List<Backend> fallbacks(Tier tier) {
        return fallbacks.get(Objects.requireNonNull(tier, "tier"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Tier, TierConfig> configs = new EnumMap<>(Tier.class);
        private final Map<Tier, List<Backend>> fallbacks = new EnumMap<>(Tier.class);

        /**
         * @throws IllegalStateException if the tier already has an entry
         */
        public Builder tier(Tier tier, TierConfig config, List<Backend> fallbackChain) {
            if (configs.putIfAbsent(tier, config) != null) {
                throw new IllegalStateException("Duplicate routing entry for tier " + tier.label());
            }
            fallbacks.put(tier, fallbackChain);
            return this;
        }

        /**
         * @throws IllegalStateException unless every tier has an entry
         */
        public TierPolicy build() {
            return new TierPolicy(configs, fallbacks);
        }
    }
}
