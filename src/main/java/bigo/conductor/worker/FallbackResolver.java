package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import bigo.conductor.model.Tier;
import bigo.conductor.policy.TierPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Picks a worker for a tier: the tier's primary backend first, then its
 * fallback chain in declared order.
 */
public class FallbackResolver {

    private static final Logger log = LoggerFactory.getLogger(FallbackResolver.class);

    private final TierPolicy policy;

    public FallbackResolver(TierPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @return a lease on the first acquirable backend, or empty if none is
     */
    public Optional<WorkerLease> resolve(Tier tier, WorkerRegistry registry) {
        Backend primary = policy.primaryBackend(tier);
        Optional<WorkerLease> lease = registry.tryAcquire(primary);
        if (lease.isPresent()) {
            return lease;
        }
        for (Backend candidate : policy.fallbacks(tier)) {
            lease = registry.tryAcquire(candidate);
            if (lease.isPresent()) {
                log.debug("Tier {} falls back from {} to {}", tier.label(), primary, candidate);
                return lease;
            }
        }
        log.debug("No worker available for tier {}", tier.label());
        return Optional.empty();
    }

    /**
     * Same search as {@link #resolve} without taking the worker.
     */
    public Optional<Backend> preview(Tier tier, WorkerRegistry registry) {
        Backend primary = policy.primaryBackend(tier);
        if (registry.available(primary)) {
            return Optional.of(primary);
        }
        for (Backend candidate : policy.fallbacks(tier)) {
            if (registry.available(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
