package bigo.conductor.worker;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline carried by one run down to the worker call.
 * A context is cancelled when {@link #cancel()} was called or its deadline passed.
 */
public final class ExecutionContext {

    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private ExecutionContext(Instant deadline) {
        this.deadline = deadline;
    }

    /** Context with no deadline. */
    public static ExecutionContext background() {
        return new ExecutionContext(null);
    }

    public static ExecutionContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        return new ExecutionContext(Instant.now().plus(timeout));
    }

    public static ExecutionContext withDeadline(Instant deadline) {
        return new ExecutionContext(deadline);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !Instant.now().isBefore(deadline));
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /** Time left until the deadline, empty when there is none. Never negative. */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * The smaller of the backend's own timeout and the time left on this context.
     */
    public Duration timeoutOr(Duration backendTimeout) {
        return remaining()
                .filter(left -> left.compareTo(backendTimeout) < 0)
                .orElse(backendTimeout);
    }
}
