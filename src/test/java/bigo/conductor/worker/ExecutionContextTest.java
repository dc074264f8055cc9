package bigo.conductor.worker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionContextTest {

    @Test
    void backgroundNeverExpires() {
        ExecutionContext ctx = ExecutionContext.background();
        assertFalse(ctx.isCancelled());
        assertTrue(ctx.remaining().isEmpty());
        assertEquals(Duration.ofMinutes(5), ctx.timeoutOr(Duration.ofMinutes(5)));
    }

    @Test
    void cancelIsObserved() {
        ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1));
        ctx.cancel();
        assertTrue(ctx.isCancelled());
    }

    @Test
    void passedDeadlineCancels() {
        ExecutionContext ctx = ExecutionContext.withDeadline(Instant.now().minusSeconds(1));
        assertTrue(ctx.isCancelled());
        assertEquals(Duration.ZERO, ctx.remaining().orElseThrow());
    }

    @Test
    void timeoutIsTheSmallerOfBackendAndDeadline() {
        ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofSeconds(30));
        assertTrue(ctx.timeoutOr(Duration.ofMinutes(10)).compareTo(Duration.ofSeconds(30)) <= 0);
        assertEquals(Duration.ofSeconds(5), ctx.timeoutOr(Duration.ofSeconds(5)));
    }

    @Test
    void negativeTimeoutRejected() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionContext.withTimeout(Duration.ofSeconds(-1)));
    }
}
