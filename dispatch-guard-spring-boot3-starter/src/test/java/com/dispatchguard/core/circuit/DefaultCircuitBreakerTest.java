package com.dispatchguard.core.circuit;

import com.dispatchguard.core.cancel.CancellationToken;
import com.dispatchguard.core.spi.CircuitStateListener;
import com.dispatchguard.exception.CircuitBreakerOpenException;
import com.dispatchguard.model.CircuitBreakerOptions;
import com.dispatchguard.model.ctx.CircuitStateChange;
import com.dispatchguard.model.enums.CircuitState;
import com.dispatchguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DefaultCircuitBreakerTest {

    private MutableClock clock;

    private DefaultCircuitBreaker breaker;

    private List<CircuitStateChange> changes;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        breaker = new DefaultCircuitBreaker("orders", CircuitBreakerOptions.builder()
                .failureThreshold(3)
                .openDuration(Duration.ofMillis(50))
                .successThreshold(2)
                .build(), clock);
        changes = new ArrayList<>();
        breaker.addListener(changes::add);
    }

    @Test
    void startsClosedWithoutHistory() {
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getConsecutiveFailures());
        assertNull(breaker.getLastOpenedAt());
        assertEquals("orders", breaker.getName());
    }

    @Test
    void opensWhenConsecutiveFailuresReachThreshold() {
        breaker.recordFailure(new IOException("1"));
        breaker.recordFailure(new IOException("2"));
        assertEquals(CircuitState.CLOSED, breaker.getState());

        breaker.recordFailure(new IOException("3"));

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(3, breaker.getConsecutiveFailures());
        assertEquals(clock.instant(), breaker.getLastOpenedAt());
        assertEquals(1, changes.size());
        assertEquals(CircuitState.CLOSED, changes.get(0).getPreviousState());
        assertEquals(CircuitState.OPEN, changes.get(0).getNewState());
        assertEquals("3", changes.get(0).getTrigger().getMessage());
    }

    @Test
    void successResetsFailureCount() {
        breaker.recordFailure(null);
        breaker.recordFailure(null);
        breaker.recordSuccess();
        breaker.recordFailure(null);
        breaker.recordFailure(null);

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getConsecutiveFailures());
    }

    @Test
    void movesToHalfOpenLazilyAfterOpenDuration() {
        tripOpen();
        clock.advance(Duration.ofMillis(49));
        assertEquals(CircuitState.OPEN, breaker.getState());

        clock.advance(Duration.ofMillis(1));

        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(CircuitState.HALF_OPEN, changes.get(changes.size() - 1).getNewState());
    }

    @Test
    void closesAfterSuccessThresholdInHalfOpen() {
        tripOpen();
        clock.advance(Duration.ofMillis(50));

        breaker.recordSuccess();
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(1, breaker.getConsecutiveSuccesses());

        breaker.recordSuccess();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getConsecutiveFailures());
        assertEquals(0, breaker.getConsecutiveSuccesses());
    }

    @Test
    void anyFailureInHalfOpenReopensImmediately() {
        tripOpen();
        clock.advance(Duration.ofMillis(50));
        breaker.recordSuccess();

        breaker.recordFailure(new IOException("trial call failed"));

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(0, breaker.getConsecutiveSuccesses());
        assertEquals(clock.instant(), breaker.getLastOpenedAt());
    }

    @Test
    void neverGoesFromClosedDirectlyToHalfOpen() {
        tripOpen();
        clock.advance(Duration.ofMillis(50));
        breaker.recordSuccess();
        breaker.recordSuccess();
        breaker.reset();
        tripOpen();
        clock.advance(Duration.ofMillis(50));
        breaker.getState();

        for (CircuitStateChange c : changes) {
            assertFalse(c.getPreviousState() == CircuitState.CLOSED && c.getNewState() == CircuitState.HALF_OPEN,
                    "unexpected transition " + c);
        }
    }

    @Test
    void executeRejectsWhileOpenWithRemainingDuration() {
        DefaultCircuitBreaker cb = new DefaultCircuitBreaker("billing", CircuitBreakerOptions.builder()
                .failureThreshold(1)
                .openDuration(Duration.ofHours(1))
                .build(), clock);
        cb.recordFailure(new IOException("down"));
        clock.advance(Duration.ofMinutes(10));
        AtomicInteger calls = new AtomicInteger();

        CircuitBreakerOpenException ex = assertThrows(CircuitBreakerOpenException.class,
                () -> cb.execute(ct -> calls.incrementAndGet(), CancellationToken.none()));

        assertEquals("billing", ex.getCircuitName());
        assertEquals(Duration.ofMinutes(50), ex.getRetryAfter());
        assertTrue(ex.getRetryAfter().compareTo(Duration.ofHours(1)) <= 0);
        assertFalse(ex.getRetryAfter().isNegative() || ex.getRetryAfter().isZero());
        assertEquals(0, calls.get());
    }

    @Test
    void executeRecordsOutcomesAndPropagatesOriginalException() throws Exception {
        IOException boom = new IOException("boom");

        IOException thrown = assertThrows(IOException.class, () -> breaker.execute(ct -> {
            throw boom;
        }, null));
        assertSame(boom, thrown);
        assertEquals(1, breaker.getConsecutiveFailures());

        assertEquals("ok", breaker.execute(ct -> "ok", CancellationToken.none()));
        assertEquals(0, breaker.getConsecutiveFailures());
    }

    @Test
    void cancellationIsNeitherFailureNorSuccess() {
        breaker.recordFailure(null);

        assertThrows(CancellationException.class, () -> breaker.execute(ct -> {
            throw new CancellationException("stop");
        }, CancellationToken.none()));

        assertEquals(1, breaker.getConsecutiveFailures());
    }

    @Test
    void shouldHandleFiltersCountedFailures() throws Exception {
        DefaultCircuitBreaker cb = new DefaultCircuitBreaker("filtered", CircuitBreakerOptions.builder()
                .failureThreshold(1)
                .shouldHandle(t -> t instanceof IOException)
                .build(), clock);

        assertThrows(IllegalStateException.class, () -> cb.run(ct -> {
            throw new IllegalStateException("ignored");
        }, CancellationToken.none()));
        assertEquals(CircuitState.CLOSED, cb.getState());
        assertEquals(0, cb.getConsecutiveFailures());

        assertThrows(IOException.class, () -> cb.run(ct -> {
            throw new IOException("counted");
        }, CancellationToken.none()));
        assertEquals(CircuitState.OPEN, cb.getState());
    }

    @Test
    void resetClosesAndClearsHistory() {
        tripOpen();

        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getConsecutiveFailures());
        assertNull(breaker.getLastOpenedAt());
        int events = changes.size();

        breaker.reset();
        assertEquals(events, changes.size());
    }

    @Test
    void listenersAreNotifiedInOrderAndFailuresAreIsolated() {
        List<String> seen = new ArrayList<>();
        breaker.addListener(c -> {
            throw new IllegalStateException("listener bug");
        });
        breaker.addListener(c -> seen.add(c.getPreviousState() + "->" + c.getNewState()));

        tripOpen();
        clock.advance(Duration.ofMillis(50));
        breaker.getState();
        breaker.recordSuccess();
        breaker.recordSuccess();

        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), seen);
    }

    @Test
    void removedListenerIsNoLongerNotified() {
        List<CircuitStateChange> other = new ArrayList<>();
        CircuitStateListener listener = other::add;
        breaker.addListener(listener);
        breaker.removeListener(listener);

        tripOpen();

        assertTrue(other.isEmpty());
        assertEquals(1, changes.size());
    }

    @Test
    void invalidOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultCircuitBreaker(" ", CircuitBreakerOptions.defaults()));
        assertThrows(NullPointerException.class, () -> new DefaultCircuitBreaker("x", null));
        assertThrows(IllegalArgumentException.class, () -> new DefaultCircuitBreaker("x",
                CircuitBreakerOptions.builder().failureThreshold(0).build()));
        assertThrows(IllegalArgumentException.class, () -> new DefaultCircuitBreaker("x",
                CircuitBreakerOptions.builder().openDuration(Duration.ZERO).build()));
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(new IOException("f" + i));
        }
    }
}
