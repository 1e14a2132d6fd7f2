package com.dispatchguard.core.backoff;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffCalculatorTest {

    @Test
    void fixedReturnsSameDelayForEveryAttempt() {
        FixedBackoffCalculator calc = new FixedBackoffCalculator(Duration.ofMillis(250));

        assertEquals(Duration.ofMillis(250), calc.calculateDelay(1));
        assertEquals(Duration.ofMillis(250), calc.calculateDelay(7));
        assertEquals(Duration.ofMillis(250), calc.calculateDelay(Integer.MAX_VALUE));
        assertEquals("fixed", calc.name());
    }

    @Test
    void linearGrowsWithAttemptAndIsCapped() {
        LinearBackoffCalculator calc = new LinearBackoffCalculator(Duration.ofSeconds(1), Duration.ofSeconds(5));

        assertEquals(Duration.ofSeconds(1), calc.calculateDelay(1));
        assertEquals(Duration.ofSeconds(3), calc.calculateDelay(3));
        assertEquals(Duration.ofSeconds(5), calc.calculateDelay(5));
        assertEquals(Duration.ofSeconds(5), calc.calculateDelay(100));
    }

    @Test
    void linearDefaultsToThirtyMinuteCap() {
        LinearBackoffCalculator calc = new LinearBackoffCalculator(Duration.ofMinutes(1));

        assertEquals(Duration.ofMinutes(30), calc.calculateDelay(45));
        assertEquals(Duration.ofMinutes(30), new LinearBackoffCalculator(Duration.ofMinutes(1), null).calculateDelay(31));
    }

    @Test
    void exponentialDoublesUntilCap() {
        ExponentialBackoffCalculator calc =
                new ExponentialBackoffCalculator(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0);

        assertEquals(Duration.ofMillis(100), calc.calculateDelay(1));
        assertEquals(Duration.ofMillis(200), calc.calculateDelay(2));
        assertEquals(Duration.ofMillis(800), calc.calculateDelay(4));
        assertEquals(Duration.ofSeconds(1), calc.calculateDelay(5));
        assertEquals("exponential", calc.name());
    }

    @Test
    void exponentialDoesNotOverflowForHugeAttempts() {
        ExponentialBackoffCalculator calc =
                new ExponentialBackoffCalculator(Duration.ofSeconds(1), Duration.ofMinutes(10), 10.0);

        assertEquals(Duration.ofMinutes(10), calc.calculateDelay(10_000));
        assertEquals(Duration.ofMinutes(10), calc.calculateDelay(Integer.MAX_VALUE));
    }

    @Test
    void jitterStaysWithinFactorAndCap() {
        ExponentialBackoffCalculator calc = new ExponentialBackoffCalculator(
                Duration.ofMillis(1000), Duration.ofMillis(3000), 2.0, true, 0.2);

        for (int i = 0; i < 500; i++) {
            long first = calc.calculateDelay(1).toMillis();
            assertTrue(first >= 800 && first <= 1200, "attempt 1 delay out of range: " + first);
            long capped = calc.calculateDelay(3).toMillis();
            assertTrue(capped >= 3000 * 0.8 && capped <= 3000, "attempt 3 delay out of range: " + capped);
        }
        assertEquals("exponential-with-jitter", calc.name());
    }

    @Test
    void jitterFactorZeroIsDeterministic() {
        ExponentialBackoffCalculator calc = new ExponentialBackoffCalculator(
                Duration.ofMillis(100), Duration.ofSeconds(10), 3.0, true, 0.0);

        assertEquals(Duration.ofMillis(900), calc.calculateDelay(3));
    }

    @Test
    void attemptBelowOneIsRejected() {
        FixedBackoffCalculator fixed = new FixedBackoffCalculator(Duration.ofMillis(1));
        ExponentialBackoffCalculator exp =
                new ExponentialBackoffCalculator(Duration.ofMillis(1), Duration.ofSeconds(1), 2.0);

        assertThrows(IllegalArgumentException.class, () -> fixed.calculateDelay(0));
        assertThrows(IllegalArgumentException.class, () -> exp.calculateDelay(-3));
    }

    @Test
    void invalidConstructionArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FixedBackoffCalculator(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new FixedBackoffCalculator(null));
        assertThrows(IllegalArgumentException.class,
                () -> new LinearBackoffCalculator(Duration.ofSeconds(1), Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffCalculator(Duration.ofSeconds(1), Duration.ofSeconds(5), 0.5));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffCalculator(Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, true, 1.5));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffCalculator(Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, true, -0.1));
    }
}
