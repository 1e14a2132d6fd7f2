package com.dispatchguard.core.backoff;

import com.dispatchguard.core.spi.BackoffCalculator;

import java.time.Duration;

/**
 * 线性增长策略: base * attempt, 不超过 maxDelay
 */
public class LinearBackoffCalculator implements BackoffCalculator {

    /** 未指定上限时的默认值 */
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(30);

    private final Duration baseDelay;

    private final long maxNanos;

    public LinearBackoffCalculator(Duration baseDelay) {
        this(baseDelay, DEFAULT_MAX_DELAY);
    }

    public LinearBackoffCalculator(Duration baseDelay, Duration maxDelay) {
        this.baseDelay = Backoffs.requirePositive(baseDelay, "baseDelay");
        this.maxNanos = Backoffs.saturatedNanos(Backoffs.requirePositive(
                maxDelay == null ? DEFAULT_MAX_DELAY : maxDelay, "maxDelay"));
    }

    @Override
    public String name() {
        return "linear";
    }

    @Override
    public Duration calculateDelay(int attempt) {
        Backoffs.requireAttempt(attempt);
        double nanos = (double) Backoffs.saturatedNanos(baseDelay) * attempt;
        return Backoffs.cap(nanos, maxNanos);
    }
}
