package com.dispatchguard.core.backoff;

import com.dispatchguard.core.spi.BackoffCalculator;

import java.time.Duration;

/**
 * 固定间隔策略
 */
public class FixedBackoffCalculator implements BackoffCalculator {

    private final Duration delay;

    public FixedBackoffCalculator(Duration delay) {
        this.delay = Backoffs.requirePositive(delay, "delay");
    }

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration calculateDelay(int attempt) {
        Backoffs.requireAttempt(attempt);
        return delay;
    }
}
