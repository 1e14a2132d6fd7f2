package com.dispatchguard.core.backoff;

import com.dispatchguard.core.spi.BackoffCalculator;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 指数退避（可选抖动）
 * attempt 从1开始: 1 -> base, 2 -> base * m, 3 -> base * m^2 ...
 * 抖动在封顶之前乘以 [1-jitter, 1+jitter] 内的随机系数, 结果始终不超过 maxDelay
 */
public class ExponentialBackoffCalculator implements BackoffCalculator {

    private final long baseNanos;

    private final long maxNanos;

    private final double multiplier;

    private final boolean jitterEnabled;

    private final double jitterFactor;

    public ExponentialBackoffCalculator(Duration baseDelay, Duration maxDelay, double multiplier) {
        this(baseDelay, maxDelay, multiplier, false, 0.0);
    }

    public ExponentialBackoffCalculator(Duration baseDelay, Duration maxDelay, double multiplier,
                                        boolean jitterEnabled, double jitterFactor) {
        this.baseNanos = Backoffs.saturatedNanos(Backoffs.requirePositive(baseDelay, "baseDelay"));
        this.maxNanos = Backoffs.saturatedNanos(Backoffs.requirePositive(maxDelay, "maxDelay"));
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, was " + multiplier);
        }
        if (Double.isNaN(jitterFactor) || jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1], was " + jitterFactor);
        }
        this.multiplier = multiplier;
        this.jitterEnabled = jitterEnabled;
        this.jitterFactor = jitterFactor;
    }

    @Override
    public String name() {
        return jitterEnabled ? "exponential-with-jitter" : "exponential";
    }

    @Override
    public Duration calculateDelay(int attempt) {
        Backoffs.requireAttempt(attempt);
        // Math.pow 溢出得到 Infinity, 由 cap 截断到上限
        double ideal = baseNanos * Math.pow(multiplier, attempt - 1);
        if (jitterEnabled && jitterFactor > 0) {
            ideal *= ThreadLocalRandom.current().nextDouble(1.0 - jitterFactor, 1.0 + jitterFactor);
        }
        return Backoffs.cap(ideal, maxNanos);
    }
}
