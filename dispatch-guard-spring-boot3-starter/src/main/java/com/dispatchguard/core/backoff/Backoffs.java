package com.dispatchguard.core.backoff;

import java.time.Duration;

/**
 * 退避参数校验与换算
 */
final class Backoffs {

    private Backoffs() {
    }

    static Duration requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, was " + d);
        }
        return d;
    }

    static void requireAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
    }

    /** 超出 long 范围的时长按 Long.MAX_VALUE 处理 */
    static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    static Duration cap(double nanos, long maxNanos) {
        if (Double.isNaN(nanos) || nanos >= maxNanos) {
            return Duration.ofNanos(maxNanos);
        }
        return Duration.ofNanos(Math.max(0L, (long) nanos));
    }
}
