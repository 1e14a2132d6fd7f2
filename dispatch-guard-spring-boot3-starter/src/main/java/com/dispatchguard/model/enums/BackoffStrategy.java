package com.dispatchguard.model.enums;

import java.util.Locale;

/**
 * 退避策略标识（YAML 中大小写均可）
 * fixed | linear | exponential | exponential-with-jitter
 */
public enum BackoffStrategy {
    FIXED, LINEAR, EXPONENTIAL, EXPONENTIAL_WITH_JITTER;

    /**
     * 解析策略标识, 同时兼容重试策略的别名
     */
    public static BackoffStrategy from(String v) {
        if (v == null) {
            throw new NullPointerException("strategy");
        }
        String s = v.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (s) {
            case "FIXED", "FIXED_DELAY" -> { return FIXED; }
            case "LINEAR" -> { return LINEAR; }
            case "EXPONENTIAL", "EXPONENTIAL_BACKOFF" -> { return EXPONENTIAL; }
            case "EXPONENTIAL_WITH_JITTER", "JITTER" -> { return EXPONENTIAL_WITH_JITTER; }
            default -> throw new IllegalArgumentException("Unknown backoff strategy: " + v);
        }
    }
}
