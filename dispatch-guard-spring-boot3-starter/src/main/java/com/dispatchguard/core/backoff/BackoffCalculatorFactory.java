package com.dispatchguard.core.backoff;

import com.dispatchguard.core.spi.BackoffCalculator;
import com.dispatchguard.model.RetryPolicyOptions;
import com.dispatchguard.model.enums.BackoffStrategy;

import java.util.Objects;

/**
 * 按策略标识创建退避计算器
 */
public final class BackoffCalculatorFactory {

    private BackoffCalculatorFactory() {
    }

    /**
     * 使用 options 中配置的策略
     */
    public static BackoffCalculator create(RetryPolicyOptions options) {
        Objects.requireNonNull(options, "options");
        return create(options.getStrategy(), options);
    }

    /**
     * 按名称解析策略, 支持 fixed | linear | exponential | exponential-with-jitter 及其别名
     */
    public static BackoffCalculator create(String strategy, RetryPolicyOptions options) {
        Objects.requireNonNull(options, "options");
        return create(BackoffStrategy.from(strategy), options);
    }

    public static BackoffCalculator create(BackoffStrategy strategy, RetryPolicyOptions options) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(options, "options");
        return switch (strategy) {
            case FIXED -> new FixedBackoffCalculator(options.getBaseDelay());
            case LINEAR -> new LinearBackoffCalculator(options.getBaseDelay(), options.getMaxDelay());
            case EXPONENTIAL -> new ExponentialBackoffCalculator(options.getBaseDelay(), options.getMaxDelay(),
                    options.getBackoffMultiplier(), options.isJitterEnabled(), options.getJitterFactor());
            case EXPONENTIAL_WITH_JITTER -> new ExponentialBackoffCalculator(options.getBaseDelay(),
                    options.getMaxDelay(), options.getBackoffMultiplier(), true,
                    options.getJitterFactor() > 0 ? options.getJitterFactor() : 0.1);
        };
    }
}
