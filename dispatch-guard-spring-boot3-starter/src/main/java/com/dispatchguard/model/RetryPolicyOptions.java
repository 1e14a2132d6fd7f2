package com.dispatchguard.model;

import com.dispatchguard.model.enums.BackoffStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * 重试参数
 * retriableExceptions / nonRetriableExceptions 按异常的具体类型精确匹配, 不考虑继承
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicyOptions {

    /** 最大执行次数（含首次）, <=1 表示只执行一次 */
    @Builder.Default
    private int maxRetryAttempts = 3;

    @Builder.Default
    private Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    private Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    private double backoffMultiplier = 2.0;

    @Builder.Default
    private boolean jitterEnabled = true;

    /** 抖动比例（0~1）, 0.1 表示 ±10% */
    @Builder.Default
    private double jitterFactor = 0.1;

    @Builder.Default
    private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;

    /** 显式可重试; 非空时只重试集合内的类型 */
    @Builder.Default
    private Set<Class<? extends Throwable>> retriableExceptions = new HashSet<>();

    /** 显式不可重试; 优先级高于 retriableExceptions */
    @Builder.Default
    private Set<Class<? extends Throwable>> nonRetriableExceptions = new HashSet<>();

    public static RetryPolicyOptions defaults() {
        return new RetryPolicyOptions();
    }
}
