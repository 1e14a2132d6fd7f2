package com.dispatchguard.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * 熔断打开时的快速失败
 * 与被保护操作自身的异常相互独立, 携带熔断器名称与建议的重试等待时长
 */
@Getter
public class CircuitBreakerOpenException extends RuntimeException {

    private final String circuitName;

    /** 距离进入半开的剩余时长 */
    private final Duration retryAfter;

    public CircuitBreakerOpenException(String circuitName, Duration retryAfter) {
        this(circuitName, retryAfter, null);
    }

    public CircuitBreakerOpenException(String circuitName, Duration retryAfter, Throwable cause) {
        super("circuit '" + circuitName + "' is open, retry after " + retryAfter, cause);
        this.circuitName = circuitName;
        this.retryAfter = retryAfter;
    }
}
