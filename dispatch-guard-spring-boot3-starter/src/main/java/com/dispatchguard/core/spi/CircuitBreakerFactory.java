package com.dispatchguard.core.spi;

import com.dispatchguard.model.CircuitBreakerOptions;

/**
 * 熔断器实现的创建入口（native / resilience4j）
 */
@FunctionalInterface
public interface CircuitBreakerFactory {

    CircuitBreaker create(String name, CircuitBreakerOptions options);
}
