package com.dispatchguard.core.circuit;

import com.dispatchguard.core.cancel.CancellationToken;
import com.dispatchguard.core.spi.CircuitBreaker;
import com.dispatchguard.core.spi.CircuitStateListener;
import com.dispatchguard.core.spi.GuardedOperation;
import com.dispatchguard.model.CircuitBreakerOptions;
import com.dispatchguard.model.enums.CircuitState;

import java.time.Instant;
import java.util.Objects;

/**
 * 永远关闭的熔断器, 关闭熔断功能时使用
 * 无状态, 单例
 */
public final class AlwaysClosedCircuitBreaker implements CircuitBreaker {

    public static final AlwaysClosedCircuitBreaker INSTANCE = new AlwaysClosedCircuitBreaker();

    private AlwaysClosedCircuitBreaker() {
    }

    @Override
    public String getName() {
        return "always-closed";
    }

    @Override
    public CircuitState getState() {
        return CircuitState.CLOSED;
    }

    @Override
    public int getConsecutiveFailures() {
        return 0;
    }

    @Override
    public int getConsecutiveSuccesses() {
        return 0;
    }

    @Override
    public Instant getLastOpenedAt() {
        return null;
    }

    /**
     * 每次返回新副本, 单例不暴露可变状态
     */
    @Override
    public CircuitBreakerOptions getOptions() {
        return CircuitBreakerOptions.defaults();
    }

    @Override
    public <T> T execute(GuardedOperation<T> operation, CancellationToken token) throws Exception {
        Objects.requireNonNull(operation, "operation");
        return operation.execute(token == null ? CancellationToken.none() : token);
    }

    @Override
    public void recordFailure(Throwable exception) {
    }

    @Override
    public void recordSuccess() {
    }

    @Override
    public void reset() {
    }

    @Override
    public void addListener(CircuitStateListener listener) {
    }

    @Override
    public void removeListener(CircuitStateListener listener) {
    }
}
