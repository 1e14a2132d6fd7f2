package com.dispatchguard.core.registry;

import com.dispatchguard.core.circuit.AlwaysClosedCircuitBreaker;
import com.dispatchguard.core.spi.CircuitBreaker;
import com.dispatchguard.core.spi.CircuitStateListener;
import com.dispatchguard.core.spi.TransportCircuitBreakerRegistry;
import com.dispatchguard.model.CircuitBreakerOptions;
import com.dispatchguard.model.enums.CircuitState;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 关闭熔断时使用的空注册表, 始终返回 {@link AlwaysClosedCircuitBreaker}
 */
public final class NoOpTransportCircuitBreakerRegistry implements TransportCircuitBreakerRegistry {

    public static final NoOpTransportCircuitBreakerRegistry INSTANCE = new NoOpTransportCircuitBreakerRegistry();

    private NoOpTransportCircuitBreakerRegistry() {
    }

    @Override
    public CircuitBreaker getOrCreate(String transportName) {
        return AlwaysClosedCircuitBreaker.INSTANCE;
    }

    @Override
    public CircuitBreaker getOrCreate(String transportName, CircuitBreakerOptions options) {
        return AlwaysClosedCircuitBreaker.INSTANCE;
    }

    @Override
    public Optional<CircuitBreaker> tryGet(String transportName) {
        return Optional.empty();
    }

    @Override
    public boolean remove(String transportName) {
        return false;
    }

    @Override
    public void resetAll() {
    }

    @Override
    public Map<String, CircuitState> getAllStates() {
        return Collections.emptyMap();
    }

    @Override
    public Set<String> getTransportNames() {
        return Collections.emptySet();
    }

    @Override
    public int count() {
        return 0;
    }

    @Override
    public void addListener(CircuitStateListener listener) {
    }

    @Override
    public void removeListener(CircuitStateListener listener) {
    }

    @Override
    public void close() {
    }
}
