package com.dispatchguard.core.registry;

import com.dispatchguard.core.circuit.DefaultCircuitBreaker;
import com.dispatchguard.core.spi.CircuitBreaker;
import com.dispatchguard.core.spi.CircuitBreakerFactory;
import com.dispatchguard.core.spi.CircuitStateListener;
import com.dispatchguard.core.spi.TransportCircuitBreakerRegistry;
import com.dispatchguard.model.CircuitBreakerOptions;
import com.dispatchguard.model.enums.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 熔断器注册表
 * key 为 Locale.ROOT 小写后的名称, 通过 computeIfAbsent 保证并发下只创建一次
 */
public class DefaultTransportCircuitBreakerRegistry implements TransportCircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultTransportCircuitBreakerRegistry.class);

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    private final CircuitBreakerOptions defaultOptions;

    /** 按名称覆盖, key 已小写 */
    private final Map<String, CircuitBreakerOptions> perTransport;

    private final CircuitBreakerFactory factory;

    private final CopyOnWriteArrayList<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DefaultTransportCircuitBreakerRegistry() {
        this(CircuitBreakerOptions.defaults());
    }

    public DefaultTransportCircuitBreakerRegistry(CircuitBreakerOptions defaultOptions) {
        this(defaultOptions, Collections.emptyMap(), DefaultCircuitBreaker::new);
    }

    public DefaultTransportCircuitBreakerRegistry(CircuitBreakerOptions defaultOptions,
                                                  Map<String, CircuitBreakerOptions> perTransport,
                                                  CircuitBreakerFactory factory) {
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
        this.factory = Objects.requireNonNull(factory, "factory");
        Map<String, CircuitBreakerOptions> overrides = new ConcurrentHashMap<>();
        if (perTransport != null) {
            perTransport.forEach((k, v) -> overrides.put(normalize(k), Objects.requireNonNull(v, k)));
        }
        this.perTransport = overrides;
    }

    @Override
    public CircuitBreaker getOrCreate(String transportName) {
        String key = normalize(transportName);
        return getOrCreate(transportName, perTransport.getOrDefault(key, defaultOptions));
    }

    @Override
    public CircuitBreaker getOrCreate(String transportName, CircuitBreakerOptions options) {
        String key = normalize(transportName);
        Objects.requireNonNull(options, "options");
        ensureOpen();
        CircuitBreaker existing = breakers.get(key);
        if (existing != null) {
            return existing;
        }
        AtomicBoolean created = new AtomicBoolean(false);
        CircuitBreaker cb = breakers.computeIfAbsent(key, k -> {
            created.set(true);
            log.debug("[CircuitRegistry] created breaker name={} failureThreshold={} openDuration={}ms",
                    transportName, options.getFailureThreshold(), options.getOpenDuration().toMillis());
            return factory.create(transportName, options);
        });
        if (created.get()) {
            // 发布后再挂监听器, 并发 addListener 遍历不到未发布的熔断器
            listeners.forEach(cb::addListener);
        }
        return cb;
    }

    @Override
    public Optional<CircuitBreaker> tryGet(String transportName) {
        String key = normalize(transportName);
        ensureOpen();
        return Optional.ofNullable(breakers.get(key));
    }

    @Override
    public boolean remove(String transportName) {
        String key = normalize(transportName);
        ensureOpen();
        CircuitBreaker removed = breakers.remove(key);
        if (removed == null) {
            return false;
        }
        listeners.forEach(removed::removeListener);
        return true;
    }

    @Override
    public void resetAll() {
        ensureOpen();
        breakers.values().forEach(CircuitBreaker::reset);
    }

    @Override
    public Map<String, CircuitState> getAllStates() {
        ensureOpen();
        Map<String, CircuitState> snapshot = new LinkedHashMap<>();
        breakers.values().forEach(cb -> snapshot.put(cb.getName(), cb.getState()));
        return Collections.unmodifiableMap(snapshot);
    }

    @Override
    public Set<String> getTransportNames() {
        ensureOpen();
        Set<String> names = new LinkedHashSet<>();
        breakers.values().forEach(cb -> names.add(cb.getName()));
        return Collections.unmodifiableSet(names);
    }

    @Override
    public int count() {
        ensureOpen();
        return breakers.size();
    }

    /**
     * 先登记再挂到已发布的熔断器; 与并发创建交错时两边都可能挂上, 由熔断器侧去重
     */
    @Override
    public void addListener(CircuitStateListener listener) {
        ensureOpen();
        if (listeners.addIfAbsent(Objects.requireNonNull(listener, "listener"))) {
            breakers.values().forEach(cb -> cb.addListener(listener));
        }
    }

    @Override
    public void removeListener(CircuitStateListener listener) {
        ensureOpen();
        listeners.remove(listener);
        breakers.values().forEach(cb -> cb.removeListener(listener));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int n = breakers.size();
        breakers.clear();
        listeners.clear();
        log.info("[CircuitRegistry] closed, released {} breakers", n);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("circuit breaker registry is closed");
        }
    }

    private static String normalize(String transportName) {
        if (transportName == null || transportName.isBlank()) {
            throw new IllegalArgumentException("transport name must not be null or blank");
        }
        return transportName.toLowerCase(Locale.ROOT);
    }
}
