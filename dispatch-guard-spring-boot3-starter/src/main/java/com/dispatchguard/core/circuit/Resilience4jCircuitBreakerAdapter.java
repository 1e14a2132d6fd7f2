package com.dispatchguard.core.circuit;

import com.dispatchguard.core.cancel.CancellationToken;
import com.dispatchguard.core.spi.CircuitBreaker;
import com.dispatchguard.core.spi.CircuitStateListener;
import com.dispatchguard.core.spi.GuardedOperation;
import com.dispatchguard.exception.CircuitBreakerOpenException;
import com.dispatchguard.model.CircuitBreakerOptions;
import com.dispatchguard.model.ctx.CircuitStateChange;
import com.dispatchguard.model.enums.CircuitState;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.IllegalStateTransitionException;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于 resilience4j 的熔断器实现
 * CLOSED: 以 failureThreshold 大小的计数窗口 + 100% 失败率表达"连续失败"语义;
 * HALF_OPEN: 探测结果不交给 resilience4j 评估, 由本类计数后显式转换
 * (连续 successThreshold 次成功关闭, 任一失败重新打开);
 * 不开启自动 OPEN -> HALF_OPEN, 与原生实现一样在读状态时惰性转换
 */
public class Resilience4jCircuitBreakerAdapter implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jCircuitBreakerAdapter.class);

    private final String name;

    private final CircuitBreakerOptions options;

    private final Clock clock;

    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;

    private final CopyOnWriteArrayList<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Instant lastOpenedAt;

    private volatile Throwable lastFailure;

    private final ReentrantLock lock = new ReentrantLock();

    private int consecutiveFailures;

    private int consecutiveSuccesses;

    public Resilience4jCircuitBreakerAdapter(String name, CircuitBreakerOptions options) {
        this(name, options, Clock.systemUTC());
    }

    public Resilience4jCircuitBreakerAdapter(String name, CircuitBreakerOptions options, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("circuit name must not be blank");
        }
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (options.getFailureThreshold() < 1 || options.getSuccessThreshold() < 1) {
            throw new IllegalArgumentException("thresholds must be >= 1");
        }
        Duration open = options.getOpenDuration();
        if (open == null || open.isZero() || open.isNegative()) {
            throw new IllegalArgumentException("openDuration must be positive");
        }
        this.name = name;

        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(options.getFailureThreshold())
                .minimumNumberOfCalls(options.getFailureThreshold())
                .failureRateThreshold(100f)
                .waitDurationInOpenState(open)
                .permittedNumberOfCallsInHalfOpenState(options.getSuccessThreshold())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordException(options::handles)
                // 不匹配的异常既不算失败也不算成功
                .ignoreException(t -> !options.handles(t))
                .build();
        this.delegate = io.github.resilience4j.circuitbreaker.CircuitBreaker.of("cb:" + name, cfg);
        this.delegate.getEventPublisher().onStateTransition(this::relay);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CircuitBreakerOptions getOptions() {
        return options;
    }

    @Override
    public CircuitState getState() {
        lock.lock();
        try {
            refreshState();
            return map(delegate.getState());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getConsecutiveSuccesses() {
        lock.lock();
        try {
            return consecutiveSuccesses;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Instant getLastOpenedAt() {
        return lastOpenedAt;
    }

    @Override
    public <T> T execute(GuardedOperation<T> operation, CancellationToken token) throws Exception {
        Objects.requireNonNull(operation, "operation");
        CancellationToken ct = token == null ? CancellationToken.none() : token;
        boolean halfOpenTrial;
        lock.lock();
        try {
            refreshState();
            if (!delegate.tryAcquirePermission()) {
                throw new CircuitBreakerOpenException(name, remainingOpenDuration());
            }
            halfOpenTrial = delegate.getState() == io.github.resilience4j.circuitbreaker.CircuitBreaker.State.HALF_OPEN;
        } finally {
            lock.unlock();
        }
        long start = System.nanoTime();
        T result;
        try {
            result = operation.execute(ct);
        } catch (CancellationException e) {
            delegate.releasePermission();
            throw e;
        } catch (InterruptedException e) {
            delegate.releasePermission();
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            if (halfOpenTrial) {
                delegate.releasePermission();
            }
            onFailure(e, System.nanoTime() - start);
            throw e;
        }
        if (halfOpenTrial) {
            delegate.releasePermission();
        }
        onSuccess(System.nanoTime() - start);
        return result;
    }

    @Override
    public void recordFailure(Throwable exception) {
        onFailure(exception == null ? new IllegalStateException("failure recorded for " + name) : exception, 0);
    }

    @Override
    public void recordSuccess() {
        onSuccess(0);
    }

    private void onFailure(Throwable t, long nanos) {
        if (!options.handles(t)) {
            log.debug("[CircuitBreaker] name={} ignored exception type={}", name, t.getClass().getName());
            return;
        }
        lock.lock();
        try {
            refreshState();
            consecutiveFailures++;
            consecutiveSuccesses = 0;
            lastFailure = t;
            switch (map(delegate.getState())) {
                case CLOSED -> delegate.onError(nanos, TimeUnit.NANOSECONDS, t);
                // 半开探测失败立即重新打开
                case HALF_OPEN -> delegate.transitionToOpenState();
                default -> {
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(long nanos) {
        lock.lock();
        try {
            refreshState();
            consecutiveFailures = 0;
            switch (map(delegate.getState())) {
                case CLOSED -> delegate.onSuccess(nanos, TimeUnit.NANOSECONDS);
                case HALF_OPEN -> {
                    if (++consecutiveSuccesses >= options.getSuccessThreshold()) {
                        delegate.transitionToClosedState();
                    }
                }
                default -> {
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            if (map(delegate.getState()) == CircuitState.CLOSED) {
                return;
            }
            delegate.transitionToClosedState();
            lastOpenedAt = null;
        } finally {
            lock.unlock();
        }
        log.info("[CircuitBreaker] name={} manually reset", name);
    }

    @Override
    public void addListener(CircuitStateListener listener) {
        listeners.addIfAbsent(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(CircuitStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * 惰性完成 OPEN -> HALF_OPEN, 必须在持锁时调用
     */
    private void refreshState() {
        Instant opened = lastOpenedAt;
        if (delegate.getState() == io.github.resilience4j.circuitbreaker.CircuitBreaker.State.OPEN
                && opened != null
                && !clock.instant().isBefore(opened.plus(options.getOpenDuration()))) {
            try {
                delegate.transitionToHalfOpenState();
            } catch (IllegalStateTransitionException e) {
                // 并发下其他线程已完成转换
                log.debug("[CircuitBreaker] name={} half-open transition raced: {}", name, e.getMessage());
            }
        }
    }

    private Duration remainingOpenDuration() {
        Instant opened = lastOpenedAt;
        if (opened == null) {
            return options.getOpenDuration();
        }
        Duration remaining = options.getOpenDuration().minus(Duration.between(opened, clock.instant()));
        return remaining.isNegative() || remaining.isZero() ? Duration.ofMillis(1) : remaining;
    }

    private void relay(CircuitBreakerOnStateTransitionEvent event) {
        CircuitState from = map(event.getStateTransition().getFromState());
        CircuitState to = map(event.getStateTransition().getToState());
        if (from == to) {
            return;
        }
        lock.lock();
        try {
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
        } finally {
            lock.unlock();
        }
        Throwable trigger = to == CircuitState.OPEN ? lastFailure : null;
        if (to == CircuitState.OPEN) {
            lastOpenedAt = clock.instant();
            log.warn("[CircuitBreaker] name={} {} -> {} (resilience4j), openDuration={}ms",
                    name, from, to, options.getOpenDuration().toMillis());
        } else {
            log.info("[CircuitBreaker] name={} {} -> {} (resilience4j)", name, from, to);
        }
        CircuitStateChange change = new CircuitStateChange(name, from, to, trigger, clock.instant());
        for (CircuitStateListener l : listeners) {
            try {
                l.onStateChange(change);
            } catch (RuntimeException e) {
                log.error("[CircuitBreaker] name={} state listener failed", name, e);
            }
        }
    }

    private static CircuitState map(io.github.resilience4j.circuitbreaker.CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }
}
