package com.dispatchguard.core.circuit;

import com.dispatchguard.core.cancel.CancellationToken;
import com.dispatchguard.core.spi.CircuitBreaker;
import com.dispatchguard.core.spi.CircuitStateListener;
import com.dispatchguard.core.spi.GuardedOperation;
import com.dispatchguard.exception.CircuitBreakerOpenException;
import com.dispatchguard.model.CircuitBreakerOptions;
import com.dispatchguard.model.ctx.CircuitStateChange;
import com.dispatchguard.model.enums.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于连续失败计数的熔断器
 * - 所有计数与状态由同一把锁保护
 * - OPEN -> HALF_OPEN 没有定时线程, 每次读状态时按 (lastOpenedAt, openDuration, now) 计算
 * - 状态变更在锁内同步通知订阅者, 保证跨线程的通知顺序与变更顺序一致
 */
public class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final String name;

    private final CircuitBreakerOptions options;

    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    private final CopyOnWriteArrayList<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();

    private CircuitState state = CircuitState.CLOSED;

    private int consecutiveFailures;

    private int consecutiveSuccesses;

    private Instant lastOpenedAt;

    public DefaultCircuitBreaker(String name, CircuitBreakerOptions options) {
        this(name, options, Clock.systemUTC());
    }

    public DefaultCircuitBreaker(String name, CircuitBreakerOptions options, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("circuit name must not be blank");
        }
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (options.getFailureThreshold() < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (options.getSuccessThreshold() < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1");
        }
        Duration open = options.getOpenDuration();
        if (open == null || open.isZero() || open.isNegative()) {
            throw new IllegalArgumentException("openDuration must be positive");
        }
        this.name = name;
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
            return state;
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
        lock.lock();
        try {
            return lastOpenedAt;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T execute(GuardedOperation<T> operation, CancellationToken token) throws Exception {
        Objects.requireNonNull(operation, "operation");
        CancellationToken ct = token == null ? CancellationToken.none() : token;

        lock.lock();
        try {
            refreshState();
            if (state == CircuitState.OPEN) {
                throw new CircuitBreakerOpenException(name, remainingOpenDuration());
            }
        } finally {
            lock.unlock();
        }

        T result;
        try {
            result = operation.execute(ct);
        } catch (CancellationException e) {
            // 取消既不算失败也不算成功
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }

    @Override
    public void recordFailure(Throwable exception) {
        if (exception != null && !options.handles(exception)) {
            log.debug("[CircuitBreaker] name={} ignored exception type={}", name, exception.getClass().getName());
            return;
        }
        lock.lock();
        try {
            refreshState();
            consecutiveFailures++;
            switch (state) {
                case CLOSED -> {
                    if (consecutiveFailures >= options.getFailureThreshold()) {
                        transitionTo(CircuitState.OPEN, exception);
                    }
                }
                // 半开探测失败立即重新打开
                case HALF_OPEN -> transitionTo(CircuitState.OPEN, exception);
                default -> {
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess() {
        lock.lock();
        try {
            refreshState();
            consecutiveFailures = 0;
            if (state == CircuitState.HALF_OPEN) {
                consecutiveSuccesses++;
                if (consecutiveSuccesses >= options.getSuccessThreshold()) {
                    transitionTo(CircuitState.CLOSED, null);
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
            if (state == CircuitState.CLOSED) {
                return;
            }
            transitionTo(CircuitState.CLOSED, null);
            lastOpenedAt = null;
            log.info("[CircuitBreaker] name={} manually reset", name);
        } finally {
            lock.unlock();
        }
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
        if (state == CircuitState.OPEN && lastOpenedAt != null
                && !clock.instant().isBefore(lastOpenedAt.plus(options.getOpenDuration()))) {
            transitionTo(CircuitState.HALF_OPEN, null);
        }
    }

    private Duration remainingOpenDuration() {
        Duration elapsed = Duration.between(lastOpenedAt, clock.instant());
        Duration remaining = options.getOpenDuration().minus(elapsed);
        return remaining.isNegative() || remaining.isZero() ? Duration.ofMillis(1) : remaining;
    }

    /**
     * 必须在持锁时调用
     */
    private void transitionTo(CircuitState next, Throwable trigger) {
        CircuitState prev = state;
        if (prev == next) {
            return;
        }
        state = next;
        switch (next) {
            case OPEN -> {
                lastOpenedAt = clock.instant();
                consecutiveSuccesses = 0;
            }
            case HALF_OPEN -> consecutiveSuccesses = 0;
            case CLOSED -> {
                consecutiveFailures = 0;
                consecutiveSuccesses = 0;
            }
        }
        if (next == CircuitState.OPEN) {
            log.warn("[CircuitBreaker] name={} {} -> {}, failures={}, openDuration={}ms, cause={}",
                    name, prev, next, consecutiveFailures, options.getOpenDuration().toMillis(),
                    trigger == null ? null : trigger.toString());
        } else {
            log.info("[CircuitBreaker] name={} {} -> {}", name, prev, next);
        }
        CircuitStateChange change = new CircuitStateChange(name, prev, next, trigger, clock.instant());
        for (CircuitStateListener l : listeners) {
            try {
                l.onStateChange(change);
            } catch (RuntimeException e) {
                log.error("[CircuitBreaker] name={} state listener failed", name, e);
            }
        }
    }
}
