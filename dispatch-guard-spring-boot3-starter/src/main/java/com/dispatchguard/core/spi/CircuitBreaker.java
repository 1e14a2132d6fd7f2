package com.dispatchguard.core.spi;

import com.dispatchguard.core.cancel.CancellationToken;
import com.dispatchguard.model.CircuitBreakerOptions;
import com.dispatchguard.model.enums.CircuitState;

import java.time.Instant;

/**
 * 熔断器
 * CLOSED --(连续失败达到阈值)--> OPEN --(openDuration 到期, 读状态时惰性判断)--> HALF_OPEN
 * HALF_OPEN --(连续成功达到阈值)--> CLOSED, HALF_OPEN --(任一失败)--> OPEN
 */
public interface CircuitBreaker {

    String getName();

    /** 读取状态, 同时完成 OPEN -> HALF_OPEN 的到期判断 */
    CircuitState getState();

    int getConsecutiveFailures();

    /** 半开探测阶段的连续成功次数 */
    int getConsecutiveSuccesses();

    /** 最近一次进入 OPEN 的时间, 从未打开或已重置为 null */
    Instant getLastOpenedAt();

    CircuitBreakerOptions getOptions();

    /**
     * 执行被保护的操作并自动记录结果
     * @throws com.dispatchguard.exception.CircuitBreakerOpenException 熔断打开
     * @throws Exception 操作本身抛出的异常, 原样透传
     */
    <T> T execute(GuardedOperation<T> operation, CancellationToken token) throws Exception;

    default void run(GuardedAction action, CancellationToken token) throws Exception {
        execute(action.asOperation(), token);
    }

    /** 手动记录失败, exception 可为 null */
    void recordFailure(Throwable exception);

    void recordSuccess();

    /** 强制回到 CLOSED 并清零计数; 已是 CLOSED 时不做任何事 */
    void reset();

    /** 同一监听器重复添加只生效一次 */
    void addListener(CircuitStateListener listener);

    void removeListener(CircuitStateListener listener);
}
