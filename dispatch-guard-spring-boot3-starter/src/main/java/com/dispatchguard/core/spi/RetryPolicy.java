package com.dispatchguard.core.spi;

import com.dispatchguard.core.cancel.CancellationToken;

/**
 * 重试策略
 * 失败重试耗尽后原样抛出最后一次的异常; 取消永远不重试
 */
public interface RetryPolicy {

    <T> T execute(GuardedOperation<T> operation, CancellationToken token) throws Exception;

    default void run(GuardedAction action, CancellationToken token) throws Exception {
        execute(action.asOperation(), token);
    }

    /**
     * 异常分类: true 表示按配置属于可重试（瞬时）故障, false 表示永久故障或取消
     */
    boolean isRetriable(Throwable failure);
}
