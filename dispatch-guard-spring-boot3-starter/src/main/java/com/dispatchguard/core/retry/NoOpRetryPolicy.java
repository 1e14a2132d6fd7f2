package com.dispatchguard.core.retry;

import com.dispatchguard.core.cancel.CancellationToken;
import com.dispatchguard.core.spi.GuardedOperation;
import com.dispatchguard.core.spi.RetryPolicy;

import java.util.Objects;

/**
 * 只执行一次, 异常原样抛出
 */
public final class NoOpRetryPolicy implements RetryPolicy {

    public static final NoOpRetryPolicy INSTANCE = new NoOpRetryPolicy();

    private NoOpRetryPolicy() {
    }

    @Override
    public <T> T execute(GuardedOperation<T> operation, CancellationToken token) throws Exception {
        Objects.requireNonNull(operation, "operation");
        return operation.execute(token == null ? CancellationToken.none() : token);
    }

    /** 不重试, 但不改变故障本身的分类 */
    @Override
    public boolean isRetriable(Throwable failure) {
        return failure != null && !DefaultRetryPolicy.isCancellation(failure);
    }
}
