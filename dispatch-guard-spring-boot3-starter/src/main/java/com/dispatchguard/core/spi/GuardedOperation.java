package com.dispatchguard.core.spi;

import com.dispatchguard.core.cancel.CancellationToken;

/**
 * 被保护的操作（发布/处理一条消息等）
 */
@FunctionalInterface
public interface GuardedOperation<T> {

    T execute(CancellationToken token) throws Exception;
}
