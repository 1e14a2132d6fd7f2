package com.dispatchguard.core.spi;

import com.dispatchguard.core.cancel.CancellationToken;
import com.dispatchguard.model.ctx.DispatchContext;

/**
 * 传输层发布入口, 由接入方实现
 */
@FunctionalInterface
public interface MessageBus {

    void publish(Object message, DispatchContext context, CancellationToken token) throws Exception;
}
