package com.dispatchguard.core.spi;

import com.dispatchguard.core.cancel.CancellationToken;

/**
 * 无返回值的被保护操作
 */
@FunctionalInterface
public interface GuardedAction {

    void run(CancellationToken token) throws Exception;

    default GuardedOperation<Void> asOperation() {
        return token -> {
            run(token);
            return null;
        };
    }
}
