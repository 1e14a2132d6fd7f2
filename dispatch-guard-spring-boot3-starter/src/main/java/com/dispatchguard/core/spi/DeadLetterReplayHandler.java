package com.dispatchguard.core.spi;

import com.dispatchguard.model.dlq.DeadLetterMessage;

/**
 * 死信重放处理器, 抛出异常表示本次重放失败, 条目保持待重放
 */
@FunctionalInterface
public interface DeadLetterReplayHandler {

    void replay(DeadLetterMessage message) throws Exception;
}
