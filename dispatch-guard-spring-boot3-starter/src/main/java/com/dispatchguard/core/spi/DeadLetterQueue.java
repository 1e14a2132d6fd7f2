package com.dispatchguard.core.spi;

import com.dispatchguard.model.dlq.DeadLetterEntry;
import com.dispatchguard.model.dlq.DeadLetterMessage;
import com.dispatchguard.model.dlq.DeadLetterQueryFilter;
import com.dispatchguard.model.enums.DeadLetterReason;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 死信队列
 * 序列化失败时以 toString 快照入队; 存储失败抛 {@link com.dispatchguard.exception.DeadLetterStoreException},
 * 返回的 id 一定已持久化
 */
public interface DeadLetterQueue {

    UUID enqueue(Object message, DeadLetterReason reason);

    UUID enqueue(Object message, DeadLetterReason reason, Throwable exception, Map<String, String> metadata);

    UUID enqueue(DeadLetterMessage message, DeadLetterReason reason, Throwable exception, Map<String, String> metadata);

    Optional<DeadLetterEntry> getEntry(UUID id);

    /** 按入队时间倒序 */
    List<DeadLetterEntry> getEntries(DeadLetterQueryFilter filter, int limit);

    long getCount(DeadLetterQueryFilter filter);

    /**
     * 重放单条; 不存在、已重放、未配置处理器或处理器失败时返回 false
     */
    boolean replay(UUID id);

    /** 逐条重放, 返回成功条数; 不保证批次原子性 */
    int replayBatch(DeadLetterQueryFilter filter);

    boolean purge(UUID id);

    int purgeOlderThan(Duration age);
}
