package com.dispatchguard.core.dlq;

import com.dispatchguard.core.metric.GuardMetrics;
import com.dispatchguard.core.spi.DeadLetterQueue;
import com.dispatchguard.core.spi.DeadLetterReplayHandler;
import com.dispatchguard.core.spi.MessageSerializer;
import com.dispatchguard.model.dlq.DeadLetterEntry;
import com.dispatchguard.model.dlq.DeadLetterMessage;
import com.dispatchguard.model.dlq.DeadLetterQueryFilter;
import com.dispatchguard.model.enums.DeadLetterReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 入队快照与重放流程的公共部分, 存储相关操作由子类实现
 * 重放流程: claim(原子抢占) -> handler -> markReplayed; handler 失败则 release
 */
public abstract class AbstractDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(AbstractDeadLetterQueue.class);

    /** 堆栈最多保留的帧数 */
    private static final int MAX_STACK_FRAMES = 50;

    protected final MessageSerializer serializer;

    protected final Clock clock;

    private volatile DeadLetterReplayHandler replayHandler;

    private volatile GuardMetrics metrics;

    protected AbstractDeadLetterQueue(MessageSerializer serializer, Clock clock) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void setReplayHandler(DeadLetterReplayHandler replayHandler) {
        this.replayHandler = replayHandler;
    }

    public void setMetrics(GuardMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public UUID enqueue(Object message, DeadLetterReason reason) {
        return enqueue(message, reason, null, null);
    }

    @Override
    public UUID enqueue(Object message, DeadLetterReason reason, Throwable exception, Map<String, String> metadata) {
        Objects.requireNonNull(message, "message");
        if (message instanceof DeadLetterMessage) {
            return enqueue((DeadLetterMessage) message, reason, exception, metadata);
        }
        return enqueue(snapshot(message), reason, exception, metadata);
    }

    @Override
    public UUID enqueue(DeadLetterMessage message, DeadLetterReason reason, Throwable exception, Map<String, String> metadata) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(reason, "reason");

        Map<String, String> merged = new HashMap<>(message.getMetadata());
        if (metadata != null) {
            merged.putAll(metadata);
        }
        DeadLetterEntry entry = DeadLetterEntry.builder()
                .id(UUID.randomUUID())
                .messageType(message.getMessageType())
                .payload(message.getPayload())
                .reason(reason)
                .exceptionMessage(exception == null ? null : exception.getMessage())
                .exceptionStackTrace(renderStackTrace(exception))
                .enqueuedAt(clock.instant())
                .originalAttempts(parseAttempts(merged.get(DeadLetterEntry.KEY_ATTEMPTS)))
                .metadata(merged)
                .correlationId(merged.get(DeadLetterEntry.KEY_CORRELATION_ID))
                .causationId(merged.get(DeadLetterEntry.KEY_CAUSATION_ID))
                .sourceQueue(merged.get(DeadLetterEntry.KEY_SOURCE_QUEUE))
                .build();
        try {
            store(entry);
        } catch (RuntimeException e) {
            // 未落库的 id 不能返回给调用方
            log.error("[DLQ] store failed id={} type={} reason={}", entry.getId(), entry.getMessageType(), reason, e);
            throw e;
        }
        GuardMetrics m = metrics;
        if (m != null) {
            m.incDeadLettered(reason);
        }
        log.warn("[DLQ] enqueued id={} type={} reason={} attempts={} error={}",
                entry.getId(), entry.getMessageType(), reason, entry.getOriginalAttempts(), entry.getExceptionMessage());
        return entry.getId();
    }

    @Override
    public boolean replay(UUID id) {
        Objects.requireNonNull(id, "id");
        DeadLetterReplayHandler handler = replayHandler;
        if (handler == null) {
            log.warn("[DLQ] replay skipped id={}: no replay handler configured", id);
            return false;
        }
        Optional<DeadLetterEntry> claimed = claim(id);
        if (claimed.isEmpty()) {
            log.debug("[DLQ] replay skipped id={}: absent or already replayed", id);
            return false;
        }
        DeadLetterEntry entry = claimed.get();
        try {
            handler.replay(entry.toMessage());
        } catch (Exception e) {
            release(id);
            log.warn("[DLQ] replay failed id={} type={}, entry stays pending: {}", id, entry.getMessageType(), e.toString());
            return false;
        }
        markReplayed(id, clock.instant());
        GuardMetrics m = metrics;
        if (m != null) {
            m.incReplayed();
        }
        log.info("[DLQ] replayed id={} type={}", id, entry.getMessageType());
        return true;
    }

    @Override
    public int replayBatch(DeadLetterQueryFilter filter) {
        List<DeadLetterEntry> candidates = getEntries(filter, Integer.MAX_VALUE);
        int replayed = 0;
        for (DeadLetterEntry e : candidates) {
            if (!e.isReplayed() && replay(e.getId())) {
                replayed++;
            }
        }
        log.info("[DLQ] batch replay finished: candidates={} replayed={}", candidates.size(), replayed);
        return replayed;
    }

    /** 持久化新条目, 失败抛 {@link com.dispatchguard.exception.DeadLetterStoreException} */
    protected abstract void store(DeadLetterEntry entry);

    /** 原子抢占待重放条目, 不存在或已被抢占返回 empty */
    protected abstract Optional<DeadLetterEntry> claim(UUID id);

    /** 重放成功后确认 */
    protected abstract void markReplayed(UUID id, Instant replayedAt);

    /** 重放失败后释放抢占 */
    protected abstract void release(UUID id);

    private DeadLetterMessage snapshot(Object message) {
        byte[] payload;
        try {
            payload = serializer.serialize(message);
        } catch (RuntimeException e) {
            log.warn("[DLQ] serialize failed type={}, falling back to toString: {}",
                    message.getClass().getName(), e.toString());
            payload = String.valueOf(message).getBytes(StandardCharsets.UTF_8);
        }
        return new DeadLetterMessage(message.getClass().getName(), payload, null);
    }

    private static int parseAttempts(String raw) {
        if (raw == null) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.debug("[DLQ] ignored non-numeric Attempts metadata: {}", raw);
            return 0;
        }
    }

    static String renderStackTrace(Throwable e) {
        if (e == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(e.toString());
        int frames = 0;
        Throwable cur = e;
        while (cur != null && frames < MAX_STACK_FRAMES) {
            if (cur != e) {
                sb.append("\nCaused by: ").append(cur);
            }
            for (StackTraceElement el : cur.getStackTrace()) {
                if (frames++ >= MAX_STACK_FRAMES) {
                    sb.append("\n  ...");
                    break;
                }
                sb.append("\n  at ").append(el);
            }
            cur = cur.getCause() == cur ? null : cur.getCause();
        }
        return sb.toString();
    }
}
