package com.dispatchguard.core.dispatch;

import com.dispatchguard.core.cancel.CancellationToken;
import com.dispatchguard.core.metric.GuardMetrics;
import com.dispatchguard.core.spi.CircuitBreaker;
import com.dispatchguard.core.spi.DeadLetterQueue;
import com.dispatchguard.core.spi.MessageBus;
import com.dispatchguard.core.spi.RetryPolicy;
import com.dispatchguard.core.spi.TransportCircuitBreakerRegistry;
import com.dispatchguard.exception.CircuitBreakerOpenException;
import com.dispatchguard.model.DispatchResult;
import com.dispatchguard.model.ctx.DispatchContext;
import com.dispatchguard.model.dlq.DeadLetterEntry;
import com.dispatchguard.model.enums.DeadLetterReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 带重试、熔断与死信兜底的派发
 * retry( breaker( bus.publish ) ), 失败按原因进入死信:
 * - 熔断打开 -> CIRCUIT_BREAKER_OPEN
 * - 可重试故障重试耗尽 -> MAX_RETRIES_EXCEEDED
 * - 不可重试故障 -> UNHANDLED_EXCEPTION
 * 取消直接向上抛出, 不进入死信
 */
public class ResilientDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ResilientDispatcher.class);

    public static final String KEY_TRANSPORT = "Transport";
    public static final String KEY_MESSAGE_ID = "MessageId";
    public static final String KEY_EXCEPTION_TYPE = "ExceptionType";

    private final MessageBus bus;

    private final RetryPolicy retryPolicy;

    private final TransportCircuitBreakerRegistry registry;

    private final DeadLetterQueue dlq;

    private final GuardMetrics metrics;

    public ResilientDispatcher(MessageBus bus, RetryPolicy retryPolicy,
                               TransportCircuitBreakerRegistry registry, DeadLetterQueue dlq) {
        this(bus, retryPolicy, registry, dlq, GuardMetrics.noop());
    }

    public ResilientDispatcher(MessageBus bus, RetryPolicy retryPolicy,
                               TransportCircuitBreakerRegistry registry, DeadLetterQueue dlq,
                               GuardMetrics metrics) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dlq = Objects.requireNonNull(dlq, "dlq");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public DispatchResult dispatch(Object message, DispatchContext context) {
        return dispatch(message, context, CancellationToken.none());
    }

    /**
     * @throws CancellationException 调用方取消
     * @throws com.dispatchguard.exception.DeadLetterStoreException 投递失败且死信落库失败, 投递异常挂在 suppressed 上
     */
    public DispatchResult dispatch(Object message, DispatchContext context, CancellationToken token) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(context, "context");
        CircuitBreaker breaker = registry.getOrCreate(context.getTransportName());
        AtomicInteger attempts = new AtomicInteger();

        try {
            retryPolicy.run(ct -> {
                context.setAttempt(attempts.incrementAndGet());
                breaker.run(inner -> bus.publish(message, context, inner), ct);
            }, token);
        } catch (CancellationException e) {
            log.info("[Dispatch] cancelled transport={} messageId={} attempts={}",
                    context.getTransportName(), context.getMessageId(), attempts.get());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException ce = new CancellationException("dispatch interrupted");
            ce.initCause(e);
            throw ce;
        } catch (CircuitBreakerOpenException e) {
            return deadLetter(message, context, attempts.get(), DeadLetterReason.CIRCUIT_BREAKER_OPEN, e);
        } catch (Exception e) {
            DeadLetterReason reason = retryPolicy.isRetriable(e)
                    ? DeadLetterReason.MAX_RETRIES_EXCEEDED
                    : DeadLetterReason.UNHANDLED_EXCEPTION;
            return deadLetter(message, context, attempts.get(), reason, e);
        }

        metrics.incPublished();
        log.debug("[Dispatch] published transport={} messageId={} attempts={}",
                context.getTransportName(), context.getMessageId(), attempts.get());
        return DispatchResult.published(attempts.get());
    }

    private DispatchResult deadLetter(Object message, DispatchContext context, int attempts,
                                      DeadLetterReason reason, Exception cause) {
        Map<String, String> metadata = new HashMap<>();
        if (context.getHeaders() != null) {
            metadata.putAll(context.getHeaders());
        }
        metadata.put(KEY_TRANSPORT, context.getTransportName());
        metadata.put(KEY_EXCEPTION_TYPE, cause.getClass().getName());
        metadata.put(DeadLetterEntry.KEY_ATTEMPTS, String.valueOf(attempts));
        putIfPresent(metadata, KEY_MESSAGE_ID, context.getMessageId());
        putIfPresent(metadata, DeadLetterEntry.KEY_CORRELATION_ID, context.getCorrelationId());
        putIfPresent(metadata, DeadLetterEntry.KEY_CAUSATION_ID, context.getCausationId());
        putIfPresent(metadata, DeadLetterEntry.KEY_SOURCE_QUEUE, context.getSourceQueue());

        UUID id;
        try {
            id = dlq.enqueue(message, reason, cause, metadata);
        } catch (RuntimeException e) {
            e.addSuppressed(cause);
            log.error("[Dispatch] dead-letter store failed, message lost unless caller retries: transport={} messageId={} reason={}",
                    context.getTransportName(), context.getMessageId(), reason);
            throw e;
        }
        log.warn("[Dispatch] dead-lettered transport={} messageId={} reason={} attempts={} dlqId={}",
                context.getTransportName(), context.getMessageId(), reason, attempts, id);
        return DispatchResult.deadLettered(attempts, id, reason);
    }

    private static void putIfPresent(Map<String, String> m, String key, String value) {
        if (value != null) {
            m.put(key, value);
        }
    }
}
