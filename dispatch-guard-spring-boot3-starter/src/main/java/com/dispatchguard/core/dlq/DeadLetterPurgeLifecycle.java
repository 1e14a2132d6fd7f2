package com.dispatchguard.core.dlq;

import com.dispatchguard.core.spi.DeadLetterQueue;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 周期清理超过保留期的死信
 * 单线程调度, 清理失败只记录日志, 下个周期继续
 */
public class DeadLetterPurgeLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterPurgeLifecycle.class);

    private final DeadLetterQueue dlq;

    private final Duration retention;

    private final Duration initialDelay;

    private final Duration period;

    private final boolean enabled;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;

    public DeadLetterPurgeLifecycle(DeadLetterQueue dlq, Duration retention,
                                    Duration initialDelay, Duration period, boolean enabled) {
        this.dlq = Objects.requireNonNull(dlq, "dlq");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.period = Objects.requireNonNull(period, "period");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("purge period must be positive");
        }
        this.enabled = enabled;
    }

    @Override
    public void start() {
        if (!enabled) {
            log.info("[DLQ-Purge] start skipped: disabled");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("dispatch-guard-dlq-purge"));
        scheduler.scheduleWithFixedDelay(this::purgeOnce,
                initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[DLQ-Purge] started: retention={}, period={}ms, first run in {}ms",
                retention, period.toMillis(), initialDelay.toMillis());
    }

    /**
     * 执行一次清理, 返回删除条数; 失败返回 -1
     */
    public int purgeOnce() {
        try {
            int n = dlq.purgeOlderThan(retention);
            log.debug("[DLQ-Purge] purged {} entries", n);
            return n;
        } catch (RuntimeException e) {
            // 不能抛出, 否则调度线程会终止后续周期
            log.error("[DLQ-Purge] purge failed, retention={}", retention, e);
            return -1;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdownNow();
        log.info("[DLQ-Purge] stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
