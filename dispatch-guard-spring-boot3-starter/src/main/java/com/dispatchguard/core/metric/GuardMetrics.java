package com.dispatchguard.core.metric;

import com.dispatchguard.model.enums.CircuitState;
import com.dispatchguard.model.enums.DeadLetterReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public final class GuardMetrics {

    private final MeterRegistry reg;

    private final Counter retries;

    private final Counter published;

    private final Counter replayed;

    private GuardMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.retries = Counter.builder("dispatch.guard.retry").description("retry attempts scheduled").register(reg);
        this.published = Counter.builder("dispatch.guard.dispatch.published").description("messages published").register(reg);
        this.replayed = Counter.builder("dispatch.guard.dlq.replayed").description("dead letters replayed").register(reg);
    }

    public static GuardMetrics create(MeterRegistry reg) {
        return new GuardMetrics(reg);
    }

    /** 不接入任何后端, 用于独立使用的组件 */
    public static GuardMetrics noop() {
        return new GuardMetrics(new SimpleMeterRegistry());
    }

    public void incRetry() { retries.increment(); }

    public void incPublished() { published.increment(); }

    public void incReplayed() { replayed.increment(); }

    public void incTransition(String circuitName, CircuitState from, CircuitState to) {
        Counter.builder("dispatch.guard.circuit.transition")
                .description("circuit state transitions")
                .tag("name", circuitName)
                .tag("from", from.name())
                .tag("to", to.name())
                .register(reg)
                .increment();
    }

    public void incDeadLettered(DeadLetterReason reason) {
        Counter.builder("dispatch.guard.dlq.enqueued")
                .description("messages dead-lettered")
                .tag("reason", reason.name())
                .register(reg)
                .increment();
    }

    public MeterRegistry getRegistry() {
        return reg;
    }
}
