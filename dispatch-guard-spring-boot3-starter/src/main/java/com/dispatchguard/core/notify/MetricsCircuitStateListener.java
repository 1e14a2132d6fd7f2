package com.dispatchguard.core.notify;

import com.dispatchguard.core.metric.GuardMetrics;
import com.dispatchguard.core.spi.CircuitStateListener;
import com.dispatchguard.model.ctx.CircuitStateChange;

import java.util.Objects;

public class MetricsCircuitStateListener implements CircuitStateListener {

    private final GuardMetrics metrics;

    public MetricsCircuitStateListener(GuardMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void onStateChange(CircuitStateChange change) {
        metrics.incTransition(change.getCircuitName(), change.getPreviousState(), change.getNewState());
    }
}
