package com.dispatchguard.core.notify;

import com.dispatchguard.core.spi.CircuitStateListener;
import com.dispatchguard.model.ctx.CircuitStateChange;
import com.dispatchguard.model.enums.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把熔断状态变更输出到独立的 logger, 便于单独路由告警
 */
public class LoggingCircuitStateListener implements CircuitStateListener {

    private static final Logger log = LoggerFactory.getLogger("dispatch.guard.circuit");

    @Override
    public void onStateChange(CircuitStateChange change) {
        if (change.getNewState() == CircuitState.OPEN) {
            log.warn("[Circuit-Notify] circuit={} {} -> {} at {}, trigger={}",
                    change.getCircuitName(), change.getPreviousState(), change.getNewState(), change.getWhen(),
                    change.getTrigger() == null ? null : change.getTrigger().toString());
        } else {
            log.info("[Circuit-Notify] circuit={} {} -> {} at {}",
                    change.getCircuitName(), change.getPreviousState(), change.getNewState(), change.getWhen());
        }
    }
}
