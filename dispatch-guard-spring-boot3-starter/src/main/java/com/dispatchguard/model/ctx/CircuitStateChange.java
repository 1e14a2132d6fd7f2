package com.dispatchguard.model.ctx;

import com.dispatchguard.model.enums.CircuitState;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 熔断器状态变更事件
 */
@Getter
@ToString
@AllArgsConstructor
public final class CircuitStateChange {

    /** 熔断器名称 */
    private final String circuitName;

    private final CircuitState previousState;

    private final CircuitState newState;

    /** 触发变更的异常, 手动重置时为 null */
    private final Throwable trigger;

    private final Instant when;
}
