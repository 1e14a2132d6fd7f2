package com.dispatchguard.core.spi;

import com.dispatchguard.model.ctx.CircuitStateChange;

/**
 * 熔断器状态变更订阅者
 * 在执行状态变更的线程上同步回调, 回调顺序与变更顺序一致; 实现应尽量轻量
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(CircuitStateChange change);
}
