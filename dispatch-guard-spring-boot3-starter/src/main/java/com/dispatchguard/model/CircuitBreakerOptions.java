package com.dispatchguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 熔断器参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerOptions {

    /** 连续失败多少次后打开 */
    @Builder.Default
    private int failureThreshold = 5;

    /** 打开状态持续时长, 到期后读状态时转为半开 */
    @Builder.Default
    private Duration openDuration = Duration.ofSeconds(30);

    /** 半开状态下连续成功多少次后关闭 */
    @Builder.Default
    private int successThreshold = 3;

    /** 只有匹配的异常才计入失败; 为空表示全部计入 */
    private Predicate<Throwable> shouldHandle;

    public static CircuitBreakerOptions defaults() {
        return new CircuitBreakerOptions();
    }

    public boolean handles(Throwable t) {
        return shouldHandle == null || shouldHandle.test(t);
    }
}
