package com.dispatchguard.core.spi;

import java.time.Duration;

/**
 * 退避计算（第 attempt 次失败后到下一次尝试之间的等待时长）
 */
public interface BackoffCalculator {

    /** 策略名称（如 "fixed"、"linear"、"exponential"） */
    String name();

    /**
     * 计算等待时长
     * @param attempt 第几次尝试, 从1开始
     * @return 等待时长, 不超过配置的上限
     * @throws IllegalArgumentException attempt 小于 1
     */
    Duration calculateDelay(int attempt);
}
