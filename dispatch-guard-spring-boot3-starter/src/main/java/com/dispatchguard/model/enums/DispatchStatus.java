package com.dispatchguard.model.enums;

/**
 * 一次派发的最终结果
 */
public enum DispatchStatus {
    /** 已成功发布到传输层 */
    PUBLISHED,

    /** 已转入死信队列 */
    DEAD_LETTERED
}
