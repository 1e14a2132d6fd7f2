package com.dispatchguard.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 熔断器状态
 */
@AllArgsConstructor
@Getter
public enum CircuitState {
    CLOSED("关闭, 正常放行"),
    OPEN("打开, 快速失败"),
    HALF_OPEN("半开, 放行探测请求")
    ;

    public final String desc;
}
