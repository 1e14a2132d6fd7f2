package com.dispatchguard.model.ctx;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 派发上下文, 随消息一起交给传输层
 */
@Data
@Builder
public class DispatchContext {

    /** 目标传输（队列/主题/连接）名称, 用于选择熔断器 */
    private String transportName;

    private String messageId;

    private String correlationId;

    private String causationId;

    /** 消息来源队列 */
    private String sourceQueue;

    /** 当前第几次尝试, 由派发器维护 */
    private int attempt;

    private Map<String, String> headers;
}
