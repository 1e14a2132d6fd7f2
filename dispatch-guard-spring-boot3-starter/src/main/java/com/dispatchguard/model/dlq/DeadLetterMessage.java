package com.dispatchguard.model.dlq;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 死信消息快照: 类型标识 + 序列化后的载荷 + 元数据
 * 重放时交给 {@link com.dispatchguard.core.spi.DeadLetterReplayHandler}
 */
@Getter
@ToString(exclude = "payload")
public final class DeadLetterMessage {

    /** 消息类型标识, 默认为消息类的全限定名 */
    private final String messageType;

    private final byte[] payload;

    private final Map<String, String> metadata;

    public DeadLetterMessage(String messageType, byte[] payload, Map<String, String> metadata) {
        if (messageType == null || messageType.isBlank()) {
            throw new IllegalArgumentException("messageType must not be blank");
        }
        this.messageType = messageType;
        this.payload = Objects.requireNonNull(payload, "payload").clone();
        this.metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    /** 返回副本, 快照本身不可变 */
    public byte[] getPayload() {
        return payload.clone();
    }
}
