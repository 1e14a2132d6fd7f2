package com.dispatchguard.core.spi;

/**
 * 死信载荷序列化
 */
public interface MessageSerializer {

    byte[] serialize(Object message);

    <T> T deserialize(byte[] payload, Class<T> type);
}
