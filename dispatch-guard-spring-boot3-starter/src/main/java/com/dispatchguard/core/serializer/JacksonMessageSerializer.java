package com.dispatchguard.core.serializer;

import com.dispatchguard.core.spi.MessageSerializer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Objects;

public class JacksonMessageSerializer implements MessageSerializer {

    private final ObjectMapper mapper;

    public JacksonMessageSerializer() {
        this(createDefaultMapper());
    }

    public JacksonMessageSerializer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] serialize(Object message) {
        Objects.requireNonNull(message, "message");
        try {
            return mapper.writeValueAsBytes(message);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize " + message.getClass().getName() + " to JSON", e);
        }
    }

    @Override
    public <T> T deserialize(byte[] payload, Class<T> type) {
        if (payload == null || payload.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize JSON to " + type.getName(), e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        // 时间按 ISO-8601 输出, 便于人工排查死信
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        m.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        m.findAndRegisterModules();
        return m;
    }
}
