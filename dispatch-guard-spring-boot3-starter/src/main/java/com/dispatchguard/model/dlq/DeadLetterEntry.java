package com.dispatchguard.model.dlq;

import com.dispatchguard.model.enums.DeadLetterReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 死信条目
 * 仅在入队时创建, 仅成功重放会修改 replayed/replayedAt, 仅显式清理会删除
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"payload", "exceptionStackTrace"})
public class DeadLetterEntry {

    public static final String KEY_CORRELATION_ID = "CorrelationId";
    public static final String KEY_CAUSATION_ID = "CausationId";
    public static final String KEY_SOURCE_QUEUE = "SourceQueue";
    public static final String KEY_ATTEMPTS = "Attempts";

    private UUID id;

    private String messageType;

    private byte[] payload;

    private DeadLetterReason reason;

    private String exceptionMessage;

    private String exceptionStackTrace;

    private Instant enqueuedAt;

    private int originalAttempts;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    private String correlationId;

    private String causationId;

    private String sourceQueue;

    private boolean replayed;

    private Instant replayedAt;

    public DeadLetterMessage toMessage() {
        return new DeadLetterMessage(messageType, payload == null ? new byte[0] : payload, metadata);
    }
}
