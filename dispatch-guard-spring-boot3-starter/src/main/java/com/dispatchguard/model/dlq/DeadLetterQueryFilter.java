package com.dispatchguard.model.dlq;

import com.dispatchguard.model.enums.DeadLetterReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 死信查询条件, 所有非空条件按 AND 组合
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterQueryFilter {

    /** 子串匹配 */
    private String messageType;

    private DeadLetterReason reason;

    /** 含 */
    private Instant fromDate;

    /** 含 */
    private Instant toDate;

    private Boolean replayed;

    private String sourceQueue;

    private String correlationId;

    private Integer minAttempts;

    /** 按时间倒序排序后跳过的条数 */
    private int skip;

    public static DeadLetterQueryFilter all() {
        return new DeadLetterQueryFilter();
    }

    public static DeadLetterQueryFilter byReason(DeadLetterReason reason) {
        return DeadLetterQueryFilter.builder().reason(reason).build();
    }

    public static DeadLetterQueryFilter byMessageType(String messageType) {
        return DeadLetterQueryFilter.builder().messageType(messageType).build();
    }

    public static DeadLetterQueryFilter pendingOnly() {
        return DeadLetterQueryFilter.builder().replayed(false).build();
    }

    public static DeadLetterQueryFilter replayedOnly() {
        return DeadLetterQueryFilter.builder().replayed(true).build();
    }

    public static DeadLetterQueryFilter byDateRange(Instant from, Instant to) {
        return DeadLetterQueryFilter.builder().fromDate(from).toDate(to).build();
    }

    public static DeadLetterQueryFilter byCorrelationId(String correlationId) {
        return DeadLetterQueryFilter.builder().correlationId(correlationId).build();
    }

    public static DeadLetterQueryFilter bySourceQueue(String sourceQueue) {
        return DeadLetterQueryFilter.builder().sourceQueue(sourceQueue).build();
    }

    public boolean matches(DeadLetterEntry e) {
        if (messageType != null && (e.getMessageType() == null || !e.getMessageType().contains(messageType))) {
            return false;
        }
        if (reason != null && e.getReason() != reason) {
            return false;
        }
        if (fromDate != null && e.getEnqueuedAt().isBefore(fromDate)) {
            return false;
        }
        if (toDate != null && e.getEnqueuedAt().isAfter(toDate)) {
            return false;
        }
        if (replayed != null && e.isReplayed() != replayed) {
            return false;
        }
        if (sourceQueue != null && !sourceQueue.equals(e.getSourceQueue())) {
            return false;
        }
        if (correlationId != null && !correlationId.equals(e.getCorrelationId())) {
            return false;
        }
        return minAttempts == null || e.getOriginalAttempts() >= minAttempts;
    }
}
