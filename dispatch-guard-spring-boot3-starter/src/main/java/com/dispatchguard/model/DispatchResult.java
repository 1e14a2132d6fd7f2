package com.dispatchguard.model;

import com.dispatchguard.model.enums.DeadLetterReason;
import com.dispatchguard.model.enums.DispatchStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * 派发结果
 */
@Getter
@ToString
@AllArgsConstructor
public final class DispatchResult {

    private final DispatchStatus status;

    /** 实际调用传输层的次数 */
    private final int attempts;

    /** 仅 DEAD_LETTERED 时非空 */
    private final UUID deadLetterId;

    private final DeadLetterReason reason;

    public static DispatchResult published(int attempts) {
        return new DispatchResult(DispatchStatus.PUBLISHED, attempts, null, null);
    }

    public static DispatchResult deadLettered(int attempts, UUID id, DeadLetterReason reason) {
        return new DispatchResult(DispatchStatus.DEAD_LETTERED, attempts, id, reason);
    }

    public boolean isPublished() {
        return status == DispatchStatus.PUBLISHED;
    }
}
