package com.dispatchguard.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 进入死信的原因
 */
@AllArgsConstructor
@Getter
public enum DeadLetterReason {
    MAX_RETRIES_EXCEEDED("Max retries exceeded"),
    CIRCUIT_BREAKER_OPEN("Circuit breaker open"),
    DESERIALIZATION_FAILED("Deserialization failed"),
    HANDLER_NOT_FOUND("Handler not found"),
    VALIDATION_FAILED("Validation failed"),
    MANUAL_REJECTION("Manual rejection"),
    MESSAGE_EXPIRED("Message expired"),
    AUTHORIZATION_FAILED("Authorization failed"),
    UNHANDLED_EXCEPTION("Unhandled exception"),
    POISON_MESSAGE("Poison message"),
    UNKNOWN("Unknown")
    ;

    public final String desc;
}
