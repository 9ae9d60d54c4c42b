package com.tasflow.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery state of an outbox task.
 * PENDING -> IN_PROGRESS -> DONE, or back to PENDING on failure until attempts run out (FAILED).
 */
public enum OutboxTaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    DONE("done"),
    FAILED("failed");

    private final String value;

    OutboxTaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static OutboxTaskStatus fromValue(String value) {
        for (OutboxTaskStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown OutboxTaskStatus: " + value);
    }
}
