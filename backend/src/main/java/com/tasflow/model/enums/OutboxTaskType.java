package com.tasflow.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Downstream side effect recorded by a committed workflow change.
 */
public enum OutboxTaskType {
    VIDEO_SYNC("video_sync"),
    GRANT_PUBLICATION_ROLES("grant_publication_roles"),
    NOTIFY_PUBLISHED("notify_published");

    private final String value;

    OutboxTaskType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static OutboxTaskType fromValue(String value) {
        for (OutboxTaskType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown OutboxTaskType: " + value);
    }
}
