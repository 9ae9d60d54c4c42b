package com.tasflow.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of URL attached to a publication.
 */
public enum PublicationUrlType {
    STREAMING("streaming"),
    MIRROR("mirror");

    private final String value;

    PublicationUrlType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PublicationUrlType fromValue(String value) {
        for (PublicationUrlType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown PublicationUrlType: " + value);
    }
}
