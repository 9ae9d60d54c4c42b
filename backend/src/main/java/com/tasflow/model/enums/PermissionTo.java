package com.tasflow.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Permission facts supplied by the authentication layer for the acting user.
 */
public enum PermissionTo {
    SUBMIT_MOVIES("submit_movies"),
    EDIT_SUBMISSIONS("edit_submissions"),
    JUDGE_SUBMISSIONS("judge_submissions"),
    PUBLISH_MOVIES("publish_movies"),
    OVERRIDE_SUBMISSION_CONSTRAINTS("override_submission_constraints");

    private final String value;

    PermissionTo(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PermissionTo fromValue(String value) {
        for (PermissionTo permission : values()) {
            if (permission.value.equals(value)) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown PermissionTo: " + value);
    }
}
