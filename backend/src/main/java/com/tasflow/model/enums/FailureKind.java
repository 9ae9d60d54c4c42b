package com.tasflow.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an expected business failure returned by a workflow operation.
 */
public enum FailureKind {
    /** Referenced submission, publication or user does not exist. */
    NOT_FOUND("not_found"),
    /** Operation is not legal in the current status or claim state, including lost write races. */
    PRECONDITION_FAILED("precondition_failed"),
    /** Request or movie file content is invalid. */
    VALIDATION_FAILED("validation_failed"),
    /** Unexpected fault caught at the operation boundary. */
    UNEXPECTED("unexpected");

    private final String value;

    FailureKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static FailureKind fromValue(String value) {
        for (FailureKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown FailureKind: " + value);
    }
}
