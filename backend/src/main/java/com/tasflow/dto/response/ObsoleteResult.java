package com.tasflow.dto.response;

import com.tasflow.model.enums.FailureKind;

public record ObsoleteResult(String errorMessage, FailureKind failureKind) {

    public boolean isSuccess() {
        return errorMessage == null;
    }

    public static ObsoleteResult successful() {
        return new ObsoleteResult(null, null);
    }

    public static ObsoleteResult error(FailureKind kind, String message) {
        return new ObsoleteResult(message, kind);
    }
}
