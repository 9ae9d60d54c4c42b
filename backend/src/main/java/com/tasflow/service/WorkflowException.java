package com.tasflow.service;

import com.tasflow.model.enums.FailureKind;

/**
 * Business failure raised inside a workflow transaction.
 * Throwing it rolls the transaction back; the operation boundary turns it into a result.
 */
public class WorkflowException extends RuntimeException {

    private final FailureKind kind;

    public WorkflowException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public static WorkflowException notFound(String message) {
        return new WorkflowException(FailureKind.NOT_FOUND, message);
    }

    public static WorkflowException preconditionFailed(String message) {
        return new WorkflowException(FailureKind.PRECONDITION_FAILED, message);
    }

    public static WorkflowException validationFailed(String message) {
        return new WorkflowException(FailureKind.VALIDATION_FAILED, message);
    }
}
