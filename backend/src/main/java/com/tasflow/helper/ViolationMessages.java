package com.tasflow.helper;

import jakarta.validation.ConstraintViolation;

import java.util.Set;
import java.util.stream.Collectors;

public final class ViolationMessages {

    private ViolationMessages() {
    }

    /**
     * One line per violated property, sorted so messages are stable.
     */
    public static <T> String describe(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
            .map(v -> v.getPropertyPath() + " " + v.getMessage())
            .sorted()
            .collect(Collectors.joining(", "));
    }
}
