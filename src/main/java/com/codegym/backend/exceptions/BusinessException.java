package com.codegym.backend.exceptions;

import java.util.List;

/**
 * A well-formed request that breaks a business rule. Mapped to 422.
 */
public class BusinessException extends RuntimeException {

    private final List<String> errors;

    public BusinessException(String message) {
        this(message, List.of(message));
    }

    public BusinessException(String message, List<String> errors) {
        super(message);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
