package com.codegym.backend.exceptions;

import java.util.List;

/**
 * Carries every problem found while checking a form, so the client can show
 * them all at once instead of one per round trip.
 */
public class ValidationErrorsException extends BadRequestException {

    private final List<String> errors;

    public ValidationErrorsException(List<String> errors) {
        super(errors == null || errors.isEmpty() ? "Invalid request" : errors.get(0));
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
