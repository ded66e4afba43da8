package com.codegym.backend.exceptions;

/**
 * Thrown when a request clashes with existing data: a duplicated email or
 * username, or deleting a row that other records still reference.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
