package com.codegym.backend.services.util;

import java.util.UUID;

import com.codegym.backend.exceptions.BadRequestException;
import com.codegym.backend.exceptions.ResourceNotFoundException;

/**
 * Path and body ids arrive as strings.
 */
public final class EntityIds {

    private EntityIds() {
    }

    /**
     * Parses an id that must point at an existing row. A malformed id can never
     * match one, so it is reported the same way as a missing row.
     */
    public static UUID parseExisting(String id, String entityName) {
        try {
            return UUID.fromString(id == null ? "" : id.trim());
        } catch (IllegalArgumentException e) {
            throw new ResourceNotFoundException(entityName + " not found");
        }
    }

    /**
     * Parses an optional filter id; blank means "no filter".
     */
    public static UUID parseOptional(String id, String parameterName) {
        if (id == null || id.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(id.trim());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Invalid " + parameterName + ": " + id);
        }
    }
}
