package com.codegym.backend.services.plans;

public record RowValidationError(int rowIndex, String reason) {

    public String message() {
        return "Row " + (rowIndex + 1) + ": " + reason;
    }
}
