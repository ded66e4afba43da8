package com.codegym.backend.exceptions;

public class InvalidDurationException extends BadRequestException {

    private final int durationMonths;

    public InvalidDurationException(int durationMonths) {
        super("Package duration must be at least 1 month, got " + durationMonths);
        this.durationMonths = durationMonths;
    }

    public int getDurationMonths() {
        return durationMonths;
    }
}
