package com.codegym.backend.services.plans;

public record TooManyTrainingDays(int maxTrainingDays, int distinctDayCount) {

    public String message() {
        return "Training schedule exceeds the maximum of " + maxTrainingDays
                + " training days per week. " + distinctDayCount + " distinct days were selected.";
    }
}
