package com.codegym.backend.exceptions;

import com.codegym.backend.services.plans.PlanValidationResult;

/**
 * Thrown when a submitted workout plan is rejected. Nothing of the plan has
 * been persisted when this is raised.
 */
public class PlanValidationException extends BusinessException {

    public PlanValidationException(PlanValidationResult result) {
        super("Workout plan rejected", result.messages());
    }
}
