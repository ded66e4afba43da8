package com.codegym.backend.services.plans;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of a single plan submission check.
 *
 * @param rowErrors      problems of individual rows, in row order
 * @param dayCountError  present when the distinct training days exceed the cap
 * @param emptyPlan      true when no row survived validation
 * @param distinctDays   normalized day tokens collected from the valid rows
 * @param validRows      rows ready to be persisted if the plan is accepted
 */
public record PlanValidationResult(
        List<RowValidationError> rowErrors,
        TooManyTrainingDays dayCountError,
        boolean emptyPlan,
        Set<String> distinctDays,
        List<ValidatedRow> validRows
) {

    public static final String EMPTY_PLAN_MESSAGE = "Please add at least one exercise.";

    public PlanValidationResult {
        rowErrors = List.copyOf(rowErrors);
        distinctDays = Collections.unmodifiableSortedSet(new TreeSet<>(distinctDays));
        validRows = List.copyOf(validRows);
    }

    public boolean accepted() {
        return rowErrors.isEmpty() && dayCountError == null && !emptyPlan;
    }

    public List<String> messages() {
        List<String> messages = new ArrayList<>();
        rowErrors.forEach(error -> messages.add(error.message()));
        if (dayCountError != null) {
            messages.add(dayCountError.message());
        }
        if (emptyPlan) {
            messages.add(EMPTY_PLAN_MESSAGE);
        }
        return messages;
    }
}
