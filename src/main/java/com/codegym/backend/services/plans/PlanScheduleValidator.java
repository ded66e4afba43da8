package com.codegym.backend.services.plans;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

import org.springframework.stereotype.Component;

/**
 * Checks a proposed workout plan against the weekly training-day cap.
 *
 * <p>Every row is evaluated even after a failure so the trainer sees all
 * problems in one go. Invalid rows never contribute days to the cap check.
 * The cap is passed in on each call; this class keeps no state between
 * submissions.</p>
 */
@Component
public class PlanScheduleValidator {

    static final String MISSING_FIELDS = "Please fill in every field for each exercise.";
    static final String UNKNOWN_EXERCISE = "Exercise not found.";
    static final String INVALID_SETS = "Sets must be a positive whole number.";
    static final String MISSING_DAYS = "At least one training day is required.";

    public PlanValidationResult validate(List<PlanRow> rows, Predicate<UUID> exerciseExists, int maxTrainingDays) {
        List<RowValidationError> rowErrors = new ArrayList<>();
        List<ValidatedRow> validRows = new ArrayList<>();
        Set<String> distinctDays = new LinkedHashSet<>();

        List<PlanRow> safeRows = rows == null ? List.of() : rows;

        for (int i = 0; i < safeRows.size(); i++) {
            PlanRow row = safeRows.get(i);

            if (row == null || isBlank(row.exerciseId()) || isBlank(row.sets())
                    || isBlank(row.reps()) || isBlank(row.scheduleDay())) {
                rowErrors.add(new RowValidationError(i, MISSING_FIELDS));
                continue;
            }

            UUID exerciseId = parseExerciseId(row.exerciseId());
            if (exerciseId == null || !exerciseExists.test(exerciseId)) {
                rowErrors.add(new RowValidationError(i, UNKNOWN_EXERCISE));
                continue;
            }

            Integer sets = parseSets(row.sets());
            if (sets == null) {
                rowErrors.add(new RowValidationError(i, INVALID_SETS));
                continue;
            }

            Set<String> rowDays = normalizeDays(row.scheduleDay());
            if (rowDays.isEmpty()) {
                rowErrors.add(new RowValidationError(i, MISSING_DAYS));
                continue;
            }

            distinctDays.addAll(rowDays);
            validRows.add(new ValidatedRow(
                    i,
                    exerciseId,
                    sets,
                    row.reps().trim(),
                    row.scheduleDay().trim(),
                    rowDays
            ));
        }

        TooManyTrainingDays dayCountError = distinctDays.size() > maxTrainingDays
                ? new TooManyTrainingDays(maxTrainingDays, distinctDays.size())
                : null;

        return new PlanValidationResult(
                rowErrors,
                dayCountError,
                validRows.isEmpty(),
                distinctDays,
                validRows
        );
    }

    /**
     * Splits a comma-separated day field into trimmed, lowercased, non-empty tokens.
     */
    public static Set<String> normalizeDays(String scheduleDay) {
        Set<String> days = new LinkedHashSet<>();
        if (scheduleDay == null) {
            return days;
        }
        for (String token : scheduleDay.split(",")) {
            String normalized = token.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                days.add(normalized);
            }
        }
        return days;
    }

    // whole numbers only; "2.5" is not truncated
    private static Integer parseSets(String raw) {
        try {
            int sets = Integer.parseInt(raw.trim());
            return sets >= 1 ? sets : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private UUID parseExerciseId(String raw) {
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
