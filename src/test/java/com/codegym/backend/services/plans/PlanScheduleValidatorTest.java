package com.codegym.backend.services.plans;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

import org.junit.jupiter.api.Test;

class PlanScheduleValidatorTest {

    private static final UUID SQUAT = UUID.randomUUID();
    private static final UUID BENCH = UUID.randomUUID();

    private final PlanScheduleValidator validator = new PlanScheduleValidator();
    private final Predicate<UUID> catalog = id -> id.equals(SQUAT) || id.equals(BENCH);

    private static PlanRow row(UUID exercise, Integer sets, String days) {
        return new PlanRow(exercise.toString(), sets == null ? null : sets.toString(), "10", days);
    }

    @Test
    void sevenDistinctDays_withCapOfSix_isRejectedWithBothNumbers() {
        List<PlanRow> rows = List.of(
                row(SQUAT, 3, "mon, tue, wed, thu"),
                row(BENCH, 4, "fri,sat,sun")
        );

        PlanValidationResult result = validator.validate(rows, catalog, 6);

        assertFalse(result.accepted());
        assertNotNull(result.dayCountError());
        assertEquals(6, result.dayCountError().maxTrainingDays());
        assertEquals(7, result.dayCountError().distinctDayCount());
        String message = result.dayCountError().message();
        assertTrue(message.contains("6"));
        assertTrue(message.contains("7"));
    }

    @Test
    void exactlyMaxDays_isAccepted() {
        List<PlanRow> rows = List.of(
                row(SQUAT, 3, "mon,tue,wed"),
                row(BENCH, 3, "thu,fri,sat")
        );

        PlanValidationResult result = validator.validate(rows, catalog, 6);

        assertTrue(result.accepted());
        assertNull(result.dayCountError());
        assertEquals(6, result.distinctDays().size());
        assertEquals(2, result.validRows().size());
    }

    @Test
    void repeatedDays_acrossRows_countOnce() {
        List<PlanRow> rows = List.of(
                row(SQUAT, 3, "Mon, Wed"),
                row(BENCH, 3, " mon ,WED,fri")
        );

        PlanValidationResult result = validator.validate(rows, catalog, 3);

        assertTrue(result.accepted());
        assertEquals(Set.of("mon", "wed", "fri"), result.distinctDays());
    }

    @Test
    void noRows_isEmptyPlan() {
        PlanValidationResult result = validator.validate(List.of(), catalog, 6);

        assertFalse(result.accepted());
        assertTrue(result.emptyPlan());
        assertEquals(List.of(PlanValidationResult.EMPTY_PLAN_MESSAGE), result.messages());
    }

    @Test
    void onlyInvalidRows_isEmptyPlanEvenUnderTheCap() {
        List<PlanRow> rows = List.of(
                new PlanRow(UUID.randomUUID().toString(), "3", "10", "mon"),
                row(SQUAT, 0, "tue")
        );

        PlanValidationResult result = validator.validate(rows, catalog, 6);

        assertFalse(result.accepted());
        assertTrue(result.emptyPlan());
        assertEquals(2, result.rowErrors().size());
        assertTrue(result.distinctDays().isEmpty());
    }

    @Test
    void invalidRows_areAccumulatedAndDoNotStopEvaluation() {
        List<PlanRow> rows = new ArrayList<>();
        rows.add(new PlanRow(SQUAT.toString(), "3", " ", "mon"));
        rows.add(new PlanRow("not-a-uuid", "3", "10", "tue"));
        rows.add(row(BENCH, -1, "wed"));
        rows.add(row(SQUAT, 2, " , ,"));
        rows.add(row(BENCH, 5, "thu"));
        rows.add(null);

        PlanValidationResult result = validator.validate(rows, catalog, 6);

        assertFalse(result.accepted());
        assertFalse(result.emptyPlan());
        assertEquals(5, result.rowErrors().size());
        assertEquals(new RowValidationError(0, PlanScheduleValidator.MISSING_FIELDS), result.rowErrors().get(0));
        assertEquals(new RowValidationError(1, PlanScheduleValidator.UNKNOWN_EXERCISE), result.rowErrors().get(1));
        assertEquals(new RowValidationError(2, PlanScheduleValidator.INVALID_SETS), result.rowErrors().get(2));
        assertEquals(new RowValidationError(3, PlanScheduleValidator.MISSING_DAYS), result.rowErrors().get(3));
        assertEquals(new RowValidationError(5, PlanScheduleValidator.MISSING_FIELDS), result.rowErrors().get(4));
        assertEquals("Row 2: " + PlanScheduleValidator.UNKNOWN_EXERCISE, result.messages().get(1));

        // only the valid row contributes days
        assertEquals(Set.of("thu"), result.distinctDays());
    }

    @Test
    void invalidRowDays_doNotCountTowardsTheCap() {
        List<PlanRow> rows = List.of(
                row(SQUAT, 3, "mon"),
                row(BENCH, 0, "tue,wed,thu,fri,sat,sun")
        );

        PlanValidationResult result = validator.validate(rows, catalog, 1);

        assertNull(result.dayCountError());
        assertEquals(1, result.rowErrors().size());
    }

    @Test
    void rowErrorsAndDayCountError_areReportedTogether() {
        List<PlanRow> rows = List.of(
                row(SQUAT, 3, "mon,tue,wed"),
                row(BENCH, null, "thu")
        );

        PlanValidationResult result = validator.validate(rows, catalog, 2);

        assertEquals(1, result.rowErrors().size());
        assertNotNull(result.dayCountError());
        assertEquals(2, result.messages().size());
    }

    @Test
    void sets_mustBeAWholeNumber() {
        List<PlanRow> rows = List.of(
                new PlanRow(SQUAT.toString(), "2.5", "10", "mon"),
                new PlanRow(SQUAT.toString(), "abc", "10", "tue"),
                new PlanRow(BENCH.toString(), " 4 ", "10", "wed")
        );

        PlanValidationResult result = validator.validate(rows, catalog, 6);

        assertEquals(List.of(
                new RowValidationError(0, PlanScheduleValidator.INVALID_SETS),
                new RowValidationError(1, PlanScheduleValidator.INVALID_SETS)
        ), result.rowErrors());
        assertEquals(1, result.validRows().size());
        assertEquals(4, result.validRows().get(0).sets());
        assertEquals(Set.of("wed"), result.distinctDays());
    }

    @Test
    void normalizeDays_trimsLowercasesAndDropsEmptyTokens() {
        assertEquals(Set.of("mon", "tue"), PlanScheduleValidator.normalizeDays(" MON,, Tue ,"));
        assertTrue(PlanScheduleValidator.normalizeDays(null).isEmpty());
    }
}
