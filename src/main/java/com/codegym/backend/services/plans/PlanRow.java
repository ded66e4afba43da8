package com.codegym.backend.services.plans;

/**
 * One submitted exercise line of a workout plan, as received from the client.
 * Fields are left raw; {@link PlanScheduleValidator} decides whether they are usable.
 */
public record PlanRow(String exerciseId, String sets, String reps, String scheduleDay) {
}
