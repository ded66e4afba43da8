package com.codegym.backend.services.plans;

import java.util.Set;
import java.util.UUID;

/**
 * A row that passed every check, with reps and schedule trimmed and the day
 * tokens already normalized.
 */
public record ValidatedRow(int rowIndex, UUID exerciseId, int sets, String reps, String scheduleDay, Set<String> days) {
}
