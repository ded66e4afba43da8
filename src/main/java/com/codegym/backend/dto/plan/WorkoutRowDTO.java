package com.codegym.backend.dto.plan;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutRowDTO {
    private String exerciseId;
    // kept as text so "2.5" or "abc" reach the validator as row errors
    private String sets;
    private String reps;

    // one day token or several separated by commas, e.g. "mon, wed"
    private String scheduleDay;
}
