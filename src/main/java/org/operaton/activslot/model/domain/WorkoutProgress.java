package org.operaton.activslot.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Workout rotation and weekly gym-day counter.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutProgress {

    private WorkoutType lastWorkoutType;

    private int gymDaysThisWeek;

    /**
     * Monday of the week {@link #gymDaysThisWeek} counts for.
     */
    private LocalDate weekStart;
}
