package org.operaton.activslot.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Consecutive days on which the step goal was reached.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Streak {

    private int currentStreak;

    private int longestStreak;

    private LocalDate lastGoalDate;

    public static Streak empty() {
        return new Streak(0, 0, null);
    }
}
