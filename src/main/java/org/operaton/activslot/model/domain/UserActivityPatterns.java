package org.operaton.activslot.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling statistics learned from historical step and workout data.
 * Read by the slot scorer, never mutated while scoring.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserActivityPatterns {

    @Builder.Default
    private int averageDailySteps = 6000;

    @Builder.Default
    private int weekdayAverage = 5500;

    @Builder.Default
    private int weekendAverage = 7000;

    @Builder.Default
    private List<DayOfWeek> bestPerformingDays = new ArrayList<>(List.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));

    /**
     * Hours of day (0-23) at which the user tends to move the most.
     */
    @Builder.Default
    private List<Integer> peakActivityHours = new ArrayList<>(List.of(8, 12, 17));

    @Builder.Default
    private int typicalWalkDuration = 20;

    @Builder.Default
    private int stepsPerMinuteWalking = 100;

    /**
     * Share of history days on which the step goal was reached, in [0, 1].
     */
    @Builder.Default
    private double goalAchievementRate = 0.3;

    /**
     * Share of history days with at least one workout, in [0, 1].
     */
    @Builder.Default
    private double workoutDayRate = 0.0;

    @Builder.Default
    private List<WalkTime> consistentWalkTimes = new ArrayList<>(List.of(
        new WalkTime(8, 0.4),
        new WalkTime(12, 0.5),
        new WalkTime(18, 0.3)
    ));

    private LocalDateTime lastUpdated;

    public static UserActivityPatterns defaults() {
        return UserActivityPatterns.builder().build();
    }

    /**
     * Hour at which the user walks with the given frequency.
     */
    public record WalkTime(int hour, double frequency) {
    }
}
