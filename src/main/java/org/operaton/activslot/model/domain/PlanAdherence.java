package org.operaton.activslot.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Completion and skip statistics for previously planned activities.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlanAdherence {

    /**
     * Rate assumed for a bucket that has no observation yet.
     */
    public static final double NEUTRAL_RATE = 0.5;

    private int activitiesCompleted;

    private int activitiesSkipped;

    /**
     * Exponential moving average of completions per time-of-day bucket.
     */
    @Builder.Default
    private Map<TimeOfDay, Double> bestTimeSlots = new EnumMap<>(TimeOfDay.class);

    /**
     * Exponential moving average of completions per activity type.
     */
    @Builder.Default
    private Map<PlannedActivity.ActivityType, Double> activityTypeRates = new EnumMap<>(PlannedActivity.ActivityType.class);

    @Builder.Default
    private double averageCompletionRate = NEUTRAL_RATE;

    @Builder.Default
    private int preferredDuration = 20;

    @Builder.Default
    private double reschedulingFrequency = 0.2;

    private LocalDateTime lastUpdated;

    public static PlanAdherence initial() {
        return PlanAdherence.builder().build();
    }

    public double rateFor(TimeOfDay timeOfDay) {
        return bestTimeSlots.getOrDefault(timeOfDay, NEUTRAL_RATE);
    }

    public double rateFor(PlannedActivity.ActivityType type) {
        return activityTypeRates.getOrDefault(type, NEUTRAL_RATE);
    }
}
