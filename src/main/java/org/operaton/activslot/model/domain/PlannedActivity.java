package org.operaton.activslot.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A walk or workout placed into a free slot by the allocator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlannedActivity {

    private UUID id;

    private ActivityType type;

    private LocalDateTime startTime;

    private int durationMinutes;

    private int estimatedSteps;

    private Priority priority;

    @Builder.Default
    private ActivityStatus status = ActivityStatus.PLANNED;

    private String reason;

    /**
     * Set only for workouts.
     */
    private WorkoutType workoutType;

    /**
     * Scheduled or moved by the user rather than placed by the allocator.
     */
    private boolean manual;

    @JsonIgnore
    public LocalDateTime getEndTime() {
        return startTime.plusMinutes(durationMinutes);
    }

    @JsonIgnore
    public TimeInterval toInterval() {
        return TimeInterval.ofMinutes(startTime, durationMinutes);
    }

    /**
     * Kind of planned movement.
     */
    public enum ActivityType {
        MICRO_WALK("Quick Walk"),
        SHORT_WALK("Short Walk"),
        STANDARD_WALK("Walk"),
        MORNING_WALK("Morning Walk"),
        LUNCH_WALK("Lunch Walk"),
        EVENING_WALK("Evening Walk"),
        POST_MEETING_WALK("Post-Meeting Walk"),
        WORKOUT("Workout");

        private final String displayName;

        ActivityType(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }

        public boolean isWalk() {
            return this != WORKOUT;
        }
    }

    /**
     * Share of the remaining step gap an activity closes.
     */
    public enum Priority {
        /**
         * Covers more than 40% of the remaining gap.
         */
        CRITICAL,

        /**
         * Covers more than 20% of the remaining gap.
         */
        RECOMMENDED,

        OPTIONAL
    }

    public enum ActivityStatus {
        PLANNED,
        COMPLETED,
        SKIPPED,
        RESCHEDULED
    }
}
