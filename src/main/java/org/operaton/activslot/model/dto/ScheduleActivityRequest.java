package org.operaton.activslot.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.WorkoutType;

import java.time.LocalDateTime;

/**
 * An activity the user commits to by hand.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleActivityRequest {

    @NotNull(message = "Activity type is required")
    private PlannedActivity.ActivityType type;

    @NotNull(message = "Start time is required")
    private LocalDateTime startTime;

    @Min(value = 5, message = "Activities last at least 5 minutes")
    @Max(value = 180, message = "Activities last at most 180 minutes")
    private int durationMinutes;

    private WorkoutType workoutType;

    public PlannedActivity toActivity(int stepsPerMinute) {
        return PlannedActivity.builder()
            .type(type)
            .startTime(startTime)
            .durationMinutes(durationMinutes)
            .estimatedSteps(type.isWalk() ? durationMinutes * stepsPerMinute : 0)
            .priority(PlannedActivity.Priority.RECOMMENDED)
            .workoutType(type == PlannedActivity.ActivityType.WORKOUT ? workoutType : null)
            .reason("Scheduled by you")
            .build();
    }
}
