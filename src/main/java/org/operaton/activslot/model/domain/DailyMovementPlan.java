package org.operaton.activslot.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The movement plan for one date. Regeneration replaces it as a whole.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DailyMovementPlan {

    /**
     * A plan whose remaining gap is below this many steps counts as on track.
     */
    public static final int ON_TRACK_THRESHOLD = 500;

    private LocalDate date;

    private int targetSteps;

    private int currentSteps;

    private int stepsNeeded;

    @Builder.Default
    private List<PlannedActivity> activities = new ArrayList<>();

    @Builder.Default
    private List<WalkableMeeting> walkableMeetings = new ArrayList<>();

    /**
     * Optional workout suggestion for combined walk and workout days.
     */
    private PlannedActivity workout;

    private double confidence;

    private String reasoning;

    private long generation;

    private LocalDateTime generatedAt;

    @JsonIgnore
    public int getTotalPlannedSteps() {
        int activitySteps = activities.stream()
            .filter(activity -> activity.getType().isWalk())
            .filter(activity -> activity.getStatus() != PlannedActivity.ActivityStatus.SKIPPED)
            .mapToInt(PlannedActivity::getEstimatedSteps)
            .sum();
        int meetingSteps = walkableMeetings.stream()
            .filter(WalkableMeeting::isRecommended)
            .mapToInt(WalkableMeeting::getEstimatedSteps)
            .sum();
        return activitySteps + meetingSteps;
    }

    @JsonIgnore
    public int getRemainingGap() {
        return Math.max(0, stepsNeeded - getTotalPlannedSteps());
    }

    @JsonIgnore
    public boolean isOnTrack() {
        return getRemainingGap() < ON_TRACK_THRESHOLD;
    }
}
