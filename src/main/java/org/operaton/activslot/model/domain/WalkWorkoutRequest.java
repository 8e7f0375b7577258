package org.operaton.activslot.model.domain;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Inputs of the capacity-tiered walk and workout allocation.
 */
@Data
@Builder
public class WalkWorkoutRequest {

    private LocalDate date;

    /**
     * Free slots of the day. Slots shorter than 45 minutes or at meal times are ignored.
     */
    private List<FreeSlot> freeSlots;

    /**
     * Large meetings the user can follow while walking.
     */
    private List<WalkableMeeting> listeningMeetings;

    /**
     * Busy time used to validate preferred-time fallbacks.
     */
    private List<TimeInterval> busyIntervals;

    private UserPreferences preferences;

    private boolean needsWalk;

    private boolean needsWorkout;

    private WorkoutType nextWorkoutType;

    private int stepsPerMinute;

    private int hardEndHour;

    /**
     * Preferred-time fallbacks never start before this instant. Null means no bound.
     */
    private LocalDateTime notBefore;
}
