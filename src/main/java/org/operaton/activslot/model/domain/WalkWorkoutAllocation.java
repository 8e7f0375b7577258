package org.operaton.activslot.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of the capacity-tiered allocation for a day with both a walk and a workout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalkWorkoutAllocation {

    private PlannedActivity workout;

    private PlannedActivity walk;

    /**
     * Set when the main walk is a walkable meeting instead of a free slot.
     */
    private WalkableMeeting walkingMeeting;

    @Builder.Default
    private List<PlannedActivity> otherWalks = new ArrayList<>();
}
