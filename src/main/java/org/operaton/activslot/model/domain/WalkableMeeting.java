package org.operaton.activslot.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A meeting that was evaluated as a walking 1:1 candidate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalkableMeeting {

    private String meetingId;

    private String title;

    private LocalDateTime startTime;

    private int durationMinutes;

    private int attendeeCount;

    private boolean oneOnOne;

    private double walkabilityScore;

    private boolean recommended;

    /**
     * Steps the user would collect by walking through the meeting. Zero when not recommended.
     */
    private int estimatedSteps;

    private String reason;

    @JsonIgnore
    public LocalDateTime getEndTime() {
        return startTime.plusMinutes(durationMinutes);
    }
}
