package org.operaton.activslot.model.domain;

import java.util.UUID;

/**
 * A planned activity that collides with, or sits too close to, a meeting.
 */
public record ScheduleConflict(
    UUID activityId,
    String meetingId,
    String meetingTitle,
    ConflictType type
) {

    public enum ConflictType {
        OVERLAP,
        TOO_CLOSE
    }

    public String description() {
        return switch (type) {
            case OVERLAP -> "Overlaps with \"" + meetingTitle + "\"";
            case TOO_CLOSE -> "Too close to \"" + meetingTitle + "\"";
        };
    }
}
