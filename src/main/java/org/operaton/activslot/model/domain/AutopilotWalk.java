package org.operaton.activslot.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A walk proposed by the nightly autopilot run.
 * At most one non-rejected walk exists per (date, startTime).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutopilotWalk {

    private UUID id;

    private LocalDate date;

    private LocalDateTime startTime;

    private int durationMinutes;

    private WalkType type;

    private ApprovalState approvalState;

    /**
     * Identifier of the calendar event once the walk was committed.
     */
    private String calendarEventId;

    private LocalDateTime createdAt;

    @JsonIgnore
    public LocalDateTime getEndTime() {
        return startTime.plusMinutes(durationMinutes);
    }

    @JsonIgnore
    public boolean isActive() {
        return approvalState != ApprovalState.REJECTED;
    }

    /**
     * Walk flavour derived from its length.
     */
    public enum WalkType {
        MICRO("Quick Reset"),
        SHORT("Energy Boost"),
        STANDARD("Power Walk");

        private final String displayName;

        WalkType(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }

        public static WalkType fromDuration(int minutes) {
            if (minutes <= 10) {
                return MICRO;
            }
            if (minutes <= 20) {
                return SHORT;
            }
            return STANDARD;
        }
    }

    public enum ApprovalState {
        /**
         * Waiting for the user to approve or reject.
         */
        PENDING,

        /**
         * Accepted, either by the user or by full-auto trust.
         */
        APPROVED,

        /**
         * Declined by the user.
         */
        REJECTED,

        /**
         * Display-only proposal created under suggest-only trust. Never transitions.
         */
        SUGGESTED
    }
}
