package org.operaton.activslot.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A calendar event as delivered by the calendar provider.
 * Immutable for the duration of a planning run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarMeeting {

    private String id;

    private String title;

    private LocalDateTime start;

    private LocalDateTime end;

    private int attendeeCount;

    /**
     * Whether the current user organizes this meeting.
     */
    private boolean organizer;

    private boolean allDay;

    private boolean outOfOffice;

    private String notes;

    /**
     * Minutes before start at which a reminder fires, null for none.
     */
    private Integer alarmOffsetMinutes;

    /**
     * Whether this event was written by the autopilot rather than by the user.
     */
    private boolean managed;

    /**
     * All-day entries and out-of-office blocks do not occupy the user's time.
     */
    @JsonIgnore
    public boolean isRealMeeting() {
        return !allDay && !outOfOffice;
    }

    @JsonIgnore
    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }

    @JsonIgnore
    public TimeInterval toInterval() {
        return new TimeInterval(start, end);
    }
}
