package org.operaton.activslot.provider;

import org.operaton.activslot.model.domain.CalendarMeeting;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Access to the user's calendar.
 */
public interface CalendarProvider {

    /**
     * All events overlapping the given date, including all-day and out-of-office entries.
     */
    List<CalendarMeeting> fetchEvents(LocalDate date);

    /**
     * Creates an event and returns its identifier.
     *
     * @throws org.operaton.activslot.exception.CalendarSyncException if the calendar rejects the write
     */
    String createEvent(String calendarId, String title, LocalDateTime start, LocalDateTime end,
                       String notes, int alarmOffsetMinutes);

    /**
     * @throws org.operaton.activslot.exception.CalendarSyncException if the event cannot be removed
     */
    void deleteEvent(String eventId);
}
