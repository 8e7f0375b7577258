package org.operaton.activslot.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.exception.CalendarSyncException;
import org.operaton.activslot.model.domain.CalendarMeeting;
import org.operaton.activslot.store.KeyValueStore;
import org.operaton.activslot.store.StoreKeys;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Calendar kept in the key-value store, one event list per start date.
 * Events are imported through the REST API; autopilot walks are written here as managed events.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoredCalendarProvider implements CalendarProvider {

    private static final TypeReference<List<CalendarMeeting>> EVENT_LIST = new TypeReference<>() {
    };

    private final KeyValueStore store;

    @Override
    public List<CalendarMeeting> fetchEvents(LocalDate date) {
        List<CalendarMeeting> events = new ArrayList<>(load(date.minusDays(1)).stream()
            .filter(event -> event.getEnd().isAfter(date.atStartOfDay()))
            .toList());
        events.addAll(load(date));
        events.sort(Comparator.comparing(CalendarMeeting::getStart));
        return events;
    }

    @Override
    public synchronized String createEvent(String calendarId, String title, LocalDateTime start, LocalDateTime end,
                                           String notes, int alarmOffsetMinutes) {
        if (!start.isBefore(end)) {
            throw new CalendarSyncException("Event '" + title + "' ends before it starts");
        }
        String eventId = calendarId + ":" + UUID.randomUUID();
        CalendarMeeting event = CalendarMeeting.builder()
            .id(eventId)
            .title(title)
            .start(start)
            .end(end)
            .attendeeCount(1)
            .organizer(true)
            .notes(notes)
            .alarmOffsetMinutes(alarmOffsetMinutes)
            .managed(true)
            .build();

        LocalDate date = start.toLocalDate();
        List<CalendarMeeting> events = load(date);
        events.add(event);
        store.put(StoreKeys.calendarEvents(date), events);
        log.info("Created calendar event {} '{}' at {}", eventId, title, start);
        return eventId;
    }

    @Override
    public synchronized void deleteEvent(String eventId) {
        for (String key : store.keysWithPrefix(StoreKeys.CALENDAR_EVENTS_PREFIX)) {
            List<CalendarMeeting> events = store.get(key, EVENT_LIST).orElseGet(ArrayList::new);
            if (events.removeIf(event -> eventId.equals(event.getId()))) {
                store.put(key, events);
                log.info("Deleted calendar event {}", eventId);
                return;
            }
        }
        log.warn("Calendar event {} not found, nothing to delete", eventId);
    }

    /**
     * Adds a user event, replacing any event with the same id.
     *
     * @param event the event to store
     * @return the stored event
     */
    public synchronized CalendarMeeting addEvent(CalendarMeeting event) {
        if (event.getStart() == null || event.getEnd() == null || !event.getStart().isBefore(event.getEnd())) {
            throw new IllegalArgumentException("Event must have a start before its end");
        }
        if (event.getId() == null || event.getId().isBlank()) {
            event.setId(UUID.randomUUID().toString());
        }
        LocalDate date = event.getStart().toLocalDate();
        List<CalendarMeeting> events = load(date);
        events.removeIf(existing -> existing.getId().equals(event.getId()));
        events.add(event);
        store.put(StoreKeys.calendarEvents(date), events);
        log.debug("Stored calendar event {} for {}", event.getId(), date);
        return event;
    }

    private List<CalendarMeeting> load(LocalDate date) {
        return new ArrayList<>(store.get(StoreKeys.calendarEvents(date), EVENT_LIST).orElseGet(ArrayList::new));
    }
}
