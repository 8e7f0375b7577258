package org.operaton.activslot.controller;

import lombok.RequiredArgsConstructor;
import org.operaton.activslot.model.domain.CalendarMeeting;
import org.operaton.activslot.provider.StoredCalendarProvider;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for importing calendar events.
 */
@RestController
@RequestMapping("/api/calendar/events")
@RequiredArgsConstructor
public class CalendarController {

    private final StoredCalendarProvider calendarProvider;

    @GetMapping
    public List<CalendarMeeting> getEvents(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return calendarProvider.fetchEvents(date);
    }

    @PostMapping
    public ResponseEntity<CalendarMeeting> addEvent(@RequestBody CalendarMeeting event) {
        event.setManaged(false);
        return ResponseEntity.status(HttpStatus.CREATED).body(calendarProvider.addEvent(event));
    }

    @DeleteMapping("/{eventId}")
    public ResponseEntity<Void> deleteEvent(@PathVariable String eventId) {
        calendarProvider.deleteEvent(eventId);
        return ResponseEntity.noContent().build();
    }
}
