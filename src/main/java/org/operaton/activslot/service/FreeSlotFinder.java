package org.operaton.activslot.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.BusyInterval;
import org.operaton.activslot.model.domain.FreeSlot;
import org.operaton.activslot.model.domain.SlotClass;
import org.operaton.activslot.model.domain.TimeInterval;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.util.IntervalUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the free time between busy intervals inside the active window.
 */
@Component
@Slf4j
public class FreeSlotFinder {

    /**
     * Find free slots with a linear sweep over the busy intervals.
     * Slots shorter than {@code minDurationMinutes} are dropped. Slots at meal times are kept and flagged.
     *
     * @param busyIntervals busy intervals of the day, in any order
     * @param window the active window; an empty or inverted window yields no slots
     * @param minDurationMinutes shortest slot to report
     * @param preferences meal times and preferred walking band
     * @return free slots ordered by start
     */
    public List<FreeSlot> findFreeSlots(List<BusyInterval> busyIntervals,
                                        TimeInterval window,
                                        int minDurationMinutes,
                                        UserPreferences preferences) {
        List<TimeInterval> sorted = busyIntervals.stream()
            .map(BusyInterval::interval)
            .sorted(Comparator.comparing(TimeInterval::start))
            .toList();

        List<FreeSlot> slots = new ArrayList<>();
        LocalDateTime cursor = window.start();

        for (TimeInterval busy : sorted) {
            if (!busy.end().isAfter(window.start()) || !busy.start().isBefore(window.end())) {
                continue;
            }
            LocalDateTime busyStart = IntervalUtils.max(busy.start(), window.start());
            if (busyStart.isAfter(cursor)) {
                addSlot(slots, cursor, busyStart, minDurationMinutes, preferences);
            }
            cursor = IntervalUtils.max(cursor, IntervalUtils.min(busy.end(), window.end()));
        }

        if (cursor.isBefore(window.end())) {
            addSlot(slots, cursor, window.end(), minDurationMinutes, preferences);
        }

        log.debug("Found {} free slots of at least {} minutes", slots.size(), minDurationMinutes);
        return slots;
    }

    /**
     * Find free slots for a window given as bounds. Returns nothing when {@code start} is not before {@code end},
     * which is what a wake time after the sleep time produces.
     */
    public List<FreeSlot> findFreeSlots(List<BusyInterval> busyIntervals,
                                        LocalDateTime start,
                                        LocalDateTime end,
                                        int minDurationMinutes,
                                        UserPreferences preferences) {
        if (!start.isBefore(end)) {
            log.debug("Empty active window {} - {}, no free slots", start, end);
            return List.of();
        }
        return findFreeSlots(busyIntervals, new TimeInterval(start, end), minDurationMinutes, preferences);
    }

    private void addSlot(List<FreeSlot> slots, LocalDateTime start, LocalDateTime end,
                         int minDurationMinutes, UserPreferences preferences) {
        long minutes = Duration.between(start, end).toMinutes();
        if (minutes < minDurationMinutes) {
            return;
        }
        slots.add(new FreeSlot(
            new TimeInterval(start, end),
            minutes,
            SlotClass.fromMinutes(minutes),
            preferences.isDuringMeal(start),
            preferences.isPreferredWalkHour(start.getHour())
        ));
    }
}
