package org.operaton.activslot.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.FreeSlot;
import org.operaton.activslot.model.domain.TimeInterval;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the autopilot's walk slots for a day.
 * <p>
 * Walks are spread over fixed time-of-day categories, taken in priority order.
 * If the target count is not reached and micro walks are enabled, short gaps between
 * meetings are used as well.
 */
@Component
@Slf4j
public class AutopilotSlotSelector {

    static final int CATEGORY_SPACING_MINUTES = 60;
    static final int MICRO_SPACING_MINUTES = 30;
    static final int MICRO_MIN_GAP_MINUTES = 5;
    static final int MICRO_MAX_GAP_MINUTES = 15;
    static final int MICRO_WALK_MINUTES = 10;

    /**
     * Ordered by priority. Morning and evening share a priority and keep their relative order.
     */
    static final List<Category> CATEGORIES = List.of(
        new Category("midday", 11, 14, 1),
        new Category("morning", 8, 11, 2),
        new Category("evening", 17, 20, 2),
        new Category("afternoon", 14, 17, 3)
    );

    /**
     * Select walk slots.
     *
     * @param freeSlots free slots of the day, ordered by start; callers remove meal-time slots beforehand
     * @param targetWalks number of walks wanted
     * @param includeMicroWalks whether short gaps may be used when the categories yield too few walks
     * @param minDuration shortest regular walk in minutes
     * @param maxDuration longest regular walk in minutes
     * @return selected walk intervals ordered by start
     */
    public List<TimeInterval> select(List<FreeSlot> freeSlots,
                                     int targetWalks,
                                     boolean includeMicroWalks,
                                     int minDuration,
                                     int maxDuration) {
        List<TimeInterval> selected = new ArrayList<>();

        for (Category category : CATEGORIES) {
            if (selected.size() >= targetWalks) {
                break;
            }
            freeSlots.stream()
                .filter(slot -> slot.durationMinutes() >= minDuration)
                .filter(slot -> category.contains(slot.startHour()))
                .filter(slot -> isSpaced(slot.start(), selected, CATEGORY_SPACING_MINUTES))
                .findFirst()
                .ifPresent(slot -> {
                    int duration = Math.min(maxDuration, Math.max(minDuration, (int) slot.durationMinutes()));
                    selected.add(TimeInterval.ofMinutes(slot.start(), duration));
                    log.debug("Autopilot picked {} slot at {} for {} minutes", category.name(), slot.start(), duration);
                });
        }

        if (selected.size() < targetWalks && includeMicroWalks) {
            for (FreeSlot slot : freeSlots) {
                if (selected.size() >= targetWalks) {
                    break;
                }
                long gap = slot.durationMinutes();
                if (gap >= MICRO_MIN_GAP_MINUTES && gap <= MICRO_MAX_GAP_MINUTES
                    && isSpaced(slot.start(), selected, MICRO_SPACING_MINUTES)) {
                    int duration = (int) Math.min(gap, MICRO_WALK_MINUTES);
                    selected.add(TimeInterval.ofMinutes(slot.start(), duration));
                    log.debug("Autopilot picked micro walk at {} for {} minutes", slot.start(), duration);
                }
            }
        }

        selected.sort(Comparator.comparing(TimeInterval::start));
        return selected;
    }

    private boolean isSpaced(LocalDateTime start, List<TimeInterval> selected, int minutes) {
        return selected.stream()
            .noneMatch(walk -> Math.abs(Duration.between(walk.start(), start).toMinutes()) < minutes);
    }

    record Category(String name, int startHour, int endHour, int priority) {

        boolean contains(int hour) {
            return hour >= startHour && hour < endHour;
        }
    }
}
