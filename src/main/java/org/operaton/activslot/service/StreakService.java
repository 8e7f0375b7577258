package org.operaton.activslot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.Streak;
import org.operaton.activslot.provider.ActivityDataProvider;
import org.operaton.activslot.store.KeyValueStore;
import org.operaton.activslot.store.StoreKeys;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Counts consecutive days on which the step goal was reached.
 * Works at day granularity only; the time of day never matters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreakService {

    static final int MAX_HISTORY_DAYS = 365;

    private final KeyValueStore store;
    private final ActivityDataProvider activityDataProvider;

    public Streak current() {
        return store.get(StoreKeys.STREAK, Streak.class).orElseGet(Streak::empty);
    }

    /**
     * Record that the goal was reached today. A second call on the same day does nothing.
     *
     * @param today the current date
     * @return the updated streak
     */
    public synchronized Streak recordGoalHit(LocalDate today) {
        Streak streak = current();
        if (today.equals(streak.getLastGoalDate())) {
            return streak;
        }

        int current = today.minusDays(1).equals(streak.getLastGoalDate()) ? streak.getCurrentStreak() + 1 : 1;
        Streak updated = Streak.builder()
            .currentStreak(current)
            .longestStreak(Math.max(streak.getLongestStreak(), current))
            .lastGoalDate(today)
            .build();
        store.put(StoreKeys.STREAK, updated);
        log.info("Step goal reached on {}, streak is now {} days (longest {})",
            today, updated.getCurrentStreak(), updated.getLongestStreak());
        return updated;
    }

    /**
     * Reset the current streak when the last goal day is older than yesterday.
     * The longest streak is kept.
     */
    public synchronized Streak validate(LocalDate today) {
        Streak streak = current();
        LocalDate last = streak.getLastGoalDate();
        boolean alive = last != null && (last.equals(today) || last.equals(today.minusDays(1)));
        if (alive || streak.getCurrentStreak() == 0) {
            return streak;
        }

        Streak reset = streak.toBuilder().currentStreak(0).build();
        store.put(StoreKeys.STREAK, reset);
        log.info("Streak of {} days ended, last goal day was {}", streak.getCurrentStreak(), last);
        return reset;
    }

    /**
     * Record today's step total and count the day when it meets the goal.
     */
    public Streak recordDailySteps(LocalDate today, int steps, int stepGoal) {
        if (steps >= stepGoal) {
            return recordGoalHit(today);
        }
        return current();
    }

    /**
     * Recount the streak from recorded step totals, newest day first.
     * Counting stops at the first day below the goal or the first day without data.
     *
     * @param today the current date; it counts only if already above the goal
     * @param stepGoal daily step goal
     * @return the rebuilt streak
     */
    public synchronized Streak rebuildFromHistory(LocalDate today, int stepGoal) {
        int count = 0;
        LocalDate lastGoalDate = null;

        // today may still be in progress, so a miss only ends the streak from yesterday on
        if (stepsOn(today) >= stepGoal) {
            count = 1;
            lastGoalDate = today;
        }
        for (int i = 1; i <= MAX_HISTORY_DAYS; i++) {
            LocalDate day = today.minusDays(i);
            int steps = stepsOn(day);
            if (steps < stepGoal) {
                break;
            }
            count++;
            if (lastGoalDate == null) {
                lastGoalDate = day;
            }
        }

        Streak previous = current();
        Streak rebuilt = Streak.builder()
            .currentStreak(count)
            .longestStreak(Math.max(previous.getLongestStreak(), count))
            .lastGoalDate(lastGoalDate != null ? lastGoalDate : previous.getLastGoalDate())
            .build();
        store.put(StoreKeys.STREAK, rebuilt);
        log.info("Streak rebuilt from history: {} days (longest {})", rebuilt.getCurrentStreak(), rebuilt.getLongestStreak());
        return rebuilt;
    }

    private int stepsOn(LocalDate date) {
        try {
            return activityDataProvider.fetchSteps(date);
        } catch (Exception e) {
            log.warn("Step data for {} unavailable while rebuilding streak: {}", date, e.getMessage());
            return -1;
        }
    }
}
