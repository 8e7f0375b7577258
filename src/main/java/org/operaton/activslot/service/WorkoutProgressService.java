package org.operaton.activslot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.model.domain.WorkoutProgress;
import org.operaton.activslot.model.domain.WorkoutType;
import org.operaton.activslot.store.KeyValueStore;
import org.operaton.activslot.store.StoreKeys;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Tracks the push, pull, legs rotation and how many gym days the user had this week.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkoutProgressService {

    private final KeyValueStore store;

    /**
     * Workout that follows the last completed one. Push when nothing was completed yet.
     */
    public WorkoutType nextWorkoutType() {
        WorkoutType last = load().getLastWorkoutType();
        return last == null ? WorkoutType.PUSH : last.next();
    }

    /**
     * Whether a workout should be suggested for the given date's week.
     */
    public boolean shouldSuggestWorkout(LocalDate date, UserPreferences preferences) {
        if (!preferences.hasWorkoutGoal()) {
            return false;
        }
        return gymDaysInWeekOf(date) < preferences.getGymFrequency();
    }

    public synchronized WorkoutProgress markWorkoutCompleted(WorkoutType type, LocalDate date) {
        WorkoutProgress progress = forWeekOf(load(), date);
        progress.setLastWorkoutType(type);
        progress.setGymDaysThisWeek(progress.getGymDaysThisWeek() + 1);
        store.put(StoreKeys.WORKOUT_PROGRESS, progress);
        log.info("Workout {} completed on {}, {} gym days this week", type, date, progress.getGymDaysThisWeek());
        return progress;
    }

    int gymDaysInWeekOf(LocalDate date) {
        return forWeekOf(load(), date).getGymDaysThisWeek();
    }

    private WorkoutProgress forWeekOf(WorkoutProgress progress, LocalDate date) {
        LocalDate weekStart = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        if (!weekStart.equals(progress.getWeekStart())) {
            return progress.toBuilder()
                .weekStart(weekStart)
                .gymDaysThisWeek(0)
                .build();
        }
        return progress;
    }

    private WorkoutProgress load() {
        return store.get(StoreKeys.WORKOUT_PROGRESS, WorkoutProgress.class)
            .orElseGet(WorkoutProgress::new);
    }
}
