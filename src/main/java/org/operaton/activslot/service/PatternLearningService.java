package org.operaton.activslot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.PlanAdherence;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.TimeOfDay;
import org.operaton.activslot.model.domain.UserActivityPatterns;
import org.operaton.activslot.provider.ActivityDataProvider;
import org.operaton.activslot.store.KeyValueStore;
import org.operaton.activslot.store.StoreKeys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Learns activity patterns from step history and from completed or skipped activities.
 * Pure statistics: never reads calendar data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternLearningService {

    /**
     * Smoothing factor of the exponential moving averages.
     */
    public static final double ALPHA = 0.2;

    private static final int BEST_DAY_COUNT = 3;

    private final KeyValueStore store;
    private final ActivityDataProvider activityDataProvider;
    private final Clock clock;

    @Value("${activslot.planning.history-days:30}")
    private int historyDays = 30;

    /**
     * Current patterns, or the documented defaults when nothing usable is stored.
     */
    public UserActivityPatterns currentPatterns() {
        return store.get(StoreKeys.PATTERNS, UserActivityPatterns.class)
            .orElseGet(UserActivityPatterns::defaults);
    }

    /**
     * Current adherence statistics, or the initial values when nothing usable is stored.
     */
    public PlanAdherence currentAdherence() {
        return store.get(StoreKeys.ADHERENCE, PlanAdherence.class)
            .orElseGet(PlanAdherence::initial);
    }

    /**
     * Rebuild patterns from daily step totals and workout flags.
     * With no history the stored patterns are returned unchanged.
     *
     * @param dailySteps steps per date
     * @param dailyWorkouts whether a workout was recorded per date
     * @param stepGoal daily step goal used for the achievement rate
     * @return the updated patterns
     */
    public synchronized UserActivityPatterns updateFromHistory(Map<LocalDate, Integer> dailySteps,
                                                               Map<LocalDate, Boolean> dailyWorkouts,
                                                               int stepGoal) {
        UserActivityPatterns current = currentPatterns();
        if (dailySteps.isEmpty()) {
            log.debug("No step history available, keeping current patterns");
            return current;
        }

        List<Integer> all = new ArrayList<>();
        List<Integer> weekdays = new ArrayList<>();
        List<Integer> weekends = new ArrayList<>();
        Map<DayOfWeek, List<Integer>> byDay = new EnumMap<>(DayOfWeek.class);

        for (Map.Entry<LocalDate, Integer> entry : dailySteps.entrySet()) {
            int steps = entry.getValue();
            DayOfWeek day = entry.getKey().getDayOfWeek();
            all.add(steps);
            if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
                weekends.add(steps);
            } else {
                weekdays.add(steps);
            }
            byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(steps);
        }

        int average = mean(all);
        int weekdayAverage = weekdays.isEmpty() ? average : mean(weekdays);
        int weekendAverage = weekends.isEmpty() ? average : mean(weekends);

        // EnumMap iterates Monday first, so ties keep calendar order
        List<DayOfWeek> bestDays = byDay.entrySet().stream()
            .sorted(Comparator.comparingInt((Map.Entry<DayOfWeek, List<Integer>> e) -> mean(e.getValue())).reversed())
            .limit(BEST_DAY_COUNT)
            .map(Map.Entry::getKey)
            .toList();

        long goalDays = all.stream().filter(steps -> steps >= stepGoal).count();
        double goalRate = (double) goalDays / all.size();

        double workoutRate = current.getWorkoutDayRate();
        if (!dailyWorkouts.isEmpty()) {
            long workoutDays = dailyWorkouts.values().stream().filter(Boolean::booleanValue).count();
            workoutRate = (double) workoutDays / dailyWorkouts.size();
        }

        UserActivityPatterns updated = current.toBuilder()
            .averageDailySteps(average)
            .weekdayAverage(weekdayAverage)
            .weekendAverage(weekendAverage)
            .bestPerformingDays(new ArrayList<>(bestDays))
            .goalAchievementRate(goalRate)
            .workoutDayRate(workoutRate)
            .lastUpdated(LocalDateTime.now(clock))
            .build();

        store.put(StoreKeys.PATTERNS, updated);
        log.info("Updated activity patterns from {} days: average={} steps, goal rate={}",
            all.size(), average, String.format("%.2f", goalRate));
        return updated;
    }

    /**
     * Rebuild patterns from the activity data provider for the days before {@code today}.
     * Days the provider cannot deliver are left out.
     *
     * @param today the current date, excluded from the history
     * @param stepGoal daily step goal
     * @return the updated patterns
     */
    public UserActivityPatterns refreshFromProvider(LocalDate today, int stepGoal) {
        Map<LocalDate, Integer> steps = new LinkedHashMap<>();
        Map<LocalDate, Boolean> workouts = new LinkedHashMap<>();
        int failures = 0;

        for (int offset = 1; offset <= historyDays; offset++) {
            LocalDate date = today.minusDays(offset);
            try {
                steps.put(date, activityDataProvider.fetchSteps(date));
                workouts.put(date, !activityDataProvider.fetchWorkouts(date).isEmpty());
            } catch (Exception e) {
                failures++;
                log.warn("Activity data for {} unavailable: {}", date, e.getMessage());
            }
        }

        if (failures > 0) {
            log.warn("Pattern refresh skipped {} of {} days", failures, historyDays);
        }
        return updateFromHistory(steps, workouts, stepGoal);
    }

    /**
     * Record whether a planned activity was completed.
     * Updates the counters and moves the time-of-day and activity-type rates toward the outcome.
     *
     * @param type the activity type
     * @param timeOfDay the bucket the activity started in
     * @param completed true when completed, false when skipped
     * @return the updated adherence
     */
    public synchronized PlanAdherence recordOutcome(PlannedActivity.ActivityType type, TimeOfDay timeOfDay, boolean completed) {
        PlanAdherence adherence = currentAdherence();

        if (completed) {
            adherence.setActivitiesCompleted(adherence.getActivitiesCompleted() + 1);
        } else {
            adherence.setActivitiesSkipped(adherence.getActivitiesSkipped() + 1);
        }
        int total = adherence.getActivitiesCompleted() + adherence.getActivitiesSkipped();
        adherence.setAverageCompletionRate((double) adherence.getActivitiesCompleted() / total);

        double outcome = completed ? 1.0 : 0.0;
        Map<TimeOfDay, Double> slots = new EnumMap<>(TimeOfDay.class);
        slots.putAll(adherence.getBestTimeSlots());
        slots.put(timeOfDay, ema(adherence.rateFor(timeOfDay), outcome));
        adherence.setBestTimeSlots(slots);

        Map<PlannedActivity.ActivityType, Double> typeRates = new EnumMap<>(PlannedActivity.ActivityType.class);
        typeRates.putAll(adherence.getActivityTypeRates());
        typeRates.put(type, ema(adherence.rateFor(type), outcome));
        adherence.setActivityTypeRates(typeRates);

        adherence.setLastUpdated(LocalDateTime.now(clock));
        store.put(StoreKeys.ADHERENCE, adherence);
        log.debug("Recorded {} {} in the {}: rate now {}", type, completed ? "completion" : "skip",
            timeOfDay, slots.get(timeOfDay));
        return adherence;
    }

    /**
     * Record that the user moved a planned activity to another time.
     *
     * @return the updated adherence
     */
    public synchronized PlanAdherence recordReschedule() {
        PlanAdherence adherence = currentAdherence();
        adherence.setReschedulingFrequency(ema(adherence.getReschedulingFrequency(), 1.0));
        adherence.setLastUpdated(LocalDateTime.now(clock));
        store.put(StoreKeys.ADHERENCE, adherence);
        return adherence;
    }

    /**
     * Exponential moving average step: {@code alpha * outcome + (1 - alpha) * previous}.
     */
    public static double ema(double previous, double outcome) {
        return ALPHA * outcome + (1 - ALPHA) * previous;
    }

    private static int mean(List<Integer> values) {
        if (values.isEmpty()) {
            return 0;
        }
        long sum = 0;
        for (int value : values) {
            sum += value;
        }
        return (int) (sum / values.size());
    }
}
