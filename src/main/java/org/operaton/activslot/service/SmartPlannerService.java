package org.operaton.activslot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.exception.PlanningException;
import org.operaton.activslot.exception.ResourceNotFoundException;
import org.operaton.activslot.model.domain.BusyInterval;
import org.operaton.activslot.model.domain.CalendarMeeting;
import org.operaton.activslot.model.domain.DailyMovementPlan;
import org.operaton.activslot.model.domain.FreeSlot;
import org.operaton.activslot.model.domain.PlanAdherence;
import org.operaton.activslot.model.domain.PlanAssessment;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.ScheduleConflict;
import org.operaton.activslot.model.domain.TimeInterval;
import org.operaton.activslot.model.domain.TimeOfDay;
import org.operaton.activslot.model.domain.UserActivityPatterns;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.model.domain.WalkWorkoutAllocation;
import org.operaton.activslot.model.domain.WalkWorkoutRequest;
import org.operaton.activslot.model.domain.WalkableMeeting;
import org.operaton.activslot.provider.ActivityDataProvider;
import org.operaton.activslot.provider.CalendarProvider;
import org.operaton.activslot.store.KeyValueStore;
import org.operaton.activslot.store.StoreKeys;
import org.operaton.activslot.util.IntervalUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Builds the daily movement plan: fetches calendar and step data, finds free slots,
 * places walks and an optional workout, and commits the result for the date.
 * <p>
 * Concurrent generations for the same date never interleave their writes; a generation that
 * finishes after a newer one committed is discarded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SmartPlannerService {

    private final CalendarProvider calendarProvider;
    private final ActivityDataProvider activityDataProvider;
    private final KeyValueStore store;
    private final BusyIntervalBuilder busyIntervalBuilder;
    private final FreeSlotFinder freeSlotFinder;
    private final WalkabilityClassifier walkabilityClassifier;
    private final SlotAllocator slotAllocator;
    private final PatternLearningService patternLearningService;
    private final PreferencesService preferencesService;
    private final ScheduledActivityService scheduledActivityService;
    private final WorkoutProgressService workoutProgressService;
    private final ConflictDetector conflictDetector;
    private final PlanGenerationGuard generationGuard;
    private final Clock clock;

    private final List<PlanListener> listeners = new CopyOnWriteArrayList<>();

    @Value("${activslot.planning.min-slot-minutes:5}")
    private int minSlotMinutes = 5;

    @Value("${activslot.planning.hard-end-hour:21}")
    private int hardEndHour = 21;

    /**
     * Generate and commit the plan for a date, replacing any previous plan.
     * Provider failures lead to a plan with less information, never to an exception.
     *
     * @param date the date to plan
     * @return the committed plan; if this generation was superseded, the plan that won
     */
    public DailyMovementPlan generatePlan(LocalDate date) {
        long epoch = generationGuard.begin(date);

        UserPreferences preferences = preferencesService.current();
        UserActivityPatterns patterns = patternLearningService.currentPatterns();
        PlanAdherence adherence = patternLearningService.currentAdherence();
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        boolean isToday = date.equals(now.toLocalDate());

        int currentSteps = isToday ? fetchSteps(date) : 0;
        int stepsNeeded = Math.max(0, preferences.getDailyStepGoal() - currentSteps);

        DayContext day = loadDay(date, preferences, patterns, isToday ? now : null);

        List<PlannedActivity> manual = scheduledActivityService.activitiesFor(date);
        int committedWalkSteps = manual.stream()
            .filter(activity -> activity.getType().isWalk())
            .filter(activity -> activity.getStatus() == PlannedActivity.ActivityStatus.PLANNED
                || activity.getStatus() == PlannedActivity.ActivityStatus.RESCHEDULED)
            .mapToInt(PlannedActivity::getEstimatedSteps)
            .sum();

        PlannedActivity workout = null;
        List<FreeSlot> walkSlots = day.freeSlots();
        if (workoutProgressService.shouldSuggestWorkout(date, preferences) && day.window() != null) {
            WalkWorkoutAllocation allocation = slotAllocator.allocateWalkAndWorkout(
                walkWorkoutRequest(day, preferences, patterns, false, true));
            workout = allocation.getWorkout();
            if (workout != null) {
                List<TimeInterval> committed = new ArrayList<>(day.committed());
                committed.add(workout.toInterval());
                walkSlots = findSlots(day.events(), committed, day, preferences);
            }
        }

        List<PlannedActivity> walks = slotAllocator.allocate(
            Math.max(0, stepsNeeded - committedWalkSteps), walkSlots, day.walkableMeetings(), patterns, adherence);

        List<PlannedActivity> activities = new ArrayList<>(manual);
        activities.addAll(walks);
        activities.sort(Comparator.comparing(PlannedActivity::getStartTime));

        PlanAssessment assessment = slotAllocator.assess(stepsNeeded, activities, day.walkableMeetings(), patterns);

        DailyMovementPlan plan = DailyMovementPlan.builder()
            .date(date)
            .targetSteps(preferences.getDailyStepGoal())
            .currentSteps(currentSteps)
            .stepsNeeded(stepsNeeded)
            .activities(activities)
            .walkableMeetings(day.walkableMeetings())
            .workout(workout)
            .confidence(assessment.confidence())
            .reasoning(assessment.reasoning())
            .generation(epoch)
            .generatedAt(LocalDateTime.now(clock))
            .build();

        boolean committed = generationGuard.commit(date, epoch, () -> store.put(StoreKeys.plan(date), plan));
        if (!committed) {
            return getPlan(date).orElse(plan);
        }

        log.info("Plan for {} committed: {} activities, {} steps needed, gap {}, confidence {}",
            date, activities.size(), stepsNeeded, plan.getRemainingGap(), String.format("%.2f", plan.getConfidence()));
        notifyListeners(plan);
        return plan;
    }

    /**
     * Generate a plan on the planning executor.
     *
     * @param date the date to plan
     * @return future completed with the committed plan
     */
    @Async("planningExecutor")
    public CompletableFuture<DailyMovementPlan> generatePlanAsync(LocalDate date) {
        return CompletableFuture.completedFuture(generatePlan(date));
    }

    public Optional<DailyMovementPlan> getPlan(LocalDate date) {
        return store.get(StoreKeys.plan(date), DailyMovementPlan.class);
    }

    /**
     * Capacity-tiered suggestion of one walk and one workout for a date.
     * A workout is only included while the weekly gym target is not met.
     *
     * @param date the date
     * @return the allocation
     */
    public WalkWorkoutAllocation suggestWalkAndWorkout(LocalDate date) {
        UserPreferences preferences = preferencesService.current();
        UserActivityPatterns patterns = patternLearningService.currentPatterns();
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        DayContext day = loadDay(date, preferences, patterns, date.equals(now.toLocalDate()) ? now : null);
        if (day.window() == null) {
            return new WalkWorkoutAllocation();
        }

        boolean needsWalk = scheduledActivityService.activitiesFor(date).stream()
            .noneMatch(activity -> activity.getType().isWalk());
        boolean needsWorkout = workoutProgressService.shouldSuggestWorkout(date, preferences);
        return slotAllocator.allocateWalkAndWorkout(walkWorkoutRequest(day, preferences, patterns, needsWalk, needsWorkout));
    }

    /**
     * Mark a planned activity as completed and feed the outcome to the pattern learner.
     */
    public PlannedActivity recordActivityCompleted(LocalDate date, UUID activityId) {
        PlannedActivity activity = updateStatus(date, activityId, PlannedActivity.ActivityStatus.COMPLETED);
        patternLearningService.recordOutcome(activity.getType(), TimeOfDay.fromHour(activity.getStartTime().getHour()), true);
        if (activity.getType() == PlannedActivity.ActivityType.WORKOUT && activity.getWorkoutType() != null) {
            workoutProgressService.markWorkoutCompleted(activity.getWorkoutType(), date);
        }
        return activity;
    }

    /**
     * Mark a planned activity as skipped and feed the outcome to the pattern learner.
     */
    public PlannedActivity recordActivitySkipped(LocalDate date, UUID activityId) {
        PlannedActivity activity = updateStatus(date, activityId, PlannedActivity.ActivityStatus.SKIPPED);
        patternLearningService.recordOutcome(activity.getType(), TimeOfDay.fromHour(activity.getStartTime().getHour()), false);
        return activity;
    }

    /**
     * Move a planned activity to a new start time. The moved activity becomes a manual commitment
     * and keeps its place when the plan is regenerated.
     *
     * @throws PlanningException if the new time leaves the date or overlaps another planned activity
     */
    public PlannedActivity rescheduleActivity(LocalDate date, UUID activityId, LocalDateTime newStart) {
        if (!newStart.toLocalDate().equals(date)) {
            throw new PlanningException("Activities can only be moved within " + date);
        }
        PlannedActivity moved = generationGuard.withLock(date, () -> {
            DailyMovementPlan plan = requirePlan(date);
            PlannedActivity activity = findActivity(plan, activityId);
            TimeInterval target = TimeInterval.ofMinutes(newStart, activity.getDurationMinutes());
            otherActivities(plan, activityId)
                .filter(other -> other.toInterval().overlaps(target))
                .findFirst()
                .ifPresent(other -> {
                    throw new PlanningException("Moving to " + newStart.toLocalTime() + " overlaps "
                        + other.getType().getDisplayName() + " at " + other.getStartTime().toLocalTime());
                });
            activity.setStartTime(newStart);
            activity.setStatus(PlannedActivity.ActivityStatus.RESCHEDULED);
            activity.setManual(true);
            plan.getActivities().sort(Comparator.comparing(PlannedActivity::getStartTime));
            store.put(StoreKeys.plan(date), plan);
            return activity;
        });

        scheduledActivityService.schedule(moved);
        patternLearningService.recordReschedule();
        log.info("Rescheduled activity {} to {}", activityId, newStart);
        return moved;
    }

    /**
     * Conflicts between the user's manually scheduled activities and the day's meetings.
     */
    public List<ScheduleConflict> detectConflicts(LocalDate date) {
        List<PlannedActivity> open = scheduledActivityService.activitiesFor(date).stream()
            .filter(activity -> activity.getStatus() == PlannedActivity.ActivityStatus.PLANNED
                || activity.getStatus() == PlannedActivity.ActivityStatus.RESCHEDULED)
            .toList();
        if (open.isEmpty()) {
            return List.of();
        }
        List<ScheduleConflict> conflicts = conflictDetector.detect(open, fetchEvents(date));
        if (!conflicts.isEmpty()) {
            log.info("{} schedule conflicts on {}", conflicts.size(), date);
        }
        return conflicts;
    }

    /**
     * Delete stored plans older than the retention window.
     *
     * @return number of deleted plans
     */
    public int cleanupOldPlans(LocalDate today, int retentionDays) {
        LocalDate cutoff = today.minusDays(retentionDays);
        int deleted = 0;
        for (String key : store.keysWithPrefix(StoreKeys.PLAN_PREFIX)) {
            try {
                LocalDate planDate = LocalDate.parse(key.substring(StoreKeys.PLAN_PREFIX.length()));
                if (planDate.isBefore(cutoff)) {
                    store.delete(key);
                    deleted++;
                }
            } catch (DateTimeParseException e) {
                log.warn("Ignoring plan key with unexpected format: {}", key);
            }
        }
        generationGuard.forgetBefore(cutoff);
        return deleted;
    }

    public void addListener(PlanListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PlanListener listener) {
        listeners.remove(listener);
    }

    private DayContext loadDay(LocalDate date, UserPreferences preferences, UserActivityPatterns patterns,
                               LocalDateTime notBefore) {
        List<CalendarMeeting> events = fetchEvents(date);
        List<WalkableMeeting> walkable = events.stream()
            .filter(CalendarMeeting::isRealMeeting)
            .filter(event -> !event.isManaged())
            .map(event -> walkabilityClassifier.toWalkingOneOnOne(event, patterns.getStepsPerMinuteWalking()))
            .toList();
        List<TimeInterval> committed = scheduledActivityService.busyIntervalsFor(date);

        Optional<TimeInterval> window = preferences.activeWindow(date, hardEndHour);
        if (window.isEmpty()) {
            log.warn("No active window on {} for wake {} and sleep {}", date, preferences.getWakeTime(), preferences.getSleepTime());
            return new DayContext(date, null, null, events, walkable, committed, List.of());
        }

        LocalDateTime start = notBefore != null
            ? IntervalUtils.max(window.get().start(), notBefore)
            : window.get().start();
        DayContext day = new DayContext(date, window.get(), start, events, walkable, committed, List.of());
        return day.withFreeSlots(findSlots(events, committed, day, preferences));
    }

    private List<FreeSlot> findSlots(List<CalendarMeeting> events, List<TimeInterval> committed,
                                     DayContext day, UserPreferences preferences) {
        List<BusyInterval> busy = busyIntervalBuilder.build(events, committed, day.window());
        return freeSlotFinder.findFreeSlots(busy, day.start(), day.window().end(), minSlotMinutes, preferences);
    }

    private WalkWorkoutRequest walkWorkoutRequest(DayContext day, UserPreferences preferences,
                                                  UserActivityPatterns patterns,
                                                  boolean needsWalk, boolean needsWorkout) {
        int pace = patterns.getStepsPerMinuteWalking();
        List<WalkableMeeting> listening = day.events().stream()
            .filter(CalendarMeeting::isRealMeeting)
            .filter(event -> !event.isManaged())
            .filter(walkabilityClassifier::isBackgroundListenable)
            .map(event -> walkabilityClassifier.toListeningWalk(event, pace))
            .toList();
        List<TimeInterval> busy = new ArrayList<>(day.committed());
        day.events().stream()
            .filter(CalendarMeeting::isRealMeeting)
            .map(CalendarMeeting::toInterval)
            .forEach(busy::add);

        return WalkWorkoutRequest.builder()
            .date(day.date())
            .freeSlots(day.freeSlots())
            .listeningMeetings(listening)
            .busyIntervals(busy)
            .preferences(preferences)
            .needsWalk(needsWalk)
            .needsWorkout(needsWorkout)
            .nextWorkoutType(workoutProgressService.nextWorkoutType())
            .stepsPerMinute(pace)
            .hardEndHour(hardEndHour)
            .notBefore(day.start())
            .build();
    }

    private PlannedActivity updateStatus(LocalDate date, UUID activityId, PlannedActivity.ActivityStatus status) {
        PlannedActivity updated = generationGuard.withLock(date, () -> {
            DailyMovementPlan plan = requirePlan(date);
            PlannedActivity activity = findActivity(plan, activityId);
            activity.setStatus(status);
            store.put(StoreKeys.plan(date), plan);
            return activity;
        });
        if (updated.isManual()) {
            scheduledActivityService.updateStatus(date, activityId, status);
        }
        log.info("Activity {} on {} marked {}", activityId, date, status);
        return updated;
    }

    private DailyMovementPlan requirePlan(LocalDate date) {
        return getPlan(date).orElseThrow(() -> new ResourceNotFoundException("No plan for " + date));
    }

    private PlannedActivity findActivity(DailyMovementPlan plan, UUID activityId) {
        if (plan.getWorkout() != null && activityId.equals(plan.getWorkout().getId())) {
            return plan.getWorkout();
        }
        return plan.getActivities().stream()
            .filter(activity -> activityId.equals(activity.getId()))
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException("No activity " + activityId + " in plan for " + plan.getDate()));
    }

    private static Stream<PlannedActivity> otherActivities(DailyMovementPlan plan, UUID activityId) {
        Stream<PlannedActivity> all = plan.getWorkout() != null
            ? Stream.concat(plan.getActivities().stream(), Stream.of(plan.getWorkout()))
            : plan.getActivities().stream();
        return all
            .filter(activity -> !activityId.equals(activity.getId()))
            .filter(activity -> activity.getStatus() != PlannedActivity.ActivityStatus.SKIPPED);
    }

    private int fetchSteps(LocalDate date) {
        try {
            return activityDataProvider.fetchSteps(date);
        } catch (Exception e) {
            log.warn("Step data for {} unavailable, assuming 0 steps: {}", date, e.getMessage());
            return 0;
        }
    }

    private List<CalendarMeeting> fetchEvents(LocalDate date) {
        try {
            return calendarProvider.fetchEvents(date);
        } catch (Exception e) {
            log.warn("Calendar for {} unavailable, planning without meetings: {}", date, e.getMessage());
            return List.of();
        }
    }

    private void notifyListeners(DailyMovementPlan plan) {
        for (PlanListener listener : listeners) {
            try {
                listener.onPlanCommitted(plan);
            } catch (RuntimeException e) {
                log.error("Plan listener failed for {}", plan.getDate(), e);
            }
        }
    }

    /**
     * Calendar data and free time of one date. {@code window} is null when wake and sleep leave no room.
     */
    private record DayContext(
        LocalDate date,
        TimeInterval window,
        LocalDateTime start,
        List<CalendarMeeting> events,
        List<WalkableMeeting> walkableMeetings,
        List<TimeInterval> committed,
        List<FreeSlot> freeSlots
    ) {

        DayContext withFreeSlots(List<FreeSlot> slots) {
            return new DayContext(date, window, start, events, walkableMeetings, committed, slots);
        }
    }
}
