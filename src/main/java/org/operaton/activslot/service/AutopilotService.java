package org.operaton.activslot.service;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.exception.CalendarSyncException;
import org.operaton.activslot.exception.PlanningException;
import org.operaton.activslot.exception.ResourceNotFoundException;
import org.operaton.activslot.model.domain.AutopilotRunResult;
import org.operaton.activslot.model.domain.AutopilotWalk;
import org.operaton.activslot.model.domain.BusyInterval;
import org.operaton.activslot.model.domain.CalendarMeeting;
import org.operaton.activslot.model.domain.FreeSlot;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.TimeInterval;
import org.operaton.activslot.model.domain.TrustLevel;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.provider.CalendarProvider;
import org.operaton.activslot.provider.NotificationDispatcher;
import org.operaton.activslot.store.KeyValueStore;
import org.operaton.activslot.store.StoreKeys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Nightly autopilot: picks tomorrow's walks and applies the user's trust level.
 * <p>
 * Full-auto walks are written to the calendar right away, confirm-first walks wait for approval
 * and suggest-only walks are kept for display. Calendar failures never abort a run; they are
 * collected in the {@link AutopilotRunResult}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutopilotService {

    private static final TypeReference<List<AutopilotWalk>> WALK_LIST = new TypeReference<>() {
    };

    static final int ALARM_OFFSET_MINUTES = 5;
    static final int POST_MEETING_MIN_GAP_MINUTES = 10;
    static final int POST_MEETING_BUFFER_MINUTES = 5;
    static final int POST_MEETING_MAX_MINUTES = 15;
    static final int SITTING_BREAK_MINUTES = 5;

    private final PreferencesService preferencesService;
    private final CalendarProvider calendarProvider;
    private final NotificationDispatcher notificationDispatcher;
    private final ScheduledActivityService scheduledActivityService;
    private final BusyIntervalBuilder busyIntervalBuilder;
    private final FreeSlotFinder freeSlotFinder;
    private final AutopilotSlotSelector slotSelector;
    private final KeyValueStore store;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean();

    @Value("${activslot.planning.hard-end-hour:21}")
    private int hardEndHour = 21;

    /**
     * Schedule walks for tomorrow unless that already happened or the autopilot is off.
     */
    public AutopilotRunResult scheduleWalksForTomorrow() {
        LocalDate tomorrow = LocalDate.now(clock).plusDays(1);
        UserPreferences preferences = preferencesService.current();
        if (!preferences.isAutopilotEnabled()) {
            return AutopilotRunResult.skipped(tomorrow, "Autopilot is disabled");
        }
        if (tomorrow.equals(lastScheduledDate().orElse(null))) {
            log.debug("Autopilot already ran for {}", tomorrow);
            return AutopilotRunResult.skipped(tomorrow, "Walks for " + tomorrow + " are already scheduled");
        }
        if (!running.compareAndSet(false, true)) {
            return AutopilotRunResult.skipped(tomorrow, "Autopilot run already in progress");
        }
        try {
            // another trigger may have finished the date while this one waited for the flag
            if (tomorrow.equals(lastScheduledDate().orElse(null))) {
                log.debug("Autopilot run for {} finished while this trigger was waiting", tomorrow);
                return AutopilotRunResult.skipped(tomorrow, "Walks for " + tomorrow + " are already scheduled");
            }
            return scheduleWalks(tomorrow, preferences);
        } finally {
            running.set(false);
        }
    }

    /**
     * Clear the idempotency marker and run again, replacing tomorrow's earlier walks.
     */
    public AutopilotRunResult forceScheduleForTomorrow() {
        store.delete(StoreKeys.AUTOPILOT_LAST_SCHEDULED_DATE);
        return scheduleWalksForTomorrow();
    }

    /**
     * Approve a pending walk and write it to the calendar.
     *
     * @throws ResourceNotFoundException if no pending walk has this id
     * @throws CalendarSyncException if the calendar write fails; the walk stays pending
     */
    public synchronized AutopilotWalk approveWalk(UUID walkId) {
        List<AutopilotWalk> walks = loadWalks();
        AutopilotWalk walk = findPending(walks, walkId);
        commit(walk, preferencesService.current());
        saveWalks(walks);
        log.info("Autopilot walk {} at {} approved", walkId, walk.getStartTime());
        return walk;
    }

    /**
     * @throws ResourceNotFoundException if no pending walk has this id
     */
    public synchronized AutopilotWalk rejectWalk(UUID walkId) {
        List<AutopilotWalk> walks = loadWalks();
        AutopilotWalk walk = findPending(walks, walkId);
        walk.setApprovalState(AutopilotWalk.ApprovalState.REJECTED);
        saveWalks(walks);
        log.info("Autopilot walk {} at {} rejected", walkId, walk.getStartTime());
        return walk;
    }

    /**
     * Move a pending walk to another time on the same day and approve it.
     *
     * @throws ResourceNotFoundException if no pending walk has this id
     * @throws PlanningException if the new time is on another day
     */
    public synchronized AutopilotWalk adjustWalkTime(UUID walkId, LocalDateTime newStart) {
        List<AutopilotWalk> walks = loadWalks();
        AutopilotWalk walk = findPending(walks, walkId);
        if (!newStart.toLocalDate().equals(walk.getDate())) {
            throw new PlanningException("A walk can only be moved within " + walk.getDate());
        }
        boolean taken = walks.stream()
            .filter(AutopilotWalk::isActive)
            .anyMatch(other -> !other.getId().equals(walkId) && other.getStartTime().equals(newStart));
        if (taken) {
            throw new PlanningException("Another walk already starts at " + newStart);
        }
        walk.setStartTime(newStart);
        commit(walk, preferencesService.current());
        saveWalks(walks);
        log.info("Autopilot walk {} moved to {} and approved", walkId, newStart);
        return walk;
    }

    public List<AutopilotWalk> pendingApprovals() {
        return loadWalks().stream()
            .filter(walk -> walk.getApprovalState() == AutopilotWalk.ApprovalState.PENDING)
            .sorted(Comparator.comparing(AutopilotWalk::getStartTime))
            .toList();
    }

    public List<AutopilotWalk> walksFor(LocalDate date) {
        return loadWalks().stream()
            .filter(walk -> date.equals(walk.getDate()))
            .sorted(Comparator.comparing(AutopilotWalk::getStartTime))
            .toList();
    }

    /**
     * Remove walks older than the retention window.
     *
     * @return number of removed walks
     */
    public synchronized int cleanupOldWalks(int retentionDays) {
        LocalDate cutoff = LocalDate.now(clock).minusDays(retentionDays);
        List<AutopilotWalk> walks = loadWalks();
        int before = walks.size();
        walks.removeIf(walk -> walk.getDate().isBefore(cutoff));
        int removed = before - walks.size();
        if (removed > 0) {
            saveWalks(walks);
        }
        return removed;
    }

    /**
     * Suggest a walk right after a meeting when there is room before the next one.
     *
     * @param meetingEnd end of the meeting that just finished
     * @return a suggested walk, or empty when the gap is too short, a meal is due or the autopilot is off
     */
    public Optional<AutopilotWalk> checkPostMeetingOpportunity(LocalDateTime meetingEnd) {
        UserPreferences preferences = preferencesService.current();
        if (!preferences.isAutopilotEnabled()) {
            return Optional.empty();
        }

        Optional<CalendarMeeting> next = fetchEvents(meetingEnd.toLocalDate(), new ArrayList<>()).stream()
            .filter(event -> !event.isAllDay())
            .filter(event -> event.getStart().isAfter(meetingEnd))
            .min(Comparator.comparing(CalendarMeeting::getStart));

        if (next.isEmpty()) {
            return Optional.of(suggestion(meetingEnd, 10));
        }

        long gap = Duration.between(meetingEnd, next.get().getStart()).toMinutes();
        if (gap >= POST_MEETING_MIN_GAP_MINUTES && !preferences.isDuringMeal(meetingEnd)) {
            int duration = (int) Math.min(gap - POST_MEETING_BUFFER_MINUTES, POST_MEETING_MAX_MINUTES);
            return Optional.of(suggestion(meetingEnd, duration));
        }
        return Optional.empty();
    }

    public AutopilotWalk suggestSittingBreak(LocalDateTime now) {
        return suggestion(now, SITTING_BREAK_MINUTES);
    }

    AutopilotRunResult scheduleWalks(LocalDate date, UserPreferences preferences) {
        log.info("Autopilot run for {} started (trust level {})", date, preferences.getTrustLevel());
        List<String> errors = new ArrayList<>();

        synchronized (this) {
            removeSupersededWalks(date, errors);
        }

        Optional<TimeInterval> window = preferences.activeWindow(date, hardEndHour);
        if (window.isEmpty()) {
            log.warn("Autopilot found no active window on {}", date);
            return AutopilotRunResult.skipped(date, "No active hours on " + date);
        }

        List<CalendarMeeting> events = fetchEvents(date, errors);
        List<BusyInterval> busy = busyIntervalBuilder.build(events, scheduledActivityService.busyIntervalsFor(date), window.get());
        List<FreeSlot> candidates = freeSlotFinder
            .findFreeSlots(busy, window.get(), AutopilotSlotSelector.MICRO_MIN_GAP_MINUTES, preferences).stream()
            .filter(slot -> !slot.duringMeal())
            .toList();

        List<TimeInterval> selected = slotSelector.select(candidates, preferences.getWalksPerDay(),
            preferences.isIncludeMicroWalks(), preferences.getMinWalkDuration(), preferences.getMaxWalkDuration());

        if (selected.isEmpty()) {
            log.info("Autopilot found no suitable walk slots for {}", date);
            AutopilotRunResult result = AutopilotRunResult.skipped(date, "No suitable walk slots");
            result.setErrors(errors);
            return result;
        }

        List<AutopilotWalk> scheduled = new ArrayList<>();
        synchronized (this) {
            for (TimeInterval interval : selected) {
                AutopilotWalk walk = AutopilotWalk.builder()
                    .id(UUID.randomUUID())
                    .date(date)
                    .startTime(interval.start())
                    .durationMinutes((int) interval.durationMinutes())
                    .type(AutopilotWalk.WalkType.fromDuration((int) interval.durationMinutes()))
                    .approvalState(AutopilotWalk.ApprovalState.PENDING)
                    .createdAt(LocalDateTime.now(clock))
                    .build();
                applyTrustLevel(walk, preferences, errors);
                scheduled.add(walk);
            }

            List<AutopilotWalk> walks = loadWalks();
            walks.addAll(scheduled);
            saveWalks(walks);
            store.put(StoreKeys.AUTOPILOT_LAST_SCHEDULED_DATE, date);
        }

        if (preferences.getTrustLevel() == TrustLevel.FULL_AUTO) {
            notificationDispatcher.scheduleSummary(date, scheduled);
        }

        log.info("Autopilot run for {} finished: {} walks, {} errors", date, scheduled.size(), errors.size());
        return AutopilotRunResult.builder()
            .targetDate(date)
            .walks(scheduled)
            .errors(errors)
            .build();
    }

    private void applyTrustLevel(AutopilotWalk walk, UserPreferences preferences, List<String> errors) {
        switch (preferences.getTrustLevel()) {
            case FULL_AUTO -> {
                try {
                    commit(walk, preferences);
                } catch (CalendarSyncException e) {
                    log.warn("Calendar write for walk at {} failed, keeping it pending: {}", walk.getStartTime(), e.getMessage());
                    errors.add("Could not add walk at " + walk.getStartTime().toLocalTime() + " to the calendar: " + e.getMessage());
                }
            }
            case CONFIRM_FIRST -> notificationDispatcher.scheduleApprovalPrompt(walk);
            case SUGGEST_ONLY -> walk.setApprovalState(AutopilotWalk.ApprovalState.SUGGESTED);
        }
    }

    /**
     * Write the walk to the calendar, when one is configured, and mark it approved.
     * The walk is left untouched when the calendar write fails.
     */
    private void commit(AutopilotWalk walk, UserPreferences preferences) {
        String calendarId = preferences.getAutopilotCalendarId();
        if (calendarId != null && !calendarId.isBlank()) {
            String eventId = calendarProvider.createEvent(calendarId, walk.getType().getDisplayName(),
                walk.getStartTime(), walk.getEndTime(), notesFor(walk), ALARM_OFFSET_MINUTES);
            walk.setCalendarEventId(eventId);
        }
        walk.setApprovalState(AutopilotWalk.ApprovalState.APPROVED);
        scheduledActivityService.schedule(PlannedActivity.builder()
            .id(walk.getId())
            .type(activityTypeFor(walk))
            .startTime(walk.getStartTime())
            .durationMinutes(walk.getDurationMinutes())
            .estimatedSteps(walk.getDurationMinutes() * WalkabilityClassifier.DEFAULT_STEPS_PER_MINUTE)
            .priority(PlannedActivity.Priority.RECOMMENDED)
            .reason("Scheduled by autopilot")
            .build());
    }

    private void removeSupersededWalks(LocalDate date, List<String> errors) {
        List<AutopilotWalk> walks = loadWalks();
        List<AutopilotWalk> superseded = walks.stream()
            .filter(walk -> date.equals(walk.getDate()))
            .toList();
        if (superseded.isEmpty()) {
            return;
        }
        for (AutopilotWalk walk : superseded) {
            if (walk.getCalendarEventId() != null) {
                try {
                    calendarProvider.deleteEvent(walk.getCalendarEventId());
                } catch (CalendarSyncException e) {
                    log.warn("Could not delete superseded calendar event {}: {}", walk.getCalendarEventId(), e.getMessage());
                    errors.add("Could not remove the earlier walk at " + walk.getStartTime().toLocalTime()
                        + " from the calendar: " + e.getMessage());
                }
            }
            if (walk.getApprovalState() == AutopilotWalk.ApprovalState.APPROVED) {
                scheduledActivityService.updateStatus(date, walk.getId(), PlannedActivity.ActivityStatus.SKIPPED);
            }
        }
        walks.removeAll(superseded);
        saveWalks(walks);
        log.info("Removed {} superseded autopilot walks for {}", superseded.size(), date);
    }

    private List<CalendarMeeting> fetchEvents(LocalDate date, List<String> errors) {
        try {
            return calendarProvider.fetchEvents(date);
        } catch (Exception e) {
            log.warn("Calendar for {} unavailable: {}", date, e.getMessage());
            errors.add("Calendar unavailable, walks were planned without meetings: " + e.getMessage());
            return List.of();
        }
    }

    private AutopilotWalk findPending(List<AutopilotWalk> walks, UUID walkId) {
        return walks.stream()
            .filter(walk -> walk.getId().equals(walkId))
            .filter(walk -> walk.getApprovalState() == AutopilotWalk.ApprovalState.PENDING)
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException("No pending autopilot walk " + walkId));
    }

    private AutopilotWalk suggestion(LocalDateTime start, int minutes) {
        LocalDateTime startTime = start.truncatedTo(ChronoUnit.MINUTES);
        return AutopilotWalk.builder()
            .id(UUID.randomUUID())
            .date(startTime.toLocalDate())
            .startTime(startTime)
            .durationMinutes(minutes)
            .type(AutopilotWalk.WalkType.fromDuration(minutes))
            .approvalState(AutopilotWalk.ApprovalState.SUGGESTED)
            .createdAt(LocalDateTime.now(clock))
            .build();
    }

    private static PlannedActivity.ActivityType activityTypeFor(AutopilotWalk walk) {
        return switch (walk.getType()) {
            case MICRO -> PlannedActivity.ActivityType.MICRO_WALK;
            case SHORT -> PlannedActivity.ActivityType.SHORT_WALK;
            case STANDARD -> PlannedActivity.ActivityType.STANDARD_WALK;
        };
    }

    private static String notesFor(AutopilotWalk walk) {
        return walk.getDurationMinutes() + " minute " + walk.getType().getDisplayName().toLowerCase(Locale.ROOT)
            + " scheduled by Activslot autopilot.";
    }

    private Optional<LocalDate> lastScheduledDate() {
        return store.get(StoreKeys.AUTOPILOT_LAST_SCHEDULED_DATE, LocalDate.class);
    }

    private List<AutopilotWalk> loadWalks() {
        return new ArrayList<>(store.get(StoreKeys.AUTOPILOT_WALKS, WALK_LIST).orElseGet(ArrayList::new));
    }

    private void saveWalks(List<AutopilotWalk> walks) {
        store.put(StoreKeys.AUTOPILOT_WALKS, walks);
    }
}
