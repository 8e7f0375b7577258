package org.operaton.activslot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.operaton.activslot.exception.CalendarSyncException;
import org.operaton.activslot.exception.PlanningException;
import org.operaton.activslot.exception.ResourceNotFoundException;
import org.operaton.activslot.model.domain.CalendarMeeting;
import org.operaton.activslot.model.domain.DailyMovementPlan;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.provider.ActivityDataProvider;
import org.operaton.activslot.provider.CalendarProvider;
import org.operaton.activslot.store.InMemoryKeyValueStore;
import org.operaton.activslot.store.StoreKeys;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SmartPlannerService.
 */
@ExtendWith(MockitoExtension.class)
class SmartPlannerServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 12);

    @Mock
    private CalendarProvider calendarProvider;

    @Mock
    private ActivityDataProvider activityDataProvider;

    @Mock
    private PreferencesService preferencesService;

    private InMemoryKeyValueStore store;
    private PlanGenerationGuard generationGuard;
    private PatternLearningService patternLearningService;
    private ScheduledActivityService scheduledActivityService;
    private SmartPlannerService plannerService;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        Clock clock = Clock.fixed(Instant.parse("2025-03-12T09:10:00Z"), ZoneOffset.UTC);
        generationGuard = new PlanGenerationGuard();
        patternLearningService = new PatternLearningService(store, activityDataProvider, clock);
        scheduledActivityService = new ScheduledActivityService(store);
        plannerService = new SmartPlannerService(calendarProvider, activityDataProvider, store,
            new BusyIntervalBuilder(), new FreeSlotFinder(), new WalkabilityClassifier(), new SlotAllocator(),
            patternLearningService, preferencesService, scheduledActivityService,
            new WorkoutProgressService(store), new ConflictDetector(), generationGuard, clock);
    }

    private void givenPreferences(UserPreferences preferences) {
        when(preferencesService.current()).thenReturn(preferences);
    }

    private void givenDay(int steps, List<CalendarMeeting> events) {
        when(activityDataProvider.fetchSteps(DAY)).thenReturn(steps);
        when(calendarProvider.fetchEvents(DAY)).thenReturn(events);
    }

    private static CalendarMeeting meeting(String title, int attendees, int startHour, int endHour) {
        return CalendarMeeting.builder()
            .id(title)
            .title(title)
            .start(DAY.atTime(startHour, 0))
            .end(DAY.atTime(endHour, 0))
            .attendeeCount(attendees)
            .build();
    }

    @Test
    @DisplayName("Provider failures give a plan without meetings and without steps")
    void testGeneratePlan_ProvidersUnavailable() {
        // Given
        givenPreferences(UserPreferences.builder().build());
        when(activityDataProvider.fetchSteps(DAY)).thenThrow(new IllegalStateException("sensor offline"));
        when(calendarProvider.fetchEvents(DAY)).thenThrow(new CalendarSyncException("timeout"));

        // When
        DailyMovementPlan plan = plannerService.generatePlan(DAY);

        // Then
        assertEquals(0, plan.getCurrentSteps());
        assertEquals(10000, plan.getStepsNeeded());
        assertTrue(plan.getWalkableMeetings().isEmpty());
        assertFalse(plan.getActivities().isEmpty());
        assertTrue(plan.getGeneration() > 0);
        assertEquals(plan, plannerService.getPlan(DAY).orElseThrow());
    }

    @Test
    @DisplayName("Walks avoid meetings, start after now and walkable 1:1s are listed")
    void testGeneratePlan_WithMeetings() {
        // Given
        givenPreferences(UserPreferences.builder().build());
        givenDay(2000, List.of(
            meeting("1:1 sync", 2, 9, 10),
            meeting("Design review", 8, 10, 12),
            meeting("Quarterly planning", 12, 14, 17)));

        // When
        DailyMovementPlan plan = plannerService.generatePlan(DAY);

        // Then
        assertEquals(2000, plan.getCurrentSteps());
        assertEquals(8000, plan.getStepsNeeded());
        assertThat(plan.getWalkableMeetings()).extracting(meeting -> meeting.getTitle())
            .contains("1:1 sync");
        assertThat(plan.getActivities()).isNotEmpty().allSatisfy(activity -> {
            assertFalse(activity.toInterval().overlaps(meeting("x", 1, 10, 12).toInterval()));
            assertFalse(activity.toInterval().overlaps(meeting("x", 1, 14, 17).toInterval()));
            assertFalse(activity.getStartTime().isBefore(DAY.atTime(9, 10)));
        });
        assertTrue(plan.getConfidence() <= 0.95);
    }

    @Test
    @DisplayName("Workout days place the workout first and keep walks clear of it")
    void testGeneratePlan_WithWorkout() {
        // Given
        givenPreferences(UserPreferences.builder().gymFrequency(3).build());
        givenDay(0, List.of());

        // When
        DailyMovementPlan plan = plannerService.generatePlan(DAY);

        // Then
        PlannedActivity workout = plan.getWorkout();
        assertNotNull(workout);
        assertEquals(DAY.atTime(9, 10), workout.getStartTime());
        assertFalse(plan.getActivities().isEmpty());
        assertThat(plan.getActivities()).noneMatch(activity -> activity.toInterval().overlaps(workout.toInterval()));
    }

    @Test
    @DisplayName("Manual activities stay in the plan and reduce the walks needed")
    void testGeneratePlan_KeepsManualActivities() {
        // Given
        givenPreferences(UserPreferences.builder().build());
        givenDay(9000, List.of());
        PlannedActivity manual = scheduledActivityService.schedule(PlannedActivity.builder()
            .type(PlannedActivity.ActivityType.LUNCH_WALK)
            .startTime(DAY.atTime(13, 0))
            .durationMinutes(20)
            .estimatedSteps(2000)
            .priority(PlannedActivity.Priority.RECOMMENDED)
            .build());

        // When
        DailyMovementPlan plan = plannerService.generatePlan(DAY);

        // Then
        assertThat(plan.getActivities()).singleElement().satisfies(activity -> {
            assertEquals(manual.getId(), activity.getId());
            assertTrue(activity.isManual());
        });
        assertEquals(0, plan.getRemainingGap());
    }

    @Test
    @DisplayName("A generation invalidated while running does not overwrite the stored plan")
    void testGeneratePlan_StaleGenerationDiscarded() {
        // Given
        DailyMovementPlan earlier = DailyMovementPlan.builder().date(DAY).reasoning("earlier").build();
        store.put(StoreKeys.plan(DAY), earlier);
        when(preferencesService.current()).thenAnswer(invocation -> {
            generationGuard.invalidateInFlight();
            return UserPreferences.builder().build();
        });
        givenDay(0, List.of());
        List<DailyMovementPlan> notified = new ArrayList<>();
        plannerService.addListener(notified::add);

        // When
        DailyMovementPlan plan = plannerService.generatePlan(DAY);

        // Then
        assertEquals("earlier", plan.getReasoning());
        assertEquals("earlier", plannerService.getPlan(DAY).orElseThrow().getReasoning());
        assertTrue(notified.isEmpty());
    }

    @Test
    @DisplayName("Listeners are notified and a failing listener does not stop the others")
    void testGeneratePlan_NotifiesListeners() {
        givenPreferences(UserPreferences.builder().build());
        givenDay(0, List.of());
        List<DailyMovementPlan> notified = new ArrayList<>();
        plannerService.addListener(plan -> {
            throw new IllegalStateException("listener broke");
        });
        plannerService.addListener(notified::add);

        DailyMovementPlan plan = plannerService.generatePlan(DAY);

        assertEquals(List.of(plan), notified);
    }

    @Test
    @DisplayName("Completing and skipping update the plan and the learned adherence")
    void testRecordOutcome() {
        // Given
        givenPreferences(UserPreferences.builder().build());
        givenDay(0, List.of());
        UUID id = plannerService.generatePlan(DAY).getActivities().get(0).getId();

        // When
        plannerService.recordActivityCompleted(DAY, id);

        // Then
        assertEquals(PlannedActivity.ActivityStatus.COMPLETED,
            plannerService.getPlan(DAY).orElseThrow().getActivities().get(0).getStatus());
        assertEquals(1, patternLearningService.currentAdherence().getActivitiesCompleted());

        plannerService.recordActivitySkipped(DAY, id);
        assertEquals(PlannedActivity.ActivityStatus.SKIPPED,
            plannerService.getPlan(DAY).orElseThrow().getActivities().get(0).getStatus());
        assertEquals(1, patternLearningService.currentAdherence().getActivitiesSkipped());
    }

    @Test
    @DisplayName("Unknown plans and activities are reported as not found")
    void testRecordOutcome_NotFound() {
        assertThrows(ResourceNotFoundException.class, () -> plannerService.recordActivityCompleted(DAY, UUID.randomUUID()));

        store.put(StoreKeys.plan(DAY), DailyMovementPlan.builder().date(DAY).build());
        assertThrows(ResourceNotFoundException.class, () -> plannerService.recordActivitySkipped(DAY, UUID.randomUUID()));
    }

    @Test
    @DisplayName("A rescheduled activity becomes a manual commitment")
    void testRescheduleActivity() {
        // Given
        givenPreferences(UserPreferences.builder().build());
        givenDay(0, List.of());
        UUID id = plannerService.generatePlan(DAY).getActivities().get(0).getId();

        // When
        PlannedActivity moved = plannerService.rescheduleActivity(DAY, id, DAY.atTime(15, 0));

        // Then
        assertEquals(PlannedActivity.ActivityStatus.RESCHEDULED, moved.getStatus());
        assertTrue(moved.isManual());
        assertThat(scheduledActivityService.activitiesFor(DAY)).extracting(PlannedActivity::getId).containsExactly(id);
        assertTrue(patternLearningService.currentAdherence().getReschedulingFrequency() > 0.2);
        assertThrows(PlanningException.class, () -> plannerService.rescheduleActivity(DAY, id, DAY.plusDays(1).atTime(9, 0)));
    }

    @Test
    @DisplayName("Moving an activity onto another one is refused and the plan stays unchanged")
    void testRescheduleActivity_Overlap() {
        // Given
        PlannedActivity morning = walk(8, 0, 45);
        PlannedActivity afternoon = walk(14, 0, 45);
        store.put(StoreKeys.plan(DAY), DailyMovementPlan.builder()
            .date(DAY)
            .activities(new ArrayList<>(List.of(morning, afternoon)))
            .build());

        // When
        PlanningException e = assertThrows(PlanningException.class,
            () -> plannerService.rescheduleActivity(DAY, afternoon.getId(), DAY.atTime(8, 5)));

        // Then
        assertTrue(e.getMessage().contains("08:00"));
        assertThat(plannerService.getPlan(DAY).orElseThrow().getActivities())
            .extracting(PlannedActivity::getStartTime)
            .containsExactly(DAY.atTime(8, 0), DAY.atTime(14, 0));
        assertThat(scheduledActivityService.activitiesFor(DAY)).isEmpty();

        PlannedActivity moved = plannerService.rescheduleActivity(DAY, afternoon.getId(), DAY.atTime(8, 45));
        assertEquals(DAY.atTime(8, 45), moved.getStartTime());
    }

    private static PlannedActivity walk(int hour, int minute, int minutes) {
        return PlannedActivity.builder()
            .id(UUID.randomUUID())
            .type(PlannedActivity.ActivityType.STANDARD_WALK)
            .startTime(DAY.atTime(hour, minute))
            .durationMinutes(minutes)
            .estimatedSteps(minutes * 100)
            .build();
    }

    @Test
    @DisplayName("Plans past the retention window are deleted")
    void testCleanupOldPlans() {
        store.put(StoreKeys.plan(LocalDate.of(2025, 1, 1)), DailyMovementPlan.builder().build());
        store.put(StoreKeys.plan(LocalDate.of(2025, 3, 10)), DailyMovementPlan.builder().build());
        store.putRaw(StoreKeys.PLAN_PREFIX + "not-a-date", "{}");

        long old = generationGuard.begin(LocalDate.of(2025, 1, 1));
        generationGuard.commit(LocalDate.of(2025, 1, 1), old, () -> { });

        int deleted = plannerService.cleanupOldPlans(DAY, 30);

        assertEquals(1, deleted);
        assertEquals(0, generationGuard.trackedDates());
        assertFalse(store.contains(StoreKeys.plan(LocalDate.of(2025, 1, 1))));
        assertTrue(store.contains(StoreKeys.PLAN_PREFIX + "not-a-date"));
    }

    @Test
    @DisplayName("Scheduled activities close to meetings are reported as conflicts")
    void testDetectConflicts() {
        when(calendarProvider.fetchEvents(DAY)).thenReturn(List.of(meeting("Design review", 6, 10, 11)));
        scheduledActivityService.schedule(PlannedActivity.builder()
            .type(PlannedActivity.ActivityType.STANDARD_WALK)
            .startTime(DAY.atTime(9, 40))
            .durationMinutes(15)
            .build());

        assertThat(plannerService.detectConflicts(DAY)).singleElement()
            .satisfies(conflict -> assertEquals("Design review", conflict.meetingTitle()));
    }
}
