package org.operaton.activslot.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.operaton.activslot.model.domain.FreeSlot;
import org.operaton.activslot.model.domain.PlanAdherence;
import org.operaton.activslot.model.domain.PlanAssessment;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.PreferredTime;
import org.operaton.activslot.model.domain.SlotClass;
import org.operaton.activslot.model.domain.TimeInterval;
import org.operaton.activslot.model.domain.UserActivityPatterns;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.model.domain.WalkWorkoutAllocation;
import org.operaton.activslot.model.domain.WalkWorkoutRequest;
import org.operaton.activslot.model.domain.WalkableMeeting;
import org.operaton.activslot.model.domain.WorkoutType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SlotAllocator.
 */
class SlotAllocatorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 12);

    private final SlotAllocator allocator = new SlotAllocator();
    private final UserActivityPatterns patterns = UserActivityPatterns.defaults();
    private final PlanAdherence adherence = PlanAdherence.initial();

    private static FreeSlot slot(int hour, int minute, int minutes) {
        return slot(hour, minute, minutes, false);
    }

    private static FreeSlot slot(int hour, int minute, int minutes, boolean duringMeal) {
        LocalDateTime start = DAY.atTime(hour, minute);
        return new FreeSlot(TimeInterval.ofMinutes(start, minutes), minutes, SlotClass.fromMinutes(minutes), duringMeal, true);
    }

    private static int plannedSteps(List<PlannedActivity> activities) {
        return activities.stream().mapToInt(PlannedActivity::getEstimatedSteps).sum();
    }

    @Nested
    @DisplayName("Walk allocation")
    class Allocate {

        @Test
        @DisplayName("3000 steps in a 40 minute slot gives one critical 35 minute walk")
        void testAllocate_SingleSlot() {
            // When
            List<PlannedActivity> activities = allocator.allocate(3000, List.of(slot(14, 0, 40)), List.of(), patterns, adherence);

            // Then
            assertThat(activities).singleElement().satisfies(walk -> {
                assertEquals(35, walk.getDurationMinutes());
                assertEquals(3500, walk.getEstimatedSteps());
                assertEquals(PlannedActivity.Priority.CRITICAL, walk.getPriority());
                assertEquals(DAY.atTime(14, 0), walk.getStartTime());
                assertEquals(PlannedActivity.ActivityStatus.PLANNED, walk.getStatus());
            });
        }

        @Test
        @DisplayName("Walk minutes round down before the buffer is added")
        void testAllocate_MinutesRoundDown() {
            // When
            List<PlannedActivity> activities = allocator.allocate(3050, List.of(slot(14, 0, 60)), List.of(), patterns, adherence);

            // Then
            assertThat(activities).singleElement()
                .satisfies(walk -> assertEquals(35, walk.getDurationMinutes()));
        }

        @Test
        @DisplayName("Identical inputs give identical activities, ids included")
        void testAllocate_Deterministic() {
            List<FreeSlot> slots = List.of(slot(8, 0, 30), slot(12, 0, 25), slot(15, 0, 60), slot(18, 0, 45));

            List<PlannedActivity> first = allocator.allocate(9000, slots, List.of(), patterns, adherence);
            List<PlannedActivity> second = allocator.allocate(9000, slots, List.of(), patterns, adherence);

            assertEquals(first, second);
        }

        @Test
        @DisplayName("A bigger gap never yields fewer planned steps")
        void testAllocate_MonotonicInGap() {
            List<FreeSlot> slots = List.of(slot(8, 0, 30), slot(12, 0, 25), slot(15, 0, 60), slot(18, 0, 45));

            int previous = 0;
            for (int needed = 0; needed <= 15000; needed += 1500) {
                int planned = plannedSteps(allocator.allocate(needed, slots, List.of(), patterns, adherence));
                assertTrue(planned >= previous, "planned steps dropped at " + needed);
                previous = planned;
            }
        }

        @Test
        @DisplayName("Walks stay inside their slots and never overlap")
        void testAllocate_NoOverlap() {
            List<FreeSlot> slots = List.of(slot(8, 0, 30), slot(9, 0, 20), slot(12, 0, 25), slot(15, 0, 60));

            List<PlannedActivity> activities = allocator.allocate(20000, slots, List.of(), patterns, adherence);

            assertThat(activities).hasSize(4);
            for (int i = 0; i < activities.size(); i++) {
                PlannedActivity walk = activities.get(i);
                assertTrue(slots.stream().anyMatch(s -> s.interval().contains(walk.toInterval())));
                assertTrue(walk.getDurationMinutes() <= SlotAllocator.MAX_WALK_MINUTES);
                if (i > 0) {
                    assertFalse(activities.get(i - 1).toInterval().overlaps(walk.toInterval()));
                }
            }
        }

        @Test
        @DisplayName("Should skip meal-time slots")
        void testAllocate_SkipsMeals() {
            List<PlannedActivity> activities = allocator.allocate(3000,
                List.of(slot(12, 30, 60, true), slot(16, 0, 40)), List.of(), patterns, adherence);

            assertThat(activities).extracting(PlannedActivity::getStartTime).containsExactly(DAY.atTime(16, 0));
        }

        @Test
        @DisplayName("Recommended walking meetings can close the gap alone")
        void testAllocate_MeetingsCoverGap() {
            WalkableMeeting meeting = WalkableMeeting.builder()
                .title("1:1 sync").startTime(DAY.atTime(10, 0)).durationMinutes(30)
                .recommended(true).estimatedSteps(3000).build();

            List<PlannedActivity> activities = allocator.allocate(2500, List.of(slot(14, 0, 40)), List.of(meeting), patterns, adherence);

            assertTrue(activities.isEmpty());
        }

        @Test
        @DisplayName("Nothing is planned when the goal is already met")
        void testAllocate_NothingNeeded() {
            assertTrue(allocator.allocate(0, List.of(slot(14, 0, 40)), List.of(), patterns, adherence).isEmpty());
        }

        @Test
        @DisplayName("Peak hours and good completion rates score higher")
        void testScoreSlot() {
            FreeSlot peak = slot(8, 0, 30);
            FreeSlot offPeak = slot(10, 0, 30);

            assertTrue(allocator.scoreSlot(peak, patterns, adherence) > allocator.scoreSlot(offPeak, patterns, adherence));
            assertEquals(0.3 + 0.25 + 0.2 + 0.15 + 0.15, allocator.scoreSlot(peak, patterns, adherence), 0.0001);
        }
    }

    @Nested
    @DisplayName("Plan assessment")
    class Assess {

        @Test
        @DisplayName("Confidence never exceeds 0.95")
        void testAssess_ConfidenceCap() {
            UserActivityPatterns reliable = patterns.toBuilder().goalAchievementRate(1.0).build();
            List<PlannedActivity> walks = allocator.allocate(5000, List.of(slot(14, 0, 60), slot(17, 0, 60)), List.of(), reliable, adherence);

            PlanAssessment assessment = allocator.assess(5000, walks, List.of(), reliable);

            assertEquals(SlotAllocator.MAX_CONFIDENCE, assessment.confidence(), 0.0001);
            assertTrue(assessment.reasoning().startsWith("This plan covers your step goal."));
        }

        @Test
        @DisplayName("Goal already met")
        void testAssess_GoalMet() {
            PlanAssessment assessment = allocator.assess(0, List.of(), List.of(), patterns);

            assertTrue(assessment.reasoning().startsWith("You've already hit your step goal!"));
        }

        @Test
        @DisplayName("Low coverage reports the missing steps")
        void testAssess_LimitedAvailability() {
            List<PlannedActivity> walks = allocator.allocate(10000, List.of(slot(14, 0, 20)), List.of(), patterns, adherence);

            PlanAssessment assessment = allocator.assess(10000, walks, List.of(), patterns);

            assertEquals(0.6 * 0.15 + 0.4 * 0.3, assessment.confidence(), 0.0001);
            assertTrue(assessment.reasoning().contains("~8500 extra steps"));
        }
    }

    @Nested
    @DisplayName("Walk and workout tiers")
    class WalkAndWorkout {

        private final UserPreferences preferences = UserPreferences.builder().gymFrequency(3).build();

        private WalkWorkoutRequest.WalkWorkoutRequestBuilder request(List<FreeSlot> slots) {
            return WalkWorkoutRequest.builder()
                .date(DAY)
                .freeSlots(slots)
                .listeningMeetings(List.of())
                .busyIntervals(List.of())
                .preferences(preferences)
                .needsWalk(true)
                .needsWorkout(true)
                .nextWorkoutType(WorkoutType.PULL)
                .stepsPerMinute(100)
                .hardEndHour(21);
        }

        @Test
        @DisplayName("Several free hours: workout at the best gym hour, extra walks offered")
        void testAllocate_ManyOneHourSlots() {
            // Given
            List<FreeSlot> slots = List.of(slot(9, 0, 90), slot(14, 0, 90), slot(17, 30, 75));

            // When
            WalkWorkoutAllocation allocation = allocator.allocateWalkAndWorkout(request(slots).build());

            // Then
            assertEquals(DAY.atTime(17, 30), allocation.getWorkout().getStartTime());
            assertEquals(45, allocation.getWorkout().getDurationMinutes());
            assertEquals(WorkoutType.PULL, allocation.getWorkout().getWorkoutType());
            assertEquals(DAY.atTime(9, 0), allocation.getWalk().getStartTime());
            assertEquals(45, allocation.getWalk().getDurationMinutes());
            assertThat(allocation.getOtherWalks()).extracting(PlannedActivity::getStartTime)
                .containsExactly(DAY.atTime(14, 0));
        }

        @Test
        @DisplayName("No free hour: workout in a shorter slot, walk in a listening meeting")
        void testAllocate_NoOneHourSlot() {
            // Given
            WalkableMeeting allHands = WalkableMeeting.builder()
                .title("Company update").startTime(DAY.atTime(15, 0)).durationMinutes(60)
                .recommended(true).estimatedSteps(6000).build();

            // When
            WalkWorkoutAllocation allocation = allocator.allocateWalkAndWorkout(
                request(List.of(slot(9, 0, 50))).listeningMeetings(List.of(allHands)).build());

            // Then
            assertEquals(DAY.atTime(9, 0), allocation.getWorkout().getStartTime());
            assertNull(allocation.getWalk());
            assertEquals("Company update", allocation.getWalkingMeeting().getTitle());
        }

        @Test
        @DisplayName("Single free hour goes to the workout")
        void testAllocate_SingleOneHourSlot() {
            WalkWorkoutAllocation allocation = allocator.allocateWalkAndWorkout(
                request(List.of(slot(10, 0, 60), slot(15, 0, 50))).build());

            assertEquals(DAY.atTime(10, 0), allocation.getWorkout().getStartTime());
            assertEquals(DAY.atTime(15, 0), allocation.getWalk().getStartTime());
        }

        @Test
        @DisplayName("Without slots both fall back to preferred hours clear of meals")
        void testAllocate_PreferredTimeFallback() {
            WalkWorkoutAllocation allocation = allocator.allocateWalkAndWorkout(request(List.of()).build());

            // 08:00 is breakfast, so the walk moves to 09:00 and the workout to 10:00
            assertEquals(DAY.atTime(9, 0), allocation.getWalk().getStartTime());
            assertEquals(DAY.atTime(10, 0), allocation.getWorkout().getStartTime());
            assertFalse(allocation.getWalk().toInterval().overlaps(allocation.getWorkout().toInterval()));
        }

        @Test
        @DisplayName("Workout alone when no walk is needed")
        void testAllocate_WorkoutOnly() {
            WalkWorkoutAllocation allocation = allocator.allocateWalkAndWorkout(
                request(List.of(slot(9, 0, 90), slot(14, 0, 90))).needsWalk(false).build());

            assertNotNull(allocation.getWorkout());
            assertNull(allocation.getWalk());
            assertTrue(allocation.getOtherWalks().isEmpty());
        }
    }

    @Test
    @DisplayName("Preference score tables")
    void testPreferenceScores() {
        assertEquals(3, allocator.gymPreferenceScore(7, PreferredTime.MORNING));
        assertEquals(1, allocator.gymPreferenceScore(10, PreferredTime.MORNING));
        assertEquals(0, allocator.gymPreferenceScore(13, PreferredTime.MORNING));
        assertEquals(2, allocator.gymPreferenceScore(18, PreferredTime.NO_PREFERENCE));
        assertEquals(1, allocator.gymPreferenceScore(12, PreferredTime.NO_PREFERENCE));
        assertEquals(3, allocator.walkPreferenceScore(18, PreferredTime.EVENING));
        assertEquals(0, allocator.walkPreferenceScore(9, PreferredTime.AFTERNOON));
        assertEquals(1, allocator.walkPreferenceScore(9, PreferredTime.NO_PREFERENCE));
    }
}
