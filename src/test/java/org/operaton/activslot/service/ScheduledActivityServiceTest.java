package org.operaton.activslot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.activslot.exception.PlanningException;
import org.operaton.activslot.exception.ResourceNotFoundException;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.TimeInterval;
import org.operaton.activslot.store.InMemoryKeyValueStore;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ScheduledActivityService.
 */
class ScheduledActivityServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 12);

    private ScheduledActivityService service;

    @BeforeEach
    void setUp() {
        service = new ScheduledActivityService(new InMemoryKeyValueStore());
    }

    private static PlannedActivity walk(LocalDateTime start, int minutes) {
        return PlannedActivity.builder()
            .type(PlannedActivity.ActivityType.STANDARD_WALK)
            .startTime(start)
            .durationMinutes(minutes)
            .estimatedSteps(minutes * 100)
            .priority(PlannedActivity.Priority.RECOMMENDED)
            .status(null)
            .build();
    }

    @Test
    @DisplayName("Scheduling fills in id, status and the manual flag")
    void testSchedule_FillsDefaults() {
        PlannedActivity stored = service.schedule(walk(DAY.atTime(10, 0), 20));

        assertNotNull(stored.getId());
        assertEquals(PlannedActivity.ActivityStatus.PLANNED, stored.getStatus());
        assertTrue(stored.isManual());
        assertEquals(List.of(stored), service.activitiesFor(DAY));
    }

    @Test
    @DisplayName("Scheduling the same id again replaces the activity")
    void testSchedule_ReplacesSameId() {
        PlannedActivity first = service.schedule(walk(DAY.atTime(10, 0), 20));
        PlannedActivity moved = walk(DAY.atTime(15, 0), 20);
        moved.setId(first.getId());

        service.schedule(moved);

        assertThat(service.activitiesFor(DAY)).extracting(PlannedActivity::getStartTime)
            .containsExactly(DAY.atTime(15, 0));
    }

    @Test
    @DisplayName("Skipped activities are not busy time")
    void testBusyIntervalsFor_IgnoresSkipped() {
        PlannedActivity kept = service.schedule(walk(DAY.atTime(9, 0), 30));
        PlannedActivity skipped = service.schedule(walk(DAY.atTime(14, 0), 30));

        assertTrue(service.updateStatus(DAY, skipped.getId(), PlannedActivity.ActivityStatus.SKIPPED));

        assertEquals(List.of(kept.toInterval()), service.busyIntervalsFor(DAY));
        assertEquals(List.of(new TimeInterval(DAY.atTime(9, 0), DAY.atTime(9, 30))), service.busyIntervalsFor(DAY));
    }

    @Test
    @DisplayName("Activities shorter than five minutes are rejected")
    void testSchedule_TooShort() {
        assertThrows(PlanningException.class, () -> service.schedule(walk(DAY.atTime(9, 0), 4)));
    }

    @Test
    @DisplayName("Removing an unknown activity fails")
    void testRemove_Unknown() {
        assertThrows(ResourceNotFoundException.class, () -> service.remove(DAY, UUID.randomUUID()));
        assertFalse(service.updateStatus(DAY, UUID.randomUUID(), PlannedActivity.ActivityStatus.COMPLETED));
    }

    @Test
    @DisplayName("Should remove a scheduled activity")
    void testRemove() {
        PlannedActivity stored = service.schedule(walk(DAY.atTime(9, 0), 30));

        service.remove(DAY, stored.getId());

        assertTrue(service.activitiesFor(DAY).isEmpty());
    }
}
