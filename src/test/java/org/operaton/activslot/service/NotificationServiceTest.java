package org.operaton.activslot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.operaton.activslot.model.domain.AutopilotWalk;
import org.operaton.activslot.model.entity.Notification;
import org.operaton.activslot.repository.NotificationRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for NotificationService.
 */
@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final LocalDate TOMORROW = LocalDate.of(2025, 3, 12);

    @Mock
    private NotificationRepository notificationRepository;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-11T19:30:00Z"), ZoneOffset.UTC);
        notificationService = new NotificationService(notificationRepository, clock);
    }

    private static AutopilotWalk walk(int hour, int minutes) {
        return AutopilotWalk.builder()
            .id(UUID.randomUUID())
            .date(TOMORROW)
            .startTime(TOMORROW.atTime(hour, 0))
            .durationMinutes(minutes)
            .type(AutopilotWalk.WalkType.fromDuration(minutes))
            .approvalState(AutopilotWalk.ApprovalState.PENDING)
            .build();
    }

    @Test
    @DisplayName("Approval prompts link the walk and fire at the prompt hour")
    void testScheduleApprovalPrompt() {
        // Given
        AutopilotWalk walk = walk(12, 20);

        // When
        notificationService.scheduleApprovalPrompt(walk);

        // Then
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(captor.capture());
        Notification notification = captor.getValue();
        assertEquals(Notification.NotificationType.AUTOPILOT_APPROVAL, notification.getType());
        assertEquals(walk.getId(), notification.getWalkId());
        assertEquals("Energy Boost at 12:00 for 20 minutes", notification.getBody());
        assertEquals(LocalDate.of(2025, 3, 11).atTime(20, 0), notification.getScheduledFor());
        assertFalse(notification.isRead());
    }

    @Test
    @DisplayName("A failing repository never reaches the autopilot")
    void testScheduleApprovalPrompt_RepositoryFailure() {
        when(notificationRepository.save(any(Notification.class))).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> notificationService.scheduleApprovalPrompt(walk(9, 30)));
    }

    @Test
    @DisplayName("Summaries list the walk times")
    void testScheduleSummary() {
        notificationService.scheduleSummary(TOMORROW, List.of(walk(9, 30), walk(17, 10)));

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(captor.capture());
        assertEquals("2 walks scheduled for 2025-03-12", captor.getValue().getTitle());
        assertEquals("40 minutes of walking at 09:00, 17:00", captor.getValue().getBody());
    }

    @Test
    @DisplayName("No summary without walks")
    void testScheduleSummary_Empty() {
        notificationService.scheduleSummary(TOMORROW, List.of());

        verify(notificationRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should mark an existing notification as read")
    void testMarkAsRead() {
        Notification notification = Notification.builder().id(UUID.randomUUID()).title("t").build();
        UUID unknown = UUID.randomUUID();
        when(notificationRepository.findById(notification.getId())).thenReturn(Optional.of(notification));
        when(notificationRepository.findById(unknown)).thenReturn(Optional.empty());

        assertTrue(notificationService.markAsRead(notification.getId()));
        assertTrue(notification.isRead());
        assertNotNull(notification.getReadAt());
        assertFalse(notificationService.markAsRead(unknown));
    }
}
