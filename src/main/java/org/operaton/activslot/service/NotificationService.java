package org.operaton.activslot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.AutopilotWalk;
import org.operaton.activslot.model.entity.Notification;
import org.operaton.activslot.provider.NotificationDispatcher;
import org.operaton.activslot.repository.NotificationRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Stores autopilot notifications so clients can pick them up at their scheduled time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService implements NotificationDispatcher {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    @Value("${activslot.autopilot.approval-prompt-hour:20}")
    private int approvalPromptHour = 20;

    @Value("${activslot.autopilot.summary-hour:21}")
    private int summaryHour = 21;

    /**
     * Create a notification asking the user to approve a walk.
     * Failures are logged and never reach the caller.
     *
     * @param walk the pending walk
     */
    @Override
    @Transactional
    public void scheduleApprovalPrompt(AutopilotWalk walk) {
        try {
            Notification notification = Notification.builder()
                .type(Notification.NotificationType.AUTOPILOT_APPROVAL)
                .title("Approve tomorrow's walk?")
                .body(String.format("%s at %s for %d minutes",
                    walk.getType().getDisplayName(),
                    walk.getStartTime().format(TIME_FORMAT),
                    walk.getDurationMinutes()))
                .walkId(walk.getId())
                .scheduledFor(notifyAt(approvalPromptHour))
                .build();
            notificationRepository.save(notification);
            log.debug("Created AUTOPILOT_APPROVAL notification for walk {}", walk.getId());
        } catch (Exception e) {
            log.error("Failed to create approval notification for walk {}", walk.getId(), e);
        }
    }

    /**
     * Create a summary notification listing the walks committed for a date.
     *
     * @param date the date the walks are planned for
     * @param walks the committed walks
     */
    @Override
    @Transactional
    public void scheduleSummary(LocalDate date, List<AutopilotWalk> walks) {
        if (walks.isEmpty()) {
            return;
        }
        try {
            String times = walks.stream()
                .map(walk -> walk.getStartTime().format(TIME_FORMAT))
                .collect(Collectors.joining(", "));
            int totalMinutes = walks.stream().mapToInt(AutopilotWalk::getDurationMinutes).sum();

            Notification notification = Notification.builder()
                .type(Notification.NotificationType.AUTOPILOT_SUMMARY)
                .title(walks.size() + (walks.size() == 1 ? " walk" : " walks") + " scheduled for " + date)
                .body(String.format("%d minutes of walking at %s", totalMinutes, times))
                .scheduledFor(notifyAt(summaryHour))
                .build();
            notificationRepository.save(notification);
            log.debug("Created AUTOPILOT_SUMMARY notification for {}", date);
        } catch (Exception e) {
            log.error("Failed to create summary notification for {}", date, e);
        }
    }

    /**
     * Get all notifications, newest first.
     *
     * @param pageable pagination parameters
     * @return page of notifications
     */
    @Transactional(readOnly = true)
    public Page<Notification> getNotifications(Pageable pageable) {
        return notificationRepository.findAllNewestFirst(pageable);
    }

    /**
     * Count unread notifications.
     *
     * @return number of unread notifications
     */
    @Transactional(readOnly = true)
    public long countUnread() {
        return notificationRepository.countByReadFalse();
    }

    /**
     * Mark a notification as read.
     *
     * @param notificationId the notification ID
     * @return true if the notification exists
     */
    @Transactional
    public boolean markAsRead(UUID notificationId) {
        return notificationRepository.findById(notificationId)
            .map(notification -> {
                notification.markAsRead(LocalDateTime.now(clock));
                notificationRepository.save(notification);
                return true;
            })
            .orElse(false);
    }

    private LocalDateTime notifyAt(int hour) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime target = now.toLocalDate().atTime(LocalTime.of(hour, 0));
        return target.isBefore(now) ? now : target;
    }
}
