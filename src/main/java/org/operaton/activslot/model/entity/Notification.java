package org.operaton.activslot.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Entity representing a notification produced by the autopilot.
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notifications_read_status", columnList = "is_read"),
    @Index(name = "idx_notifications_scheduled_for", columnList = "scheduled_for")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 50)
    private NotificationType type;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "body", length = 1000)
    private String body;

    /**
     * Walk the notification refers to. Null for summaries.
     */
    @Column(name = "walk_id")
    private UUID walkId;

    /**
     * When the notification should be shown to the user.
     */
    @Column(name = "scheduled_for", nullable = false)
    private LocalDateTime scheduledFor;

    @Column(name = "is_read", nullable = false)
    @Builder.Default
    private boolean read = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "read_at")
    private LocalDateTime readAt;

    /**
     * Types of notifications that can be sent.
     */
    public enum NotificationType {
        /**
         * A walk for tomorrow awaits approval.
         */
        AUTOPILOT_APPROVAL,

        /**
         * Overview of the walks committed for tomorrow.
         */
        AUTOPILOT_SUMMARY
    }

    /**
     * Mark this notification as read.
     */
    public void markAsRead(LocalDateTime now) {
        this.read = true;
        this.readAt = now;
    }
}
