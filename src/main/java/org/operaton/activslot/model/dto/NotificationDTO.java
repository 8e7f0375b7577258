package org.operaton.activslot.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.activslot.model.entity.Notification;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for Notification data transfer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDTO {

    private UUID id;
    private String type;
    private String title;
    private String body;
    private UUID walkId;
    private LocalDateTime scheduledFor;
    private boolean read;
    private LocalDateTime createdAt;

    /**
     * Creates a DTO from a Notification entity.
     *
     * @param notification the notification entity
     * @return notification DTO
     */
    public static NotificationDTO fromEntity(Notification notification) {
        return NotificationDTO.builder()
            .id(notification.getId())
            .type(notification.getType().name())
            .title(notification.getTitle())
            .body(notification.getBody())
            .walkId(notification.getWalkId())
            .scheduledFor(notification.getScheduledFor())
            .read(notification.isRead())
            .createdAt(notification.getCreatedAt())
            .build();
    }
}
