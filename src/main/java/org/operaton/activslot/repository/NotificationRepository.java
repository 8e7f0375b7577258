package org.operaton.activslot.repository;

import org.operaton.activslot.model.entity.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for Notification entity.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    /**
     * Find all notifications, newest first.
     *
     * @param pageable pagination parameters
     * @return page of notifications
     */
    @Query("SELECT n FROM Notification n ORDER BY n.scheduledFor DESC, n.createdAt DESC")
    Page<Notification> findAllNewestFirst(Pageable pageable);

    /**
     * Count unread notifications.
     *
     * @return number of unread notifications
     */
    long countByReadFalse();
}
