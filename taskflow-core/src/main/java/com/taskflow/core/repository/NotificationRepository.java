package com.taskflow.core.repository;

import com.taskflow.core.model.Notification;
import java.util.List;
import java.util.UUID;

/**
 * Contract for the external notification store.
 */
public interface NotificationRepository {

    Notification create(Notification notification);

    List<Notification> findByUser(UUID userId);
}
