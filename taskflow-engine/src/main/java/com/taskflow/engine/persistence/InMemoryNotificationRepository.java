package com.taskflow.engine.persistence;

import com.taskflow.core.model.Notification;
import com.taskflow.core.repository.NotificationRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory notification store used when no external notification system is wired.
 */
public class InMemoryNotificationRepository implements NotificationRepository {

    private final Map<UUID, Notification> notifications = new ConcurrentHashMap<>();

    @Override
    public Notification create(Notification notification) {
        notifications.put(notification.id(), notification);
        return notification;
    }

    @Override
    public List<Notification> findByUser(UUID userId) {
        return notifications.values().stream()
            .filter(n -> n.userId().equals(userId))
            .sorted(Comparator.comparing(Notification::createdAt))
            .collect(Collectors.toList());
    }
}
