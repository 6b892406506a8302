package in.kinship.infrastructure.persistence;

import in.kinship.domain.messaging.Notification;
import in.kinship.repository.NotificationRepository;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryNotificationRepository implements NotificationRepository {

    private final ConcurrentMap<String, Notification> notifications = new ConcurrentHashMap<>();

    @Override
    public Notification save(Notification notification) {
        notifications.put(notification.id(), notification);
        return notification;
    }

    @Override
    public List<Notification> findByUser(String userId) {
        return notifications.values().stream()
            .filter(n -> n.userId().equals(userId))
            .sorted(Comparator.comparing(Notification::createdAt).reversed())
            .toList();
    }

    @Override
    public long countUnread(String userId) {
        return notifications.values().stream()
            .filter(n -> n.userId().equals(userId) && !n.read())
            .count();
    }

    @Override
    public int markAllRead(String userId) {
        int marked = 0;
        for (Notification n : notifications.values()) {
            if (n.userId().equals(userId) && !n.read()) {
                if (notifications.replace(n.id(), n, n.markedRead())) {
                    marked++;
                }
            }
        }
        return marked;
    }
}
