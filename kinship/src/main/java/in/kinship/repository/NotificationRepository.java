package in.kinship.repository;

import in.kinship.domain.messaging.Notification;

import java.util.List;

public interface NotificationRepository {

    Notification save(Notification notification);

    /**
     * Newest first.
     */
    List<Notification> findByUser(String userId);

    long countUnread(String userId);

    int markAllRead(String userId);
}
