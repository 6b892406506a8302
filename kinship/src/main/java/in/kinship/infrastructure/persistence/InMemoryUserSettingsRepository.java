package in.kinship.infrastructure.persistence;

import in.kinship.repository.UserSettingsRepository;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Notifications are enabled unless a user turned them off.
 */
public final class InMemoryUserSettingsRepository implements UserSettingsRepository {

    private final ConcurrentMap<String, Boolean> notificationsEnabled = new ConcurrentHashMap<>();

    @Override
    public boolean notificationsEnabled(String userId) {
        return notificationsEnabled.getOrDefault(userId, Boolean.TRUE);
    }

    @Override
    public void setNotificationsEnabled(String userId, boolean enabled) {
        notificationsEnabled.put(userId, enabled);
    }
}
