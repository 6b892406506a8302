package in.kinship.repository;

/**
 * Per-user preferences consulted by messaging. Users without stored settings get the defaults.
 */
public interface UserSettingsRepository {

    boolean notificationsEnabled(String userId);

    void setNotificationsEnabled(String userId, boolean enabled);
}
