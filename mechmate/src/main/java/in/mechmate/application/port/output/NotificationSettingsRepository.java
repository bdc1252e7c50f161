package in.mechmate.application.port.output;

import in.mechmate.domain.model.NotificationSettings;

import java.util.Optional;

/**
 * Repository for the notification_settings table (single global row).
 */
public interface NotificationSettingsRepository {

    /**
     * @return settings, or empty when the row has never been seeded
     */
    Optional<NotificationSettings> getSettings();

    /**
     * Overwrite the settings row.
     *
     * @return the stored settings
     */
    NotificationSettings update(NotificationSettings settings);
}
