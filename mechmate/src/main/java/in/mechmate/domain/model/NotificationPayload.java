package in.mechmate.domain.model;

/**
 * Push message delivered to the client service worker.
 *
 * Wire shape is fixed: {title, body, icon, badge, data: {url}}.
 */
public record NotificationPayload(
        String title,
        String body,
        String icon,
        String badge,
        Data data) {

    public static final String DEFAULT_ICON = "/robot.png";
    public static final String DEFAULT_URL = "/";

    public record Data(String url) {
    }

    public static NotificationPayload of(String title, String body) {
        return new NotificationPayload(title, body, DEFAULT_ICON, DEFAULT_ICON, new Data(DEFAULT_URL));
    }
}
