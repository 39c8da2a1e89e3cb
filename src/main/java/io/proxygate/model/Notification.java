package io.proxygate.model;

public record Notification(
        NotificationKind kind,
        String link,
        String detail
) {
    public Notification {
        if (kind == null) {
            throw new IllegalArgumentException("notification kind must not be null");
        }
        if (kind == NotificationKind.ACCESS_GRANTED && (link == null || link.isBlank())) {
            throw new IllegalArgumentException("access_granted requires a link");
        }
    }

    public static Notification accessGranted(String link) {
        return new Notification(NotificationKind.ACCESS_GRANTED, link, null);
    }

    public static Notification accessRevoked() {
        return new Notification(NotificationKind.ACCESS_REVOKED, null, null);
    }

    public static Notification provisioningFailed(String detail) {
        return new Notification(NotificationKind.PROVISIONING_FAILED, null, detail);
    }
}
