package io.proxygate.model;

public enum NotificationKind {
    ACCESS_GRANTED,
    ACCESS_REVOKED,
    PROVISIONING_FAILED
}
