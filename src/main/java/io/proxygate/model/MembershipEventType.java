package io.proxygate.model;

import java.util.Locale;

public enum MembershipEventType {
    JOIN,
    LEAVE;

    public static MembershipEventType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("event type must not be blank");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "join", "joined" -> JOIN;
            case "leave", "left", "removed" -> LEAVE;
            default -> throw new IllegalArgumentException("Unknown membership event type: " + raw);
        };
    }
}
