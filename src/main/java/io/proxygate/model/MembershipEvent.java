package io.proxygate.model;

/**
 * A membership change for the gated channel. Delivery is at-least-once and may be reordered;
 * {@code timestampMs} decides which of two events for the same user wins.
 */
public record MembershipEvent(
        MembershipEventType type,
        String userId,
        String username,
        long timestampMs
) {
    public MembershipEvent {
        if (type == null) {
            throw new IllegalArgumentException("event type must not be null");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (timestampMs < 0L) {
            throw new IllegalArgumentException("timestampMs must not be negative: " + timestampMs);
        }
        userId = userId.trim();
        username = username == null || username.isBlank() ? null : username.trim();
    }

    public static MembershipEvent join(String userId, String username, long timestampMs) {
        return new MembershipEvent(MembershipEventType.JOIN, userId, username, timestampMs);
    }

    public static MembershipEvent leave(String userId, long timestampMs) {
        return new MembershipEvent(MembershipEventType.LEAVE, userId, null, timestampMs);
    }
}
