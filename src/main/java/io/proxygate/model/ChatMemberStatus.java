package io.proxygate.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Chat member statuses as reported by the chat platform.
 */
public enum ChatMemberStatus {
    OWNER(true),
    ADMINISTRATOR(true),
    MEMBER(true),
    RESTRICTED(true),
    LEFT(false),
    KICKED(false);

    private final boolean member;

    ChatMemberStatus(boolean member) {
        this.member = member;
    }

    public boolean isMember() {
        return member;
    }

    public static ChatMemberStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("chat member status must not be blank");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "creator", "owner" -> OWNER;
            case "administrator", "admin" -> ADMINISTRATOR;
            case "member" -> MEMBER;
            case "restricted" -> RESTRICTED;
            case "left" -> LEFT;
            case "kicked", "banned" -> KICKED;
            default -> throw new IllegalArgumentException("Unknown chat member status: " + raw);
        };
    }

    /**
     * Maps a status change to a membership event type. Non-member to member is a join, member to
     * non-member (left or removed) is a leave, everything else is not relevant.
     */
    public static Optional<MembershipEventType> classify(ChatMemberStatus oldStatus, ChatMemberStatus newStatus) {
        if (oldStatus == null || newStatus == null) {
            return Optional.empty();
        }
        if (!oldStatus.member && newStatus.member) {
            return Optional.of(MembershipEventType.JOIN);
        }
        if (oldStatus.member && !newStatus.member) {
            return Optional.of(MembershipEventType.LEAVE);
        }
        return Optional.empty();
    }
}
