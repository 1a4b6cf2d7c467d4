package com.github.anirbanmu.herald.discord.model;

import java.util.Optional;

// message "type" field on the wire
public enum MessageKind {
    REGULAR(0),
    RECIPIENT_ADD(1),
    RECIPIENT_REMOVE(2),
    CALL(3),
    CHANNEL_NAME_CHANGE(4),
    CHANNEL_ICON_CHANGE(5),
    CHANNEL_PINNED_MESSAGE(6),
    GUILD_MEMBER_JOIN(7),
    USER_PREMIUM_GUILD_SUBSCRIPTION(8),
    USER_PREMIUM_GUILD_SUBSCRIPTION_TIER_1(9),
    USER_PREMIUM_GUILD_SUBSCRIPTION_TIER_2(10),
    USER_PREMIUM_GUILD_SUBSCRIPTION_TIER_3(11),
    CHANNEL_FOLLOW_ADD(12),
    GUILD_DISCOVERY_DISQUALIFIED(14),
    GUILD_DISCOVERY_REQUALIFIED(15);

    private static final MessageKind[] BY_VALUE = new MessageKind[16];

    static {
        for (MessageKind kind : values()) {
            BY_VALUE[kind.value] = kind;
        }
    }

    private final int value;

    MessageKind(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static Optional<MessageKind> fromValue(int value) {
        if (value < 0 || value >= BY_VALUE.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_VALUE[value]);
    }
}
