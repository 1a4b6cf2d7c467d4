package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.util.Lists;
import java.util.List;
import java.util.Objects;

@CompiledJson
public record Channel(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(mandatory = true) int type,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId,
    @JsonAttribute(nullable = true) Integer position,
    @JsonAttribute(name = "permission_overwrites", nullable = true) List<Overwrite> permissionOverwrites,
    @JsonAttribute(nullable = true) String name,
    @JsonAttribute(nullable = true) String topic,
    @JsonAttribute(nullable = true) Boolean nsfw,
    @JsonAttribute(name = "last_message_id", nullable = true) String lastMessageId,
    @JsonAttribute(nullable = true) Integer bitrate,
    @JsonAttribute(name = "user_limit", nullable = true) Integer userLimit,
    @JsonAttribute(name = "rate_limit_per_user", nullable = true) Integer rateLimitPerUser,
    @JsonAttribute(nullable = true) List<User> recipients,
    @JsonAttribute(nullable = true) String icon,
    @JsonAttribute(name = "owner_id", nullable = true) String ownerId,
    @JsonAttribute(name = "application_id", nullable = true) String applicationId,
    @JsonAttribute(name = "parent_id", nullable = true) String parentId,
    @JsonAttribute(name = "last_pin_timestamp", nullable = true) String lastPinTimestamp) {

    // channel types
    public static final int TYPE_GUILD_TEXT = 0;
    public static final int TYPE_DM = 1;
    public static final int TYPE_GUILD_VOICE = 2;
    public static final int TYPE_GROUP_DM = 3;
    public static final int TYPE_GUILD_CATEGORY = 4;
    public static final int TYPE_GUILD_NEWS = 5;
    public static final int TYPE_GUILD_STORE = 6;

    public Channel {
        Objects.requireNonNull(id, "id");
        permissionOverwrites = Lists.copyOrNull(permissionOverwrites);
        recipients = Lists.copyOrNull(recipients);
    }
}
