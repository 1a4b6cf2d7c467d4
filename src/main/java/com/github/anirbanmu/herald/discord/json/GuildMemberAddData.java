package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.User;
import java.util.List;
import java.util.Objects;

// GUILD_MEMBER_ADD event data: a guild member plus the guild it joined
@CompiledJson
public record GuildMemberAddData(
    @JsonAttribute(name = "guild_id", mandatory = true) String guildId,
    @JsonAttribute(mandatory = true) User user,
    @JsonAttribute(nullable = true) String nick,
    @JsonAttribute(mandatory = true) List<String> roles,
    @JsonAttribute(name = "joined_at", mandatory = true) String joinedAt,
    @JsonAttribute(name = "premium_since", nullable = true) String premiumSince,
    @JsonAttribute(mandatory = true) boolean deaf,
    @JsonAttribute(mandatory = true) boolean mute) {

    public GuildMemberAddData {
        Objects.requireNonNull(guildId, "guild_id");
        Objects.requireNonNull(user, "user");
        roles = List.copyOf(roles);
    }
}
