package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.User;
import java.util.List;
import java.util.Objects;

// GUILD_MEMBER_UPDATE event data. roles is the member's complete role list
@CompiledJson
public record GuildMemberUpdateData(
    @JsonAttribute(name = "guild_id", mandatory = true) String guildId,
    @JsonAttribute(mandatory = true) List<String> roles,
    @JsonAttribute(mandatory = true) User user,
    @JsonAttribute(nullable = true) String nick,
    @JsonAttribute(name = "joined_at", nullable = true) String joinedAt,
    @JsonAttribute(name = "premium_since", nullable = true) String premiumSince) {

    public GuildMemberUpdateData {
        Objects.requireNonNull(user, "user");
        roles = List.copyOf(roles);
    }
}
