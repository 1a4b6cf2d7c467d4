package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.GuildMember;

// timestamp is unix seconds
@CompiledJson
public record TypingStartData(
    @JsonAttribute(name = "channel_id", mandatory = true) String channelId,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId,
    @JsonAttribute(name = "user_id", mandatory = true) String userId,
    @JsonAttribute(mandatory = true) long timestamp,
    @JsonAttribute(nullable = true) GuildMember member) {
}
