package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson
public record MessageDeleteData(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(name = "channel_id", mandatory = true) String channelId,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId) {
}
