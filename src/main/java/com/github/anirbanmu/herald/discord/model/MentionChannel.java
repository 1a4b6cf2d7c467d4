package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// channel mentioned in a crossposted message
@CompiledJson
public record MentionChannel(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(name = "guild_id", mandatory = true) String guildId,
    @JsonAttribute(mandatory = true) int type,
    @JsonAttribute(mandatory = true) String name) {
}
