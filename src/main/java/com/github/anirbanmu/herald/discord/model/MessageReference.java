package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// points at the source message of a crosspost, reply or pin notice
@CompiledJson
public record MessageReference(
    @JsonAttribute(name = "message_id", nullable = true) String messageId,
    @JsonAttribute(name = "channel_id", nullable = true) String channelId,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId) {
}
