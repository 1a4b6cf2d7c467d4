package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson
public record MessageReactionRemoveAllData(
    @JsonAttribute(name = "channel_id", mandatory = true) String channelId,
    @JsonAttribute(name = "message_id", mandatory = true) String messageId,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId) {
}
