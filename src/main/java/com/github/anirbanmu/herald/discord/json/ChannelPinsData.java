package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// CHANNEL_PINS_UPDATE event data
@CompiledJson
public record ChannelPinsData(
    @JsonAttribute(name = "guild_id", nullable = true) String guildId,
    @JsonAttribute(name = "channel_id", mandatory = true) String channelId,
    @JsonAttribute(name = "last_pin_timestamp", nullable = true) String lastPinTimestamp) {
}
