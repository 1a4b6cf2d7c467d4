package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

@CompiledJson
public record MessageDeleteBulkData(
    @JsonAttribute(mandatory = true) List<String> ids,
    @JsonAttribute(name = "channel_id", mandatory = true) String channelId,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId) {

    public MessageDeleteBulkData {
        ids = List.copyOf(ids);
    }
}
