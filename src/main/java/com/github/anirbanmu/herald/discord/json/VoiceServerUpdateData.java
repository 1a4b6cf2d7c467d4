package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// endpoint is null while the voice server is being reallocated
@CompiledJson
public record VoiceServerUpdateData(
    @JsonAttribute(mandatory = true) String token,
    @JsonAttribute(name = "guild_id", mandatory = true) String guildId,
    @JsonAttribute(nullable = true) String endpoint) {
}
