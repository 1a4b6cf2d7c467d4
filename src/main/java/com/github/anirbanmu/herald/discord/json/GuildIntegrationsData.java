package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson
public record GuildIntegrationsData(@JsonAttribute(name = "guild_id", mandatory = true) String guildId) {
}
