package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.User;

@CompiledJson
public record GuildMemberRemoveData(@JsonAttribute(name = "guild_id", mandatory = true) String guildId, @JsonAttribute(mandatory = true) User user) {
}
