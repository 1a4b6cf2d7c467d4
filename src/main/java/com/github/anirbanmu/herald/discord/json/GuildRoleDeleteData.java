package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson
public record GuildRoleDeleteData(@JsonAttribute(name = "guild_id", mandatory = true) String guildId, @JsonAttribute(name = "role_id", mandatory = true) String roleId) {
}
