package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.Role;
import java.util.Objects;

// GUILD_ROLE_CREATE and GUILD_ROLE_UPDATE event data
@CompiledJson
public record GuildRoleData(@JsonAttribute(name = "guild_id", mandatory = true) String guildId, @JsonAttribute(mandatory = true) Role role) {

    public GuildRoleData {
        Objects.requireNonNull(role, "role");
    }
}
