package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.User;
import java.util.Objects;

// GUILD_BAN_ADD and GUILD_BAN_REMOVE event data
@CompiledJson
public record GuildBanData(@JsonAttribute(name = "guild_id", mandatory = true) String guildId, @JsonAttribute(mandatory = true) User user) {

    public GuildBanData {
        Objects.requireNonNull(guildId, "guild_id");
        Objects.requireNonNull(user, "user");
    }
}
