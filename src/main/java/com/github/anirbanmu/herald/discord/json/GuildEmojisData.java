package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.Emoji;
import java.util.List;

// GUILD_EMOJIS_UPDATE event data, the guild's full emoji list after the change
@CompiledJson
public record GuildEmojisData(@JsonAttribute(name = "guild_id", mandatory = true) String guildId, @JsonAttribute(mandatory = true) List<Emoji> emojis) {

    public GuildEmojisData {
        emojis = List.copyOf(emojis);
    }
}
