package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.Objects;

// guild stub sent in READY and GUILD_DELETE. unavailable is absent when the bot left or was removed
@CompiledJson
public record UnavailableGuild(@JsonAttribute(mandatory = true) String id, @JsonAttribute(nullable = true) Boolean unavailable) {

    public UnavailableGuild {
        Objects.requireNonNull(id, "id");
    }

    public boolean outage() {
        return Boolean.TRUE.equals(unavailable);
    }
}
