package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.UnavailableGuild;
import com.github.anirbanmu.herald.discord.model.User;
import com.github.anirbanmu.herald.util.Lists;
import java.util.List;
import java.util.Objects;

// READY event data. shard is [shard_id, num_shards] when the session was identified with one
@CompiledJson
public record ReadyData(
    @JsonAttribute(mandatory = true) int v,
    @JsonAttribute(mandatory = true) User user,
    @JsonAttribute(mandatory = true) List<UnavailableGuild> guilds,
    @JsonAttribute(name = "session_id", mandatory = true) String sessionId,
    @JsonAttribute(name = "resume_gateway_url", nullable = true) String resumeGatewayUrl,
    @JsonAttribute(nullable = true) List<Integer> shard) {

    public ReadyData {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(sessionId, "session_id");
        guilds = List.copyOf(guilds);
        shard = Lists.copyOrNull(shard);
    }
}
