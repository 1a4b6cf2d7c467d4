package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.GuildMember;
import com.github.anirbanmu.herald.util.Lists;
import java.util.List;

// one chunk of a request guild members reply
@CompiledJson
public record GuildMembersChunkData(
    @JsonAttribute(name = "guild_id", mandatory = true) String guildId,
    @JsonAttribute(mandatory = true) List<GuildMember> members,
    @JsonAttribute(name = "chunk_index", mandatory = true) int chunkIndex,
    @JsonAttribute(name = "chunk_count", mandatory = true) int chunkCount,
    @JsonAttribute(name = "not_found", nullable = true) List<String> notFound,
    @JsonAttribute(nullable = true) List<PresenceUpdateData> presences,
    @JsonAttribute(nullable = true) String nonce) {

    public GuildMembersChunkData {
        members = List.copyOf(members);
        notFound = Lists.copyOrNull(notFound);
        presences = Lists.copyOrNull(presences);
    }

    public boolean last() {
        return chunkIndex == chunkCount - 1;
    }
}
