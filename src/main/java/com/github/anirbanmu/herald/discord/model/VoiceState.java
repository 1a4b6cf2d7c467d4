package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// channel_id is null once the user has left voice
@CompiledJson
public record VoiceState(
    @JsonAttribute(name = "guild_id", nullable = true) String guildId,
    @JsonAttribute(name = "channel_id", nullable = true) String channelId,
    @JsonAttribute(name = "user_id", mandatory = true) String userId,
    @JsonAttribute(nullable = true) GuildMember member,
    @JsonAttribute(name = "session_id", mandatory = true) String sessionId,
    @JsonAttribute(mandatory = true) boolean deaf,
    @JsonAttribute(mandatory = true) boolean mute,
    @JsonAttribute(name = "self_deaf", mandatory = true) boolean selfDeaf,
    @JsonAttribute(name = "self_mute", mandatory = true) boolean selfMute,
    @JsonAttribute(name = "self_stream", nullable = true) Boolean selfStream,
    @JsonAttribute(name = "self_video", mandatory = true) boolean selfVideo,
    @JsonAttribute(mandatory = true) boolean suppress) {
}
