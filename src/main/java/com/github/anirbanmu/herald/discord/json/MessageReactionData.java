package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.Emoji;
import com.github.anirbanmu.herald.discord.model.GuildMember;
import java.util.Objects;

// MESSAGE_REACTION_ADD and MESSAGE_REACTION_REMOVE event data. member is only sent on add, in guilds
@CompiledJson
public record MessageReactionData(
    @JsonAttribute(name = "user_id", mandatory = true) String userId,
    @JsonAttribute(name = "channel_id", mandatory = true) String channelId,
    @JsonAttribute(name = "message_id", mandatory = true) String messageId,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId,
    @JsonAttribute(nullable = true) GuildMember member,
    @JsonAttribute(mandatory = true) Emoji emoji) {

    public MessageReactionData {
        Objects.requireNonNull(emoji, "emoji");
    }
}
