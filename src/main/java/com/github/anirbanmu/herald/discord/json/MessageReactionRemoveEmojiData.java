package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.Emoji;

// all reactions of one emoji removed from a message
@CompiledJson
public record MessageReactionRemoveEmojiData(
    @JsonAttribute(name = "channel_id", mandatory = true) String channelId,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId,
    @JsonAttribute(name = "message_id", mandatory = true) String messageId,
    @JsonAttribute(mandatory = true) Emoji emoji) {
}
