package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.model.Attachment;
import com.github.anirbanmu.herald.discord.model.Embed;
import com.github.anirbanmu.herald.discord.model.User;
import com.github.anirbanmu.herald.util.Lists;
import java.util.List;
import java.util.Objects;

/**
 * MESSAGE_UPDATE event data. Updates are partial: only id and channel_id are guaranteed, and an absent
 * field means "unchanged", so nothing here defaults to empty. Embed unfurls arrive this way with no
 * author or content.
 */
@CompiledJson
public record MessageUpdateData(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(name = "channel_id", mandatory = true) String channelId,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId,
    @JsonAttribute(nullable = true) User author,
    @JsonAttribute(nullable = true) String content,
    @JsonAttribute(nullable = true) String timestamp,
    @JsonAttribute(name = "edited_timestamp", nullable = true) String editedTimestamp,
    @JsonAttribute(nullable = true) Boolean tts,
    @JsonAttribute(name = "mention_everyone", nullable = true) Boolean mentionEveryone,
    @JsonAttribute(nullable = true) List<User> mentions,
    @JsonAttribute(name = "mention_roles", nullable = true) List<String> mentionRoles,
    @JsonAttribute(nullable = true) List<Attachment> attachments,
    @JsonAttribute(nullable = true) List<Embed> embeds,
    @JsonAttribute(nullable = true) Boolean pinned,
    @JsonAttribute(nullable = true) Integer type,
    @JsonAttribute(nullable = true) Long flags) {

    public MessageUpdateData {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(channelId, "channel_id");
        mentions = Lists.copyOrNull(mentions);
        mentionRoles = Lists.copyOrNull(mentionRoles);
        attachments = Lists.copyOrNull(attachments);
        embeds = Lists.copyOrNull(embeds);
    }
}
