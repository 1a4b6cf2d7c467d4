package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.discord.DiscordRest;
import com.github.anirbanmu.herald.discord.DiscordResult;
import com.github.anirbanmu.herald.util.JsonNumbers;
import com.github.anirbanmu.herald.util.Lists;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A message sent in a channel, as delivered by MESSAGE_CREATE or returned from the REST API.
 *
 * <p>Values are immutable; an edit arrives as a separate MESSAGE_UPDATE event. The action methods
 * act on this message's channel through the {@link DiscordRest} handle they are given and return that
 * handle's future as-is, so failures and cancellation reach the caller untouched.
 */
@CompiledJson
public record Message(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(name = "channel_id", mandatory = true) String channelId,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId,
    @JsonAttribute(mandatory = true) User author,
    @JsonAttribute(nullable = true) GuildMember member,
    @JsonAttribute(mandatory = true) String content,
    @JsonAttribute(mandatory = true) String timestamp,
    @JsonAttribute(name = "edited_timestamp", nullable = true) String editedTimestamp,
    @JsonAttribute(mandatory = true) boolean tts,
    @JsonAttribute(name = "mention_everyone", mandatory = true) boolean mentionEveryone,
    @JsonAttribute(mandatory = true) List<User> mentions,
    @JsonAttribute(name = "mention_roles", mandatory = true) List<String> mentionRoles,
    @JsonAttribute(name = "mention_channels", nullable = true) List<MentionChannel> mentionChannels,
    @JsonAttribute(mandatory = true) List<Attachment> attachments,
    @JsonAttribute(nullable = true) List<Embed> embeds,
    @JsonAttribute(nullable = true) List<Reaction> reactions,
    @JsonAttribute(nullable = true) String nonce,
    @JsonAttribute(mandatory = true) boolean pinned,
    @JsonAttribute(name = "webhook_id", nullable = true) String webhookId,
    @JsonAttribute(nullable = true, converter = JsonNumbers.Int32.class) Integer type,
    @JsonAttribute(nullable = true) MessageApplication application,
    @JsonAttribute(name = "message_reference", nullable = true) MessageReference messageReference,
    @JsonAttribute(nullable = true, converter = JsonNumbers.Int64.class) Long flags) {

    // flag bits
    public static final long FLAG_CROSSPOSTED = 1;
    public static final long FLAG_IS_CROSSPOST = 1 << 1;
    public static final long FLAG_SUPPRESS_EMBEDS = 1 << 2;
    public static final long FLAG_SOURCE_MESSAGE_DELETED = 1 << 3;
    public static final long FLAG_URGENT = 1 << 4;

    public Message {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(channelId, "channel_id");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
        mentions = List.copyOf(mentions);
        mentionRoles = List.copyOf(mentionRoles);
        attachments = List.copyOf(attachments);
        mentionChannels = Lists.orEmpty(mentionChannels);
        embeds = Lists.orEmpty(embeds);
        reactions = Lists.orEmpty(reactions);
        if (type != null && MessageKind.fromValue(type).isEmpty()) {
            throw new IllegalArgumentException("unknown message type " + type);
        }
    }

    public Optional<MessageKind> kind() {
        return type == null ? Optional.empty() : MessageKind.fromValue(type);
    }

    public boolean hasFlag(long flag) {
        return flags != null && (flags & flag) != 0;
    }

    public boolean edited() {
        return editedTimestamp != null;
    }

    public CompletableFuture<DiscordResult<Message>> send(DiscordRest rest, String content) {
        return rest.sendMessage(channelId, content);
    }

    public CompletableFuture<DiscordResult<Message>> sendEmbed(DiscordRest rest, Embed embed) {
        return rest.sendEmbed(channelId, embed);
    }

    public CompletableFuture<DiscordResult<Void>> addReaction(DiscordRest rest, String emoji) {
        return rest.addReaction(channelId, id, emoji);
    }

    // any message in this channel, not just this one
    public CompletableFuture<DiscordResult<Void>> addReactionToMessage(DiscordRest rest, String messageId, String emoji) {
        return rest.addReaction(channelId, messageId, emoji);
    }

    public CompletableFuture<DiscordResult<Void>> remove(DiscordRest rest) {
        return rest.deleteMessage(channelId, id);
    }

    // pinned() on this value is left as decoded
    public CompletableFuture<DiscordResult<Void>> pin(DiscordRest rest) {
        return rest.pinMessage(channelId, id);
    }

    public CompletableFuture<DiscordResult<Void>> unpin(DiscordRest rest) {
        return rest.unpinMessage(channelId, id);
    }
}
