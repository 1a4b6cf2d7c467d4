package com.github.anirbanmu.herald.discord.json;

import com.github.anirbanmu.herald.discord.model.Channel;
import com.github.anirbanmu.herald.discord.model.Guild;
import com.github.anirbanmu.herald.discord.model.Message;
import com.github.anirbanmu.herald.discord.model.UnavailableGuild;
import com.github.anirbanmu.herald.discord.model.User;
import com.github.anirbanmu.herald.discord.model.VoiceState;
import com.github.anirbanmu.herald.util.Json;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Maps dispatch {@code t} tags to decoders for their {@code d} bodies.
 *
 * <p>Lookup is an exact, case-sensitive match against a table fixed at class init. A body is bound by
 * writing the untyped value back out and reading it into the payload's {@code @CompiledJson} record, so
 * unknown fields are skipped and mandatory ones enforced by dsl-json. Failures name the tag that was
 * being decoded.
 */
public final class DispatchRegistry {

    @FunctionalInterface
    interface Decoder {
        DispatchEvent decode(Object d) throws IOException;
    }

    private static final Map<String, Decoder> DECODERS = Map.ofEntries(
        bind(DispatchEvent.Ready.TAG, ReadyData.class, DispatchEvent.Ready::new),
        empty(DispatchEvent.Resumed.TAG, DispatchEvent.Resumed::new),
        empty(DispatchEvent.Reconnect.TAG, DispatchEvent.Reconnect::new),

        bind(DispatchEvent.ChannelCreate.TAG, Channel.class, DispatchEvent.ChannelCreate::new),
        bind(DispatchEvent.ChannelUpdate.TAG, Channel.class, DispatchEvent.ChannelUpdate::new),
        bind(DispatchEvent.ChannelDelete.TAG, Channel.class, DispatchEvent.ChannelDelete::new),
        bind(DispatchEvent.ChannelPinsUpdate.TAG, ChannelPinsData.class, DispatchEvent.ChannelPinsUpdate::new),

        bind(DispatchEvent.GuildCreate.TAG, Guild.class, DispatchEvent.GuildCreate::new),
        bind(DispatchEvent.GuildUpdate.TAG, Guild.class, DispatchEvent.GuildUpdate::new),
        bind(DispatchEvent.GuildDelete.TAG, UnavailableGuild.class, DispatchEvent.GuildDelete::new),
        bind(DispatchEvent.GuildBanAdd.TAG, GuildBanData.class, DispatchEvent.GuildBanAdd::new),
        bind(DispatchEvent.GuildBanRemove.TAG, GuildBanData.class, DispatchEvent.GuildBanRemove::new),
        bind(DispatchEvent.GuildEmojisUpdate.TAG, GuildEmojisData.class, DispatchEvent.GuildEmojisUpdate::new),
        bind(DispatchEvent.GuildIntegrationsUpdate.TAG, GuildIntegrationsData.class, DispatchEvent.GuildIntegrationsUpdate::new),
        bind(DispatchEvent.GuildMemberAdd.TAG, GuildMemberAddData.class, DispatchEvent.GuildMemberAdd::new),
        bind(DispatchEvent.GuildMemberRemove.TAG, GuildMemberRemoveData.class, DispatchEvent.GuildMemberRemove::new),
        bind(DispatchEvent.GuildMemberUpdate.TAG, GuildMemberUpdateData.class, DispatchEvent.GuildMemberUpdate::new),
        bind(DispatchEvent.GuildMembersChunk.TAG, GuildMembersChunkData.class, DispatchEvent.GuildMembersChunk::new),
        bind(DispatchEvent.GuildRoleCreate.TAG, GuildRoleData.class, DispatchEvent.GuildRoleCreate::new),
        bind(DispatchEvent.GuildRoleUpdate.TAG, GuildRoleData.class, DispatchEvent.GuildRoleUpdate::new),
        bind(DispatchEvent.GuildRoleDelete.TAG, GuildRoleDeleteData.class, DispatchEvent.GuildRoleDelete::new),

        bind(DispatchEvent.MessageCreate.TAG, Message.class, DispatchEvent.MessageCreate::new),
        bind(DispatchEvent.MessageUpdate.TAG, MessageUpdateData.class, DispatchEvent.MessageUpdate::new),
        bind(DispatchEvent.MessageDelete.TAG, MessageDeleteData.class, DispatchEvent.MessageDelete::new),
        bind(DispatchEvent.MessageDeleteBulk.TAG, MessageDeleteBulkData.class, DispatchEvent.MessageDeleteBulk::new),
        bind(DispatchEvent.MessageReactionAdd.TAG, MessageReactionData.class, DispatchEvent.MessageReactionAdd::new),
        bind(DispatchEvent.MessageReactionRemove.TAG, MessageReactionData.class, DispatchEvent.MessageReactionRemove::new),
        bind(DispatchEvent.MessageReactionRemoveAll.TAG, MessageReactionRemoveAllData.class, DispatchEvent.MessageReactionRemoveAll::new),
        bind(DispatchEvent.MessageReactionRemoveEmoji.TAG, MessageReactionRemoveEmojiData.class, DispatchEvent.MessageReactionRemoveEmoji::new),

        bind(DispatchEvent.PresenceUpdate.TAG, PresenceUpdateData.class, DispatchEvent.PresenceUpdate::new),
        bind(DispatchEvent.TypingStart.TAG, TypingStartData.class, DispatchEvent.TypingStart::new),
        bind(DispatchEvent.UserUpdate.TAG, User.class, DispatchEvent.UserUpdate::new),

        bind(DispatchEvent.VoiceStateUpdate.TAG, VoiceState.class, DispatchEvent.VoiceStateUpdate::new),
        bind(DispatchEvent.VoiceServerUpdate.TAG, VoiceServerUpdateData.class, DispatchEvent.VoiceServerUpdate::new));

    private DispatchRegistry() {
    }

    public static Set<String> tags() {
        return DECODERS.keySet();
    }

    public static boolean recognizes(String tag) {
        return DECODERS.containsKey(tag);
    }

    public static DecodeResult<DispatchEvent> decode(String tag, Object d) {
        Decoder decoder = DECODERS.get(tag);
        if (decoder == null) {
            return new DecodeResult.Failure<>(new DecodeError.UnrecognizedDispatchType(tag));
        }
        try {
            return DecodeResult.success(decoder.decode(d));
        } catch (IOException | RuntimeException e) {
            // dsl-json reports missing/mistyped fields as ParsingException, record constructors as NPE/IAE
            return DecodeResult.formatError(tag, describe(e));
        }
    }

    // reads an untyped gateway value into a bound record
    private static <T> T bindValue(Class<T> type, Object d) throws IOException {
        return Json.fromBytes(type, Json.toBytes(d));
    }

    private static <T> Map.Entry<String, Decoder> bind(String tag, Class<T> type, Function<T, DispatchEvent> wrap) {
        Decoder decoder = d -> wrap.apply(bindValue(type, d));
        return Map.entry(tag, decoder);
    }

    // body is accepted and ignored
    private static Map.Entry<String, Decoder> empty(String tag, Supplier<DispatchEvent> event) {
        Decoder decoder = d -> event.get();
        return Map.entry(tag, decoder);
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return msg;
    }
}
