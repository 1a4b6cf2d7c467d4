package com.github.anirbanmu.herald.discord.json;

import com.github.anirbanmu.herald.discord.model.Channel;
import com.github.anirbanmu.herald.discord.model.Guild;
import com.github.anirbanmu.herald.discord.model.Message;
import com.github.anirbanmu.herald.discord.model.UnavailableGuild;
import com.github.anirbanmu.herald.discord.model.User;
import com.github.anirbanmu.herald.discord.model.VoiceState;

/**
 * Application-level events carried by op 0 dispatch frames, one variant per recognized {@code t} tag.
 *
 * <p>Each variant holds the decoded {@code d} body, except RESUMED and RECONNECT which carry nothing.
 * {@link #tag()} is the wire tag the variant is decoded from; {@link DispatchRegistry} keys on it.
 */
public sealed interface DispatchEvent {

    String tag();

    record Ready(ReadyData data) implements DispatchEvent {
        public static final String TAG = "READY";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record Resumed() implements DispatchEvent {
        public static final String TAG = "RESUMED";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record Reconnect() implements DispatchEvent {
        public static final String TAG = "RECONNECT";

        @Override
        public String tag() {
            return TAG;
        }
    }

    // channel
    record ChannelCreate(Channel channel) implements DispatchEvent {
        public static final String TAG = "CHANNEL_CREATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record ChannelUpdate(Channel channel) implements DispatchEvent {
        public static final String TAG = "CHANNEL_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record ChannelDelete(Channel channel) implements DispatchEvent {
        public static final String TAG = "CHANNEL_DELETE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record ChannelPinsUpdate(ChannelPinsData data) implements DispatchEvent {
        public static final String TAG = "CHANNEL_PINS_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    // guild
    record GuildCreate(Guild guild) implements DispatchEvent {
        public static final String TAG = "GUILD_CREATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildUpdate(Guild guild) implements DispatchEvent {
        public static final String TAG = "GUILD_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildDelete(UnavailableGuild guild) implements DispatchEvent {
        public static final String TAG = "GUILD_DELETE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildBanAdd(GuildBanData data) implements DispatchEvent {
        public static final String TAG = "GUILD_BAN_ADD";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildBanRemove(GuildBanData data) implements DispatchEvent {
        public static final String TAG = "GUILD_BAN_REMOVE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildEmojisUpdate(GuildEmojisData data) implements DispatchEvent {
        public static final String TAG = "GUILD_EMOJIS_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildIntegrationsUpdate(GuildIntegrationsData data) implements DispatchEvent {
        public static final String TAG = "GUILD_INTEGRATIONS_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildMemberAdd(GuildMemberAddData data) implements DispatchEvent {
        public static final String TAG = "GUILD_MEMBER_ADD";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildMemberRemove(GuildMemberRemoveData data) implements DispatchEvent {
        public static final String TAG = "GUILD_MEMBER_REMOVE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildMemberUpdate(GuildMemberUpdateData data) implements DispatchEvent {
        public static final String TAG = "GUILD_MEMBER_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildMembersChunk(GuildMembersChunkData data) implements DispatchEvent {
        public static final String TAG = "GUILD_MEMBERS_CHUNK";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildRoleCreate(GuildRoleData data) implements DispatchEvent {
        public static final String TAG = "GUILD_ROLE_CREATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildRoleUpdate(GuildRoleData data) implements DispatchEvent {
        public static final String TAG = "GUILD_ROLE_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record GuildRoleDelete(GuildRoleDeleteData data) implements DispatchEvent {
        public static final String TAG = "GUILD_ROLE_DELETE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    // message
    record MessageCreate(Message message) implements DispatchEvent {
        public static final String TAG = "MESSAGE_CREATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record MessageUpdate(MessageUpdateData data) implements DispatchEvent {
        public static final String TAG = "MESSAGE_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record MessageDelete(MessageDeleteData data) implements DispatchEvent {
        public static final String TAG = "MESSAGE_DELETE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record MessageDeleteBulk(MessageDeleteBulkData data) implements DispatchEvent {
        public static final String TAG = "MESSAGE_DELETE_BULK";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record MessageReactionAdd(MessageReactionData data) implements DispatchEvent {
        public static final String TAG = "MESSAGE_REACTION_ADD";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record MessageReactionRemove(MessageReactionData data) implements DispatchEvent {
        public static final String TAG = "MESSAGE_REACTION_REMOVE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record MessageReactionRemoveAll(MessageReactionRemoveAllData data) implements DispatchEvent {
        public static final String TAG = "MESSAGE_REACTION_REMOVE_ALL";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record MessageReactionRemoveEmoji(MessageReactionRemoveEmojiData data) implements DispatchEvent {
        public static final String TAG = "MESSAGE_REACTION_REMOVE_EMOJI";

        @Override
        public String tag() {
            return TAG;
        }
    }

    // presence
    record PresenceUpdate(PresenceUpdateData data) implements DispatchEvent {
        public static final String TAG = "PRESENCE_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record TypingStart(TypingStartData data) implements DispatchEvent {
        public static final String TAG = "TYPING_START";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record UserUpdate(User user) implements DispatchEvent {
        public static final String TAG = "USER_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    // voice
    record VoiceStateUpdate(VoiceState state) implements DispatchEvent {
        public static final String TAG = "VOICE_STATE_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }

    record VoiceServerUpdate(VoiceServerUpdateData data) implements DispatchEvent {
        public static final String TAG = "VOICE_SERVER_UPDATE";

        @Override
        public String tag() {
            return TAG;
        }
    }
}
