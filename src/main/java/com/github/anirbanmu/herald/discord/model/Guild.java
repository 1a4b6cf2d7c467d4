package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.util.Lists;
import java.util.List;
import java.util.Objects;

/**
 * Full guild object. The joined_at, large, member_count, voice_states, members and channels
 * fields are only present on GUILD_CREATE.
 */
@CompiledJson
public record Guild(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(mandatory = true) String name,
    @JsonAttribute(nullable = true) String icon,
    @JsonAttribute(nullable = true) String splash,
    @JsonAttribute(name = "owner_id", mandatory = true) String ownerId,
    @JsonAttribute(nullable = true) String region,
    @JsonAttribute(name = "afk_channel_id", nullable = true) String afkChannelId,
    @JsonAttribute(name = "afk_timeout", nullable = true) Integer afkTimeout,
    @JsonAttribute(name = "verification_level", nullable = true) Integer verificationLevel,
    @JsonAttribute(name = "default_message_notifications", nullable = true) Integer defaultMessageNotifications,
    @JsonAttribute(name = "explicit_content_filter", nullable = true) Integer explicitContentFilter,
    @JsonAttribute(mandatory = true) List<Role> roles,
    @JsonAttribute(mandatory = true) List<Emoji> emojis,
    @JsonAttribute(mandatory = true) List<String> features,
    @JsonAttribute(name = "mfa_level", nullable = true) Integer mfaLevel,
    @JsonAttribute(name = "application_id", nullable = true) String applicationId,
    @JsonAttribute(name = "system_channel_id", nullable = true) String systemChannelId,
    @JsonAttribute(name = "joined_at", nullable = true) String joinedAt,
    @JsonAttribute(nullable = true) Boolean large,
    @JsonAttribute(nullable = true) Boolean unavailable,
    @JsonAttribute(name = "member_count", nullable = true) Integer memberCount,
    @JsonAttribute(name = "voice_states", nullable = true) List<VoiceState> voiceStates,
    @JsonAttribute(nullable = true) List<GuildMember> members,
    @JsonAttribute(nullable = true) List<Channel> channels,
    @JsonAttribute(name = "premium_tier", nullable = true) Integer premiumTier,
    @JsonAttribute(name = "premium_subscription_count", nullable = true) Integer premiumSubscriptionCount,
    @JsonAttribute(name = "preferred_locale", nullable = true) String preferredLocale,
    @JsonAttribute(nullable = true) String description,
    @JsonAttribute(nullable = true) String banner,
    @JsonAttribute(name = "vanity_url_code", nullable = true) String vanityUrlCode) {

    public Guild {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(ownerId, "owner_id");
        roles = List.copyOf(roles);
        emojis = List.copyOf(emojis);
        features = List.copyOf(features);
        voiceStates = Lists.copyOrNull(voiceStates);
        members = Lists.copyOrNull(members);
        channels = Lists.copyOrNull(channels);
    }
}
