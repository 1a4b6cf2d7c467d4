package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// user is omitted when the member is attached to a message or reaction
@CompiledJson
public record GuildMember(
    @JsonAttribute(nullable = true) User user,
    @JsonAttribute(nullable = true) String nick,
    @JsonAttribute(mandatory = true) List<String> roles,
    @JsonAttribute(name = "joined_at", mandatory = true) String joinedAt,
    @JsonAttribute(name = "premium_since", nullable = true) String premiumSince,
    @JsonAttribute(mandatory = true) boolean deaf,
    @JsonAttribute(mandatory = true) boolean mute,
    @JsonAttribute(nullable = true) Boolean pending) {

    public GuildMember {
        roles = List.copyOf(roles);
    }
}
