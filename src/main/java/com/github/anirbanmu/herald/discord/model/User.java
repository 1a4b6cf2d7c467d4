package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.Objects;

@CompiledJson
public record User(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(mandatory = true) String username,
    @JsonAttribute(nullable = true) String discriminator,
    @JsonAttribute(name = "global_name", nullable = true) String globalName,
    @JsonAttribute(nullable = true) String avatar,
    @JsonAttribute(nullable = true) Boolean bot,
    @JsonAttribute(nullable = true) Boolean system,
    @JsonAttribute(name = "mfa_enabled", nullable = true) Boolean mfaEnabled,
    @JsonAttribute(nullable = true) String locale,
    @JsonAttribute(nullable = true) Boolean verified,
    @JsonAttribute(nullable = true) String email,
    @JsonAttribute(nullable = true) Long flags,
    @JsonAttribute(name = "premium_type", nullable = true) Integer premiumType,
    @JsonAttribute(name = "public_flags", nullable = true) Long publicFlags) {

    public User {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(username, "username");
    }

    // <@id> form, renders as a mention in message content
    public String mention() {
        return "<@" + id + ">";
    }
}
