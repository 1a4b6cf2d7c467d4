package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.util.Lists;
import java.util.List;

// id is null for unicode emoji, name is null for deleted custom emoji
@CompiledJson
public record Emoji(
    @JsonAttribute(nullable = true) String id,
    @JsonAttribute(nullable = true) String name,
    @JsonAttribute(nullable = true) List<String> roles,
    @JsonAttribute(nullable = true) User user,
    @JsonAttribute(name = "require_colons", nullable = true) Boolean requireColons,
    @JsonAttribute(nullable = true) Boolean managed,
    @JsonAttribute(nullable = true) Boolean animated,
    @JsonAttribute(nullable = true) Boolean available) {

    public Emoji {
        roles = Lists.copyOrNull(roles);
    }

    public boolean custom() {
        return id != null;
    }

    // form accepted by the reaction endpoints: the unicode character, or name:id for custom emoji
    public String reactionKey() {
        return id == null ? name : name + ":" + id;
    }
}
