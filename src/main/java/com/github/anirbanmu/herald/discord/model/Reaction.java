package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.Objects;

@CompiledJson
public record Reaction(
    @JsonAttribute(mandatory = true) int count,
    @JsonAttribute(mandatory = true) boolean me,
    @JsonAttribute(mandatory = true) Emoji emoji) {

    public Reaction {
        Objects.requireNonNull(emoji, "emoji");
    }
}
