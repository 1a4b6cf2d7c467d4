package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.Objects;

@CompiledJson
public record Role(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(mandatory = true) String name,
    @JsonAttribute(mandatory = true) int color,
    @JsonAttribute(mandatory = true) boolean hoist,
    @JsonAttribute(mandatory = true) int position,
    @JsonAttribute(nullable = true) String permissions,
    @JsonAttribute(mandatory = true) boolean managed,
    @JsonAttribute(mandatory = true) boolean mentionable) {

    public Role {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }
}
