package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// sent with rich presence chat embeds
@CompiledJson
public record MessageApplication(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(name = "cover_image", nullable = true) String coverImage,
    @JsonAttribute(nullable = true) String description,
    @JsonAttribute(nullable = true) String icon,
    @JsonAttribute(mandatory = true) String name) {
}
