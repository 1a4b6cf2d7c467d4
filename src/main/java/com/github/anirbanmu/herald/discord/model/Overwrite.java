package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// permission overwrite on a channel, type 0 = role, 1 = member
@CompiledJson
public record Overwrite(@JsonAttribute(mandatory = true) String id, int type, String allow, String deny) {
}
