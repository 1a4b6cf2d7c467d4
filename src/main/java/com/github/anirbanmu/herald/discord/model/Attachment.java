package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.Objects;

@CompiledJson
public record Attachment(
    @JsonAttribute(mandatory = true) String id,
    @JsonAttribute(mandatory = true) String filename,
    @JsonAttribute(mandatory = true) long size,
    @JsonAttribute(mandatory = true) String url,
    @JsonAttribute(name = "proxy_url", nullable = true) String proxyUrl,
    @JsonAttribute(name = "content_type", nullable = true) String contentType,
    @JsonAttribute(nullable = true) Integer height,
    @JsonAttribute(nullable = true) Integer width) {

    public Attachment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(url, "url");
    }
}
