package com.github.anirbanmu.herald.discord.model;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.util.Lists;
import java.util.ArrayList;
import java.util.List;

// rich embed, received on messages and sent through Message.sendEmbed
@CompiledJson
public record Embed(
    @JsonAttribute(nullable = true) String title,
    @JsonAttribute(nullable = true) String type,
    @JsonAttribute(nullable = true) String description,
    @JsonAttribute(nullable = true) String url,
    @JsonAttribute(nullable = true) String timestamp,
    @JsonAttribute(nullable = true) Integer color,
    @JsonAttribute(nullable = true) Footer footer,
    @JsonAttribute(nullable = true) Media image,
    @JsonAttribute(nullable = true) Media thumbnail,
    @JsonAttribute(nullable = true) Media video,
    @JsonAttribute(nullable = true) Provider provider,
    @JsonAttribute(nullable = true) Author author,
    @JsonAttribute(nullable = true) List<Field> fields) {

    public Embed {
        fields = Lists.copyOrNull(fields);
    }

    public static Embed of(String title, String description) {
        return new Embed(title, null, description, null, null, null, null, null, null, null, null, null, null);
    }

    public Embed withColor(int rgb) {
        return new Embed(title, type, description, url, timestamp, rgb, footer, image, thumbnail, video, provider, author, fields);
    }

    public Embed withFooter(String text) {
        return new Embed(title, type, description, url, timestamp, color, new Footer(text, null, null), image, thumbnail, video, provider, author, fields);
    }

    public Embed withField(String name, String value, boolean inline) {
        List<Field> next = fields == null ? new ArrayList<>() : new ArrayList<>(fields);
        next.add(new Field(name, value, inline));
        return new Embed(title, type, description, url, timestamp, color, footer, image, thumbnail, video, provider, author, next);
    }

    @CompiledJson
    public record Footer(String text, @JsonAttribute(name = "icon_url", nullable = true) String iconUrl, @JsonAttribute(name = "proxy_icon_url", nullable = true) String proxyIconUrl) {
    }

    // image, thumbnail and video share a shape
    @CompiledJson
    public record Media(@JsonAttribute(nullable = true) String url, @JsonAttribute(name = "proxy_url", nullable = true) String proxyUrl, @JsonAttribute(nullable = true) Integer height, @JsonAttribute(nullable = true) Integer width) {
    }

    @CompiledJson
    public record Provider(@JsonAttribute(nullable = true) String name, @JsonAttribute(nullable = true) String url) {
    }

    @CompiledJson
    public record Author(@JsonAttribute(nullable = true) String name, @JsonAttribute(nullable = true) String url, @JsonAttribute(name = "icon_url", nullable = true) String iconUrl) {
    }

    @CompiledJson
    public record Field(String name, String value, @JsonAttribute(nullable = true) Boolean inline) {
    }
}
