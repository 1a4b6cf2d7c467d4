package com.github.anirbanmu.herald.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.util.Lists;
import java.util.List;
import java.util.Objects;

// PRESENCE_UPDATE event data, also embedded in member chunks
@CompiledJson
public record PresenceUpdateData(
    @JsonAttribute(mandatory = true) PresenceUser user,
    @JsonAttribute(name = "guild_id", nullable = true) String guildId,
    @JsonAttribute(mandatory = true) String status,
    @JsonAttribute(nullable = true) List<Activity> activities,
    @JsonAttribute(name = "client_status", nullable = true) ClientStatus clientStatus) {

    public static final String STATUS_ONLINE = "online";
    public static final String STATUS_IDLE = "idle";
    public static final String STATUS_DND = "dnd";
    public static final String STATUS_OFFLINE = "offline";

    public PresenceUpdateData {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(status, "status");
        activities = Lists.orEmpty(activities);
    }

    // presence updates only guarantee the user's id
    @CompiledJson
    public record PresenceUser(@JsonAttribute(mandatory = true) String id, @JsonAttribute(nullable = true) String username, @JsonAttribute(nullable = true) String avatar) {
    }

    @CompiledJson
    public record Activity(
        @JsonAttribute(mandatory = true) String name,
        @JsonAttribute(mandatory = true) int type,
        @JsonAttribute(nullable = true) String url,
        @JsonAttribute(name = "created_at", nullable = true) Long createdAt,
        @JsonAttribute(nullable = true) String details,
        @JsonAttribute(nullable = true) String state) {

        // activity types
        public static final int TYPE_PLAYING = 0;
        public static final int TYPE_STREAMING = 1;
        public static final int TYPE_LISTENING = 2;
        public static final int TYPE_WATCHING = 3;
        public static final int TYPE_CUSTOM = 4;
        public static final int TYPE_COMPETING = 5;
    }

    // per-platform status, absent platforms are offline
    @CompiledJson
    public record ClientStatus(@JsonAttribute(nullable = true) String desktop, @JsonAttribute(nullable = true) String mobile, @JsonAttribute(nullable = true) String web) {
    }
}
