package com.github.anirbanmu.herald.config;

import com.github.anirbanmu.herald.log.Log;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.time.Duration;

public record HeraldConfig(Rest rest, Dispatch dispatch, Logging logging) {
    public static final URI DEFAULT_BASE_URL = URI.create("https://discord.com/api/v10");
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMillis(2500);
    public static final String DEFAULT_USER_AGENT = "DiscordBot (https://github.com/anirbanmu/herald, 1.0)";

    public static HeraldConfig defaults() {
        return new HeraldConfig(Rest.defaults(), Dispatch.defaults(), Logging.defaults());
    }

    // REST collaborator settings
    public record Rest(URI baseUrl, Duration requestTimeout, String userAgent) {
        public static Rest defaults() {
            return new Rest(DEFAULT_BASE_URL, DEFAULT_REQUEST_TIMEOUT, DEFAULT_USER_AGENT);
        }
    }

    // ignoreUnknown: log and skip dispatch types this build doesn't know instead of reporting them as errors
    public record Dispatch(boolean ignoreUnknown) {
        public static Dispatch defaults() {
            return new Dispatch(true);
        }
    }

    // null level leaves filtering to the System.Logger backend
    public record Logging(Level level) {
        public static Logging defaults() {
            return new Logging(null);
        }

        public void apply() {
            if (level != null) {
                Log.setLevel(level);
            }
        }
    }
}
