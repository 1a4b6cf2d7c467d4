package com.github.anirbanmu.herald.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

public class ConfigLoader {
    public static HeraldConfig load(Path path) throws IOException {
        TomlParseResult result = Toml.parse(path);
        return parse(result);
    }

    public static HeraldConfig load(InputStream stream) throws IOException {
        TomlParseResult result = Toml.parse(stream);
        return parse(result);
    }

    public static HeraldConfig load(String content) {
        TomlParseResult result = Toml.parse(content);
        return parse(result);
    }

    private static HeraldConfig parse(TomlParseResult result) {
        if (result.hasErrors()) {
            StringBuilder sb = new StringBuilder("Failed to parse TOML configuration:\n");
            result.errors().forEach(error -> sb.append("- ").append(error.toString()).append("\n"));
            throw new ConfigException(sb.toString());
        }

        HeraldConfig.Rest rest = HeraldConfig.Rest.defaults();
        if (result.contains("rest")) {
            rest = parseRest(table(result, "rest"));
        }

        HeraldConfig.Dispatch dispatch = HeraldConfig.Dispatch.defaults();
        if (result.contains("dispatch")) {
            dispatch = parseDispatch(table(result, "dispatch"));
        }

        HeraldConfig.Logging logging = HeraldConfig.Logging.defaults();
        if (result.contains("log")) {
            logging = parseLogging(table(result, "log"));
        }

        return new HeraldConfig(rest, dispatch, logging);
    }

    private static TomlTable table(TomlTable parent, String key) {
        if (!parent.isTable(key)) {
            throw new ConfigException("'" + key + "' must be a table.");
        }
        return parent.getTable(key);
    }

    private static HeraldConfig.Rest parseRest(TomlTable table) {
        URI baseUrl = HeraldConfig.DEFAULT_BASE_URL;
        String baseUrlStr = string(table, "rest.base_url", "base_url");
        if (baseUrlStr != null) {
            try {
                baseUrl = new URI(stripTrailingSlash(baseUrlStr));
            } catch (URISyntaxException e) {
                throw new ConfigException("'rest.base_url' is not a valid URL: " + baseUrlStr, e);
            }
            if (!"https".equals(baseUrl.getScheme()) && !"http".equals(baseUrl.getScheme())) {
                throw new ConfigException("'rest.base_url' must be an http(s) URL: " + baseUrlStr);
            }
        }

        Duration timeout = HeraldConfig.DEFAULT_REQUEST_TIMEOUT;
        String timeoutStr = string(table, "rest.request_timeout", "request_timeout");
        if (timeoutStr != null) {
            try {
                // ISO-8601, e.g. "PT2.5S"
                timeout = Duration.parse(timeoutStr);
            } catch (DateTimeParseException e) {
                throw new ConfigException("'rest.request_timeout' is not an ISO-8601 duration: " + timeoutStr, e);
            }
            if (timeout.isNegative() || timeout.isZero()) {
                throw new ConfigException("'rest.request_timeout' must be positive: " + timeoutStr);
            }
        }

        String userAgent = string(table, "rest.user_agent", "user_agent");
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = HeraldConfig.DEFAULT_USER_AGENT;
        }

        return new HeraldConfig.Rest(baseUrl, timeout, userAgent);
    }

    private static HeraldConfig.Dispatch parseDispatch(TomlTable table) {
        if (!table.contains("ignore_unknown")) {
            return HeraldConfig.Dispatch.defaults();
        }
        if (!table.isBoolean("ignore_unknown")) {
            throw new ConfigException("'dispatch.ignore_unknown' must be a boolean.");
        }
        return new HeraldConfig.Dispatch(table.getBoolean("ignore_unknown"));
    }

    private static HeraldConfig.Logging parseLogging(TomlTable table) {
        String levelStr = string(table, "log.level", "level");
        if (levelStr == null) {
            return HeraldConfig.Logging.defaults();
        }
        String normalized = levelStr.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("WARN")) {
            normalized = "WARNING";
        }
        try {
            return new HeraldConfig.Logging(Level.valueOf(normalized));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("'log.level' is not a known level: " + levelStr, e);
        }
    }

    private static String string(TomlTable table, String context, String key) {
        if (!table.contains(key)) {
            return null;
        }
        if (!table.isString(key)) {
            throw new ConfigException("'" + context + "' must be a string.");
        }
        return table.getString(key);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
