package com.github.anirbanmu.herald.discord;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.herald.config.HeraldConfig;
import com.github.anirbanmu.herald.discord.model.Embed;
import com.github.anirbanmu.herald.discord.model.Message;
import com.github.anirbanmu.herald.log.Log;
import com.github.anirbanmu.herald.util.Http;
import com.github.anirbanmu.herald.util.Json;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

// REST client for the channel message endpoints. no retries and no rate limiting: callers own both
public class DiscordHttpClient implements DiscordRest {
    private final String token;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final String userAgent;

    public DiscordHttpClient(String token) {
        this(token, HeraldConfig.Rest.defaults());
    }

    public DiscordHttpClient(String token, HeraldConfig.Rest settings) {
        this.token = token;
        this.baseUrl = settings.baseUrl().toString();
        this.requestTimeout = settings.requestTimeout();
        this.userAgent = settings.userAgent();
    }

    @Override
    public CompletableFuture<DiscordResult<Message>> sendMessage(String channelId, String content) {
        return send("send_message", messagesUrl(channelId), "POST", new CreateMessage(content, null), DiscordHttpClient::readMessage);
    }

    @Override
    public CompletableFuture<DiscordResult<Message>> sendEmbed(String channelId, Embed embed) {
        return send("send_embed", messagesUrl(channelId), "POST", new CreateMessage(null, List.of(embed)), DiscordHttpClient::readMessage);
    }

    @Override
    public CompletableFuture<DiscordResult<Void>> addReaction(String channelId, String messageId, String emoji) {
        String url = messagesUrl(channelId) + "/" + messageId + "/reactions/" + URLEncoder.encode(emoji, StandardCharsets.UTF_8) + "/@me";
        return send("add_reaction", url, "PUT", null, DiscordHttpClient::discard);
    }

    @Override
    public CompletableFuture<DiscordResult<Void>> deleteMessage(String channelId, String messageId) {
        return send("delete_message", messagesUrl(channelId) + "/" + messageId, "DELETE", null, DiscordHttpClient::discard);
    }

    @Override
    public CompletableFuture<DiscordResult<Void>> pinMessage(String channelId, String messageId) {
        return send("pin_message", pinsUrl(channelId, messageId), "PUT", null, DiscordHttpClient::discard);
    }

    @Override
    public CompletableFuture<DiscordResult<Void>> unpinMessage(String channelId, String messageId) {
        return send("unpin_message", pinsUrl(channelId, messageId), "DELETE", null, DiscordHttpClient::discard);
    }

    private String messagesUrl(String channelId) {
        return baseUrl + "/channels/" + channelId + "/messages";
    }

    private String pinsUrl(String channelId, String messageId) {
        return baseUrl + "/channels/" + channelId + "/pins/" + messageId;
    }

    @FunctionalInterface
    private interface BodyReader<T> {
        T read(byte[] body) throws IOException;
    }

    private static Message readMessage(byte[] body) throws IOException {
        return Json.fromBytes(Message.class, body);
    }

    private static Void discard(byte[] body) {
        return null;
    }

    private <T> CompletableFuture<DiscordResult<T>> send(String route, String url, String method, Object body, BodyReader<T> reader) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(requestTimeout)
            .header("Authorization", "Bot " + token)
            .header("User-Agent", userAgent);
        if (body != null) {
            builder.header("Content-Type", "application/json").method(method, bodyPublisher(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        Log.debug("http.request", "route", route, "method", method);
        return Http.CLIENT.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofByteArray())
            .<DiscordResult<T>>handle((response, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                    if (cause instanceof IOException) {
                        Log.error("http.request_failed", cause, "route", route);
                        return new DiscordResult.Failure<>("HTTP request failed", cause);
                    }
                    // cancellation and anything unexpected stay exceptional
                    throw error instanceof CompletionException ce ? ce : new CompletionException(cause);
                }
                if (response.statusCode() >= 400) {
                    Log.error("http.request_failed", "route", route, "status", response.statusCode());
                    return new DiscordResult.Failure<>("Discord API error", response.statusCode());
                }
                try {
                    return new DiscordResult.Success<>(reader.read(response.body()));
                } catch (IOException | RuntimeException e) {
                    Log.error("http.response_decode_failed", e, "route", route);
                    return new DiscordResult.Failure<>("Failed to decode response", e);
                }
            });
    }

    private HttpRequest.BodyPublisher bodyPublisher(Object data) {
        try {
            return HttpRequest.BodyPublishers.ofByteArray(Json.toBytes(data));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
    }

    // create message request body
    @CompiledJson
    public record CreateMessage(@JsonAttribute(nullable = true) String content, @JsonAttribute(nullable = true) List<Embed> embeds) {
    }
}
