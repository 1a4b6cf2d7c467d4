package com.github.anirbanmu.herald.discord;

import com.github.anirbanmu.herald.discord.model.Embed;
import com.github.anirbanmu.herald.discord.model.Message;
import java.util.concurrent.CompletableFuture;

/**
 * Channel message endpoints of the REST API, as used by the {@link Message} actions.
 *
 * <p>Futures complete with a {@link DiscordResult}; API and I/O failures are reported as
 * {@link DiscordResult.Failure}. Cancelling a returned future is up to the caller.
 */
public interface DiscordRest {

    CompletableFuture<DiscordResult<Message>> sendMessage(String channelId, String content);

    CompletableFuture<DiscordResult<Message>> sendEmbed(String channelId, Embed embed);

    /**
     * @param emoji unicode emoji, or {@code name:id} for a custom emoji
     */
    CompletableFuture<DiscordResult<Void>> addReaction(String channelId, String messageId, String emoji);

    CompletableFuture<DiscordResult<Void>> deleteMessage(String channelId, String messageId);

    CompletableFuture<DiscordResult<Void>> pinMessage(String channelId, String messageId);

    CompletableFuture<DiscordResult<Void>> unpinMessage(String channelId, String messageId);
}
