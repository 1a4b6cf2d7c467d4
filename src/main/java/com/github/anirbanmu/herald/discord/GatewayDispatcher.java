package com.github.anirbanmu.herald.discord;

import com.github.anirbanmu.herald.config.HeraldConfig;
import com.github.anirbanmu.herald.discord.json.DecodeError;
import com.github.anirbanmu.herald.discord.json.DecodeResult;
import com.github.anirbanmu.herald.discord.json.FrameEnvelope;
import com.github.anirbanmu.herald.discord.json.GatewayEvent;
import com.github.anirbanmu.herald.discord.json.GatewayEventParser;
import com.github.anirbanmu.herald.log.Log;
import java.util.function.Consumer;

/**
 * Hands decoded gateway events to application code.
 *
 * <p>Frames must be fed in the order the transport received them; nothing here reorders. Not thread
 * safe: one dispatcher per connection, fed from a single reader.
 */
public class GatewayDispatcher {
    private final GatewayEventParser parser = new GatewayEventParser();
    private final boolean ignoreUnknown;
    private final Consumer<GatewayEvent> eventHandler;
    private final Consumer<DecodeError> errorHandler;

    private volatile int lastSequence = -1;

    public GatewayDispatcher(HeraldConfig.Dispatch settings, Consumer<GatewayEvent> eventHandler, Consumer<DecodeError> errorHandler) {
        this.ignoreUnknown = settings.ignoreUnknown();
        this.eventHandler = eventHandler;
        this.errorHandler = errorHandler;
    }

    // true if an event reached the handler
    public boolean accept(String raw) {
        DecodeResult<FrameEnvelope> envelope = FrameEnvelope.parse(raw);
        if (envelope instanceof DecodeResult.Failure<FrameEnvelope> f) {
            return reject(f.error(), null);
        }
        FrameEnvelope frame = envelope.orElseThrow();

        // the frame was received even if we can't decode it, so its sequence still counts
        if (frame.s() != null && frame.s() > lastSequence) {
            lastSequence = frame.s();
        }

        DecodeResult<GatewayEventParser.ParseResult> result = parser.resolve(frame);
        if (result instanceof DecodeResult.Failure<GatewayEventParser.ParseResult> f) {
            return reject(f.error(), frame);
        }

        GatewayEvent event = result.orElseThrow().event();
        if (event instanceof GatewayEvent.Dispatch dispatch) {
            Log.debug("gateway.dispatch", "type", dispatch.event().tag(), "seq", frame.s());
        }
        eventHandler.accept(event);
        return true;
    }

    // -1 until a frame carrying a sequence number has been seen
    public int lastSequence() {
        return lastSequence;
    }

    private boolean reject(DecodeError error, FrameEnvelope frame) {
        Integer op = frame == null ? null : frame.op();
        if (error instanceof DecodeError.UnrecognizedDispatchType unknown && ignoreUnknown) {
            Log.warn("gateway.unknown_dispatch", "type", unknown.tag(), "seq", frame == null ? null : frame.s());
            return false;
        }
        Log.error("gateway.decode_failed", "op", op, "error", error.message());
        errorHandler.accept(error);
        return false;
    }
}
