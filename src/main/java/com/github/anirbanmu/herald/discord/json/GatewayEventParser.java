package com.github.anirbanmu.herald.discord.json;

import java.nio.charset.StandardCharsets;

// parses raw gateway json into typed GatewayEvent
public final class GatewayEventParser {

    public GatewayEventParser() {
    }

    // sequence is the frame's s, null for frames that don't carry one
    public record ParseResult(GatewayEvent event, Integer sequence) {
    }

    public DecodeResult<ParseResult> parse(String raw) {
        return parse(raw.getBytes(StandardCharsets.UTF_8));
    }

    public DecodeResult<ParseResult> parse(byte[] raw) {
        return FrameEnvelope.parse(raw).flatMap(this::resolve);
    }

    public DecodeResult<ParseResult> resolve(FrameEnvelope envelope) {
        return OpcodeResolver.resolve(envelope).map(event -> new ParseResult(event, envelope.s()));
    }
}
