package com.github.anirbanmu.herald.discord.json;

// thrown by DecodeResult.orElseThrow for callers that prefer exceptions
public class GatewayDecodeException extends RuntimeException {
    private final DecodeError error;

    public GatewayDecodeException(DecodeError error) {
        super(error.message());
        this.error = error;
    }

    public DecodeError error() {
        return error;
    }
}
