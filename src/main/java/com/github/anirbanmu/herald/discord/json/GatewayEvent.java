package com.github.anirbanmu.herald.discord.json;

// sealed type for everything a gateway frame can decode to
public sealed interface GatewayEvent {

    // op 0
    record Dispatch(DispatchEvent event) implements GatewayEvent {
    }

    // op 1, server wants a heartbeat now
    record HeartbeatRequest() implements GatewayEvent {
    }

    // op 7
    record Reconnect() implements GatewayEvent {
    }

    // op 9
    record InvalidSession(boolean resumable) implements GatewayEvent {
    }

    // op 10
    record Hello(int heartbeatInterval) implements GatewayEvent {
    }

    // op 11
    record HeartbeatAck() implements GatewayEvent {
    }
}
