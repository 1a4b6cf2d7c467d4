package com.github.anirbanmu.herald.discord.json;

import java.util.Map;

/**
 * Classifies a {@link FrameEnvelope} by opcode.
 *
 * <p>Pure and stateless: safe to call from any thread, and the same envelope always resolves to an
 * equal result. Opcodes outside the known set are reported, never skipped, since they usually mean the
 * server speaks a gateway version this build does not.
 */
public final class OpcodeResolver {
    public static final int OP_DISPATCH = 0;
    public static final int OP_HEARTBEAT = 1;
    public static final int OP_RECONNECT = 7;
    public static final int OP_INVALID_SESSION = 9;
    public static final int OP_HELLO = 10;
    public static final int OP_HEARTBEAT_ACK = 11;

    private static final String HELLO_INTERVAL = "heartbeat_interval";

    private OpcodeResolver() {
    }

    public static DecodeResult<GatewayEvent> resolve(FrameEnvelope frame) {
        return switch (frame.op()) {
            case OP_DISPATCH -> resolveDispatch(frame);
            case OP_HEARTBEAT -> DecodeResult.success(new GatewayEvent.HeartbeatRequest());
            case OP_RECONNECT -> DecodeResult.success(new GatewayEvent.Reconnect());
            case OP_INVALID_SESSION -> resolveInvalidSession(frame);
            case OP_HELLO -> resolveHello(frame);
            case OP_HEARTBEAT_ACK -> DecodeResult.success(new GatewayEvent.HeartbeatAck());
            default -> new DecodeResult.Failure<>(new DecodeError.UnexpectedOpcode(frame.op()));
        };
    }

    private static DecodeResult<GatewayEvent> resolveDispatch(FrameEnvelope frame) {
        if (frame.d() == null) {
            return DecodeResult.formatError("d", "dispatch frame without payload");
        }
        if (frame.t() == null) {
            return DecodeResult.formatError("t", "dispatch frame without event type");
        }
        return DispatchRegistry.decode(frame.t(), frame.d()).map(GatewayEvent.Dispatch::new);
    }

    // d must be exactly a JSON boolean
    private static DecodeResult<GatewayEvent> resolveInvalidSession(FrameEnvelope frame) {
        if (!(frame.d() instanceof Boolean resumable)) {
            return DecodeResult.formatError("d", "invalid session expects a boolean, got " + describe(frame.d()));
        }
        return DecodeResult.success(new GatewayEvent.InvalidSession(resumable));
    }

    // read straight from the untyped map so an out-of-range interval is rejected rather than wrapped
    private static DecodeResult<GatewayEvent> resolveHello(FrameEnvelope frame) {
        if (frame.d() == null) {
            return DecodeResult.formatError("d", "hello frame without payload");
        }
        if (!(frame.d() instanceof Map<?, ?> fields)) {
            return DecodeResult.formatError("heartbeat_interval", "hello expects an object, got " + describe(frame.d()));
        }
        Object value = fields.get(HELLO_INTERVAL);
        if (value == null) {
            return DecodeResult.formatError("heartbeat_interval", "missing");
        }
        Long interval = FrameEnvelope.integral(value);
        if (interval == null || interval > Integer.MAX_VALUE) {
            return DecodeResult.formatError("heartbeat_interval", "expected an integer, got " + describe(value));
        }
        if (interval <= 0) {
            return DecodeResult.formatError("heartbeat_interval", "must be positive, got " + interval);
        }
        return DecodeResult.success(new GatewayEvent.Hello(interval.intValue()));
    }

    private static String describe(Object value) {
        if (value == null) {
            return "nothing";
        }
        return value.getClass().getSimpleName() + " " + value;
    }
}
