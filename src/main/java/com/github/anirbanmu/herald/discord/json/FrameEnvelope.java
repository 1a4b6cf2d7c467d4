package com.github.anirbanmu.herald.discord.json;

import com.github.anirbanmu.herald.util.Json;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * One gateway frame as handed over by the transport: {@code {op, d?, s?, t?}}.
 *
 * <p>{@code d} is left untyped (maps, lists, strings, numbers, booleans as read by dsl-json) because its
 * shape depends on the opcode and, for dispatch frames, on {@code t}. A JSON {@code null} is treated the
 * same as an absent field.
 */
public record FrameEnvelope(int op, Object d, Integer s, String t) {

    public static DecodeResult<FrameEnvelope> parse(String raw) {
        return read(raw.getBytes(StandardCharsets.UTF_8));
    }

    // bytes straight off the wire; malformed UTF-8 is rejected, not replaced
    public static DecodeResult<FrameEnvelope> parse(byte[] raw) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(raw));
        } catch (CharacterCodingException e) {
            return DecodeResult.formatError("frame", "not valid UTF-8");
        }
        return read(raw);
    }

    private static DecodeResult<FrameEnvelope> read(byte[] raw) {
        Map<?, ?> fields;
        try {
            fields = Json.DSL.deserialize(Map.class, raw, raw.length);
        } catch (IOException e) {
            return DecodeResult.formatError("frame", "not a JSON object (" + e.getMessage() + ")");
        }
        if (fields == null) {
            return DecodeResult.formatError("frame", "not a JSON object");
        }

        Object opValue = fields.get("op");
        if (opValue == null) {
            return DecodeResult.formatError("op", "missing");
        }
        Long op = integral(opValue);
        if (op == null || op < Integer.MIN_VALUE || op > Integer.MAX_VALUE) {
            return DecodeResult.formatError("op", "expected an integer, got " + opValue);
        }

        Integer sequence = null;
        Object sValue = fields.get("s");
        if (sValue != null) {
            Long s = integral(sValue);
            if (s == null || s < 0 || s > Integer.MAX_VALUE) {
                return DecodeResult.formatError("s", "expected a sequence number, got " + sValue);
            }
            sequence = s.intValue();
        }

        Object tValue = fields.get("t");
        if (tValue != null && !(tValue instanceof String)) {
            return DecodeResult.formatError("t", "expected a string, got " + tValue);
        }

        return DecodeResult.success(new FrameEnvelope(op.intValue(), fields.get("d"), sequence, (String) tValue));
    }

    public boolean isDispatch() {
        return op == OpcodeResolver.OP_DISPATCH;
    }

    // whole numbers only; 3.0 is accepted, 3.5 is not
    static Long integral(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) <= Long.MAX_VALUE) {
                return (long) d;
            }
            return null;
        }
        if (value instanceof BigDecimal bd) {
            try {
                return bd.longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        if (value instanceof BigInteger bi && bi.bitLength() < 64) {
            return bi.longValue();
        }
        return null;
    }
}
