package com.github.anirbanmu.herald.util;

import com.dslplatform.json.JsonReader;
import com.dslplatform.json.JsonWriter;
import com.dslplatform.json.NumberConverter;
import java.io.IOException;
import java.math.BigDecimal;

/**
 * dsl-json converters for integer fields that must fail on overflow or fractions.
 *
 * <p>The stock int and long readers wrap out-of-range values, so a field bound through them can decode
 * to a different number than was sent. Use with {@code @JsonAttribute(converter = ...)} on boxed fields.
 */
public final class JsonNumbers {
    private JsonNumbers() {
    }

    public static final class Int32 {
        private Int32() {
        }

        public static final JsonReader.ReadObject<Integer> JSON_READER = reader -> {
            if (reader.wasNull()) {
                return null;
            }
            return (int) readExact(reader, Integer.MIN_VALUE, Integer.MAX_VALUE);
        };

        public static final JsonWriter.WriteObject<Integer> JSON_WRITER = (writer, value) -> {
            if (value == null) {
                writer.writeNull();
            } else {
                NumberConverter.serialize(value.intValue(), writer);
            }
        };
    }

    public static final class Int64 {
        private Int64() {
        }

        public static final JsonReader.ReadObject<Long> JSON_READER = reader -> {
            if (reader.wasNull()) {
                return null;
            }
            return readExact(reader, Long.MIN_VALUE, Long.MAX_VALUE);
        };

        public static final JsonWriter.WriteObject<Long> JSON_WRITER = (writer, value) -> {
            if (value == null) {
                writer.writeNull();
            } else {
                NumberConverter.serialize(value.longValue(), writer);
            }
        };
    }

    static long readExact(JsonReader<?> reader, long min, long max) throws IOException {
        BigDecimal value = NumberConverter.deserializeDecimal(reader);
        long exact;
        try {
            exact = value.longValueExact();
        } catch (ArithmeticException e) {
            throw reader.newParseError("Expecting an integer in range, found " + value.toPlainString());
        }
        if (exact < min || exact > max) {
            throw reader.newParseError("Integer out of range: " + exact);
        }
        return exact;
    }
}
