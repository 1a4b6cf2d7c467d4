package com.github.anirbanmu.herald.discord.json;

// why a frame could not be turned into a GatewayEvent
public sealed interface DecodeError {

    String message();

    // frame or payload is structurally invalid for its kind. field names the field or dispatch tag
    record FormatError(String field, String detail) implements DecodeError {
        @Override
        public String message() {
            return "Invalid payload format for " + field + ": " + detail;
        }
    }

    // dispatch tag with no decoder, most likely an event newer than this build
    record UnrecognizedDispatchType(String tag) implements DecodeError {
        @Override
        public String message() {
            return "Unrecognized dispatch type: " + tag;
        }
    }

    record UnexpectedOpcode(int op) implements DecodeError {
        @Override
        public String message() {
            return "Unexpected opcode: " + op;
        }
    }
}
