package com.github.anirbanmu.herald.discord.json;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.herald.discord.json.GatewayEventParser.ParseResult;
import com.github.anirbanmu.herald.discord.model.Message;
import org.junit.jupiter.api.Test;

class GatewayEventParserTest {

    private final GatewayEventParser parser = new GatewayEventParser();

    static final String MINIMAL_MESSAGE = """
        {
            "id": "334385199974967042",
            "channel_id": "290926798999357250",
            "author": {"id": "53908099506183680", "username": "Mason", "discriminator": "9999"},
            "content": "Supa Hot",
            "timestamp": "2017-07-11T17:27:07.299000+00:00",
            "edited_timestamp": null,
            "tts": false,
            "mention_everyone": false,
            "mentions": [],
            "mention_roles": [],
            "attachments": [],
            "pinned": false
        }
        """;

    @Test
    void parseHello() throws Exception {
        String json = """
            {"op": 10, "t": null, "s": null, "d": {"heartbeat_interval": 41250}}
            """;

        ParseResult result = parser.parse(json).orElseThrow();

        assertNull(result.sequence());
        GatewayEvent.Hello hello = assertInstanceOf(GatewayEvent.Hello.class, result.event());
        assertEquals(41250, hello.heartbeatInterval());
    }

    @Test
    void helloWithoutIntervalIsFormatError() {
        assertFormatError(parser.parse("{\"op\": 10, \"d\": {}}"), "heartbeat_interval");
    }

    @Test
    void helloWithoutPayloadIsFormatError() {
        assertFormatError(parser.parse("{\"op\": 10}"), "d");
    }

    @Test
    void helloWithNonPositiveIntervalIsFormatError() {
        assertFormatError(parser.parse("{\"op\": 10, \"d\": {\"heartbeat_interval\": 0}}"), "heartbeat_interval");
        assertFormatError(parser.parse("{\"op\": 10, \"d\": {\"heartbeat_interval\": \"soon\"}}"), "heartbeat_interval");
    }

    @Test
    void helloIntervalOutOfRangeIsFormatError() {
        // 2^32 + 41250 must not wrap to 41250
        assertFormatError(parser.parse("{\"op\": 10, \"d\": {\"heartbeat_interval\": 4295008546}}"), "heartbeat_interval");
        assertFormatError(parser.parse("{\"op\": 10, \"d\": {\"heartbeat_interval\": 41250.5}}"), "heartbeat_interval");
        assertFormatError(parser.parse("{\"op\": 10, \"d\": 41250}"), "heartbeat_interval");
    }

    @Test
    void parseHeartbeatRequest() {
        ParseResult result = parser.parse("{\"op\": 1, \"d\": null}").orElseThrow();

        assertInstanceOf(GatewayEvent.HeartbeatRequest.class, result.event());
    }

    @Test
    void parseHeartbeatAck() {
        ParseResult result = parser.parse("{\"op\": 11}").orElseThrow();

        assertInstanceOf(GatewayEvent.HeartbeatAck.class, result.event());
    }

    @Test
    void parseReconnect() {
        ParseResult result = parser.parse("{\"op\": 7}").orElseThrow();

        assertInstanceOf(GatewayEvent.Reconnect.class, result.event());
    }

    @Test
    void parseInvalidSession() {
        ParseResult resumable = parser.parse("{\"op\": 9, \"d\": true}").orElseThrow();
        ParseResult fresh = parser.parse("{\"op\": 9, \"d\": false}").orElseThrow();

        assertTrue(assertInstanceOf(GatewayEvent.InvalidSession.class, resumable.event()).resumable());
        assertFalse(assertInstanceOf(GatewayEvent.InvalidSession.class, fresh.event()).resumable());
    }

    @Test
    void invalidSessionRequiresBoolean() {
        assertFormatError(parser.parse("{\"op\": 9, \"d\": \"x\"}"), "d");
        assertFormatError(parser.parse("{\"op\": 9, \"d\": 1}"), "d");
        assertFormatError(parser.parse("{\"op\": 9}"), "d");
    }

    @Test
    void dispatchWithoutTypeIsFormatError() {
        assertFormatError(parser.parse("{\"op\": 0, \"s\": 3, \"d\": {}}"), "t");
    }

    @Test
    void dispatchWithoutPayloadIsFormatError() {
        assertFormatError(parser.parse("{\"op\": 0, \"s\": 3, \"t\": \"RESUMED\"}"), "d");
    }

    @Test
    void unknownOpcodeIsRejectedWhateverThePayload() {
        for (String json : new String[]{
            "{\"op\": 2}",
            "{\"op\": 3, \"d\": {\"status\": \"online\"}}",
            "{\"op\": 8, \"d\": true}",
            "{\"op\": 12, \"d\": [1, 2]}",
            "{\"op\": -1, \"d\": \"x\"}",
            "{\"op\": 4000, \"t\": \"READY\", \"d\": {}}"}) {
            DecodeResult.Failure<?> failure = assertInstanceOf(DecodeResult.Failure.class, parser.parse(json), json);
            assertInstanceOf(DecodeError.UnexpectedOpcode.class, failure.error(), json);
        }
    }

    @Test
    void unexpectedOpcodeCarriesOpcode() {
        DecodeResult.Failure<?> failure = assertInstanceOf(DecodeResult.Failure.class, parser.parse("{\"op\": 42}"));

        assertEquals(new DecodeError.UnexpectedOpcode(42), failure.error());
        assertEquals("Unexpected opcode: 42", failure.error().message());
    }

    @Test
    void parseDispatchWithSequence() {
        String json = """
            {"op": 0, "t": "RESUMED", "s": 42, "d": {"_trace": ["gateway-prd-main-abcd"]}}
            """;

        ParseResult result = parser.parse(json).orElseThrow();

        assertEquals(42, result.sequence());
        GatewayEvent.Dispatch dispatch = assertInstanceOf(GatewayEvent.Dispatch.class, result.event());
        assertInstanceOf(DispatchEvent.Resumed.class, dispatch.event());
    }

    @Test
    void unknownDispatchTypeCarriesTag() {
        String json = """
            {"op": 0, "t": "SOME_FUTURE_EVENT", "s": 42, "d": {}}
            """;

        DecodeResult.Failure<?> failure = assertInstanceOf(DecodeResult.Failure.class, parser.parse(json));

        DecodeError.UnrecognizedDispatchType error = assertInstanceOf(DecodeError.UnrecognizedDispatchType.class, failure.error());
        assertEquals("SOME_FUTURE_EVENT", error.tag());
    }

    @Test
    void parseReady() {
        String json = """
            {
                "op": 0,
                "t": "READY",
                "s": 1,
                "d": {
                    "v": 10,
                    "user": {"id": "1", "username": "herald", "discriminator": "0", "bot": true},
                    "guilds": [{"id": "100", "unavailable": true}],
                    "session_id": "abc123",
                    "resume_gateway_url": "wss://resume.discord.gg",
                    "shard": [0, 1],
                    "application": {"id": "1", "flags": 0}
                }
            }
            """;

        ParseResult result = parser.parse(json).orElseThrow();

        assertEquals(1, result.sequence());
        GatewayEvent.Dispatch dispatch = assertInstanceOf(GatewayEvent.Dispatch.class, result.event());
        ReadyData ready = assertInstanceOf(DispatchEvent.Ready.class, dispatch.event()).data();
        assertEquals(10, ready.v());
        assertEquals("abc123", ready.sessionId());
        assertEquals("wss://resume.discord.gg", ready.resumeGatewayUrl());
        assertEquals("herald", ready.user().username());
        assertEquals(1, ready.guilds().size());
        assertTrue(ready.guilds().get(0).outage());
        assertEquals(java.util.List.of(0, 1), ready.shard());
    }

    @Test
    void parseMessageCreate() {
        String json = "{\"op\": 0, \"t\": \"MESSAGE_CREATE\", \"s\": 5, \"d\": " + MINIMAL_MESSAGE + "}";

        ParseResult result = parser.parse(json).orElseThrow();

        GatewayEvent.Dispatch dispatch = assertInstanceOf(GatewayEvent.Dispatch.class, result.event());
        Message message = assertInstanceOf(DispatchEvent.MessageCreate.class, dispatch.event()).message();
        assertEquals("334385199974967042", message.id());
        assertEquals("290926798999357250", message.channelId());
        assertEquals("53908099506183680", message.author().id());
        assertEquals("Mason", message.author().username());
        assertEquals("Supa Hot", message.content());
        assertEquals("2017-07-11T17:27:07.299000+00:00", message.timestamp());
        assertFalse(message.tts());
        assertFalse(message.mentionEveryone());
        assertFalse(message.pinned());
        assertTrue(message.embeds().isEmpty());
        assertTrue(message.reactions().isEmpty());
        assertTrue(message.mentionChannels().isEmpty());
        assertNull(message.guildId());
        assertNull(message.editedTimestamp());
        assertTrue(message.kind().isEmpty());
    }

    @Test
    void decodingIsRepeatable() {
        String json = "{\"op\": 0, \"t\": \"MESSAGE_CREATE\", \"s\": 5, \"d\": " + MINIMAL_MESSAGE + "}";

        ParseResult first = parser.parse(json).orElseThrow();
        ParseResult second = new GatewayEventParser().parse(json).orElseThrow();

        assertEquals(first, second);
        assertNotSame(first.event(), second.event());
    }

    @Test
    void orElseThrowCarriesError() {
        GatewayDecodeException ex = assertThrows(GatewayDecodeException.class,
            () -> parser.parse("{\"op\": 0, \"t\": \"NOPE\", \"d\": {}}").orElseThrow());

        assertEquals(new DecodeError.UnrecognizedDispatchType("NOPE"), ex.error());
        assertTrue(ex.getMessage().contains("NOPE"));
    }

    static void assertFormatError(DecodeResult<?> result, String field) {
        DecodeResult.Failure<?> failure = assertInstanceOf(DecodeResult.Failure.class, result);
        DecodeError.FormatError error = assertInstanceOf(DecodeError.FormatError.class, failure.error());
        assertEquals(field, error.field());
    }
}
