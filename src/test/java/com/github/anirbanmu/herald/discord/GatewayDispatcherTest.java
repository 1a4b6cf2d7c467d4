package com.github.anirbanmu.herald.discord;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.herald.config.HeraldConfig;
import com.github.anirbanmu.herald.discord.json.DecodeError;
import com.github.anirbanmu.herald.discord.json.DispatchEvent;
import com.github.anirbanmu.herald.discord.json.GatewayEvent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class GatewayDispatcherTest {

    private final List<GatewayEvent> events = new ArrayList<>();
    private final List<DecodeError> errors = new ArrayList<>();

    private GatewayDispatcher dispatcher(boolean ignoreUnknown) {
        return new GatewayDispatcher(new HeraldConfig.Dispatch(ignoreUnknown), events::add, errors::add);
    }

    @Test
    void eventsReachHandlerInOrder() {
        GatewayDispatcher dispatcher = dispatcher(true);

        assertTrue(dispatcher.accept("{\"op\": 10, \"d\": {\"heartbeat_interval\": 45000}}"));
        assertTrue(dispatcher.accept("{\"op\": 0, \"s\": 1, \"t\": \"RESUMED\", \"d\": {}}"));
        assertTrue(dispatcher.accept("{\"op\": 11}"));

        assertEquals(List.of(
            new GatewayEvent.Hello(45000),
            new GatewayEvent.Dispatch(new DispatchEvent.Resumed()),
            new GatewayEvent.HeartbeatAck()), events);
        assertTrue(errors.isEmpty());
        assertEquals(1, dispatcher.lastSequence());
    }

    @Test
    void unknownDispatchSkippedWhenIgnored() {
        GatewayDispatcher dispatcher = dispatcher(true);

        assertFalse(dispatcher.accept("{\"op\": 0, \"s\": 5, \"t\": \"SOMETHING_NEW\", \"d\": {}}"));

        assertTrue(events.isEmpty());
        assertTrue(errors.isEmpty());
        assertEquals(5, dispatcher.lastSequence());
    }

    @Test
    void unknownDispatchReportedWhenNotIgnored() {
        GatewayDispatcher dispatcher = dispatcher(false);

        assertFalse(dispatcher.accept("{\"op\": 0, \"s\": 5, \"t\": \"SOMETHING_NEW\", \"d\": {}}"));

        assertEquals(List.of(new DecodeError.UnrecognizedDispatchType("SOMETHING_NEW")), errors);
        assertTrue(events.isEmpty());
    }

    @Test
    void formatErrorsAlwaysReported() {
        GatewayDispatcher dispatcher = dispatcher(true);

        assertFalse(dispatcher.accept("not json"));
        assertFalse(dispatcher.accept("{\"op\": 0, \"s\": 2, \"t\": \"MESSAGE_CREATE\", \"d\": {\"id\": \"1\"}}"));
        assertFalse(dispatcher.accept("{\"op\": 42}"));

        assertEquals(3, errors.size());
        assertInstanceOf(DecodeError.FormatError.class, errors.get(0));
        assertEquals("MESSAGE_CREATE", assertInstanceOf(DecodeError.FormatError.class, errors.get(1)).field());
        assertEquals(new DecodeError.UnexpectedOpcode(42), errors.get(2));
        assertEquals(2, dispatcher.lastSequence());
    }

    @Test
    void sequenceNeverMovesBackwards() {
        GatewayDispatcher dispatcher = dispatcher(true);
        assertEquals(-1, dispatcher.lastSequence());

        dispatcher.accept("{\"op\": 0, \"s\": 7, \"t\": \"RESUMED\", \"d\": null}");
        dispatcher.accept("{\"op\": 0, \"s\": 3, \"t\": \"RESUMED\", \"d\": {}}");
        dispatcher.accept("{\"op\": 11, \"s\": null}");

        assertEquals(7, dispatcher.lastSequence());
    }
}
