package com.questrail.keycode.protocol.observability;

import com.questrail.keycode.api.FieldRangeException;
import com.questrail.keycode.api.KeypadFamily;
import com.questrail.keycode.protocol.model.MessageType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jKeycodeObservabilitySinkTest
{
    @Test
    void logsEveryEventKindWithoutFailing()
    {
        Slf4jKeycodeObservabilitySink sink = new Slf4jKeycodeObservabilitySink();
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        assertDoesNotThrow(() -> {
            sink.onKeycodeIssued(new KeycodeIssuedEvent(now, MessageType.FULL_UNLOCK, KeypadFamily.FULL_KEYPAD, 3, 16));
            sink.onCollision(new KeycodeCollisionEvent(now, MessageType.SMALL_SET_CREDIT, 63, 64));
            sink.onError(new KeycodeErrorEvent(now, MessageType.SMALL_ADD_CREDIT, "days out of range",
                    new FieldRangeException("days", 406, "expected 1-405 days")));
        });
    }

    @Test
    void nullSinkIgnoresEvents()
    {
        assertDoesNotThrow(() ->
                NullObservabilitySink.INSTANCE.onCollision(
                        new KeycodeCollisionEvent(Instant.EPOCH, MessageType.SMALL_SET_CREDIT, 63, 64)));
    }
}
