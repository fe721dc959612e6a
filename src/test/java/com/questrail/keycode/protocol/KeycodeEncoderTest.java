package com.questrail.keycode.protocol;

import com.questrail.keycode.api.FieldRangeException;
import com.questrail.keycode.api.IdCollisionException;
import com.questrail.keycode.api.KeypadFamily;
import com.questrail.keycode.api.SchemaMismatchException;
import com.questrail.keycode.api.SecretKey;
import com.questrail.keycode.protocol.config.KeycodeEncoderConfig;
import com.questrail.keycode.protocol.messages.FullMessages;
import com.questrail.keycode.protocol.messages.SmallMaintenanceType;
import com.questrail.keycode.protocol.messages.SmallMessages;
import com.questrail.keycode.protocol.model.Keycode;
import com.questrail.keycode.protocol.model.Message;
import com.questrail.keycode.protocol.model.MessageType;
import com.questrail.keycode.protocol.observability.KeycodeCollisionEvent;
import com.questrail.keycode.protocol.observability.KeycodeErrorEvent;
import com.questrail.keycode.protocol.observability.KeycodeIssuedEvent;
import com.questrail.keycode.protocol.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class KeycodeEncoderTest
{
    private static final SecretKey KEY = SecretKey.fromHex("deadbeefdeadbeefdeadbeefdeadbeef");
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final KeycodeEncoder encoder = new KeycodeEncoder(KeycodeEncoderConfig.builder()
            .withObservabilitySink(sink)
            .withClock(Clock.fixed(NOW, ZoneOffset.UTC))
            .build());

    // -------------------------------------------------------------------------
    // Full keypad
    // -------------------------------------------------------------------------

    @Test
    void fullUnlockIsDeterministic() throws Exception
    {
        Keycode first = encoder.encode(FullMessages.unlock(44, KEY));
        Keycode second = encoder.encode(FullMessages.unlock(44, KEY));

        assertEquals(first, second);
        assertEquals(KeypadFamily.FULL_KEYPAD, first.keypad());
        assertEquals(16, first.digits().length());
        assertTrue(first.text().matches("\\*\\d{3}( \\d{3})*( \\d{1,2})?#"), first.text());
    }

    @Test
    void identifierAndKeyChangeTheKeycode() throws Exception
    {
        Keycode base = encoder.encode(FullMessages.addCredit(10, 24, KEY));

        assertNotEquals(base, encoder.encode(FullMessages.addCredit(11, 24, KEY)));
        assertNotEquals(base, encoder.encode(FullMessages.addCredit(10, 24, SecretKey.filled((byte) 1))));
        assertNotEquals(base, encoder.encode(FullMessages.addCredit(10, 25, KEY)));
    }

    @Test
    void fullHoursAreRangeChecked() throws Exception
    {
        assertEquals(16, encoder.encode(FullMessages.setCredit(3, 99_999, KEY)).digits().length());

        FieldRangeException e = assertThrows(FieldRangeException.class,
                () -> encoder.encode(FullMessages.setCredit(3, 100_000, KEY)));
        assertEquals("hours", e.field());
        assertFalse(e.getMessage().toLowerCase().contains("deadbeef"));
        assertTrue(sink.hasEventOfType(KeycodeErrorEvent.class));
    }

    @Test
    void factoryCodesAreShort() throws Exception
    {
        Keycode k = encoder.encode(FullMessages.factoryAllowTest());

        assertEquals(9, k.digits().length());
    }

    // -------------------------------------------------------------------------
    // Small keypad
    // -------------------------------------------------------------------------

    @Test
    void smallCodesUseOnlyKeypadSymbols() throws Exception
    {
        Keycode add = encoder.encode(SmallMessages.addCredit(7, 30, KEY));
        Keycode wipe = encoder.encode(SmallMessages.maintenance(SmallMaintenanceType.WIPE_STATE_0, KEY));

        for (Keycode k : new Keycode[] {add, wipe}) {
            assertEquals(KeypadFamily.SMALL_KEYPAD, k.keypad());
            assertEquals(15, k.text().length());
            assertTrue(k.text().chars().allMatch(c -> c >= '1' && c <= '5'), k.text());
        }
    }

    @Test
    void smallDaysAreRangeChecked()
    {
        assertThrows(FieldRangeException.class, () -> encoder.encode(SmallMessages.addCredit(1, 406, KEY)));
        assertThrows(FieldRangeException.class, () -> encoder.encode(SmallMessages.addCredit(1, 0, KEY)));
    }

    @Test
    void schemaMismatchIsReported()
    {
        Message extra = new Message(MessageType.SMALL_UNLOCK, Map.of("days", 1L), 1, KEY);

        assertThrows(SchemaMismatchException.class, () -> encoder.encode(extra));
    }

    // -------------------------------------------------------------------------
    // Collisions
    // -------------------------------------------------------------------------

    @Test
    void reservedBodyCollisionSuggestsNextId() throws Exception
    {
        IdCollisionException e = assertThrows(IdCollisionException.class,
                () -> encoder.encode(SmallMessages.setCredit(63, 1, KEY)));

        assertEquals(63, e.offendingId());
        assertEquals(64, e.nextId());

        KeycodeCollisionEvent event = sink.getCollisions().get(0);
        assertEquals(NOW, event.timestamp());
        assertEquals(64, event.nextId());

        assertEquals(15, encoder.encode(SmallMessages.setCredit(e.nextId(), 1, KEY)).text().length());
    }

    @Test
    void collisionAtLastIdentifierReportsNoNextId()
    {
        IdCollisionException e = assertThrows(IdCollisionException.class,
                () -> encoder.encode(SmallMessages.setCredit(IdCollisionException.MAX_ID, 1, KEY)));

        assertFalse(e.hasNextId());
        assertEquals(KeycodeCollisionEvent.NO_NEXT_ID, sink.getCollisions().get(0).nextId());
    }

    @Test
    void extendedCodeCollisionIsResolvedByNextId() throws Exception
    {
        int collisions = 0;
        boolean resolved = false;

        for (long id = 0; id < 400 && !resolved; id++) {
            try {
                encoder.encode(SmallMessages.setCreditWipeRestrictedFlag(id, 30, KEY));
            } catch (IdCollisionException e) {
                collisions++;
                assertEquals(id + 1, e.nextId());
                try {
                    Keycode k = encoder.encode(SmallMessages.setCreditWipeRestrictedFlag(e.nextId(), 30, KEY));
                    assertEquals(15, k.text().length());
                    assertTrue(k.text().chars().allMatch(c -> c >= '1' && c <= '5'));
                    resolved = true;
                } catch (IdCollisionException again) {
                    // consecutive collisions; keep searching
                }
            }
        }

        assertTrue(collisions > 0);
        assertTrue(resolved);
    }

    // -------------------------------------------------------------------------
    // Observability
    // -------------------------------------------------------------------------

    @Test
    void issuedEventCarriesNoKeyMaterial() throws Exception
    {
        encoder.encode(FullMessages.addCredit(2, 48, KEY));

        KeycodeIssuedEvent event = (KeycodeIssuedEvent) sink.getAllEvents().get(0);
        assertEquals(NOW, event.timestamp());
        assertEquals(MessageType.FULL_ADD_CREDIT, event.type());
        assertEquals(2, event.id());
        assertEquals(16, event.digitCount());
        assertFalse(event.toString().toLowerCase().contains("deadbeef"));
    }
}
