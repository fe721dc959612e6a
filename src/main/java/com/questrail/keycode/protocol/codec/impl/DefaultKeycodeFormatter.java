package com.questrail.keycode.protocol.codec.impl;

import com.questrail.keycode.api.KeypadFamily;
import com.questrail.keycode.api.SchemaMismatchException;
import com.questrail.keycode.protocol.codec.KeycodeFormatter;
import com.questrail.keycode.protocol.model.AuthenticatedPayload;
import com.questrail.keycode.protocol.model.Keycode;
import com.questrail.keycode.protocol.model.MessageType;
import com.questrail.keycode.protocol.model.ProtocolDefinition;
import com.questrail.keycode.protocol.registry.ProtocolRegistry;

import java.util.Objects;

/**
 * DefaultKeycodeFormatter
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link KeycodeFormatter}.
 *
 * <p>Digit counts come from the type's {@link ProtocolDefinition}; the
 * formatter itself holds no per-type knowledge.</p>
 */
public final class DefaultKeycodeFormatter implements KeycodeFormatter
{
    @Override
    public Keycode format(AuthenticatedPayload payload, KeypadFamily keypad)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(keypad, "keypad");

        final MessageType type = payload.type();
        final ProtocolDefinition def = ProtocolRegistry.definition(type);

        final KeypadFamily expected = type.family().keypad().orElseThrow(() ->
                new SchemaMismatchException(type + " is carried only inside a passthrough message"));
        if (expected != keypad) {
            throw new SchemaMismatchException(type + " renders on " + expected + ", not " + keypad);
        }

        // ---------------------------------------------------------------------
        // 1) Radix conversion, MSB first, fixed width
        // ---------------------------------------------------------------------

        final int[] data = RadixConversion.toDigits(
                payload.transmitted().toBigInteger(), keypad.base(), def.dataDigits());

        // ---------------------------------------------------------------------
        // 2) Check digits
        // ---------------------------------------------------------------------

        final int[] digits = PositionalChecksum.interleave(data, keypad.base());

        // ---------------------------------------------------------------------
        // 3) Framing
        // ---------------------------------------------------------------------

        return new Keycode(type, keypad, KeycodeFraming.frame(digits, keypad));
    }
}
