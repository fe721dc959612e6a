package com.questrail.keycode.protocol.codec.impl;

import com.questrail.keycode.api.KeypadFamily;
import com.questrail.keycode.api.SchemaMismatchException;
import com.questrail.keycode.api.SecretKey;
import com.questrail.keycode.protocol.KeycodeEncoder;
import com.questrail.keycode.protocol.codec.KeycodeFormatter;
import com.questrail.keycode.protocol.messages.FullMessages;
import com.questrail.keycode.protocol.messages.SmallMessages;
import com.questrail.keycode.protocol.model.AuthenticatedPayload;
import com.questrail.keycode.protocol.model.BitString;
import com.questrail.keycode.protocol.model.Body;
import com.questrail.keycode.protocol.model.Keycode;
import com.questrail.keycode.protocol.model.MessageType;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultKeycodeFormatterTest
{
    private final KeycodeFormatter formatter = new DefaultKeycodeFormatter();

    @Test
    void allZeroFullPayload()
    {
        Keycode k = formatter.format(payload(MessageType.FULL_ADD_CREDIT, 26, BigInteger.ZERO, 20),
                KeypadFamily.FULL_KEYPAD);

        assertEquals("*000 000 000 000 000 0#", k.text());
        assertEquals(16, k.digits().length());
    }

    @Test
    void largestFullPayloadStillFits()
    {
        BigInteger max = BigInteger.ONE.shiftLeft(46).subtract(BigInteger.ONE);

        Keycode k = formatter.format(payload(MessageType.FULL_SET_CREDIT, 26, max, 20), KeypadFamily.FULL_KEYPAD);

        // 2^46 - 1 = 70368744177663; data digits 70368744 | c1 | 177663 | c2
        String digits = k.digits();
        assertEquals(16, digits.length());
        assertEquals("70368744", digits.substring(0, 8));
        assertEquals("177663", digits.substring(9, 15));
        assertEquals('8', digits.charAt(8));
        assertEquals('3', digits.charAt(15));
    }

    @Test
    void allZeroSmallPayloadIsAllOnes()
    {
        Keycode k = formatter.format(payload(MessageType.SMALL_ADD_CREDIT, 16, BigInteger.ZERO, 12),
                KeypadFamily.SMALL_KEYPAD);

        assertEquals("111111111111111", k.text());
        assertEquals(k.text(), k.digits());
    }

    @Test
    void factoryCodesAreNineDigits()
    {
        Keycode k = formatter.format(payload(MessageType.FULL_FACTORY_ALLOW_TEST, 3, BigInteger.valueOf(4), 20),
                KeypadFamily.FULL_KEYPAD);

        assertEquals(9, k.digits().length());
        assertTrue(k.text().startsWith("*") && k.text().endsWith("#"));
    }

    @Test
    void keypadMustMatchTheType()
    {
        AuthenticatedPayload p = payload(MessageType.SMALL_ADD_CREDIT, 16, BigInteger.ONE, 12);

        assertThrows(SchemaMismatchException.class, () -> formatter.format(p, KeypadFamily.FULL_KEYPAD));
    }

    @Test
    void nestedTypesCannotBeRendered()
    {
        AuthenticatedPayload p = payload(MessageType.CHANNEL_ORIGIN_GENERIC_ACTION, 48, BigInteger.ONE, 0);

        assertThrows(SchemaMismatchException.class, () -> formatter.format(p, KeypadFamily.FULL_KEYPAD));
    }

    @Test
    void formattingIsDeterministic()
    {
        AuthenticatedPayload p = payload(MessageType.FULL_ADD_CREDIT, 26, BigInteger.valueOf(987_654_321L), 20);

        assertEquals(formatter.format(p, KeypadFamily.FULL_KEYPAD), formatter.format(p, KeypadFamily.FULL_KEYPAD));
    }

    @Test
    void renderedCodesDetectEveryAdjacentSwap() throws Exception
    {
        KeycodeEncoder encoder = new KeycodeEncoder();
        SecretKey key = SecretKey.filled((byte) 0x6B);

        for (long id = 0; id < 300; id++) {
            for (Keycode k : new Keycode[] {
                    encoder.encode(FullMessages.addCredit(id, 24, key)),
                    encoder.encode(FullMessages.unlock(id, key)),
                    encoder.encode(SmallMessages.addCredit(id, 7, key)) }) {
                int[] digits = values(k);
                int base = k.keypad().base();
                assertTrue(PositionalChecksum.verify(digits, base), k.text());

                for (int pos = 0; pos + 1 < digits.length; pos++) {
                    if (digits[pos] == digits[pos + 1]) {
                        continue;
                    }
                    int[] swapped = digits.clone();
                    swapped[pos] = digits[pos + 1];
                    swapped[pos + 1] = digits[pos];
                    assertFalse(PositionalChecksum.verify(swapped, base), k.text() + " swap at " + pos);
                }
            }
        }
    }

    private static int[] values(Keycode k)
    {
        String digits = k.digits();
        char zero = k.keypad().symbol(0);
        int[] out = new int[digits.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = digits.charAt(i) - zero;
        }
        return out;
    }

    private static AuthenticatedPayload payload(MessageType type, int bodyBits, BigInteger value, int digestBits)
    {
        BitString transmitted = BitString.of(value, bodyBits + digestBits);
        BitString body = transmitted.slice(0, bodyBits);
        BitString digest = transmitted.slice(bodyBits, bodyBits + digestBits);
        return new AuthenticatedPayload(new Body(type, 0, body), digest, transmitted);
    }
}
