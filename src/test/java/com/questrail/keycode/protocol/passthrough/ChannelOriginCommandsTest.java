package com.questrail.keycode.protocol.passthrough;

import com.questrail.keycode.api.FieldRangeException;
import com.questrail.keycode.api.SecretKey;
import com.questrail.keycode.protocol.internal.auth.MacInput;
import com.questrail.keycode.protocol.internal.auth.SipHashes;
import com.questrail.keycode.protocol.internal.encode.FieldEncoder;
import com.questrail.keycode.protocol.model.Body;
import com.questrail.keycode.protocol.model.MessageType;
import com.questrail.keycode.protocol.registry.ProtocolRegistry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChannelOriginCommandsTest
 * -----------------------------------------------------------------------------
 * Authentication values are checked against vectors produced by the reference
 * controller firmware test suite.
 */
final class ChannelOriginCommandsTest
{
    private static final SecretKey CONTROLLER_KEY = halves((byte) 0xFE, (byte) 0xA2);
    private static final SecretKey ACCESSORY_KEY = halves((byte) 0xFA, (byte) 0x01);

    private final ChannelOriginCommands commands = new ChannelOriginCommands(new FieldEncoder());

    // -------------------------------------------------------------------------
    // Generic controller actions
    // -------------------------------------------------------------------------

    @Test
    void unlinkAllAccessories()
    {
        Body body = commands.unlinkAllAccessories(15, CONTROLLER_KEY);

        assertEquals(MessageType.CHANNEL_ORIGIN_GENERIC_ACTION, body.type());
        assertEquals(0, field(body, "opcode"));
        assertEquals(0, field(body, "action"));
        assertEquals(18783, field(body, "controllerAuth"));
        assertEquals(48, body.bits().length());
    }

    @Test
    void unlockAllAccessories()
    {
        Body body = commands.unlockAllAccessories(15, CONTROLLER_KEY);

        assertEquals(1, field(body, "action"));
        assertEquals(906394, field(body, "controllerAuth"));
    }

    // -------------------------------------------------------------------------
    // Specific accessory
    // -------------------------------------------------------------------------

    @Test
    void unlinkSpecificAccessory()
    {
        Body body = commands.unlinkAccessory(0x010294837158L, 15, CONTROLLER_KEY);

        assertEquals(2, field(body, "opcode"));
        assertEquals(0, field(body, "truncatedAccessoryId"));
        assertEquals(536545, field(body, "controllerAuth"));
    }

    @Test
    void unlockSpecificAccessory()
    {
        Body body = commands.unlockAccessory(0x010294837158L, 15, CONTROLLER_KEY);

        assertEquals(1, field(body, "opcode"));
        assertEquals(244210, field(body, "controllerAuth"));
    }

    @Test
    void specificAccessoryWithOtherKeyAndCount()
    {
        SecretKey key = halves((byte) 0x00, (byte) 0x17);

        Body unlink = commands.unlinkAccessory(0x120003827125L, 2000, key);
        Body unlock = commands.unlockAccessory(0x120003827125L, 2000, key);

        assertEquals(3, field(unlink, "truncatedAccessoryId"));
        assertEquals(228427, field(unlink, "controllerAuth"));
        assertEquals(46876, field(unlock, "controllerAuth"));
    }

    @Test
    void accessoryIdIsFortyEightBits()
    {
        assertThrows(FieldRangeException.class,
                () -> commands.unlockAccessory(ChannelOriginCommands.MAX_ACCESSORY_ID + 1, 1, CONTROLLER_KEY));
        assertThrows(FieldRangeException.class,
                () -> commands.unlockAccessory(1, -1, CONTROLLER_KEY));
    }

    // -------------------------------------------------------------------------
    // Link, challenge mode 3
    // -------------------------------------------------------------------------

    @Test
    void linkAccessoryMode3()
    {
        Body body = commands.linkAccessoryMode3(0x010294837158L, 15, 312, ACCESSORY_KEY, CONTROLLER_KEY);

        assertEquals(9, field(body, "opcode"));
        assertEquals(0, field(body, "truncatedAccessoryId"));
        assertEquals(445034, field(body, "challengeResult"));
        assertEquals(581275, field(body, "controllerAuth"));
    }

    @Test
    void linkAccessoryMode3WithIrregularKey()
    {
        SecretKey accessoryKey = SecretKey.fromHex("c4b84048cf0424a25dc5e9d3f0674036");

        Body body = commands.linkAccessoryMode3(0x000200003322L, 15, 2, accessoryKey, CONTROLLER_KEY);

        assertEquals(382847, field(body, "challengeResult"));
        assertEquals(429307, field(body, "controllerAuth"));
        assertEquals(382847, ChannelOriginCommands.challengeResult(2, accessoryKey));
    }

    // -------------------------------------------------------------------------
    // Small keypad bearer
    // -------------------------------------------------------------------------

    @Test
    void wipeRestrictedFlagLayout()
    {
        Body body = commands.setCreditWipeRestrictedFlag(30, 15, CONTROLLER_KEY);

        assertEquals(26, body.bits().length());
        // app id 1 | origin 000 | action 11
        assertEquals("100011", body.bits().slice(0, 6).toString());
        assertEquals(29, field(body, "increment"));

        byte[] input = MacInput.create().u32le(15).u8(0).u16le(6).u16le(29).toByteArray();
        assertEquals(SipHashes.hash(CONTROLLER_KEY, input) >>> 52, field(body, "controllerAuth"));
    }

    @Test
    void unlockWipeRestrictedFlagUsesUnlockIncrement()
    {
        Body body = commands.unlockWipeRestrictedFlag(15, CONTROLLER_KEY);

        assertEquals(255, field(body, "increment"));
    }

    @Test
    void wipeRestrictedFlagDaysAreRangeChecked()
    {
        assertThrows(FieldRangeException.class,
                () -> commands.setCreditWipeRestrictedFlag(961, 15, CONTROLLER_KEY));
    }

    private static long field(Body body, String name)
    {
        return ProtocolRegistry.definition(body.type()).fieldValue(body.bits(), name);
    }

    private static SecretKey halves(byte first, byte second)
    {
        byte[] b = new byte[16];
        Arrays.fill(b, 0, 8, first);
        Arrays.fill(b, 8, 16, second);
        return SecretKey.of(b);
    }
}
