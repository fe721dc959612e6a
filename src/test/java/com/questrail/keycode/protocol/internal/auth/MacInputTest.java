package com.questrail.keycode.protocol.internal.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MacInputTest
{
    @Test
    void fieldsAreLittleEndian()
    {
        byte[] bytes = MacInput.create()
                .u32le(15)
                .u8(9)
                .u16le(0x0102)
                .bytes(new byte[] { (byte) 0xAA })
                .toByteArray();

        assertArrayEquals(new byte[] { 15, 0, 0, 0, 9, 0x02, 0x01, (byte) 0xAA }, bytes);
    }

    @Test
    void valuesMustFitTheirWidth()
    {
        assertThrows(IllegalArgumentException.class, () -> MacInput.create().u8(256));
        assertThrows(IllegalArgumentException.class, () -> MacInput.create().u16le(-1));
        assertThrows(IllegalArgumentException.class, () -> MacInput.create().u32le(0x1_0000_0000L));
    }
}
