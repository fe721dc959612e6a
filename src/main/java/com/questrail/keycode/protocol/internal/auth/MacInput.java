package com.questrail.keycode.protocol.internal.auth;

import java.io.ByteArrayOutputStream;

/**
 * Little-endian byte assembler for digest inputs.
 */
public final class MacInput
{
    private final ByteArrayOutputStream out = new ByteArrayOutputStream(16);

    public static MacInput create()
    {
        return new MacInput();
    }

    public MacInput u8(long value)
    {
        return put(value, 1, 0xFFL);
    }

    public MacInput u16le(long value)
    {
        return put(value, 2, 0xFFFFL);
    }

    public MacInput u32le(long value)
    {
        return put(value, 4, 0xFFFF_FFFFL);
    }

    public MacInput bytes(byte[] data)
    {
        out.writeBytes(data);
        return this;
    }

    public byte[] toByteArray()
    {
        return out.toByteArray();
    }

    private MacInput put(long value, int size, long max)
    {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException("value does not fit " + size + " unsigned byte(s)");
        }
        for (int i = 0; i < size; i++) {
            out.write((int) (value >>> (8 * i)) & 0xFF);
        }
        return this;
    }
}
