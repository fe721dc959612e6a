package com.questrail.keycode.protocol.passthrough;

import com.questrail.keycode.api.SecretKey;
import com.questrail.keycode.protocol.internal.auth.SipHashes;

import java.util.Objects;

/**
 * Derives the key protecting a device's UART passthrough channel from its
 * keycode secret key.
 *
 * <pre>
 *   uartKey = LE(SipHash-2-4(zeroKey, key[0..8))) || LE(SipHash-2-4(zeroKey, key[8..16)))
 * </pre>
 */
public final class UartSecurityKeys
{
    private UartSecurityKeys() {}

    public static SecretKey derive(SecretKey secretKey)
    {
        Objects.requireNonNull(secretKey, "secretKey");

        byte[] a = SipHashes.toLittleEndian(SipHashes.hashUnkeyed(secretKey.half(0)));
        byte[] b = SipHashes.toLittleEndian(SipHashes.hashUnkeyed(secretKey.half(1)));

        byte[] derived = new byte[SecretKey.LENGTH];
        System.arraycopy(a, 0, derived, 0, a.length);
        System.arraycopy(b, 0, derived, a.length, b.length);
        return SecretKey.of(derived);
    }
}
