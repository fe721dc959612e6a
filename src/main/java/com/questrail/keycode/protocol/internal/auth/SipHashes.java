package com.questrail.keycode.protocol.internal.auth;

import com.questrail.keycode.api.SecretKey;
import org.bouncycastle.crypto.macs.SipHash;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * SipHashes
 * -----------------------------------------------------------------------------
 * SipHash-2-4 keyed digest, as used by every authenticated keycode.
 *
 * <p>Parameters:</p>
 * <ul>
 *   <li>Compression rounds: 2</li>
 *   <li>Finalization rounds: 4</li>
 *   <li>Key: 16 bytes</li>
 *   <li>Output: 64 bits; {@link #toLittleEndian(long)} gives the byte order of
 *       the reference implementation</li>
 * </ul>
 */
public final class SipHashes
{
    private static final byte[] ZERO_KEY = new byte[SecretKey.LENGTH];

    private SipHashes() {}

    public static long hash(SecretKey key, byte[] data)
    {
        return hash(key.bytes(), data);
    }

    /**
     * SipHash-2-4 under the public all-zero key.
     */
    public static long hashUnkeyed(byte[] data)
    {
        return hash(ZERO_KEY, data);
    }

    static long hash(byte[] key, byte[] data)
    {
        SipHash mac = new SipHash(2, 4);
        mac.init(new KeyParameter(key));
        mac.update(data, 0, data.length);
        return mac.doFinal();
    }

    /**
     * The most-significant {@code width} bits of a 64-bit digest.
     */
    public static long truncate(long digest, int width)
    {
        if (width <= 0 || width > 64) {
            throw new IllegalArgumentException("width must be in range 1-64");
        }
        return width == 64 ? digest : digest >>> (64 - width);
    }

    public static byte[] toLittleEndian(long value)
    {
        byte[] out = new byte[8];
        for (int i = 0; i < 8; i++) {
            out[i] = (byte) (value >>> (8 * i));
        }
        return out;
    }
}
