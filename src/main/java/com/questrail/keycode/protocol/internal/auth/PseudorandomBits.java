package com.questrail.keycode.protocol.internal.auth;

import com.questrail.keycode.protocol.model.BitString;

import java.util.Objects;

/**
 * Deterministic bit stream used to obscure message bodies.
 *
 * <p>Chunk {@code i} is {@code SipHash-2-4(zeroKey, [i] || seedBytes)}, emitted
 * as 8 little-endian bytes; chunks are concatenated and cut to the requested
 * length. Seed bits are left-padded with zeros to a whole byte.</p>
 */
public final class PseudorandomBits
{
    private static final int MAX_CHUNKS = 256;

    private PseudorandomBits() {}

    public static BitString generate(BitString seed, int length)
    {
        Objects.requireNonNull(seed, "seed");
        if (length < 0 || length > MAX_CHUNKS * 64) {
            throw new IllegalArgumentException("length must be in range 0-" + (MAX_CHUNKS * 64));
        }

        final byte[] seedBytes = seed.toByteArray();
        final byte[] input = new byte[seedBytes.length + 1];
        System.arraycopy(seedBytes, 0, input, 1, seedBytes.length);

        BitString out = BitString.empty();
        for (int i = 0; out.length() < length; i++) {
            input[0] = (byte) i;
            out = out.append(BitString.fromBytes(SipHashes.toLittleEndian(SipHashes.hashUnkeyed(input))));
        }
        return out.slice(0, length);
    }

    /**
     * XORs {@code bits} with the stream seeded by {@code seed}. Applying it
     * twice with the same seed restores the input.
     */
    public static BitString obscure(BitString bits, BitString seed)
    {
        return bits.xor(generate(seed, bits.length()));
    }
}
