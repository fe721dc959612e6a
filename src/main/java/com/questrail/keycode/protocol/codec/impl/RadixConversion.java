package com.questrail.keycode.protocol.codec.impl;

import com.questrail.keycode.api.EncodingOverflowException;

import java.math.BigInteger;
import java.util.Objects;

/**
 * RadixConversion
 * -----------------------------------------------------------------------------
 * Converts an unsigned integer into a fixed number of digits in a small base,
 * most-significant digit first, zero-padded on the left.
 */
final class RadixConversion
{
    private RadixConversion() {}

    /**
     * @throws EncodingOverflowException if {@code value} needs more than {@code width} digits
     */
    static int[] toDigits(BigInteger value, int base, int width)
    {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative");
        }
        if (base < 2) {
            throw new IllegalArgumentException("base must be at least 2");
        }

        final BigInteger b = BigInteger.valueOf(base);
        final int[] digits = new int[width];
        BigInteger rest = value;
        for (int i = width - 1; i >= 0; i--) {
            BigInteger[] qr = rest.divideAndRemainder(b);
            digits[i] = qr[1].intValue();
            rest = qr[0];
        }

        if (rest.signum() != 0) {
            // Do not render the value itself; it may carry digest bits.
            throw new EncodingOverflowException(
                    "payload of " + value.bitLength() + " bits does not fit " + width + " base-" + base + " digits");
        }
        return digits;
    }

    static BigInteger fromDigits(int[] digits, int base)
    {
        final BigInteger b = BigInteger.valueOf(base);
        BigInteger v = BigInteger.ZERO;
        for (int d : digits) {
            if (d < 0 || d >= base) {
                throw new IllegalArgumentException("digit " + d + " is not a base-" + base + " digit");
            }
            v = v.multiply(b).add(BigInteger.valueOf(d));
        }
        return v;
    }
}
