package com.questrail.keycode.protocol.codec.impl;

import java.util.Objects;

/**
 * PositionalChecksum
 * -----------------------------------------------------------------------------
 * Computes and interleaves the two check digits of a keycode.
 *
 * <p>The check digits are chosen so that the complete rendered sequence
 * {@code o_0 .. o_(m-1)}, check digits included, satisfies</p>
 *
 * <pre>
 *   sum(o_j)           = 0 mod b
 *   sum((j + 1) * o_j) = 0 mod b
 * </pre>
 *
 * <p>A substitution changes the plain sum by a non-zero amount smaller than
 * {@code b}. Swapping adjacent {@code o_j != o_(j+1)} changes the weighted sum
 * by {@code +-(o_j - o_(j+1))}, also non-zero modulo {@code b}. Both hold for
 * every position of the output, the check digits' neighbours included.</p>
 *
 * <p>{@code c2} is the last digit. {@code c1} sits at the first position
 * {@code p >= ceil(n/2)} for which {@code n + 1 - p} is invertible modulo
 * {@code b}, which makes the pair solvable for every data sequence.</p>
 */
final class PositionalChecksum
{
    static final int CHECK_DIGITS = 2;

    private PositionalChecksum() {}

    static int plainSum(int[] digits, int base)
    {
        long sum = 0;
        for (int d : digits) {
            sum += d;
        }
        return (int) (sum % base);
    }

    /**
     * {@code sum((j + 1) * o_j) mod b} over the given positions.
     */
    static int weightedSum(int[] digits, int base)
    {
        long sum = 0;
        for (int j = 0; j < digits.length; j++) {
            sum += (long) (j + 1) * digits[j];
        }
        return (int) (sum % base);
    }

    /**
     * Position of the first check digit in the interleaved sequence.
     */
    static int firstCheckPosition(int dataDigits, int base)
    {
        int p = (dataDigits + 1) / 2;
        while (inverse(dataDigits + 1 - p, base) < 0) {
            p++;
        }
        return p;
    }

    /**
     * Returns {@code data} with both check digits in place; length {@code n + 2}.
     */
    static int[] interleave(int[] data, int base)
    {
        Objects.requireNonNull(data, "data");

        final int n = data.length;
        final int p = firstCheckPosition(n, base);
        final int last = n + 1;
        final int[] out = new int[n + CHECK_DIGITS];

        System.arraycopy(data, 0, out, 0, p);
        System.arraycopy(data, p, out, p + 1, n - p);

        // Check positions are still zero, so these are the data contributions.
        final int plain = plainSum(out, base);
        final int weighted = weightedSum(out, base);

        // c1 + c2 = -plain, (p + 1) c1 + (last + 1) c2 = -weighted
        final int rhs = Math.floorMod((p + 1) * plain - weighted, base);
        final int c2 = (inverse(last - p, base) * rhs) % base;
        final int c1 = Math.floorMod(-plain - c2, base);

        out[p] = c1;
        out[last] = c2;
        return out;
    }

    /**
     * Inverse of {@link #interleave}: the data digits without check digits.
     */
    static int[] dataDigits(int[] interleaved, int base)
    {
        final int n = interleaved.length - CHECK_DIGITS;
        if (n < 0) {
            throw new IllegalArgumentException("sequence shorter than its check digits");
        }
        final int p = firstCheckPosition(n, base);
        final int[] data = new int[n];
        System.arraycopy(interleaved, 0, data, 0, p);
        System.arraycopy(interleaved, p + 1, data, p, n - p);
        return data;
    }

    /**
     * True if the interleaved sequence satisfies both check equations.
     */
    static boolean verify(int[] interleaved, int base)
    {
        if (interleaved.length < CHECK_DIGITS) {
            return false;
        }
        for (int d : interleaved) {
            if (d < 0 || d >= base) {
                return false;
            }
        }
        return plainSum(interleaved, base) == 0 && weightedSum(interleaved, base) == 0;
    }

    /**
     * Multiplicative inverse of {@code k} modulo {@code base}, or -1 if there is none.
     */
    private static int inverse(int k, int base)
    {
        final int r = Math.floorMod(k, base);
        for (int x = 1; x < base; x++) {
            if ((r * x) % base == 1) {
                return x;
            }
        }
        return -1;
    }
}
