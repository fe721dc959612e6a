package com.questrail.keycode.protocol.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * BitString
 * -----------------------------------------------------------------------------
 * Immutable, fixed-length sequence of bits, most-significant bit first.
 *
 * <p>Leading zero bits are significant: {@code 0b0011} as a 4-bit string is
 * distinct from {@code 0b11} as a 2-bit string. Bit {@code 0} is the first
 * (most-significant) bit.</p>
 */
public final class BitString
{
    private static final BitString EMPTY = new BitString(BigInteger.ZERO, 0);

    private final BigInteger value;
    private final int length;

    private BitString(BigInteger value, int length) {
        this.value = value;
        this.length = length;
    }

    public static BitString empty() {
        return EMPTY;
    }

    /**
     * Creates a bit string holding the low {@code length} bits of {@code value}.
     *
     * @throws IllegalArgumentException if {@code value} is negative or needs more
     *                                  than {@code length} bits
     */
    public static BitString of(long value, int length) {
        return of(BigInteger.valueOf(value), length);
    }

    public static BitString of(BigInteger value, int length) {
        Objects.requireNonNull(value, "value");
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative");
        }
        if (value.bitLength() > length) {
            throw new IllegalArgumentException(
                    "value needs " + value.bitLength() + " bits, only " + length + " available");
        }
        return length == 0 ? EMPTY : new BitString(value, length);
    }

    /**
     * Parses a string of {@code '0'} and {@code '1'} characters.
     */
    public static BitString parse(String bits) {
        Objects.requireNonNull(bits, "bits");
        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("not a bit character at index " + i + ": '" + c + "'");
            }
        }
        return bits.isEmpty() ? EMPTY : new BitString(new BigInteger(bits, 2), bits.length());
    }

    /**
     * Interprets {@code bytes} as a big-endian bit sequence of {@code 8 * bytes.length} bits.
     */
    public static BitString fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return of(new BigInteger(1, bytes), bytes.length * 8);
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * Returns the bit at {@code index} (0 = most significant).
     */
    public boolean bit(int index) {
        Objects.checkIndex(index, length);
        return value.testBit(length - 1 - index);
    }

    public BitString append(BitString other) {
        Objects.requireNonNull(other, "other");
        if (other.length == 0) {
            return this;
        }
        return new BitString(value.shiftLeft(other.length).or(other.value), length + other.length);
    }

    /**
     * Returns bits {@code [from, to)}.
     */
    public BitString slice(int from, int to) {
        Objects.checkFromToIndex(from, to, length);
        int width = to - from;
        BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
        return of(value.shiftRight(length - to).and(mask), width);
    }

    /**
     * Bitwise exclusive-or with a bit string of the same length.
     */
    public BitString xor(BitString other) {
        Objects.requireNonNull(other, "other");
        if (other.length != length) {
            throw new IllegalArgumentException(
                    "length mismatch: " + length + " vs " + other.length);
        }
        return of(value.xor(other.value), length);
    }

    public BigInteger toBigInteger() {
        return value;
    }

    /**
     * Returns the value as a {@code long}; only valid for strings of at most 63 bits.
     */
    public long toLong() {
        if (length > 63) {
            throw new ArithmeticException("bit string of " + length + " bits does not fit a long");
        }
        return value.longValue();
    }

    /**
     * Returns the bits left-padded with zeros to a whole number of bytes, big-endian.
     */
    public byte[] toByteArray() {
        int byteCount = (length + 7) / 8;
        byte[] out = new byte[byteCount];
        byte[] raw = value.toByteArray();
        // BigInteger may prepend a sign byte or omit leading zero bytes
        int copy = Math.min(raw.length, byteCount);
        System.arraycopy(raw, raw.length - copy, out, byteCount - copy, copy);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BitString that)) return false;
        return length == that.length && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * value.hashCode() + length;
    }

    @Override
    public String toString() {
        if (length == 0) {
            return "";
        }
        String digits = value.toString(2);
        return "0".repeat(length - digits.length()) + digits;
    }
}
