package com.questrail.keycode.api;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Symmetric key shared between the encoder and exactly one device.
 *
 * <h2>Key length</h2>
 * <p>
 * Keyed digests in this library require exactly {@value #LENGTH} bytes. Longer
 * key material is accepted and truncated to its first {@value #LENGTH} bytes;
 * shorter material is rejected.
 * </p>
 *
 * <h2>Handling</h2>
 * <ul>
 *   <li>Key bytes are copied on the way in and on the way out</li>
 *   <li>{@link #toString()} never renders key material</li>
 *   <li>Error messages never echo key material</li>
 * </ul>
 */
public final class SecretKey
{
    public static final int LENGTH = 16;

    private static final SecretKey ZEROS = new SecretKey(new byte[LENGTH]);

    private final byte[] bytes;

    private SecretKey(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a key from raw bytes; only the first {@value #LENGTH} bytes are used.
     *
     * @throws IllegalArgumentException if fewer than {@value #LENGTH} bytes are supplied
     */
    public static SecretKey of(byte[] material) {
        Objects.requireNonNull(material, "material");
        if (material.length < LENGTH) {
            throw new IllegalArgumentException(
                    "secret key requires at least " + LENGTH + " bytes (was " + material.length + ")");
        }
        return new SecretKey(Arrays.copyOf(material, LENGTH));
    }

    /**
     * Creates a key from {@code 2 * LENGTH} hexadecimal characters.
     */
    public static SecretKey fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        if (hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException(
                    "secret key must be " + (LENGTH * 2) + " hex characters");
        }
        final byte[] parsed;
        try {
            parsed = HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            // Deliberately drop the cause; its message quotes the input.
            throw new IllegalArgumentException("secret key contains non-hexadecimal characters");
        }
        return new SecretKey(parsed);
    }

    /**
     * Key with every byte set to {@code value}.
     */
    public static SecretKey filled(byte value) {
        byte[] b = new byte[LENGTH];
        Arrays.fill(b, value);
        return new SecretKey(b);
    }

    /**
     * The all-zero key used by unauthenticated factory codes.
     */
    public static SecretKey zeros() {
        return ZEROS;
    }

    /**
     * Returns a copy of the key bytes.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * Returns the first or second half of the key (used by key derivation).
     */
    public byte[] half(int index) {
        if (index != 0 && index != 1) {
            throw new IllegalArgumentException("half index must be 0 or 1");
        }
        int from = index * (LENGTH / 2);
        return Arrays.copyOfRange(bytes, from, from + LENGTH / 2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecretKey that)) return false;
        return MessageDigest.isEqual(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "SecretKey[redacted]";
    }
}
