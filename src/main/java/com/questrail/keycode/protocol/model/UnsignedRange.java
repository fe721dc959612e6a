package com.questrail.keycode.protocol.model;

/**
 * Contiguous range {@code [min, max]} of non-negative values, written unchanged.
 */
public record UnsignedRange(long min, long max) implements FieldDomain
{
    public UnsignedRange {
        if (min < 0) {
            throw new IllegalArgumentException("min must be non-negative");
        }
        if (max < min) {
            throw new IllegalArgumentException("max must be >= min");
        }
    }

    /**
     * Every value representable in {@code width} bits.
     */
    public static UnsignedRange ofWidth(int width) {
        if (width <= 0 || width > 62) {
            throw new IllegalArgumentException("width must be in range 1-62");
        }
        return new UnsignedRange(0, (1L << width) - 1);
    }

    @Override
    public boolean contains(long value) {
        return value >= min && value <= max;
    }

    @Override
    public long toEncoded(long value) {
        return value;
    }

    @Override
    public long maxEncoded() {
        return max;
    }

    @Override
    public String describe() {
        return "expected " + min + "-" + max;
    }
}
