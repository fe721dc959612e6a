package com.questrail.keycode.protocol.model;

/**
 * Set of values a {@link FieldKind#VALUE} field accepts, and how an accepted
 * value maps onto the bits written to the body.
 */
public sealed interface FieldDomain permits UnsignedRange, EnumeratedValues, CreditIncrementTable
{
    /**
     * True if {@code value} is a member of this domain.
     */
    boolean contains(long value);

    /**
     * Maps a member of the domain onto the value written into the body.
     * Only called with values for which {@link #contains(long)} is true.
     */
    long toEncoded(long value);

    /**
     * Largest value {@link #toEncoded(long)} can produce.
     */
    long maxEncoded();

    /**
     * Human-readable description used in range errors.
     */
    String describe();
}
