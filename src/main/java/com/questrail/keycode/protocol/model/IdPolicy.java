package com.questrail.keycode.protocol.model;

/**
 * How a message type uses the message identifier.
 */
public enum IdPolicy
{
    /** Per-device sequence counter; any unsigned 32-bit value. */
    SEQUENCED,
    /** Fixed-identity codes (factory, maintenance, opaque passthrough); the identifier must be 0. */
    NONE
}
