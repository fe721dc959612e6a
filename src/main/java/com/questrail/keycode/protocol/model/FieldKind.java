package com.questrail.keycode.protocol.model;

/**
 * Where the value of a body field comes from.
 */
public enum FieldKind
{
    /** The opcode (or type slot) of the message's definition. */
    OPCODE,
    /** The low {@code width} bits of the message identifier. */
    MESSAGE_ID,
    /** Caller-supplied value, checked against the field's domain. */
    VALUE,
    /** Fixed value owned by the definition (reserved padding, sentinels). */
    CONSTANT,
    /** Caller-supplied opaque bits (nested passthrough bodies). */
    PAYLOAD;

    /**
     * True if the caller must supply a value for fields of this kind.
     */
    public boolean callerSupplied() {
        return this == VALUE || this == PAYLOAD;
    }
}
