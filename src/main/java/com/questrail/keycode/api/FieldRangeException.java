package com.questrail.keycode.api;

/**
 * A field value (or the message identifier) lies outside its declared domain
 * or does not fit its bit width. Raised before any bit is emitted.
 */
public final class FieldRangeException extends KeycodeException
{
    private final String field;
    private final long value;

    public FieldRangeException(String field, long value, String constraint) {
        super("field '" + field + "' value " + value + " out of range: " + constraint);
        this.field = field;
        this.value = value;
    }

    public String field() {
        return field;
    }

    public long value() {
        return value;
    }
}
