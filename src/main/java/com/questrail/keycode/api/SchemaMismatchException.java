package com.questrail.keycode.api;

/**
 * The supplied field values do not match the message type's declared schema
 * (missing or unexpected fields). Indicates a programming error by the caller.
 */
public final class SchemaMismatchException extends KeycodeException
{
    public SchemaMismatchException(String message) {
        super(message);
    }
}
