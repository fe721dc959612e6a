package com.questrail.keycode.api;

/**
 * Internal invariant violation: a payload needs more digits than the fixed
 * width of its message type. Never expected with a consistent registry.
 */
public final class EncodingOverflowException extends KeycodeException
{
    public EncodingOverflowException(String message) {
        super(message);
    }
}
