package com.questrail.keycode.api;

/**
 * Base type for failures raised while turning a message into a keycode.
 *
 * <p>Any failure means no keycode is produced at all; partial output is never
 * returned. Messages never include key material.</p>
 */
public abstract class KeycodeException extends RuntimeException
{
    protected KeycodeException(String message) {
        super(message);
    }

    protected KeycodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
