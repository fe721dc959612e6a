package com.questrail.keycode.protocol.model;

import com.questrail.keycode.api.KeypadFamily;

import java.util.Optional;

/**
 * Protocol family a {@link MessageType} belongs to.
 *
 * <p>{@link #CHANNEL_ORIGIN} messages are only ever carried inside a
 * passthrough host message and have no keypad rendering of their own.</p>
 */
public enum ProtocolFamily
{
    FULL(KeypadFamily.FULL_KEYPAD),
    SMALL(KeypadFamily.SMALL_KEYPAD),
    SMALL_EXTENDED(KeypadFamily.SMALL_KEYPAD),
    CHANNEL_ORIGIN(null);

    private final KeypadFamily keypad;

    ProtocolFamily(KeypadFamily keypad) {
        this.keypad = keypad;
    }

    public Optional<KeypadFamily> keypad() {
        return Optional.ofNullable(keypad);
    }
}
