package com.questrail.keycode.protocol.runtime;

import com.questrail.keycode.protocol.model.Keycode;

import java.util.Objects;

/**
 * A keycode together with the identifier it was finally issued under.
 *
 * @param keycode  the rendered keycode
 * @param id       identifier the keycode consumes; the caller's next identifier is {@code id + 1}
 * @param attempts number of encode attempts it took
 */
public record IssuedKeycode(Keycode keycode, long id, int attempts) {
    public IssuedKeycode {
        Objects.requireNonNull(keycode, "keycode");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
    }
}
