package com.questrail.keycode.protocol.model;

import java.util.Objects;

/**
 * Packed message body: the concatenated field bits of one message, before
 * authentication. Its length equals the definition's body width.
 */
public record Body(MessageType type, long id, BitString bits) {
    public Body {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(bits, "bits");
    }
}
