package com.questrail.keycode.protocol.model;

import java.util.Objects;

/**
 * A body bound to its identifier and key.
 *
 * @param body        the plain body
 * @param digest      truncated digest bits (empty for types without a core digest)
 * @param transmitted bits handed to the formatter: the body (obscured where the
 *                    definition asks for it) followed by the digest
 */
public record AuthenticatedPayload(Body body, BitString digest, BitString transmitted) {
    public AuthenticatedPayload {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(transmitted, "transmitted");
        if (transmitted.length() != body.bits().length() + digest.length()) {
            throw new IllegalArgumentException("transmitted bits must be body plus digest");
        }
    }

    public MessageType type() {
        return body.type();
    }
}
