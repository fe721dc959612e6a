package com.questrail.keycode.protocol.model;

import java.util.Objects;

/**
 * A body whose field {@code field} holds {@code encodedValue} while the
 * transmitted (compressed) identifier equals {@code compressedId} is
 * indistinguishable from a legacy unauthenticated code.
 */
public record ReservedBodyRule(String field, long encodedValue, long compressedId) implements CollisionRule
{
    public ReservedBodyRule {
        Objects.requireNonNull(field, "field");
        if (encodedValue < 0 || compressedId < 0) {
            throw new IllegalArgumentException("encodedValue and compressedId must be non-negative");
        }
    }
}
