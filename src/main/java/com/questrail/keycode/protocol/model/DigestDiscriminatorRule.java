package com.questrail.keycode.protocol.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The low {@code bits} bits of the truncated digest select between
 * interpretations sharing one wire slot.
 *
 * <p>For each rival interpretation the reserved pattern is the low {@code bits}
 * bits of the digest the rival would carry for the same identifier, body and
 * key. An encoding whose own discriminator equals any reserved pattern is
 * ambiguous.</p>
 */
public record DigestDiscriminatorRule(int bits, Set<MessageType> rivals) implements CollisionRule
{
    public DigestDiscriminatorRule {
        Objects.requireNonNull(rivals, "rivals");
        if (bits <= 0 || bits > 16) {
            throw new IllegalArgumentException("bits must be in range 1-16");
        }
        if (rivals.isEmpty()) {
            throw new IllegalArgumentException("rivals must not be empty");
        }
        rivals = Set.copyOf(EnumSet.copyOf(rivals));
    }

    public long mask() {
        return (1L << bits) - 1;
    }
}
