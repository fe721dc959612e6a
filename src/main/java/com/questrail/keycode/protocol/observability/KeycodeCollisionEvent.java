package com.questrail.keycode.protocol.observability;

import com.questrail.keycode.protocol.model.MessageType;

import java.time.Instant;

/**
 * Record describing an identifier rejected because its encoding was ambiguous.
 *
 * @param nextId identifier to retry with, or {@link #NO_NEXT_ID} once the
 *               identifier space is exhausted
 */
public record KeycodeCollisionEvent(
    Instant timestamp,
    MessageType type,
    long offendingId,
    long nextId
) {
    public static final long NO_NEXT_ID = -1;
}
