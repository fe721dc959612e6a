package com.questrail.keycode.api;

/**
 * The chosen identifier makes the encoded message ambiguous with a different
 * interpretation of the same keycode.
 *
 * <p>This is the one failure a caller is expected to recover from: encode the
 * same command again with {@link #nextId()}. A retry is likely, but not
 * guaranteed, to succeed, so callers should bound their retries.</p>
 *
 * <p>Identifiers are unsigned 32-bit counters. A collision at
 * {@link #MAX_ID} has no successor: {@link #hasNextId()} is false and the
 * device's identifier space is exhausted.</p>
 */
public final class IdCollisionException extends Exception
{
    /** Largest identifier a keycode can carry. */
    public static final long MAX_ID = 0xFFFF_FFFFL;

    private final String messageType;
    private final long offendingId;

    public IdCollisionException(String messageType, long offendingId, String reason) {
        super(messageType + " with id " + offendingId + " is ambiguous (" + reason + "); "
                + (offendingId < MAX_ID
                        ? "retry with id " + (offendingId + 1)
                        : "identifier space exhausted"));
        this.messageType = messageType;
        this.offendingId = offendingId;
    }

    public String messageType() {
        return messageType;
    }

    public long offendingId() {
        return offendingId;
    }

    /**
     * False when the collision happened at {@link #MAX_ID}.
     */
    public boolean hasNextId() {
        return offendingId < MAX_ID;
    }

    /**
     * The identifier the caller should retry with ({@code offendingId + 1}).
     *
     * @throws IllegalStateException if the identifier space is exhausted
     */
    public long nextId() {
        if (!hasNextId()) {
            throw new IllegalStateException("no identifier after " + MAX_ID);
        }
        return offendingId + 1;
    }
}
