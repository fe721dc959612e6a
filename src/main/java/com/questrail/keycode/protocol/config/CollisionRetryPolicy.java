package com.questrail.keycode.protocol.config;

/**
 * CollisionRetryPolicy
 * -----------------------------------------------------------------------------
 * Bound on how many identifiers a caller tries before giving up on a command
 * whose encodings keep colliding.
 *
 * <p>Collisions are rare (about one identifier in sixteen for types guarded by
 * a 4-bit digest discriminator) and independent between consecutive
 * identifiers, so a handful of attempts is enough in practice. The encoder
 * itself never retries; this policy is read by
 * {@code com.questrail.keycode.protocol.runtime.KeycodeIssuer}.</p>
 *
 * @param maxAttempts total encode attempts, including the first
 */
public record CollisionRetryPolicy(int maxAttempts) {

    public static final int DEFAULT_MAX_ATTEMPTS = 8;

    /**
     * Canonical constructor with validation.
     */
    public CollisionRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    /**
     * Policy that surfaces the first collision to the caller.
     */
    public static CollisionRetryPolicy noRetry() {
        return new CollisionRetryPolicy(1);
    }

    public static CollisionRetryPolicy defaults() {
        return new CollisionRetryPolicy(DEFAULT_MAX_ATTEMPTS);
    }
}
