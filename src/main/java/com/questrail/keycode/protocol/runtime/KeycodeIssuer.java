package com.questrail.keycode.protocol.runtime;

import com.questrail.keycode.api.IdCollisionException;
import com.questrail.keycode.protocol.KeycodeEncoder;
import com.questrail.keycode.protocol.config.CollisionRetryPolicy;
import com.questrail.keycode.protocol.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Caller-side issuing helper.
 *
 * - Encodes a message, moving to the suggested identifier after each collision
 * - Gives up after {@link CollisionRetryPolicy#maxAttempts()} attempts
 * - Gives up at once when a collision hits the last identifier
 * - Does not persist identifiers; the caller records {@link IssuedKeycode#id()}
 */
public final class KeycodeIssuer {

    private static final Logger log = LoggerFactory.getLogger(KeycodeIssuer.class);

    private final KeycodeEncoder encoder;
    private final CollisionRetryPolicy retryPolicy;

    public KeycodeIssuer(KeycodeEncoder encoder) {
        this(encoder, encoder.config().retryPolicy());
    }

    public KeycodeIssuer(KeycodeEncoder encoder, CollisionRetryPolicy retryPolicy) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    /**
     * Encodes {@code message}, starting at its own identifier.
     *
     * @throws IdCollisionException the last collision, once the policy's attempts are used up
     */
    public IssuedKeycode issue(Message message) throws IdCollisionException {
        Objects.requireNonNull(message, "message");

        Message attempt = message;
        for (int i = 1; ; i++) {
            try {
                return new IssuedKeycode(encoder.encode(attempt), attempt.id(), i);
            } catch (IdCollisionException e) {
                if (!e.hasNextId()) {
                    log.warn("Giving up on {}: collision at id {} and no identifiers remain",
                        message.type(), e.offendingId());
                    throw e;
                }
                if (i >= retryPolicy.maxAttempts()) {
                    log.warn("Giving up on {} after {} attempts (ids {}-{})",
                        message.type(), i, message.id(), e.offendingId());
                    throw e;
                }
                log.debug("{} id {} collided, retrying with {}", message.type(), e.offendingId(), e.nextId());
                attempt = attempt.withId(e.nextId());
            }
        }
    }
}
