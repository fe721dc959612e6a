package com.questrail.keycode.protocol.observability;

/**
 * Main interface for receiving keycode encoder observability events.
 * Implementations can provide logging, metrics, or auditing.
 *
 * <p>Events never carry key material or the rendered keycode. Implementations
 * must be thread-safe; the encoder may be called from many threads.</p>
 */
public interface KeycodeObservabilitySink {
    /**
     * Called after a keycode has been produced.
     * @param event the issued keycode's type, identifier and length
     */
    void onKeycodeIssued(KeycodeIssuedEvent event);

    /**
     * Called when an identifier was rejected as ambiguous.
     * @param event the offending and suggested identifiers
     */
    void onCollision(KeycodeCollisionEvent event);

    /**
     * Called when encoding failed for any other reason.
     * @param event the error event
     */
    void onError(KeycodeErrorEvent event);
}
