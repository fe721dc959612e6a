package com.questrail.keycode.protocol.observability;

/**
 * No-op implementation of KeycodeObservabilitySink.
 */
public final class NullObservabilitySink implements KeycodeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onKeycodeIssued(KeycodeIssuedEvent event) {}

    @Override
    public void onCollision(KeycodeCollisionEvent event) {}

    @Override
    public void onError(KeycodeErrorEvent event) {}
}
