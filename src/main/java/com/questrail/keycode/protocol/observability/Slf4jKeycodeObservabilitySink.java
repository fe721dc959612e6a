package com.questrail.keycode.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of KeycodeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jKeycodeObservabilitySink implements KeycodeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jKeycodeObservabilitySink.class);

    @Override
    public void onKeycodeIssued(KeycodeIssuedEvent event) {
        log.info("Keycode issued: type={} keypad={} id={} digits={}",
            event.type(),
            event.keypad(),
            event.id(),
            event.digitCount());
    }

    @Override
    public void onCollision(KeycodeCollisionEvent event) {
        log.warn("Keycode id collision: type={} id={} next={}",
            event.type(),
            event.offendingId(),
            event.nextId());
    }

    @Override
    public void onError(KeycodeErrorEvent event) {
        log.error("Keycode encode failed: type={} {}", event.type(), event.message(), event.cause());
    }
}
