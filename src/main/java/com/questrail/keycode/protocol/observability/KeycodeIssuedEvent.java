package com.questrail.keycode.protocol.observability;

import com.questrail.keycode.api.KeypadFamily;
import com.questrail.keycode.protocol.model.MessageType;

import java.time.Instant;

/**
 * Record describing a successfully issued keycode.
 */
public record KeycodeIssuedEvent(
    Instant timestamp,
    MessageType type,
    KeypadFamily keypad,
    long id,
    int digitCount
) {
}
