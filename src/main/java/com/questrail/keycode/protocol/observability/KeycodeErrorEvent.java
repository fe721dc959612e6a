package com.questrail.keycode.protocol.observability;

import com.questrail.keycode.protocol.model.MessageType;

import java.time.Instant;

/**
 * Record representing a failed encode.
 */
public record KeycodeErrorEvent(
    Instant timestamp,
    MessageType type,
    String message,
    Throwable cause
) {
}
