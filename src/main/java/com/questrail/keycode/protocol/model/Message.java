package com.questrail.keycode.protocol.model;

import com.questrail.keycode.api.SecretKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A command ready to be encoded: type, caller-supplied field values,
 * identifier and the key that authenticates it.
 *
 * <p>Messages are immutable and built by the factories in
 * {@code com.questrail.keycode.protocol.messages}. Field values are validated
 * when the message is encoded, not here. The key is held only for the lifetime
 * of the message and never rendered by {@link #toString()}.</p>
 */
public record Message(
        MessageType type,
        Map<String, Long> values,
        long id,
        SecretKey key
) {
    public Message {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(key, "key");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Same command with a different identifier (used when retrying after a collision).
     */
    public Message withId(long newId) {
        return new Message(type, values, newId, key);
    }
}
