package com.questrail.keycode.protocol.model;

import com.questrail.keycode.api.KeypadFamily;

import java.util.Objects;

/**
 * Rendered keycode, exactly as the user types it.
 */
public record Keycode(MessageType type, KeypadFamily keypad, String text) {
    public Keycode {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(keypad, "keypad");
        Objects.requireNonNull(text, "text");
    }

    /**
     * The keypad digits only, with framing characters and spaces removed.
     */
    public String digits() {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (keypad.isSymbol(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return text;
    }
}
