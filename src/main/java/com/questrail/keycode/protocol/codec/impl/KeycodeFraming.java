package com.questrail.keycode.protocol.codec.impl;

import com.questrail.keycode.api.KeypadFamily;

/**
 * KeycodeFraming
 * -----------------------------------------------------------------------------
 * Keypad-specific rendering of a digit sequence.
 *
 * <ul>
 *   <li>Full keypad: {@code *} + groups of three digits joined by single
 *       spaces + {@code #}. Grouping is cosmetic; the decoder ignores it.</li>
 *   <li>Small keypad: digit values {@code 0-4} typed as keys {@code 1-5}, one
 *       unbroken run. The fixed length is what frames the code.</li>
 * </ul>
 */
final class KeycodeFraming
{
    static final char START = '*';
    static final char END = '#';
    static final int GROUP = 3;

    private KeycodeFraming() {}

    static String frame(int[] digits, KeypadFamily keypad)
    {
        if (keypad == KeypadFamily.FULL_KEYPAD) {
            StringBuilder sb = new StringBuilder(digits.length + digits.length / GROUP + 2);
            sb.append(START);
            for (int i = 0; i < digits.length; i++) {
                if (i > 0 && i % GROUP == 0) {
                    sb.append(' ');
                }
                sb.append(keypad.symbol(digits[i]));
            }
            sb.append(END);
            return sb.toString();
        }

        StringBuilder sb = new StringBuilder(digits.length);
        for (int d : digits) {
            sb.append(keypad.symbol(d));
        }
        return sb.toString();
    }
}
