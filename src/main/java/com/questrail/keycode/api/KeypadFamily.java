package com.questrail.keycode.api;

/**
 * Keypad a rendered keycode is typed on.
 *
 * <p>The keypad fixes the digit alphabet (and therefore the radix of the
 * conversion) and whether the rendered code is framed with delimiters.</p>
 */
public enum KeypadFamily
{
    /** Numeric keypad: base 10, digits {@code 0}-{@code 9}, {@code *...#} framing. */
    FULL_KEYPAD(10, '0'),

    /** Five-button keypad: base 5 mapped onto digits {@code 1}-{@code 5}, no framing. */
    SMALL_KEYPAD(5, '1');

    private final int base;
    private final char firstSymbol;

    KeypadFamily(int base, char firstSymbol) {
        this.base = base;
        this.firstSymbol = firstSymbol;
    }

    public int base() {
        return base;
    }

    /**
     * Returns the keypad character for a digit value in {@code [0, base)}.
     */
    public char symbol(int digit) {
        if (digit < 0 || digit >= base) {
            throw new IllegalArgumentException(
                    "digit must be in range 0-" + (base - 1) + " (was " + digit + ")");
        }
        return (char) (firstSymbol + digit);
    }

    /**
     * Returns true if {@code c} is a digit of this keypad's alphabet.
     */
    public boolean isSymbol(char c) {
        return c >= firstSymbol && c < firstSymbol + base;
    }
}
