package com.questrail.keycode.protocol.messages;

/**
 * Small keypad factory test commands.
 */
public enum SmallTestType
{
    SHORT_TEST(0),
    OQC_TEST(1);

    private final int value;

    SmallTestType(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
