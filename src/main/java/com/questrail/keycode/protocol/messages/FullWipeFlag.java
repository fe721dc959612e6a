package com.questrail.keycode.protocol.messages;

/**
 * What a full keypad wipe-state code clears. Flag value 3 is reserved.
 */
public enum FullWipeFlag
{
    /** Wipe state, keeping the received-messages mask. */
    TARGET_FLAGS_0(0),
    /** Wipe state, including the received-messages mask. */
    TARGET_FLAGS_1(1),
    /** Clear the received-messages mask only. */
    WIPE_IDS_ALL(2);

    private final int value;

    FullWipeFlag(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
