package com.questrail.keycode.protocol.messages;

/**
 * Custom commands carried in the set-credit slot above the credit increments.
 */
public enum SmallCustomCommand
{
    WIPE_RESTRICTED_FLAG(240);

    private final int value;

    SmallCustomCommand(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
