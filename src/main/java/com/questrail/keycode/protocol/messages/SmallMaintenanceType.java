package com.questrail.keycode.protocol.messages;

/**
 * Small keypad maintenance commands. The body sets its top bit to mark a
 * maintenance (rather than test) command.
 */
public enum SmallMaintenanceType
{
    WIPE_STATE_0(0),
    WIPE_STATE_1(1),
    WIPE_IDS_ALL(2);

    private static final int MAINTENANCE_BIT = 0x80;

    private final int value;

    SmallMaintenanceType(int value) {
        this.value = value;
    }

    public int bodyValue() {
        return MAINTENANCE_BIT | value;
    }
}
