package com.questrail.keycode.protocol.model;

/**
 * Closed set of encodable message types.
 *
 * <p>Layouts, opcodes and policies for each type live in
 * {@code com.questrail.keycode.protocol.registry.ProtocolRegistry}; this enum
 * only names the types and fixes their family.</p>
 */
public enum MessageType
{
    FULL_ADD_CREDIT(ProtocolFamily.FULL),
    FULL_SET_CREDIT(ProtocolFamily.FULL),
    FULL_UNLOCK(ProtocolFamily.FULL),
    FULL_WIPE_STATE(ProtocolFamily.FULL),
    FULL_FACTORY_ALLOW_TEST(ProtocolFamily.FULL),
    FULL_FACTORY_OQC_TEST(ProtocolFamily.FULL),
    FULL_FACTORY_DISPLAY_PAYG_ID(ProtocolFamily.FULL),
    FULL_PASSTHROUGH(ProtocolFamily.FULL),

    SMALL_ADD_CREDIT(ProtocolFamily.SMALL),
    SMALL_UNLOCK(ProtocolFamily.SMALL),
    SMALL_UPDATE_CREDIT(ProtocolFamily.SMALL),
    SMALL_SET_CREDIT(ProtocolFamily.SMALL),
    SMALL_SET_UNLOCK(ProtocolFamily.SMALL),
    SMALL_CUSTOM_COMMAND(ProtocolFamily.SMALL),
    SMALL_MAINTENANCE(ProtocolFamily.SMALL),
    SMALL_TEST(ProtocolFamily.SMALL),
    SMALL_PASSTHROUGH(ProtocolFamily.SMALL),

    SMALL_EXTENDED_SET_CREDIT_WIPE_FLAG(ProtocolFamily.SMALL_EXTENDED),

    CHANNEL_ORIGIN_GENERIC_ACTION(ProtocolFamily.CHANNEL_ORIGIN),
    CHANNEL_ORIGIN_UNLOCK_ACCESSORY(ProtocolFamily.CHANNEL_ORIGIN),
    CHANNEL_ORIGIN_UNLINK_ACCESSORY(ProtocolFamily.CHANNEL_ORIGIN),
    CHANNEL_ORIGIN_LINK_ACCESSORY_MODE_3(ProtocolFamily.CHANNEL_ORIGIN),
    CHANNEL_ORIGIN_SMALL_WIPE_FLAG(ProtocolFamily.CHANNEL_ORIGIN);

    private final ProtocolFamily family;

    MessageType(ProtocolFamily family) {
        this.family = family;
    }

    public ProtocolFamily family() {
        return family;
    }
}
