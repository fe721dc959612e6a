package com.questrail.keycode.protocol.passthrough;

/**
 * Generic actions a channel origin can ask of a controller.
 *
 * <p>The numeric codes are mixed into the controller's authentication and
 * must never be renumbered.</p>
 */
public enum ControllerAction
{
    UNLINK_ALL_ACCESSORIES(0),
    UNLOCK_ALL_ACCESSORIES(1),
    /** Small keypad bearer only; see {@link ChannelOriginCommands#setCreditWipeRestrictedFlag}. */
    SET_CREDIT_WIPE_RESTRICTED_FLAG(6);

    private final int code;

    ControllerAction(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
