package com.questrail.keycode.protocol.messages;

import com.questrail.keycode.api.SecretKey;
import com.questrail.keycode.protocol.model.Message;
import com.questrail.keycode.protocol.model.MessageType;

import java.util.Map;
import java.util.Objects;

/**
 * Factories for full keypad messages.
 *
 * <p>Values are checked when the message is encoded. Factory codes use
 * identifier 0 and the public all-zero key, so they take no arguments.</p>
 */
public final class FullMessages
{
    private FullMessages() {}

    /**
     * Adds {@code hours} (0-99999) of credit.
     */
    public static Message addCredit(long id, long hours, SecretKey key)
    {
        return new Message(MessageType.FULL_ADD_CREDIT, Map.of("hours", hours), id, key);
    }

    /**
     * Sets remaining credit to {@code hours} (0-99999); 0 locks the device.
     */
    public static Message setCredit(long id, long hours, SecretKey key)
    {
        return new Message(MessageType.FULL_SET_CREDIT, Map.of("hours", hours), id, key);
    }

    public static Message unlock(long id, SecretKey key)
    {
        return new Message(MessageType.FULL_UNLOCK, Map.of(), id, key);
    }

    public static Message wipeState(long id, FullWipeFlag flag, SecretKey key)
    {
        Objects.requireNonNull(flag, "flag");
        return new Message(MessageType.FULL_WIPE_STATE, Map.of("flags", (long) flag.value()), id, key);
    }

    public static Message factoryAllowTest()
    {
        return factory(MessageType.FULL_FACTORY_ALLOW_TEST);
    }

    public static Message factoryOqcTest()
    {
        return factory(MessageType.FULL_FACTORY_OQC_TEST);
    }

    public static Message factoryDisplayPaygId()
    {
        return factory(MessageType.FULL_FACTORY_DISPLAY_PAYG_ID);
    }

    private static Message factory(MessageType type)
    {
        return new Message(type, Map.of(), 0, SecretKey.zeros());
    }
}
