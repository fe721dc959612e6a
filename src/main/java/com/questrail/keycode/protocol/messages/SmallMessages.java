package com.questrail.keycode.protocol.messages;

import com.questrail.keycode.api.FieldRangeException;
import com.questrail.keycode.api.SecretKey;
import com.questrail.keycode.protocol.model.CreditIncrementTable;
import com.questrail.keycode.protocol.model.Message;
import com.questrail.keycode.protocol.model.MessageType;

import java.util.Map;
import java.util.Objects;

/**
 * Factories for small (five-button) keypad messages.
 *
 * <p>Credit is expressed in days and mapped onto 8-bit increment ids by
 * {@link CreditIncrementTable}; coarse bands round down.</p>
 */
public final class SmallMessages
{
    private SmallMessages() {}

    /**
     * Adds {@code days} (1-405) of credit.
     */
    public static Message addCredit(long id, long days, SecretKey key)
    {
        return new Message(MessageType.SMALL_ADD_CREDIT, Map.of("days", days), id, key);
    }

    public static Message unlock(long id, SecretKey key)
    {
        return new Message(MessageType.SMALL_UNLOCK, Map.of(), id, key);
    }

    /**
     * Sets remaining credit to {@code days} (0-960); 0 locks the device.
     */
    public static Message setCredit(long id, long days, SecretKey key)
    {
        return new Message(MessageType.SMALL_SET_CREDIT, Map.of("days", days), id, key);
    }

    /**
     * Set-credit slot carrying a raw increment id (0-239, 254 lock, 255 unlock).
     */
    public static Message updateCredit(long id, long incrementId, SecretKey key)
    {
        return new Message(MessageType.SMALL_UPDATE_CREDIT, Map.of("increment", incrementId), id, key);
    }

    public static Message setUnlock(long id, SecretKey key)
    {
        return new Message(MessageType.SMALL_SET_UNLOCK, Map.of(), id, key);
    }

    public static Message customCommand(long id, SmallCustomCommand command, SecretKey key)
    {
        Objects.requireNonNull(command, "command");
        return new Message(MessageType.SMALL_CUSTOM_COMMAND, Map.of("command", (long) command.value()), id, key);
    }

    public static Message maintenance(SmallMaintenanceType type, SecretKey key)
    {
        Objects.requireNonNull(type, "type");
        return new Message(MessageType.SMALL_MAINTENANCE, Map.of("command", (long) type.bodyValue()), 0, key);
    }

    /**
     * Factory test code; authenticated with the public all-{@code 0xFF} key.
     */
    public static Message test(SmallTestType type)
    {
        Objects.requireNonNull(type, "type");
        return new Message(MessageType.SMALL_TEST, Map.of("command", (long) type.value()),
                0, SecretKey.filled((byte) 0xFF));
    }

    /**
     * Extended code: set credit to {@code days} (0-960) and wipe the
     * restricted flag in a single keycode.
     */
    public static Message setCreditWipeRestrictedFlag(long id, long days, SecretKey key)
    {
        if (!CreditIncrementTable.SET.contains(days)) {
            throw new FieldRangeException("days", days, CreditIncrementTable.SET.describe());
        }
        return extended(id, CreditIncrementTable.SET.toEncoded(days), key);
    }

    /**
     * Extended code: unlock and wipe the restricted flag.
     */
    public static Message unlockWipeRestrictedFlag(long id, SecretKey key)
    {
        return extended(id, CreditIncrementTable.UNLOCK_INCREMENT, key);
    }

    private static Message extended(long id, long increment, SecretKey key)
    {
        return new Message(MessageType.SMALL_EXTENDED_SET_CREDIT_WIPE_FLAG,
                Map.of("increment", increment), id, key);
    }
}
