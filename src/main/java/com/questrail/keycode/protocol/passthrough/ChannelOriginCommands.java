package com.questrail.keycode.protocol.passthrough;

import com.questrail.keycode.api.FieldRangeException;
import com.questrail.keycode.api.SecretKey;
import com.questrail.keycode.protocol.internal.auth.MacInput;
import com.questrail.keycode.protocol.internal.auth.SipHashes;
import com.questrail.keycode.protocol.internal.encode.FieldEncoder;
import com.questrail.keycode.protocol.model.Body;
import com.questrail.keycode.protocol.model.CreditIncrementTable;
import com.questrail.keycode.protocol.model.MessageType;
import com.questrail.keycode.protocol.registry.ProtocolRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ChannelOriginCommands
 * ============================================================================
 * Builds nested commands sent from the channel origin (back end) to a
 * controller device, for carriage inside a passthrough keycode.
 *
 * <p>Each command authenticates itself with the controller's (and, for
 * linking, the accessory's) own key. The resulting {@link Body} is then opaque
 * to the host keycode, whose digest covers it like any other payload.</p>
 *
 * <h2>Commands</h2>
 * <ul>
 *   <li>Generic controller action (origin type 0): unlink or unlock all accessories</li>
 *   <li>Unlock (1) / unlink (2) one accessory, named by its truncated id</li>
 *   <li>Link accessory, challenge mode 3 (9)</li>
 *   <li>Set credit + wipe restricted flag, small keypad bearer only</li>
 * </ul>
 *
 * <p>Authentication fields are six decimal digits, the low digits of the low
 * 32 bits of a SipHash-2-4 digest, except on the small keypad bearer, which
 * carries the top 12 digest bits instead.</p>
 */
public final class ChannelOriginCommands
{
    /** Accessory ids are 48-bit: 16-bit authority id, 32-bit device id. */
    public static final long MAX_ACCESSORY_ID = 0xFFFF_FFFF_FFFFL;

    private static final long MAX_COUNT = 0xFFFF_FFFFL;
    private static final int SMALL_MAC_WIDTH = 12;

    private static final int ORIGIN_GENERIC_ACTION = 0;
    private static final int ORIGIN_UNLOCK_ACCESSORY = 1;
    private static final int ORIGIN_UNLINK_ACCESSORY = 2;
    private static final int ORIGIN_LINK_MODE_3 = 9;

    private final FieldEncoder fieldEncoder;

    public ChannelOriginCommands(FieldEncoder fieldEncoder)
    {
        this.fieldEncoder = Objects.requireNonNull(fieldEncoder, "fieldEncoder");
    }

    // -------------------------------------------------------------------------
    // Generic controller actions
    // -------------------------------------------------------------------------

    public Body unlinkAllAccessories(long controllerCount, SecretKey controllerKey)
    {
        return genericAction(ControllerAction.UNLINK_ALL_ACCESSORIES, controllerCount, controllerKey);
    }

    public Body unlockAllAccessories(long controllerCount, SecretKey controllerKey)
    {
        return genericAction(ControllerAction.UNLOCK_ALL_ACCESSORIES, controllerCount, controllerKey);
    }

    private Body genericAction(ControllerAction action, long controllerCount, SecretKey controllerKey)
    {
        long auth = controllerAuth(controllerKey, genericActionInput(controllerCount, action, 0));

        Map<String, Long> values = new LinkedHashMap<>();
        values.put("action", (long) action.code());
        values.put("controllerAuth", auth);
        return fieldEncoder.encode(MessageType.CHANNEL_ORIGIN_GENERIC_ACTION, 0, values);
    }

    /**
     * Small keypad bearer: set credit to {@code days} (via the set-credit
     * table) and wipe the restricted flag. Produces a 26-bit body for a small
     * passthrough keycode.
     */
    public Body setCreditWipeRestrictedFlag(long days, long controllerCount, SecretKey controllerKey)
    {
        if (!CreditIncrementTable.SET.contains(days)) {
            throw new FieldRangeException("days", days, CreditIncrementTable.SET.describe());
        }
        return wipeRestrictedFlag(CreditIncrementTable.SET.toEncoded(days), controllerCount, controllerKey);
    }

    /**
     * Small keypad bearer: unlock the device and wipe the restricted flag.
     */
    public Body unlockWipeRestrictedFlag(long controllerCount, SecretKey controllerKey)
    {
        return wipeRestrictedFlag(CreditIncrementTable.UNLOCK_INCREMENT, controllerCount, controllerKey);
    }

    private Body wipeRestrictedFlag(long increment, long controllerCount, SecretKey controllerKey)
    {
        byte[] input = genericActionInput(controllerCount, ControllerAction.SET_CREDIT_WIPE_RESTRICTED_FLAG, increment);
        long mac = SipHashes.truncate(SipHashes.hash(requireKey(controllerKey), input), SMALL_MAC_WIDTH);

        Map<String, Long> values = new LinkedHashMap<>();
        values.put("increment", increment);
        values.put("controllerAuth", mac);
        return fieldEncoder.encode(MessageType.CHANNEL_ORIGIN_SMALL_WIPE_FLAG, 0, values);
    }

    private static byte[] genericActionInput(long controllerCount, ControllerAction action, long actionData)
    {
        return MacInput.create()
                .u32le(checkCount("controllerCount", controllerCount))
                .u8(ORIGIN_GENERIC_ACTION)
                .u16le(action.code())
                .u16le(actionData)
                .toByteArray();
    }

    // -------------------------------------------------------------------------
    // Specific accessory
    // -------------------------------------------------------------------------

    public Body unlockAccessory(long accessoryId, long controllerCount, SecretKey controllerKey)
    {
        return specificAccessory(MessageType.CHANNEL_ORIGIN_UNLOCK_ACCESSORY, ORIGIN_UNLOCK_ACCESSORY,
                accessoryId, controllerCount, controllerKey);
    }

    public Body unlinkAccessory(long accessoryId, long controllerCount, SecretKey controllerKey)
    {
        return specificAccessory(MessageType.CHANNEL_ORIGIN_UNLINK_ACCESSORY, ORIGIN_UNLINK_ACCESSORY,
                accessoryId, controllerCount, controllerKey);
    }

    private Body specificAccessory(MessageType type,
                                   int originType,
                                   long accessoryId,
                                   long controllerCount,
                                   SecretKey controllerKey)
    {
        checkAccessoryId(accessoryId);

        // The controller expands the truncated id from its link table, so the
        // full authority and device ids are authenticated but not transmitted.
        byte[] input = MacInput.create()
                .u32le(checkCount("controllerCount", controllerCount))
                .u8(originType)
                .u16le(authorityId(accessoryId))
                .u32le(deviceId(accessoryId))
                .toByteArray();

        Map<String, Long> values = new LinkedHashMap<>();
        values.put("truncatedAccessoryId", truncatedAccessoryId(accessoryId));
        values.put("controllerAuth", controllerAuth(controllerKey, input));
        return fieldEncoder.encode(type, 0, values);
    }

    // -------------------------------------------------------------------------
    // Link accessory, challenge mode 3
    // -------------------------------------------------------------------------

    public Body linkAccessoryMode3(long accessoryId,
                                   long controllerCount,
                                   long accessoryCount,
                                   SecretKey accessoryKey,
                                   SecretKey controllerKey)
    {
        checkAccessoryId(accessoryId);

        long challenge = challengeResult(accessoryCount, accessoryKey);
        long truncated = truncatedAccessoryId(accessoryId);

        byte[] input = MacInput.create()
                .u32le(checkCount("controllerCount", controllerCount))
                .u8(ORIGIN_LINK_MODE_3)
                .u8(truncated)
                .u32le(challenge)
                .toByteArray();

        Map<String, Long> values = new LinkedHashMap<>();
        values.put("truncatedAccessoryId", truncated);
        values.put("challengeResult", challenge);
        values.put("controllerAuth", controllerAuth(controllerKey, input));
        return fieldEncoder.encode(MessageType.CHANNEL_ORIGIN_LINK_ACCESSORY_MODE_3, 0, values);
    }

    /**
     * The six-digit value the accessory checks when asked to link.
     */
    public static long challengeResult(long accessoryCount, SecretKey accessoryKey)
    {
        byte[] input = MacInput.create()
                .u32le(checkCount("accessoryCount", accessoryCount))
                .toByteArray();
        return sixDigits(SipHashes.hash(requireKey(accessoryKey), input));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    static long truncatedAccessoryId(long accessoryId)
    {
        return deviceId(accessoryId) % 10;
    }

    private static long authorityId(long accessoryId)
    {
        return (accessoryId & 0xFFFF_0000_0000L) >>> 32;
    }

    private static long deviceId(long accessoryId)
    {
        return accessoryId & 0xFFFF_FFFFL;
    }

    private static long controllerAuth(SecretKey key, byte[] input)
    {
        return sixDigits(SipHashes.hash(requireKey(key), input));
    }

    private static long sixDigits(long digest)
    {
        return (digest & 0xFFFF_FFFFL) % 1_000_000;
    }

    private static SecretKey requireKey(SecretKey key)
    {
        return Objects.requireNonNull(key, "key");
    }

    private static long checkCount(String name, long count)
    {
        if (count < 0 || count > MAX_COUNT) {
            throw new FieldRangeException(name, count, "expected 0-" + MAX_COUNT);
        }
        return count;
    }

    private static void checkAccessoryId(long accessoryId)
    {
        if (accessoryId < 0 || accessoryId > MAX_ACCESSORY_ID) {
            throw new FieldRangeException("accessoryId", accessoryId, "expected 0-" + MAX_ACCESSORY_ID);
        }
    }

    /**
     * Nested body width expected by a host of the given type.
     */
    static int hostPayloadWidth(MessageType host)
    {
        return host == MessageType.FULL_PASSTHROUGH
                ? ProtocolRegistry.FULL_PASSTHROUGH_PAYLOAD_WIDTH
                : ProtocolRegistry.SMALL_PASSTHROUGH_PAYLOAD_WIDTH;
    }
}
