package com.questrail.keycode.protocol.registry;

import com.questrail.keycode.api.KeypadFamily;
import com.questrail.keycode.protocol.model.CreditIncrementTable;
import com.questrail.keycode.protocol.model.DigestDiscriminatorRule;
import com.questrail.keycode.protocol.model.EnumeratedValues;
import com.questrail.keycode.protocol.model.FieldSpec;
import com.questrail.keycode.protocol.model.IdPolicy;
import com.questrail.keycode.protocol.model.KeyPolicy;
import com.questrail.keycode.protocol.model.MessageType;
import com.questrail.keycode.protocol.model.ProtocolDefinition;
import com.questrail.keycode.protocol.model.ProtocolFamily;
import com.questrail.keycode.protocol.model.ReservedBodyRule;
import com.questrail.keycode.protocol.model.UnsignedRange;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * ProtocolRegistry
 * -----------------------------------------------------------------------------
 * Static table of every {@link MessageType}'s {@link ProtocolDefinition}.
 *
 * <p>Adding a message type means adding an entry here; the field encoder,
 * authentication engine and formatter read definitions and never switch on the
 * type. Entries are checked when the class loads and an inconsistent table
 * refuses to load.</p>
 *
 * <h2>Layouts</h2>
 * <pre>
 *   Full     opcode(3) | id(6) | body(17) | digest(20)          14 + 2 digits, base 10
 *   Factory  opcode(3) | digest(20)                               7 + 2 digits, base 10
 *   Full PT  opcode(3) | id(6) | payload(48) | digest(20)        24 + 2 digits, base 10
 *   Small    id(6) | slot(2) | body(8) | digest(12)              13 + 2 digits, base 5
 *   Small PT payloadHigh(6) | slot(2) | payloadLow(20)           13 + 2 digits, base 5
 *   Extended app(1) | ext(3) | id(2) | slot(2) | incr(8) | digest(12)
 * </pre>
 */
public final class ProtocolRegistry
{
    public static final int FULL_ID_WIDTH = 6;
    public static final int FULL_DIGEST_WIDTH = 20;
    public static final int FULL_PASSTHROUGH_PAYLOAD_WIDTH = 48;
    public static final long FULL_MAX_HOURS = 99_999;

    public static final int SMALL_ID_WIDTH = 6;
    public static final int SMALL_DIGEST_WIDTH = 12;
    public static final int SMALL_PASSTHROUGH_PAYLOAD_WIDTH = 26;
    public static final int SMALL_PASSTHROUGH_LOW_WIDTH = 20;

    public static final String PASSTHROUGH_PAYLOAD = "payload";
    public static final String PASSTHROUGH_PAYLOAD_HIGH = "payloadHigh";
    public static final String PASSTHROUGH_PAYLOAD_LOW = "payloadLow";

    static final int DISCRIMINATOR_BITS = 4;

    private static final EnumeratedValues RAW_INCREMENTS = EnumeratedValues.rangeAnd(
            0, 239, CreditIncrementTable.LOCK_INCREMENT, CreditIncrementTable.UNLOCK_INCREMENT);
    private static final UnsignedRange SIX_DIGIT_AUTH = new UnsignedRange(0, 999_999);

    private static final Map<MessageType, ProtocolDefinition> DEFINITIONS = load();

    private ProtocolRegistry() {}

    /**
     * Returns the definition of {@code type}. Total over {@link MessageType}.
     */
    public static ProtocolDefinition definition(MessageType type) {
        return DEFINITIONS.get(type);
    }

    public static Collection<ProtocolDefinition> definitions() {
        return Collections.unmodifiableCollection(DEFINITIONS.values());
    }

    /**
     * Smallest number of base-{@code base} digits able to represent every
     * {@code bits}-bit unsigned value.
     */
    public static int minimumDigits(int bits, int base) {
        BigInteger limit = BigInteger.ONE.shiftLeft(bits);
        BigInteger b = BigInteger.valueOf(base);
        BigInteger capacity = BigInteger.ONE;
        int digits = 0;
        while (capacity.compareTo(limit) < 0) {
            capacity = capacity.multiply(b);
            digits++;
        }
        return digits;
    }

    // -------------------------------------------------------------------------
    // Catalog
    // -------------------------------------------------------------------------

    private static Map<MessageType, ProtocolDefinition> load() {
        Map<MessageType, ProtocolDefinition> m = new EnumMap<>(MessageType.class);

        // Full keypad
        put(m, full(MessageType.FULL_ADD_CREDIT, 0)
                .withField(FieldSpec.value("hours", 17, new UnsignedRange(0, FULL_MAX_HOURS)))
                .build());
        put(m, full(MessageType.FULL_SET_CREDIT, 1)
                .withField(FieldSpec.value("hours", 17, new UnsignedRange(0, FULL_MAX_HOURS)))
                .build());
        put(m, full(MessageType.FULL_UNLOCK, 1)
                .withField(FieldSpec.constant("hours", 17, FULL_MAX_HOURS))
                .build());
        put(m, full(MessageType.FULL_WIPE_STATE, 2)
                .withField(FieldSpec.value("flags", 2, EnumeratedValues.of(0, 1, 2)))
                .withField(FieldSpec.constant("reserved", 15, 0))
                .build());
        put(m, factory(MessageType.FULL_FACTORY_ALLOW_TEST, 4));
        put(m, factory(MessageType.FULL_FACTORY_OQC_TEST, 5));
        put(m, factory(MessageType.FULL_FACTORY_DISPLAY_PAYG_ID, 6));
        put(m, ProtocolDefinition.builder(MessageType.FULL_PASSTHROUGH)
                .withOpcode(7)
                .withField(FieldSpec.opcode(3))
                .withField(FieldSpec.messageId(FULL_ID_WIDTH))
                .withField(FieldSpec.payload(PASSTHROUGH_PAYLOAD, FULL_PASSTHROUGH_PAYLOAD_WIDTH))
                .withDigest(FULL_DIGEST_WIDTH)
                .withDataDigits(24)
                .obscured()
                .build());

        // Small keypad, slot 0
        put(m, small(MessageType.SMALL_ADD_CREDIT, 0)
                .withField(FieldSpec.value("days", 8, CreditIncrementTable.ADD))
                .build());
        put(m, small(MessageType.SMALL_UNLOCK, 0)
                .withField(FieldSpec.constant("increment", 8, CreditIncrementTable.UNLOCK_INCREMENT))
                .build());

        // Small keypad, slot 2
        put(m, small(MessageType.SMALL_UPDATE_CREDIT, 2)
                .withField(FieldSpec.value("increment", 8, RAW_INCREMENTS))
                .withCollisionRule(new ReservedBodyRule("increment", 0, 63))
                .build());
        put(m, small(MessageType.SMALL_SET_CREDIT, 2)
                .withField(FieldSpec.value("days", 8, CreditIncrementTable.SET))
                .withCollisionRule(new ReservedBodyRule("days", 0, 63))
                .build());
        put(m, small(MessageType.SMALL_SET_UNLOCK, 2)
                .withField(FieldSpec.constant("increment", 8, CreditIncrementTable.UNLOCK_INCREMENT))
                .build());
        put(m, small(MessageType.SMALL_CUSTOM_COMMAND, 2)
                .withAuthTag(0x12)
                .withField(FieldSpec.value("command", 8, EnumeratedValues.of(240)))
                .withCollisionRule(new DigestDiscriminatorRule(DISCRIMINATOR_BITS,
                        Set.of(MessageType.SMALL_SET_CREDIT)))
                .build());

        // Small keypad, slot 3
        put(m, small(MessageType.SMALL_MAINTENANCE, 3)
                .withIdPolicy(IdPolicy.NONE)
                .withField(FieldSpec.value("command", 8, EnumeratedValues.of(0x80, 0x81, 0x82)))
                .build());
        put(m, small(MessageType.SMALL_TEST, 3)
                .withIdPolicy(IdPolicy.NONE)
                .withKeyPolicy(KeyPolicy.FACTORY_ONES)
                .withField(FieldSpec.value("command", 8, EnumeratedValues.of(0, 1)))
                .build());

        // Small keypad, slot 1
        put(m, ProtocolDefinition.builder(MessageType.SMALL_PASSTHROUGH)
                .withOpcode(1)
                .withField(FieldSpec.payload(PASSTHROUGH_PAYLOAD_HIGH,
                        SMALL_PASSTHROUGH_PAYLOAD_WIDTH - SMALL_PASSTHROUGH_LOW_WIDTH))
                .withField(FieldSpec.opcode(2))
                .withField(FieldSpec.payload(PASSTHROUGH_PAYLOAD_LOW, SMALL_PASSTHROUGH_LOW_WIDTH))
                .withDataDigits(13)
                .withIdPolicy(IdPolicy.NONE)
                .withKeyPolicy(KeyPolicy.UNKEYED)
                .build());
        put(m, ProtocolDefinition.builder(MessageType.SMALL_EXTENDED_SET_CREDIT_WIPE_FLAG)
                .withOpcode(1)
                .withAuthTag(0x40)
                .withField(FieldSpec.constant("appId", 1, 1))
                .withField(FieldSpec.constant("extendedType", 3, 0))
                .withField(FieldSpec.messageId(2))
                .withField(FieldSpec.opcode(2))
                .withField(FieldSpec.value("increment", 8, RAW_INCREMENTS))
                .withDigest(SMALL_DIGEST_WIDTH)
                .withDataDigits(13)
                .withCollisionRule(new DigestDiscriminatorRule(DISCRIMINATOR_BITS,
                        Set.of(MessageType.CHANNEL_ORIGIN_SMALL_WIPE_FLAG)))
                .build());

        // Channel origin (nested only)
        put(m, nested(MessageType.CHANNEL_ORIGIN_GENERIC_ACTION, 0)
                .withField(FieldSpec.value("action", 7, EnumeratedValues.of(0, 1)))
                .withField(FieldSpec.value("controllerAuth", 20, SIX_DIGIT_AUTH))
                .withField(FieldSpec.constant("reserved", 17, 0))
                .build());
        put(m, nested(MessageType.CHANNEL_ORIGIN_UNLOCK_ACCESSORY, 1)
                .withField(FieldSpec.value("truncatedAccessoryId", 4, new UnsignedRange(0, 9)))
                .withField(FieldSpec.value("controllerAuth", 20, SIX_DIGIT_AUTH))
                .withField(FieldSpec.constant("reserved", 20, 0))
                .build());
        put(m, nested(MessageType.CHANNEL_ORIGIN_UNLINK_ACCESSORY, 2)
                .withField(FieldSpec.value("truncatedAccessoryId", 4, new UnsignedRange(0, 9)))
                .withField(FieldSpec.value("controllerAuth", 20, SIX_DIGIT_AUTH))
                .withField(FieldSpec.constant("reserved", 20, 0))
                .build());
        put(m, nested(MessageType.CHANNEL_ORIGIN_LINK_ACCESSORY_MODE_3, 9)
                .withField(FieldSpec.value("truncatedAccessoryId", 4, new UnsignedRange(0, 9)))
                .withField(FieldSpec.value("challengeResult", 20, SIX_DIGIT_AUTH))
                .withField(FieldSpec.value("controllerAuth", 20, SIX_DIGIT_AUTH))
                .build());
        put(m, ProtocolDefinition.builder(MessageType.CHANNEL_ORIGIN_SMALL_WIPE_FLAG)
                .withOpcode(0)
                .withAuthTag(6)
                .withField(FieldSpec.constant("appId", 1, 1))
                .withField(FieldSpec.opcode(3))
                .withField(FieldSpec.constant("actionType", 2, 3))
                .withField(FieldSpec.value("increment", 8, RAW_INCREMENTS))
                .withField(FieldSpec.value("controllerAuth", 12, UnsignedRange.ofWidth(12)))
                .withIdPolicy(IdPolicy.NONE)
                .withKeyPolicy(KeyPolicy.UNKEYED)
                .build());

        validate(m);
        return Collections.unmodifiableMap(m);
    }

    private static ProtocolDefinition.Builder full(MessageType type, int opcode) {
        return ProtocolDefinition.builder(type)
                .withOpcode(opcode)
                .withField(FieldSpec.opcode(3))
                .withField(FieldSpec.messageId(FULL_ID_WIDTH))
                .withDigest(FULL_DIGEST_WIDTH)
                .withDataDigits(14)
                .obscured();
    }

    private static ProtocolDefinition factory(MessageType type, int opcode) {
        return ProtocolDefinition.builder(type)
                .withOpcode(opcode)
                .withField(FieldSpec.opcode(3))
                .withDigest(FULL_DIGEST_WIDTH)
                .withDataDigits(7)
                .withIdPolicy(IdPolicy.NONE)
                .withKeyPolicy(KeyPolicy.FACTORY_ZEROS)
                .build();
    }

    private static ProtocolDefinition.Builder small(MessageType type, int slot) {
        return ProtocolDefinition.builder(type)
                .withOpcode(slot)
                .withField(FieldSpec.messageId(SMALL_ID_WIDTH))
                .withField(FieldSpec.opcode(2))
                .withDigest(SMALL_DIGEST_WIDTH)
                .withDataDigits(13)
                .obscured();
    }

    private static ProtocolDefinition.Builder nested(MessageType type, int originCommand) {
        return ProtocolDefinition.builder(type)
                .withOpcode(originCommand)
                .withField(FieldSpec.opcode(4))
                .withIdPolicy(IdPolicy.NONE)
                .withKeyPolicy(KeyPolicy.UNKEYED);
    }

    private static void put(Map<MessageType, ProtocolDefinition> m, ProtocolDefinition d) {
        if (m.putIfAbsent(d.type(), d) != null) {
            throw new IllegalStateException("duplicate definition for " + d.type());
        }
    }

    // -------------------------------------------------------------------------
    // Load-time checks
    // -------------------------------------------------------------------------

    static void validate(Map<MessageType, ProtocolDefinition> m) {
        for (MessageType type : MessageType.values()) {
            ProtocolDefinition d = m.get(type);
            if (d == null) {
                throw new IllegalStateException("no definition for " + type);
            }

            var keypad = type.family().keypad();
            if (keypad.isPresent()) {
                int required = minimumDigits(d.payloadWidth(), keypad.get().base());
                if (d.dataDigits() != required) {
                    throw new IllegalStateException(type + ": " + d.payloadWidth() + " bits need "
                            + required + " base-" + keypad.get().base() + " digits, definition declares "
                            + d.dataDigits());
                }
            } else if (d.dataDigits() != 0 || d.digestWidth() != 0) {
                throw new IllegalStateException(type + ": nested-only types carry no digits or digest");
            }

            if (d.idPolicy() == IdPolicy.SEQUENCED && d.idWidth() == 0) {
                throw new IllegalStateException(type + ": sequenced types must transmit an id field");
            }
        }

        int fullPayload = m.get(MessageType.FULL_PASSTHROUGH).field(PASSTHROUGH_PAYLOAD).orElseThrow().width();
        for (ProtocolDefinition d : m.values()) {
            if (d.family() == ProtocolFamily.CHANNEL_ORIGIN
                    && d.bodyWidth() != fullPayload
                    && d.bodyWidth() != SMALL_PASSTHROUGH_PAYLOAD_WIDTH) {
                throw new IllegalStateException(d.type() + ": nested body of " + d.bodyWidth()
                        + " bits fits no passthrough host");
            }
        }
    }

    /**
     * Keypad a type renders on, for types that have one.
     */
    public static KeypadFamily keypadOf(MessageType type) {
        return type.family().keypad().orElseThrow(() ->
                new IllegalArgumentException(type + " is carried only inside a passthrough message"));
    }
}
