package com.questrail.keycode.protocol.passthrough;

import com.questrail.keycode.api.SchemaMismatchException;
import com.questrail.keycode.api.SecretKey;
import com.questrail.keycode.protocol.model.Body;
import com.questrail.keycode.protocol.model.Message;
import com.questrail.keycode.protocol.model.MessageType;
import com.questrail.keycode.protocol.model.ProtocolFamily;
import com.questrail.keycode.protocol.registry.ProtocolRegistry;

import java.util.Map;
import java.util.Objects;

/**
 * PassthroughEncoder
 * ============================================================================
 * Wraps a nested channel-origin {@link Body} into a passthrough host
 * {@link Message}.
 *
 * <p>The nested bits become the host's payload field unchanged. The host then
 * goes through the same authentication and formatting as any other message;
 * nothing here computes a digest.</p>
 *
 * <ul>
 *   <li>{@link MessageType#FULL_PASSTHROUGH}: 48-bit payload, authenticated
 *       with the device key under the host identifier</li>
 *   <li>{@link MessageType#SMALL_PASSTHROUGH}: 26-bit payload split around
 *       the type slot; no core digest, the nested command carries its own</li>
 * </ul>
 */
public final class PassthroughEncoder
{
    /**
     * Full keypad host for a 48-bit nested command.
     */
    public Message fullHost(long id, Body nested, SecretKey deviceKey)
    {
        Objects.requireNonNull(deviceKey, "deviceKey");
        long payload = nestedPayload(nested, MessageType.FULL_PASSTHROUGH);
        return new Message(MessageType.FULL_PASSTHROUGH,
                Map.of(ProtocolRegistry.PASSTHROUGH_PAYLOAD, payload),
                id,
                deviceKey);
    }

    /**
     * Small keypad host for a 26-bit nested command.
     */
    public Message smallHost(Body nested)
    {
        long payload = nestedPayload(nested, MessageType.SMALL_PASSTHROUGH);
        long lowMask = (1L << ProtocolRegistry.SMALL_PASSTHROUGH_LOW_WIDTH) - 1;
        return new Message(MessageType.SMALL_PASSTHROUGH,
                Map.of(ProtocolRegistry.PASSTHROUGH_PAYLOAD_HIGH, payload >>> ProtocolRegistry.SMALL_PASSTHROUGH_LOW_WIDTH,
                        ProtocolRegistry.PASSTHROUGH_PAYLOAD_LOW, payload & lowMask),
                0,
                SecretKey.zeros());
    }

    private static long nestedPayload(Body nested, MessageType host)
    {
        Objects.requireNonNull(nested, "nested");
        if (nested.type().family() != ProtocolFamily.CHANNEL_ORIGIN) {
            throw new SchemaMismatchException(nested.type() + " cannot be carried by " + host);
        }
        int expected = ChannelOriginCommands.hostPayloadWidth(host);
        if (nested.bits().length() != expected) {
            throw new SchemaMismatchException(host + " carries " + expected + "-bit payloads, "
                    + nested.type() + " is " + nested.bits().length() + " bits");
        }
        return nested.bits().toLong();
    }
}
