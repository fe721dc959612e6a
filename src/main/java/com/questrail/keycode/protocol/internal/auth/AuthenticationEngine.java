package com.questrail.keycode.protocol.internal.auth;

import com.questrail.keycode.api.IdCollisionException;
import com.questrail.keycode.api.SecretKey;
import com.questrail.keycode.protocol.model.AuthenticatedPayload;
import com.questrail.keycode.protocol.model.BitString;
import com.questrail.keycode.protocol.model.Body;
import com.questrail.keycode.protocol.model.CollisionRule;
import com.questrail.keycode.protocol.model.DigestDiscriminatorRule;
import com.questrail.keycode.protocol.model.MessageType;
import com.questrail.keycode.protocol.model.ProtocolDefinition;
import com.questrail.keycode.protocol.model.ReservedBodyRule;
import com.questrail.keycode.protocol.registry.ProtocolRegistry;

import java.util.Objects;

/**
 * AuthenticationEngine
 * ============================================================================
 * Binds a {@link Body} to its identifier and key with a truncated SipHash-2-4
 * digest, and refuses to return a payload the decoder could read as a
 * different command.
 *
 * <h2>Digest</h2>
 * <pre>
 *   input  = u32le(id) || u8(authTag) || body bytes (left-padded, big-endian)
 *   digest = top digestWidth bits of SipHash-2-4(key, input)
 * </pre>
 *
 * <h2>Collision table</h2>
 * <p>Every {@link CollisionRule} of the definition is evaluated before a
 * payload is returned. A match raises {@link IdCollisionException} naming
 * {@code id + 1}; the engine never picks another identifier itself.</p>
 *
 * <h2>Obscuring</h2>
 * <p>For obscured definitions the body bits are XORed with
 * {@link PseudorandomBits} seeded by the digest. The digest is always
 * transmitted in the clear after the body.</p>
 */
public final class AuthenticationEngine
{
    public AuthenticatedPayload authenticate(long id, Body body, SecretKey key) throws IdCollisionException
    {
        Objects.requireNonNull(body, "body");

        if (id != body.id()) {
            throw new IllegalArgumentException("identifier " + id + " does not match body identifier " + body.id());
        }

        final ProtocolDefinition def = ProtocolRegistry.definition(body.type());
        if (body.bits().length() != def.bodyWidth()) {
            throw new IllegalArgumentException(body.type() + " body must be " + def.bodyWidth()
                    + " bits (was " + body.bits().length() + ")");
        }

        if (def.digestWidth() == 0) {
            // Opaque payloads carry their own authentication.
            return new AuthenticatedPayload(body, BitString.empty(), body.bits());
        }

        final SecretKey effectiveKey = resolveKey(def, key);
        final long digest = digest(def, def.authTag(), id, body.bits(), effectiveKey);

        for (CollisionRule rule : def.collisionRules()) {
            checkCollision(def, rule, id, body.bits(), digest, effectiveKey);
        }

        final BitString digestBits = BitString.of(digest, def.digestWidth());
        final BitString sent = def.obscured()
                ? PseudorandomBits.obscure(body.bits(), digestBits)
                : body.bits();

        return new AuthenticatedPayload(body, digestBits, sent.append(digestBits));
    }

    /**
     * Truncated digest of {@code bits} read as the interpretation {@code authTag}.
     */
    static long digest(ProtocolDefinition def, int authTag, long id, BitString bits, SecretKey key)
    {
        byte[] input = MacInput.create()
                .u32le(id)
                .u8(authTag)
                .bytes(bits.toByteArray())
                .toByteArray();
        return SipHashes.truncate(SipHashes.hash(key, input), def.digestWidth());
    }

    private static SecretKey resolveKey(ProtocolDefinition def, SecretKey callerKey)
    {
        switch (def.keyPolicy()) {
            case DEVICE:
                return Objects.requireNonNull(callerKey, def.type() + " requires the device key");
            case FACTORY_ZEROS:
                return SecretKey.zeros();
            case FACTORY_ONES:
                return SecretKey.filled((byte) 0xFF);
            default:
                throw new IllegalStateException(def.type() + " has no key but carries a digest");
        }
    }

    private static void checkCollision(ProtocolDefinition def,
                                       CollisionRule rule,
                                       long id,
                                       BitString bits,
                                       long digest,
                                       SecretKey key) throws IdCollisionException
    {
        if (rule instanceof DigestDiscriminatorRule d) {
            final long own = digest & d.mask();
            for (MessageType rival : d.rivals()) {
                int rivalTag = ProtocolRegistry.definition(rival).authTag();
                long reserved = digest(def, rivalTag, id, bits, key) & d.mask();
                if (own == reserved) {
                    throw new IdCollisionException(def.type().name(), id,
                            "digest discriminator reserved by " + rival);
                }
            }
        } else if (rule instanceof ReservedBodyRule r) {
            long compressedId = id & ((1L << def.idWidth()) - 1);
            if (compressedId == r.compressedId() && def.fieldValue(bits, r.field()) == r.encodedValue()) {
                throw new IdCollisionException(def.type().name(), id,
                        "body matches a legacy unauthenticated code");
            }
        } else {
            throw new IllegalStateException("unhandled collision rule " + rule);
        }
    }
}
