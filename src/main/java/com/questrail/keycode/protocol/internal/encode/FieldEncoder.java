package com.questrail.keycode.protocol.internal.encode;

import com.questrail.keycode.api.FieldRangeException;
import com.questrail.keycode.api.IdCollisionException;
import com.questrail.keycode.api.SchemaMismatchException;
import com.questrail.keycode.protocol.model.BitString;
import com.questrail.keycode.protocol.model.Body;
import com.questrail.keycode.protocol.model.FieldSpec;
import com.questrail.keycode.protocol.model.IdPolicy;
import com.questrail.keycode.protocol.model.MessageType;
import com.questrail.keycode.protocol.model.ProtocolDefinition;
import com.questrail.keycode.protocol.registry.ProtocolRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * FieldEncoder
 * ============================================================================
 * Packs caller-supplied field values into the fixed-width {@link Body} of a
 * message type.
 *
 * <p>The outbound pipeline is:</p>
 * <pre>
 *   field values  ->  Body  ->  AuthenticatedPayload  ->  Keycode
 *      (this)         (authentication engine)  (formatter)
 * </pre>
 *
 * <h2>What this encoder does</h2>
 * <ul>
 *   <li>Checks the supplied names against the type's schema</li>
 *   <li>Checks every value against its field's domain and width</li>
 *   <li>Writes fields in definition order, most-significant bit first</li>
 * </ul>
 *
 * <p>All checks run before the first bit is written, so a failure never
 * leaves a partial body behind. The encoder is stateless and may be shared
 * between threads.</p>
 */
public final class FieldEncoder
{
    /** Identifiers are unsigned 32-bit counters. */
    public static final long MAX_ID = IdCollisionException.MAX_ID;

    public Body encode(MessageType type, long id, Map<String, Long> values)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(values, "values");

        final ProtocolDefinition def = ProtocolRegistry.definition(type);

        checkId(def, id);
        checkSchema(def, values);

        // Resolve every field value first; nothing is written until all pass.
        final long[] resolved = new long[def.fields().size()];
        int i = 0;
        for (FieldSpec f : def.fields()) {
            resolved[i++] = resolve(def, f, id, values);
        }

        BitString bits = BitString.empty();
        i = 0;
        for (FieldSpec f : def.fields()) {
            bits = bits.append(BitString.of(resolved[i++], f.width()));
        }
        return new Body(type, id, bits);
    }

    private static void checkId(ProtocolDefinition def, long id)
    {
        if (id < 0 || id > MAX_ID) {
            throw new FieldRangeException(FieldSpec.MESSAGE_ID, id, "expected 0-" + MAX_ID);
        }
        if (def.idPolicy() == IdPolicy.NONE && id != 0) {
            throw new FieldRangeException(FieldSpec.MESSAGE_ID, id,
                    def.type() + " does not carry an identifier; expected 0");
        }
    }

    private static void checkSchema(ProtocolDefinition def, Map<String, Long> values)
    {
        for (String name : new TreeSet<>(values.keySet())) {
            FieldSpec f = def.field(name).orElse(null);
            if (f == null) {
                throw new SchemaMismatchException(def.type() + " has no field '" + name + "'");
            }
            if (!f.kind().callerSupplied()) {
                throw new SchemaMismatchException(def.type() + " field '" + name
                        + "' is " + f.kind() + " and cannot be supplied");
            }
        }
        for (FieldSpec f : def.fields()) {
            if (f.kind().callerSupplied() && values.get(f.name()) == null) {
                throw new SchemaMismatchException(def.type() + " requires field '" + f.name() + "'");
            }
        }
    }

    private static long resolve(ProtocolDefinition def, FieldSpec f, long id, Map<String, Long> values)
    {
        switch (f.kind()) {
            case OPCODE:
                return def.opcode();
            case MESSAGE_ID:
                return id & ((1L << f.width()) - 1);
            case CONSTANT:
                return f.constant();
            case PAYLOAD: {
                long v = values.get(f.name());
                if (v < 0 || v >= (1L << f.width())) {
                    throw new FieldRangeException(f.name(), v, "payload must fit " + f.width() + " bits");
                }
                return v;
            }
            case VALUE: {
                long v = values.get(f.name());
                if (!f.domain().contains(v)) {
                    throw new FieldRangeException(f.name(), v, f.domain().describe());
                }
                long encoded = f.domain().toEncoded(v);
                if (encoded < 0 || encoded >= (1L << f.width())) {
                    throw new FieldRangeException(f.name(), v, "does not fit " + f.width() + " bits");
                }
                return encoded;
            }
            default:
                throw new IllegalStateException("unhandled field kind " + f.kind());
        }
    }
}
