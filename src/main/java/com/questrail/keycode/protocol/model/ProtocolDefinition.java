package com.questrail.keycode.protocol.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ProtocolDefinition
 * -----------------------------------------------------------------------------
 * Wire layout and policies of a single {@link MessageType}.
 *
 * <p>A definition is pure data. The encoding engine never branches on the
 * message type itself; everything it needs to pack, authenticate and render a
 * message is read from here.</p>
 *
 * <ul>
 *   <li><b>opcode</b>: value written into the {@link FieldKind#OPCODE} field</li>
 *   <li><b>authTag</b>: interpretation byte mixed into the digest input;
 *       types a decoder tells apart only by digest carry different tags</li>
 *   <li><b>fields</b>: body fields in transmission order</li>
 *   <li><b>digestWidth</b>: number of digest bits appended after the body
 *       ({@code 0} for types without a core digest)</li>
 *   <li><b>dataDigits</b>: fixed digit count before check digits are added
 *       ({@code 0} for nested-only types)</li>
 * </ul>
 */
public record ProtocolDefinition(
        MessageType type,
        int opcode,
        int authTag,
        List<FieldSpec> fields,
        int digestWidth,
        int dataDigits,
        IdPolicy idPolicy,
        KeyPolicy keyPolicy,
        boolean obscured,
        List<CollisionRule> collisionRules
) {
    public ProtocolDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(idPolicy, "idPolicy");
        Objects.requireNonNull(keyPolicy, "keyPolicy");
        Objects.requireNonNull(collisionRules, "collisionRules");

        fields = List.copyOf(fields);
        collisionRules = List.copyOf(collisionRules);

        if (fields.isEmpty()) {
            throw new IllegalArgumentException(type + ": at least one field is required");
        }
        if (authTag < 0 || authTag > 0xFF) {
            throw new IllegalArgumentException(type + ": authTag must fit one byte");
        }
        if (digestWidth < 0 || digestWidth > 64) {
            throw new IllegalArgumentException(type + ": digestWidth must be in range 0-64");
        }
        if (dataDigits < 0) {
            throw new IllegalArgumentException(type + ": dataDigits must be non-negative");
        }
        if ((digestWidth == 0) != (keyPolicy == KeyPolicy.UNKEYED)) {
            throw new IllegalArgumentException(type + ": UNKEYED types, and only those, carry no digest");
        }
        if (obscured && digestWidth == 0) {
            throw new IllegalArgumentException(type + ": obscuring needs digest bits to seed it");
        }

        Set<String> names = new HashSet<>();
        for (FieldSpec f : fields) {
            if (!names.add(f.name())) {
                throw new IllegalArgumentException(type + ": duplicate field '" + f.name() + "'");
            }
            if (f.kind() == FieldKind.OPCODE && opcode >= (1L << f.width())) {
                throw new IllegalArgumentException(type + ": opcode does not fit its field");
            }
        }
        for (CollisionRule rule : collisionRules) {
            if (rule instanceof ReservedBodyRule r) {
                if (!names.contains(r.field()) || !names.contains(FieldSpec.MESSAGE_ID)) {
                    throw new IllegalArgumentException(type + ": reserved-body rule needs fields '"
                            + r.field() + "' and '" + FieldSpec.MESSAGE_ID + "'");
                }
            } else if (rule instanceof DigestDiscriminatorRule d) {
                if (d.bits() > digestWidth) {
                    throw new IllegalArgumentException(type + ": discriminator wider than digest");
                }
                if (d.rivals().contains(type)) {
                    throw new IllegalArgumentException(type + ": a type cannot be its own rival");
                }
            }
        }
    }

    public static Builder builder(MessageType type) {
        return new Builder(type);
    }

    public ProtocolFamily family() {
        return type.family();
    }

    /**
     * Total width of the body fields.
     */
    public int bodyWidth() {
        int w = 0;
        for (FieldSpec f : fields) {
            w += f.width();
        }
        return w;
    }

    /**
     * Width of the transmitted bit string: body plus digest.
     */
    public int payloadWidth() {
        return bodyWidth() + digestWidth;
    }

    public Optional<FieldSpec> field(String name) {
        for (FieldSpec f : fields) {
            if (f.name().equals(name)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    /**
     * Bit offset of the named field from the start of the body.
     *
     * @throws IllegalArgumentException if no such field exists
     */
    public int offsetOf(String name) {
        int offset = 0;
        for (FieldSpec f : fields) {
            if (f.name().equals(name)) {
                return offset;
            }
            offset += f.width();
        }
        throw new IllegalArgumentException(type + " has no field '" + name + "'");
    }

    /**
     * Reads the named field back out of a body produced for this definition.
     */
    public long fieldValue(BitString body, String name) {
        if (body.length() != bodyWidth()) {
            throw new IllegalArgumentException("body is " + body.length() + " bits, " + type
                    + " bodies are " + bodyWidth());
        }
        int offset = offsetOf(name);
        FieldSpec f = field(name).orElseThrow();
        return body.slice(offset, offset + f.width()).toLong();
    }

    /**
     * Width of the transmitted identifier field, or 0 if the body carries none.
     */
    public int idWidth() {
        return field(FieldSpec.MESSAGE_ID).map(FieldSpec::width).orElse(0);
    }

    public static final class Builder {
        private final MessageType type;
        private int opcode;
        private int authTag;
        private final List<FieldSpec> fields = new ArrayList<>();
        private int digestWidth;
        private int dataDigits;
        private IdPolicy idPolicy = IdPolicy.SEQUENCED;
        private KeyPolicy keyPolicy = KeyPolicy.DEVICE;
        private boolean obscured;
        private final List<CollisionRule> collisionRules = new ArrayList<>();

        private Builder(MessageType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        /**
         * Sets the opcode; the interpretation tag defaults to the same value.
         */
        public Builder withOpcode(int opcode) {
            this.opcode = opcode;
            this.authTag = opcode;
            return this;
        }

        public Builder withAuthTag(int authTag) {
            this.authTag = authTag;
            return this;
        }

        public Builder withField(FieldSpec field) {
            this.fields.add(field);
            return this;
        }

        public Builder withDigest(int digestWidth) {
            this.digestWidth = digestWidth;
            return this;
        }

        public Builder withDataDigits(int dataDigits) {
            this.dataDigits = dataDigits;
            return this;
        }

        public Builder withIdPolicy(IdPolicy idPolicy) {
            this.idPolicy = idPolicy;
            return this;
        }

        public Builder withKeyPolicy(KeyPolicy keyPolicy) {
            this.keyPolicy = keyPolicy;
            return this;
        }

        public Builder obscured() {
            this.obscured = true;
            return this;
        }

        public Builder withCollisionRule(CollisionRule rule) {
            this.collisionRules.add(rule);
            return this;
        }

        public ProtocolDefinition build() {
            return new ProtocolDefinition(type, opcode, authTag, fields, digestWidth, dataDigits,
                    idPolicy, keyPolicy, obscured, collisionRules);
        }
    }
}
