package com.questrail.keycode.protocol.model;

import java.util.Objects;

/**
 * One field of a message body: its name, bit width, value source and, for
 * caller-supplied values, the accepted domain.
 *
 * @param name     field name, unique within a definition
 * @param width    width in bits, fixed per message type
 * @param kind     where the value comes from
 * @param domain   accepted values ({@link FieldKind#VALUE} only, otherwise {@code null})
 * @param constant value written for {@link FieldKind#CONSTANT} fields
 */
public record FieldSpec(
        String name,
        int width,
        FieldKind kind,
        FieldDomain domain,
        long constant
) {
    public static final String OPCODE = "opcode";
    public static final String MESSAGE_ID = "id";

    public FieldSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (width <= 0 || width > 62) {
            throw new IllegalArgumentException("field '" + name + "' width must be in range 1-62");
        }
        if ((kind == FieldKind.VALUE) != (domain != null)) {
            throw new IllegalArgumentException("field '" + name + "': a domain is required for, and only for, VALUE fields");
        }
        if (domain != null && domain.maxEncoded() >= (1L << width)) {
            throw new IllegalArgumentException("field '" + name + "' domain does not fit " + width + " bits");
        }
        if (kind == FieldKind.CONSTANT && (constant < 0 || constant >= (1L << width))) {
            throw new IllegalArgumentException("field '" + name + "' constant does not fit " + width + " bits");
        }
    }

    public static FieldSpec opcode(int width) {
        return new FieldSpec(OPCODE, width, FieldKind.OPCODE, null, 0);
    }

    public static FieldSpec messageId(int width) {
        return new FieldSpec(MESSAGE_ID, width, FieldKind.MESSAGE_ID, null, 0);
    }

    public static FieldSpec value(String name, int width, FieldDomain domain) {
        return new FieldSpec(name, width, FieldKind.VALUE, Objects.requireNonNull(domain, "domain"), 0);
    }

    public static FieldSpec constant(String name, int width, long constant) {
        return new FieldSpec(name, width, FieldKind.CONSTANT, null, constant);
    }

    public static FieldSpec payload(String name, int width) {
        return new FieldSpec(name, width, FieldKind.PAYLOAD, null, 0);
    }
}
