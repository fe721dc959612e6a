package com.questrail.keycode.protocol.model;

/**
 * Condition under which an encoded message would be read by the decoder as a
 * different command. Rules are data attached to a {@link ProtocolDefinition}
 * and evaluated by the authentication engine before any payload is returned.
 */
public sealed interface CollisionRule permits DigestDiscriminatorRule, ReservedBodyRule
{
}
