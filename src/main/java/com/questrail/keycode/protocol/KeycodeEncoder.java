package com.questrail.keycode.protocol;

import com.questrail.keycode.api.IdCollisionException;
import com.questrail.keycode.api.KeycodeException;
import com.questrail.keycode.api.KeypadFamily;
import com.questrail.keycode.api.SchemaMismatchException;
import com.questrail.keycode.protocol.codec.KeycodeFormatter;
import com.questrail.keycode.protocol.codec.impl.DefaultKeycodeFormatter;
import com.questrail.keycode.protocol.config.KeycodeEncoderConfig;
import com.questrail.keycode.protocol.internal.auth.AuthenticationEngine;
import com.questrail.keycode.protocol.internal.encode.FieldEncoder;
import com.questrail.keycode.protocol.model.AuthenticatedPayload;
import com.questrail.keycode.protocol.model.Body;
import com.questrail.keycode.protocol.model.Keycode;
import com.questrail.keycode.protocol.model.Message;
import com.questrail.keycode.protocol.observability.KeycodeCollisionEvent;
import com.questrail.keycode.protocol.observability.KeycodeErrorEvent;
import com.questrail.keycode.protocol.observability.KeycodeIssuedEvent;
import com.questrail.keycode.protocol.observability.KeycodeObservabilitySink;

import java.util.Objects;

/**
 * KeycodeEncoder
 * ============================================================================
 * Entry point that turns a {@link Message} into the {@link Keycode} a user
 * types on the device.
 *
 * <pre>
 *   Message
 *     -> FieldEncoder           (schema and range checks, bit packing)
 *     -> AuthenticationEngine   (digest, collision table, obscuring)
 *     -> KeycodeFormatter       (radix, check digits, framing)
 *     -> Keycode
 * </pre>
 *
 * <h2>Failure</h2>
 * <p>Every failure surfaces synchronously and no keycode is returned. An
 * {@link IdCollisionException} is the only failure a caller is expected to
 * recover from, by re-encoding with {@link IdCollisionException#nextId()};
 * the encoder never retries on its own.</p>
 *
 * <h2>Threading</h2>
 * <p>The encoder holds no mutable state and does not retain keys between
 * calls. A single instance may be shared freely.</p>
 */
public final class KeycodeEncoder
{
    private final FieldEncoder fieldEncoder;
    private final AuthenticationEngine authenticationEngine;
    private final KeycodeFormatter formatter;
    private final KeycodeEncoderConfig config;
    private final KeycodeObservabilitySink sink;

    public KeycodeEncoder()
    {
        this(KeycodeEncoderConfig.defaults());
    }

    public KeycodeEncoder(KeycodeEncoderConfig config)
    {
        this(config, new FieldEncoder(), new AuthenticationEngine(), new DefaultKeycodeFormatter());
    }

    KeycodeEncoder(KeycodeEncoderConfig config,
                   FieldEncoder fieldEncoder,
                   AuthenticationEngine authenticationEngine,
                   KeycodeFormatter formatter)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.fieldEncoder = Objects.requireNonNull(fieldEncoder, "fieldEncoder");
        this.authenticationEngine = Objects.requireNonNull(authenticationEngine, "authenticationEngine");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.sink = config.observabilitySink();
    }

    public KeycodeEncoderConfig config()
    {
        return config;
    }

    /**
     * Encodes {@code message} into a keycode.
     *
     * @throws IdCollisionException if the message's identifier makes the
     *         keycode ambiguous; retry with {@link IdCollisionException#nextId()}
     * @throws KeycodeException     for invalid values, schema mismatches and
     *         internal width violations
     */
    public Keycode encode(Message message) throws IdCollisionException
    {
        Objects.requireNonNull(message, "message");

        try {
            final KeypadFamily keypad = message.type().family().keypad().orElseThrow(() ->
                    new SchemaMismatchException(message.type() + " is carried only inside a passthrough message"));

            final Body body = fieldEncoder.encode(message.type(), message.id(), message.values());
            final AuthenticatedPayload payload = authenticationEngine.authenticate(message.id(), body, message.key());
            final Keycode keycode = formatter.format(payload, keypad);

            sink.onKeycodeIssued(new KeycodeIssuedEvent(
                    config.clock().instant(),
                    message.type(),
                    keypad,
                    message.id(),
                    keycode.digits().length()));
            return keycode;
        } catch (IdCollisionException e) {
            sink.onCollision(new KeycodeCollisionEvent(
                    config.clock().instant(),
                    message.type(),
                    e.offendingId(),
                    e.hasNextId() ? e.nextId() : KeycodeCollisionEvent.NO_NEXT_ID));
            throw e;
        } catch (KeycodeException e) {
            sink.onError(new KeycodeErrorEvent(
                    config.clock().instant(),
                    message.type(),
                    e.getMessage(),
                    e));
            throw e;
        }
    }
}
