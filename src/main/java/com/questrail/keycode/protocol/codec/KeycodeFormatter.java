package com.questrail.keycode.protocol.codec;

import com.questrail.keycode.api.KeypadFamily;
import com.questrail.keycode.protocol.model.AuthenticatedPayload;
import com.questrail.keycode.protocol.model.Keycode;

/**
 * KeycodeFormatter
 * -----------------------------------------------------------------------------
 * Renders an {@link AuthenticatedPayload} as the digit string a user types.
 *
 * <p><strong>Layering note:</strong> the formatter does not decide what bits
 * are sent and never looks inside them. It only applies the mechanical rules
 * of:</p>
 * <ul>
 *   <li>radix conversion into the keypad's base, zero-padded to a fixed width</li>
 *   <li>check digit computation and interleaving</li>
 *   <li>keypad-specific framing</li>
 * </ul>
 *
 * <p>Identical input always renders the identical string.</p>
 */
public interface KeycodeFormatter
{
    /**
     * @throws com.questrail.keycode.api.EncodingOverflowException if the payload
     *         needs more digits than its type's fixed width
     * @throws com.questrail.keycode.api.SchemaMismatchException if the payload's
     *         type does not render on {@code keypad}
     */
    Keycode format(AuthenticatedPayload payload, KeypadFamily keypad);
}
