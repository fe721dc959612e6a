/**
 * Keycode Codec
 * =============================================================================
 *
 * <p>Turns authenticated bit strings into keypad digit strings.</p>
 *
 * <pre>
 *   AuthenticatedPayload.transmitted()
 *        -> RadixConversion      (base 10 or base 5, fixed width)
 *        -> PositionalChecksum   (two check digits, interleaved)
 *        -> KeycodeFraming       (*DDD DDD ...# or 1-5 digit run)
 *        -> Keycode
 * </pre>
 *
 * <h2>Check digits</h2>
 * <p>Two check digits are chosen so that the whole rendered sequence
 * {@code o_0..o_(m-1)} in base {@code b} satisfies
 * {@code sum(o_j) = 0} and {@code sum((j + 1) * o_j) = 0} modulo {@code b}.
 * {@code c2} is the last digit; {@code c1} sits near the middle.</p>
 * <p>Every single-digit substitution and every swap of two adjacent, distinct
 * digits of the keycode, check digits included, fails verification.</p>
 */
package com.questrail.keycode.protocol.codec;
