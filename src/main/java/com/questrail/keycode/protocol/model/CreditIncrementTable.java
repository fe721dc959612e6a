package com.questrail.keycode.protocol.model;

/**
 * CreditIncrementTable
 * -----------------------------------------------------------------------------
 * Maps a number of credit days onto the 8-bit increment id carried by small
 * keypad credit messages.
 *
 * <p>Resolution coarsens as the number of days grows; values inside a coarse
 * band round down to the band's increment. Increment ids {@code 240}-{@code 253}
 * are never produced by either table; the decoder reads them as custom
 * commands. {@code 254} locks the device (set only), {@code 255} unlocks it and
 * is written by constant fields rather than produced here.</p>
 */
public enum CreditIncrementTable implements FieldDomain
{
    /** Add-credit table, 1-405 days. */
    ADD(1, 405),

    /** Set-credit table, 0-960 days; 0 locks the device. */
    SET(0, 960);

    public static final long LOCK_INCREMENT = 254;
    public static final long UNLOCK_INCREMENT = 255;

    private final long minDays;
    private final long maxDays;

    CreditIncrementTable(long minDays, long maxDays) {
        this.minDays = minDays;
        this.maxDays = maxDays;
    }

    @Override
    public boolean contains(long days) {
        return days >= minDays && days <= maxDays;
    }

    @Override
    public long toEncoded(long days) {
        if (!contains(days)) {
            throw new IllegalArgumentException(name() + " table has no increment for " + days + " days");
        }
        if (this == ADD) {
            if (days <= 180) {
                return days - 1;
            }
            return (days - 181) / 3 + 180;
        }
        if (days == 0) {
            return LOCK_INCREMENT;
        }
        if (days <= 90) {
            return days - 1;
        }
        if (days <= 180) {
            return (days - 91) / 2 + 90;
        }
        if (days <= 360) {
            return (days - 181) / 4 + 135;
        }
        if (days <= 720) {
            return (days - 361) / 8 + 180;
        }
        return (days - 721) / 16 + 225;
    }

    @Override
    public long maxEncoded() {
        return this == ADD ? toEncoded(maxDays) : LOCK_INCREMENT;
    }

    @Override
    public String describe() {
        return "expected " + minDays + "-" + maxDays + " days";
    }
}
