package com.questrail.keycode.protocol.model;

/**
 * Which key authenticates a message type.
 */
public enum KeyPolicy
{
    /** The device's own secret key, supplied by the caller. */
    DEVICE,
    /** Public all-zero key (factory codes). */
    FACTORY_ZEROS,
    /** Public all-{@code 0xFF} key (small keypad test codes). */
    FACTORY_ONES,
    /** No core digest is computed. */
    UNKEYED
}
