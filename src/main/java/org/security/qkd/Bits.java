// File: Bits.java
package org.security.qkd;

import java.util.Arrays;

/**
 * Helpers for bit sequences held as {@code int[]} with every element 0 or 1.
 */
public final class Bits {
    private Bits() {}

    public static int requireBit(int bit) {
        if (bit != 0 && bit != 1) throw new IllegalArgumentException("bit must be 0 or 1 (was " + bit + ")");
        return bit;
    }

    /** Validates every element and returns a copy, so callers never share arrays. */
    public static int[] copyOf(int[] bits) {
        if (bits == null) throw new IllegalArgumentException("bits must not be null");
        for (int i = 0; i < bits.length; i++) {
            if (bits[i] != 0 && bits[i] != 1) {
                throw new IllegalArgumentException("element " + i + " must be 0 or 1 (was " + bits[i] + ")");
            }
        }
        return Arrays.copyOf(bits, bits.length);
    }

    /** Renders bits the way the report prints them, e.g. {@code [1, 0, 1]}. */
    public static String toString(int[] bits) { return Arrays.toString(bits); }
}
