// File: KeyExpansion.java
package org.security.qkd;

/** Stretches a sifted key to an exact length by cyclic repetition. */
public final class KeyExpansion {
    private KeyExpansion() {}

    /**
     * Repeats {@code siftedKey} until it covers {@code targetLength} bits, then truncates.
     *
     * @throws KeyExpansionException if {@code siftedKey} is empty
     */
    public static int[] expand(int[] siftedKey, int targetLength) {
        int[] key = Bits.copyOf(siftedKey);
        if (targetLength < 0) throw new IllegalArgumentException("targetLength must be >= 0 (was " + targetLength + ")");
        if (key.length == 0) throw new KeyExpansionException("cannot expand an empty sifted key");
        if (targetLength == 0) return new int[0];

        int[] out = new int[targetLength];
        for (int i = 0; i < targetLength; i++) out[i] = key[i % key.length];
        return out;
    }
}
