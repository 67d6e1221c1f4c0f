// File: RandomSource.java
package org.security.qkd;

/**
 * Source of independent uniform bits for the sender's bit/basis draws, the receiver's
 * basis draws and the simulator's measurement outcomes. Implementations need not be
 * thread-safe; a run owns its source.
 */
public interface RandomSource {

    /** Returns 0 or 1 with equal probability. */
    int nextBit();

    default Basis nextBasis() { return Basis.fromBit(nextBit()); }

    /** Uniform double in [0, 1) built from 53 random bits. */
    default double nextDouble() {
        long v = 0L;
        for (int i = 0; i < 53; i++) v = (v << 1) | nextBit();
        return v * 0x1.0p-53;
    }
}
