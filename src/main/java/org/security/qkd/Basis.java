// File: Basis.java
package org.security.qkd;

/**
 * Measurement frame used to encode or read one qubit.
 * Z is the rectilinear (computational) basis, X the diagonal (Hadamard) basis.
 */
public enum Basis {
    Z,
    X;

    /** Maps a uniform random bit to a basis: 0 -> Z, 1 -> X. */
    public static Basis fromBit(int bit) {
        Bits.requireBit(bit);
        return bit == 0 ? Z : X;
    }
}
