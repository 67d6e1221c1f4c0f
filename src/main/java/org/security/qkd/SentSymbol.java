// File: SentSymbol.java
package org.security.qkd;

import java.util.Objects;

/** Sender's choice for one round: the bit to transmit and the basis it is encoded in. */
public final class SentSymbol {
    private final int bit;
    private final Basis basis;

    public SentSymbol(int bit, Basis basis) {
        this.bit = Bits.requireBit(bit);
        this.basis = Objects.requireNonNull(basis, "basis");
    }

    public int bit() { return bit; }
    public Basis basis() { return basis; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SentSymbol)) return false;
        SentSymbol that = (SentSymbol) o;
        return bit == that.bit && basis == that.basis;
    }

    @Override
    public int hashCode() { return Objects.hash(bit, basis); }

    @Override
    public String toString() { return "SentSymbol{bit=" + bit + ", basis=" + basis + '}'; }
}
