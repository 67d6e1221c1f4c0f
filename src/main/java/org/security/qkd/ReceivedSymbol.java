// File: ReceivedSymbol.java
package org.security.qkd;

import java.util.Objects;

/** Receiver's side of one round: the basis chosen and the bit the channel reported. */
public final class ReceivedSymbol {
    private final Basis basis;
    private final int measuredBit;

    public ReceivedSymbol(Basis basis, int measuredBit) {
        this.basis = Objects.requireNonNull(basis, "basis");
        this.measuredBit = Bits.requireBit(measuredBit);
    }

    public Basis basis() { return basis; }
    public int measuredBit() { return measuredBit; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReceivedSymbol)) return false;
        ReceivedSymbol that = (ReceivedSymbol) o;
        return measuredBit == that.measuredBit && basis == that.basis;
    }

    @Override
    public int hashCode() { return Objects.hash(basis, measuredBit); }

    @Override
    public String toString() { return "ReceivedSymbol{basis=" + basis + ", measuredBit=" + measuredBit + '}'; }
}
