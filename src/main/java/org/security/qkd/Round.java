// File: Round.java
package org.security.qkd;

import java.util.Objects;

/** One indexed exchange in a transcript, pairing what was sent with what was measured. */
public final class Round {
    private final int index;
    private final SentSymbol sent;
    private final ReceivedSymbol received;

    public Round(int index, SentSymbol sent, ReceivedSymbol received) {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0 (was " + index + ")");
        this.index = index;
        this.sent = Objects.requireNonNull(sent, "sent");
        this.received = Objects.requireNonNull(received, "received");
    }

    public int index() { return index; }
    public SentSymbol sent() { return sent; }
    public ReceivedSymbol received() { return received; }

    /** True when both parties used the same basis, i.e. the round survives sifting. */
    public boolean basesMatch() { return sent.basis() == received.basis(); }

    @Override
    public String toString() {
        return "Round{" + index + ": " + sent + " -> " + received + (basesMatch() ? ", kept" : ", discarded") + '}';
    }
}
