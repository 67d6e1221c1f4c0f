// File: KeyAgreementResult.java
package org.security.qkd;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one BB84 run: the full transcript plus the sifted key.
 * The per-party views are derived from the transcript on demand.
 */
public final class KeyAgreementResult {
    private final List<Round> rounds;
    private final int[] siftedKey;

    KeyAgreementResult(List<Round> rounds, int[] siftedKey) {
        this.rounds = Collections.unmodifiableList(new ArrayList<>(rounds));
        this.siftedKey = Bits.copyOf(siftedKey);
    }

    public List<Round> getRounds() { return rounds; }
    public int getRoundCount() { return rounds.size(); }
    public int[] getSiftedKey() { return Bits.copyOf(siftedKey); }
    public int getSiftedLength() { return siftedKey.length; }

    public int[] getSenderBits() {
        int[] out = new int[rounds.size()];
        for (int i = 0; i < out.length; i++) out[i] = rounds.get(i).sent().bit();
        return out;
    }

    public List<Basis> getSenderBases() {
        List<Basis> out = new ArrayList<>(rounds.size());
        for (Round r : rounds) out.add(r.sent().basis());
        return out;
    }

    public List<Basis> getReceiverBases() {
        List<Basis> out = new ArrayList<>(rounds.size());
        for (Round r : rounds) out.add(r.received().basis());
        return out;
    }

    public int[] getReceiverResults() {
        int[] out = new int[rounds.size()];
        for (int i = 0; i < out.length; i++) out[i] = rounds.get(i).received().measuredBit();
        return out;
    }
}
