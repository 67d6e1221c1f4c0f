// File: Bb84KeyAgreement.java
package org.security.qkd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * BB84 key agreement between a sender and a receiver over a {@link ChannelOracle}.
 * <p>
 * Each round draws, in order, the sender's bit, the sender's basis and the receiver's
 * basis from the injected {@link RandomSource}, asks the oracle for the measured bit,
 * and keeps the sender's bit when both bases agree (sifting). Under the noiseless
 * channel contract the kept bit equals the receiver's measurement.
 * <p>
 * Instances hold no per-run state; each call to {@link #run(int)} builds a fresh transcript.
 */
public class Bb84KeyAgreement {
    private static final Logger log = LoggerFactory.getLogger(Bb84KeyAgreement.class);

    /** Eight qubits per run unless configured otherwise. */
    public static final int DEFAULT_ROUNDS = 8;

    private final ChannelOracle oracle;
    private final RandomSource rng;

    public Bb84KeyAgreement(ChannelOracle oracle, RandomSource rng) {
        if (oracle == null) throw new IllegalArgumentException("oracle must not be null");
        if (rng == null) throw new IllegalArgumentException("rng must not be null");
        this.oracle = oracle;
        this.rng = rng;
    }

    /**
     * Runs {@code roundCount} exchanges and sifts them.
     *
     * @param roundCount number of qubits to exchange, at least 1
     * @return transcript and non-empty sifted key
     * @throws KeyAgreementException if no round had matching bases
     */
    public KeyAgreementResult run(int roundCount) throws KeyAgreementException {
        if (roundCount < 1) throw new IllegalArgumentException("roundCount must be >= 1 (was " + roundCount + ")");

        List<Round> rounds = new ArrayList<>(roundCount);
        int[] sifted = new int[roundCount];
        int kept = 0;
        for (int i = 0; i < roundCount; i++) {
            Round round = exchange(i);
            rounds.add(round);
            if (round.basesMatch()) sifted[kept++] = round.sent().bit();
            if (log.isDebugEnabled()) log.debug("{}", round);
        }

        if (kept == 0) {
            log.warn("Key agreement failed: no matching bases in {} rounds", roundCount);
            throw new KeyAgreementException(roundCount);
        }
        int[] siftedKey = new int[kept];
        System.arraycopy(sifted, 0, siftedKey, 0, kept);
        log.info("Key agreement complete: {} rounds, {} bits sifted", roundCount, kept);
        if (log.isDebugEnabled()) log.debug("Sifted key: {}", Bits.toString(siftedKey));
        return new KeyAgreementResult(rounds, siftedKey);
    }

    private Round exchange(int index) {
        SentSymbol sent = new SentSymbol(rng.nextBit(), rng.nextBasis());
        Basis receiverBasis = rng.nextBasis();
        int measured = oracle.measure(sent, receiverBasis);
        return new Round(index, sent, new ReceivedSymbol(receiverBasis, measured));
    }
}
