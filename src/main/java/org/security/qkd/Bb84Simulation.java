// File: Bb84Simulation.java
package org.security.qkd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One end-to-end run: agree on a key, encrypt the message, decrypt it again.
 * Key agreement is retried up to {@code retries} extra times when sifting keeps nothing;
 * each attempt is a fresh run over the same source.
 */
public class Bb84Simulation {
    private static final Logger log = LoggerFactory.getLogger(Bb84Simulation.class);

    private final Bb84KeyAgreement keyAgreement;
    private final int rounds;
    private final int retries;

    public Bb84Simulation(Bb84KeyAgreement keyAgreement, int rounds, int retries) {
        if (keyAgreement == null) throw new IllegalArgumentException("keyAgreement must not be null");
        if (retries < 0) throw new IllegalArgumentException("retries must be >= 0 (was " + retries + ")");
        this.keyAgreement = keyAgreement;
        this.rounds = rounds;
        this.retries = retries;
    }

    /** Wires the state-vector oracle to the configured source. */
    public static Bb84Simulation fromConfig(SimulationConfig config) {
        RandomSource rng = config.newRandomSource();
        Bb84KeyAgreement agreement = new Bb84KeyAgreement(new StateVectorChannelOracle(rng), rng);
        return new Bb84Simulation(agreement, config.getRounds(), config.getRetries());
    }

    public SimulationReport run(String message) throws KeyAgreementException, MalformedBitLengthException {
        if (message == null || message.isEmpty()) throw new IllegalArgumentException("Enter a message to send");

        KeyAgreementResult agreement = agree();
        EncryptedMessage encrypted = MessageCipher.encryptMessage(message, agreement.getSiftedKey());
        String decrypted = MessageCipher.decrypt(encrypted);
        if (!decrypted.equals(message)) {
            throw new IllegalStateException("decrypted message does not match the plaintext");
        }
        log.info("Simulation complete: {} message bits under a {}-bit sifted key",
                encrypted.getBitLength(), agreement.getSiftedLength());
        return new SimulationReport(agreement, encrypted, decrypted);
    }

    private KeyAgreementResult agree() throws KeyAgreementException {
        KeyAgreementException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return keyAgreement.run(rounds);
            } catch (KeyAgreementException ex) {
                last = ex;
                if (attempt < retries) log.info("Retrying key agreement ({} of {})", attempt + 1, retries);
            }
        }
        throw last;
    }
}
