// File: KeyAgreementException.java
package org.security.qkd;

/** Sifting kept no rounds: sender and receiver never chose the same basis. */
public class KeyAgreementException extends QkdException {
    private final int roundCount;

    public KeyAgreementException(int roundCount) {
        super("no matching bases in " + roundCount + " rounds; re-run with a larger round count");
        this.roundCount = roundCount;
    }

    public int getRoundCount() { return roundCount; }
}
