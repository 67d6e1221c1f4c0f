// File: SimulationReport.java
package org.security.qkd;

import java.util.List;

/** Everything one end-to-end run produced, in the order the demo displays it. */
public final class SimulationReport {
    private final KeyAgreementResult agreement;
    private final EncryptedMessage encrypted;
    private final String decryptedMessage;

    SimulationReport(KeyAgreementResult agreement, EncryptedMessage encrypted, String decryptedMessage) {
        this.agreement = agreement;
        this.encrypted = encrypted;
        this.decryptedMessage = decryptedMessage;
    }

    public KeyAgreementResult getAgreement() { return agreement; }
    public int[] getSharedKey() { return agreement.getSiftedKey(); }
    public int[] getExpandedKey() { return encrypted.getExpandedKey(); }
    public int[] getCipherBits() { return encrypted.getCipherBits(); }
    public String getDecryptedMessage() { return decryptedMessage; }

    public String format() {
        StringBuilder sb = new StringBuilder();
        line(sb, "Sender bits:", Bits.toString(agreement.getSenderBits()));
        line(sb, "Sender bases:", bases(agreement.getSenderBases()));
        line(sb, "Receiver bases:", bases(agreement.getReceiverBases()));
        line(sb, "Receiver results:", Bits.toString(agreement.getReceiverResults()));
        line(sb, "Shared key:", Bits.toString(agreement.getSiftedKey()));
        line(sb, "Encrypted bits:", Bits.toString(encrypted.getCipherBits()));
        line(sb, "Decrypted msg:", decryptedMessage);
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(String.format("%-18s%s%n", label, value));
    }

    private static String bases(List<Basis> bases) { return bases.toString(); }
}
