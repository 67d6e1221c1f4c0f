// File: EncryptedMessage.java
package org.security.qkd;

/** Cipher bits together with the expanded key they were produced with. */
public final class EncryptedMessage {
    private final int[] cipherBits;
    private final int[] expandedKey;

    EncryptedMessage(int[] cipherBits, int[] expandedKey) {
        if (cipherBits.length != expandedKey.length) throw new LengthMismatchException(cipherBits.length, expandedKey.length);
        this.cipherBits = Bits.copyOf(cipherBits);
        this.expandedKey = Bits.copyOf(expandedKey);
    }

    public int[] getCipherBits() { return Bits.copyOf(cipherBits); }
    public int[] getExpandedKey() { return Bits.copyOf(expandedKey); }
    public int getBitLength() { return cipherBits.length; }
}
