// File: LengthMismatchException.java
package org.security.qkd;

/** XOR operands of different lengths; always a caller bug. */
public class LengthMismatchException extends IllegalArgumentException {
    private final int bitsLength;
    private final int keyLength;

    public LengthMismatchException(int bitsLength, int keyLength) {
        super("bits and key must have equal length (bits=" + bitsLength + ", key=" + keyLength + ")");
        this.bitsLength = bitsLength;
        this.keyLength = keyLength;
    }

    public int getBitsLength() { return bitsLength; }
    public int getKeyLength() { return keyLength; }
}
