// File: MalformedBitLengthException.java
package org.security.qkd;

/** Decode was given a bit sequence whose length is not a whole number of 8-bit groups. */
public class MalformedBitLengthException extends QkdException {
    private final int bitLength;

    public MalformedBitLengthException(int bitLength) {
        super("bit length " + bitLength + " is not a multiple of " + BitCodec.BITS_PER_CHAR);
        this.bitLength = bitLength;
    }

    public int getBitLength() { return bitLength; }
}
