// File: BitCodec.java
package org.security.qkd;

/**
 * Text to bits and back, one 8-bit most-significant-bit-first group per character.
 * Only characters 0..255 are representable; anything wider is rejected rather than wrapped.
 */
public final class BitCodec {
    public static final int BITS_PER_CHAR = 8;
    public static final int MAX_CHAR = (1 << BITS_PER_CHAR) - 1;

    private BitCodec() {}

    public static int[] encode(String message) {
        if (message == null) throw new IllegalArgumentException("message must not be null");
        int[] out = new int[message.length() * BITS_PER_CHAR];
        for (int c = 0; c < message.length(); c++) {
            char ch = message.charAt(c);
            if (ch > MAX_CHAR) {
                throw new IllegalArgumentException("character at index " + c + " (U+"
                        + String.format("%04X", (int) ch) + ") does not fit in " + BITS_PER_CHAR + " bits");
            }
            for (int b = 0; b < BITS_PER_CHAR; b++) {
                out[c * BITS_PER_CHAR + b] = (ch >>> (BITS_PER_CHAR - 1 - b)) & 1;
            }
        }
        return out;
    }

    /** @throws MalformedBitLengthException if the length is not a multiple of 8 */
    public static String decode(int[] bits) throws MalformedBitLengthException {
        if (bits == null) throw new IllegalArgumentException("bits must not be null");
        if (bits.length % BITS_PER_CHAR != 0) throw new MalformedBitLengthException(bits.length);
        StringBuilder sb = new StringBuilder(bits.length / BITS_PER_CHAR);
        for (int i = 0; i < bits.length; i += BITS_PER_CHAR) {
            int val = 0;
            for (int b = 0; b < BITS_PER_CHAR; b++) val = (val << 1) | Bits.requireBit(bits[i + b]);
            sb.append((char) val);
        }
        return sb.toString();
    }
}
