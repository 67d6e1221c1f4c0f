// File: StreamCipher.java
package org.security.qkd;

/**
 * Bitwise XOR of a bit sequence with an equal-length keystream. Applying it twice with
 * the same key returns the input, so one operation serves for both directions.
 * A toy cipher: it gives no confidentiality beyond the key material it is handed.
 */
public final class StreamCipher {
    private StreamCipher() {}

    public static int[] transform(int[] bits, int[] key) {
        int[] in = Bits.copyOf(bits);
        int[] k = Bits.copyOf(key);
        if (in.length != k.length) throw new LengthMismatchException(in.length, k.length);
        int[] out = new int[in.length];
        for (int i = 0; i < in.length; i++) out[i] = in[i] ^ k[i];
        return out;
    }
}
