// File: XofRandomSource.java
package org.security.qkd;

import org.bouncycastle.crypto.digests.AsconXof;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Deterministic source: the same seed always yields the same bit stream.
 * Bits are squeezed from Ascon-XOF in fixed blocks, block i being XOF(seed || i),
 * so the output depends only on the seed and the number of bits consumed.
 */
public final class XofRandomSource implements RandomSource {
    /** Ascon-XOF output per doFinal call in this BouncyCastle line; longer requests come back zero-padded. */
    public static final int BLOCK_BYTES = 32;

    private final XofBitReader reader;

    public XofRandomSource(long seed) { this(ByteBuffer.allocate(Long.BYTES).putLong(seed).array()); }

    public XofRandomSource(byte[] seed) {
        if (seed == null || seed.length == 0) throw new IllegalArgumentException("seed must not be empty");
        this.reader = new XofBitReader(new AsconXofStream(seed));
    }

    @Override
    public int nextBit() { return reader.nextBits(1); }

    @Override
    public double nextDouble() {
        long hi = reader.nextBits(26) & 0xFFFFFFFFL;
        long lo = reader.nextBits(27) & 0xFFFFFFFFL;
        return ((hi << 27) | lo) * 0x1.0p-53;
    }

    /* ---- Counter-mode Ascon XOF stream ----
       doFinal resets the XOF, so every block is squeezed from a fresh instance
       over seed || blockCounter (big-endian).
    */
    private static final class AsconXofStream {
        private final byte[] seed;
        private final byte[] buffer = new byte[BLOCK_BYTES];
        private long blockCounter;
        private int pos = BLOCK_BYTES;

        AsconXofStream(byte[] seed) { this.seed = Arrays.copyOf(seed, seed.length); }

        private void refill() {
            AsconXof xof = new AsconXof(AsconXof.AsconParameters.AsconXof);
            byte[] input = Arrays.copyOf(seed, seed.length + Long.BYTES);
            for (int i = 0; i < Long.BYTES; i++) {
                input[seed.length + i] = (byte) (blockCounter >>> (8 * (Long.BYTES - 1 - i)));
            }
            xof.update(input, 0, input.length);
            xof.doFinal(buffer, 0, buffer.length);
            blockCounter++;
            pos = 0;
        }

        void squeeze(byte[] out) {
            for (int i = 0; i < out.length; i++) {
                if (pos == buffer.length) refill();
                out[i] = buffer[pos++];
            }
        }
    }

    /* ---- Bit reader over the stream ---- */
    private static final class XofBitReader {
        private final AsconXofStream stream;
        private long buffer = 0L;
        private int bitsAvailable = 0;

        XofBitReader(AsconXofStream s) { this.stream = s; }

        private void refill() {
            byte[] tmp = new byte[4];
            stream.squeeze(tmp);
            long newBits = 0L;
            for (int i = 0; i < 4; i++) newBits |= ((long) (tmp[i] & 0xFF)) << (8 * i);
            buffer |= (newBits << bitsAvailable);
            bitsAvailable += 32;
        }

        // n bits, n <= 32
        int nextBits(int n) {
            if (n <= 0 || n > 32) throw new IllegalArgumentException("n must be 1..32");
            while (bitsAvailable < n) refill();
            int res = (int) (buffer & ((1L << n) - 1));
            buffer >>>= n;
            bitsAvailable -= n;
            return res;
        }
    }
}
