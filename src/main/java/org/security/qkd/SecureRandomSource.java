// File: SecureRandomSource.java
package org.security.qkd;

import java.security.SecureRandom;

/** Non-reproducible source backed by the platform CSPRNG; used for live runs. */
public final class SecureRandomSource implements RandomSource {
    private final SecureRandom rng;

    public SecureRandomSource() { this(new SecureRandom()); }

    public SecureRandomSource(SecureRandom rng) {
        if (rng == null) throw new IllegalArgumentException("rng must not be null");
        this.rng = rng;
    }

    @Override
    public int nextBit() { return rng.nextBoolean() ? 1 : 0; }

    @Override
    public double nextDouble() { return rng.nextDouble(); }
}
