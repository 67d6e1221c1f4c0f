// File: StateVectorChannelOracle.java
package org.security.qkd;

/**
 * Single-qubit state-vector simulation of the BB84 channel.
 * The sender prepares |0>, applies X for bit 1 and then H for the diagonal basis; the
 * receiver applies H for the diagonal basis and measures in the computational basis.
 * Amplitudes stay real, so the state is two doubles.
 */
public final class StateVectorChannelOracle implements ChannelOracle {
    private static final double INV_SQRT2 = Math.sqrt(0.5);
    // snaps probabilities that are 0 or 1 up to rounding error
    private static final double EPSILON = 1e-12;

    private final RandomSource rng;

    public StateVectorChannelOracle(RandomSource rng) {
        if (rng == null) throw new IllegalArgumentException("rng must not be null");
        this.rng = rng;
    }

    @Override
    public int measure(SentSymbol sent, Basis receiverBasis) {
        if (sent == null || receiverBasis == null) throw new IllegalArgumentException("sent and receiverBasis are required");
        double[] state = {1.0, 0.0};
        if (sent.bit() == 1) pauliX(state);
        if (sent.basis() == Basis.X) hadamard(state);
        if (receiverBasis == Basis.X) hadamard(state);
        return sample(state);
    }

    /** Probability of reading 0 from {@code state}, snapped to exactly 0 or 1 when within rounding. */
    static double probabilityOfZero(double[] state) {
        double p0 = state[0] * state[0];
        if (p0 < EPSILON) return 0.0;
        if (p0 > 1.0 - EPSILON) return 1.0;
        return p0;
    }

    private int sample(double[] state) {
        return rng.nextDouble() < probabilityOfZero(state) ? 0 : 1;
    }

    private static void pauliX(double[] state) {
        double tmp = state[0];
        state[0] = state[1];
        state[1] = tmp;
    }

    private static void hadamard(double[] state) {
        double a0 = state[0], a1 = state[1];
        state[0] = (a0 + a1) * INV_SQRT2;
        state[1] = (a0 - a1) * INV_SQRT2;
    }
}
