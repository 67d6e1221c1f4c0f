package org.security.qkd;

import org.junit.Test;

import static org.junit.Assert.*;

public class StateVectorChannelOracleTest {

    @Test
    public void matchedBasisReturnsSentBit() {
        StateVectorChannelOracle oracle = new StateVectorChannelOracle(new XofRandomSource(11));
        for (Basis basis : Basis.values()) {
            for (int bit = 0; bit <= 1; bit++) {
                for (int i = 0; i < 1_000; i++) {
                    assertEquals(basis + "/" + bit, bit, oracle.measure(new SentSymbol(bit, basis), basis));
                }
            }
        }
    }

    @Test
    public void mismatchedBasisIsFairCoin() {
        StateVectorChannelOracle oracle = new StateVectorChannelOracle(new XofRandomSource(2024));
        int trials = 100_000;
        int[] zeros = new int[2];
        for (int i = 0; i < trials; i++) {
            int bit = i & 1;
            Basis sender = (i & 2) == 0 ? Basis.Z : Basis.X;
            Basis receiver = sender == Basis.Z ? Basis.X : Basis.Z;
            if (oracle.measure(new SentSymbol(bit, sender), receiver) == 0) zeros[bit]++;
        }
        assertEquals(0.5, (zeros[0] + zeros[1]) / (double) trials, 0.01);
        // independent of the sent bit
        assertEquals(0.5, zeros[0] / (trials / 2.0), 0.015);
        assertEquals(0.5, zeros[1] / (trials / 2.0), 0.015);
    }

    @Test
    public void probabilityOfZeroSnapsRoundingNoise() {
        assertEquals(1.0, StateVectorChannelOracle.probabilityOfZero(new double[]{1.0000000000000002, 0.0}), 0.0);
        assertEquals(0.0, StateVectorChannelOracle.probabilityOfZero(new double[]{1e-17, 1.0}), 0.0);
        assertEquals(0.5, StateVectorChannelOracle.probabilityOfZero(new double[]{Math.sqrt(0.5), Math.sqrt(0.5)}), 1e-12);
    }

    @Test
    public void rejectsMissingArguments() {
        StateVectorChannelOracle oracle = new StateVectorChannelOracle(new XofRandomSource(1));
        assertThrows(IllegalArgumentException.class, () -> oracle.measure(null, Basis.Z));
        assertThrows(IllegalArgumentException.class, () -> oracle.measure(new SentSymbol(0, Basis.Z), null));
        assertThrows(IllegalArgumentException.class, () -> new StateVectorChannelOracle(null));
    }
}
