package org.security.qkd;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class Bb84SimulationTest {

    @Test
    public void seededRunDecryptsMessage() throws Exception {
        SimulationConfig config = new SimulationConfig("HELLO BB84", 64, 42L, 0, false);

        SimulationReport report = Bb84Simulation.fromConfig(config).run(config.getMessage());

        assertEquals("HELLO BB84", report.getDecryptedMessage());
        assertEquals(80, report.getCipherBits().length);
        assertArrayEquals(KeyExpansion.expand(report.getSharedKey(), 80), report.getExpandedKey());
        assertEquals(64, report.getAgreement().getRoundCount());
        assertFalse(Arrays.equals(BitCodec.encode("HELLO BB84"), report.getCipherBits()));
        int ones = 0;
        for (int bit : report.getSharedKey()) ones += bit;
        assertTrue("shared key must mix 0s and 1s", ones > 0 && ones < report.getSharedKey().length);
    }

    @Test
    public void reportListsEveryStage() throws Exception {
        SimulationReport report = Bb84Simulation.fromConfig(new SimulationConfig("HI", 32, 1L, 0, false)).run("HI");

        String text = report.format();
        for (String label : new String[]{"Sender bits:", "Sender bases:", "Receiver bases:", "Receiver results:",
                "Shared key:", "Encrypted bits:", "Decrypted msg:"}) {
            assertTrue(label, text.contains(label));
        }
        assertTrue(text.contains(Bits.toString(report.getSharedKey())));
    }

    @Test
    public void retriesKeyAgreementWhenNothingSifts() throws Exception {
        // first round mismatched (Z vs X), second matched on bit 1
        RandomSource rng = new ScriptedRandomSource(0, 0, 1, 1, 0, 0);
        Bb84KeyAgreement agreement = new Bb84KeyAgreement(new ContractChannelOracle(new XofRandomSource(1)), rng);

        SimulationReport report = new Bb84Simulation(agreement, 1, 1).run("A");

        assertArrayEquals(new int[]{1}, report.getSharedKey());
        assertEquals("A", report.getDecryptedMessage());
    }

    @Test
    public void givesUpWithoutRetries() {
        RandomSource rng = new ScriptedRandomSource(0, 0, 1);
        Bb84KeyAgreement agreement = new Bb84KeyAgreement(new ContractChannelOracle(new XofRandomSource(1)), rng);

        assertThrows(KeyAgreementException.class, () -> new Bb84Simulation(agreement, 4, 0).run("A"));
    }

    @Test
    public void rejectsEmptyMessage() {
        Bb84Simulation simulation = Bb84Simulation.fromConfig(new SimulationConfig("x", 8, 1L, 0, false));
        assertThrows(IllegalArgumentException.class, () -> simulation.run(""));
    }
}
