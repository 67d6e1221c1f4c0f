// File: SimulationConfig.java
package org.security.qkd;

import java.util.Map;
import java.util.Set;

/**
 * Immutable settings for one demo run, built from {@code key=value} arguments.
 * <pre>
 *   message=&lt;text&gt;   required
 *   rounds=&lt;n&gt;       1..100000, default 8
 *   seed=&lt;long&gt;      optional; selects the reproducible XOF source
 *   retries=&lt;n&gt;      0..10, default 0
 *   verbose=true|false
 * </pre>
 */
public final class SimulationConfig {
    public static final int MAX_ROUNDS = 100_000;
    public static final int MAX_RETRIES = 10;
    private static final Set<String> KNOWN_KEYS = Set.of("message", "rounds", "seed", "retries", "verbose");

    private final String message;
    private final int rounds;
    private final Long seed;
    private final int retries;
    private final boolean verbose;

    public SimulationConfig(String message, int rounds, Long seed, int retries, boolean verbose) {
        if (message == null || message.isEmpty()) throw new IllegalArgumentException("Enter a message to send (message=...)");
        this.message = message;
        this.rounds = requireRange("rounds", rounds, 1, MAX_ROUNDS);
        this.seed = seed;
        this.retries = requireRange("retries", retries, 0, MAX_RETRIES);
        this.verbose = verbose;
    }

    public static SimulationConfig fromArgs(Map<String, String> args) {
        for (String key : args.keySet()) {
            if (!KNOWN_KEYS.contains(key)) throw new IllegalArgumentException("unknown argument: " + key);
        }
        String message = args.get("message");
        int rounds = parseInt("rounds", args.getOrDefault("rounds", String.valueOf(Bb84KeyAgreement.DEFAULT_ROUNDS)));
        Long seed = args.containsKey("seed") ? parseLong("seed", args.get("seed")) : null;
        int retries = parseInt("retries", args.getOrDefault("retries", "0"));
        boolean verbose = parseBoolean("verbose", args.getOrDefault("verbose", "false"));
        return new SimulationConfig(message, rounds, seed, retries, verbose);
    }

    public String getMessage() { return message; }
    public int getRounds() { return rounds; }
    public Long getSeed() { return seed; }
    public boolean isSeeded() { return seed != null; }
    public int getRetries() { return retries; }
    public boolean isVerbose() { return verbose; }

    /** Seeded runs get the XOF source so they can be replayed; otherwise the CSPRNG. */
    public RandomSource newRandomSource() {
        return seed != null ? new XofRandomSource(seed) : new SecureRandomSource();
    }

    private static int requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max + " (was " + value + ")");
        }
        return value;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer (was '" + value + "')", ex);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be a long integer (was '" + value + "')", ex);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException(name + " must be true or false (was '" + value + "')");
    }

    @Override
    public String toString() {
        return "SimulationConfig{rounds=" + rounds + ", seeded=" + isSeeded() + ", retries=" + retries
                + ", verbose=" + verbose + ", messageLength=" + message.length() + '}';
    }
}
