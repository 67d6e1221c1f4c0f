// File: Bb84Demo.java
package org.security.qkd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Console demo: runs one BB84 exchange and sends a message under the resulting key.
 * Failures are reported once on stderr; the logged stack traces are DEBUG only.
 * <pre>
 *   java org.security.qkd.Bb84Demo message=HELLO rounds=16 seed=42 verbose=true
 * </pre>
 */
public final class Bb84Demo {
    private static final Logger log = LoggerFactory.getLogger(Bb84Demo.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_ARGS = 2;
    public static final int EXIT_KEY_AGREEMENT_FAILED = 3;
    public static final int EXIT_DECODE_FAILED = 4;

    private static final String USAGE =
            "usage: Bb84Demo message=<text> [rounds=8] [seed=<long>] [retries=0] [verbose=false]";

    private Bb84Demo() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        SimulationConfig config;
        try {
            config = SimulationConfig.fromArgs(CliArgsParser.toMap(args));
        } catch (IllegalArgumentException ex) {
            log.debug("Invalid arguments", ex);
            err.println(ex.getMessage());
            err.println(USAGE);
            return EXIT_INVALID_ARGS;
        }
        if (config.isVerbose()) LoggingConfigurator.enableVerboseLogging();
        log.debug("Starting simulation with {}", config);

        try {
            SimulationReport report = Bb84Simulation.fromConfig(config).run(config.getMessage());
            out.print(report.format());
            out.println("Simulation complete!");
            return EXIT_OK;
        } catch (KeyAgreementException ex) {
            log.debug("Key agreement failed after {} attempt(s)", config.getRetries() + 1, ex);
            err.println(ex.getMessage());
            return EXIT_KEY_AGREEMENT_FAILED;
        } catch (MalformedBitLengthException ex) {
            log.debug("Decryption produced an undecodable bit sequence", ex);
            err.println(ex.getMessage());
            return EXIT_DECODE_FAILED;
        } catch (IllegalArgumentException ex) {
            log.debug("Rejected message", ex);
            err.println(ex.getMessage());
            return EXIT_INVALID_ARGS;
        }
    }
}
