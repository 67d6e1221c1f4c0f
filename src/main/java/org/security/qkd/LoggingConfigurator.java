// File: LoggingConfigurator.java
package org.security.qkd;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Raises the root log level at runtime for {@code verbose=true}. Logback only. */
public final class LoggingConfigurator {
    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {}

    public static void enableVerboseLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ch.qos.logback.classic.Logger root = ((LoggerContext) factory).getLogger(Logger.ROOT_LOGGER_NAME);
            if (!Level.DEBUG.equals(root.getLevel())) root.setLevel(Level.DEBUG);
            return;
        }
        log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
                factory.getClass().getName());
    }
}
