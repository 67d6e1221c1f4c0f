// File: QkdException.java
package org.security.qkd;

/**
 * Base type for recoverable failures of a simulation run. Callers handle these by
 * starting a fresh run; nothing in the core retries on its own.
 */
public class QkdException extends Exception {
    public QkdException(String message) { super(message); }
}
