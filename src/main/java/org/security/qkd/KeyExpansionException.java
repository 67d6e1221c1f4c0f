// File: KeyExpansionException.java
package org.security.qkd;

/** Expansion was asked to stretch an empty sifted key. */
public class KeyExpansionException extends IllegalStateException {
    public KeyExpansionException(String message) { super(message); }
}
