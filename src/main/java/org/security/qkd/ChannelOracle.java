// File: ChannelOracle.java
package org.security.qkd;

/**
 * Boundary to whatever executes the qubit: a simulator, hardware, or a scripted double.
 * <p>
 * Contract: when {@code receiverBasis == sent.basis()} the result is {@code sent.bit()}
 * with probability 1; otherwise it is 0 or 1 with probability 1/2 each, independent of
 * the sent bit. Called once per round and has no other effect.
 */
public interface ChannelOracle {

    int measure(SentSymbol sent, Basis receiverBasis);
}
