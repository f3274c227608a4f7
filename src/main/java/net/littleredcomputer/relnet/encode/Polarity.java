package net.littleredcomputer.relnet.encode;

import java.math.BigDecimal;

/**
 * Which event the satisfying assignments of an encoded formula stand for.
 * The fraction of sampling-set assignments that satisfy the formula is the
 * probability of that event.
 */
public enum Polarity {
    /**
     * Satisfied exactly when the terminals are connected: the count measures reliability.
     * The reachability circuit has a layer per vertex of the root's component, so the
     * encoding grows as |V|(|V| + |E|).
     */
    CONNECTED,
    /**
     * Satisfied exactly when the terminals are disconnected: the count measures unreliability.
     * One marking variable per vertex and two clauses per edge.
     */
    DISCONNECTED;

    /**
     * @param satisfyingFraction satisfying assignments over all assignments of the sampling set
     * @return the probability that the terminals stay connected
     */
    public BigDecimal reliability(BigDecimal satisfyingFraction) {
        return this == CONNECTED ? satisfyingFraction : BigDecimal.ONE.subtract(satisfyingFraction);
    }

    public static Polarity fromName(String name) {
        switch (name.toLowerCase()) {
            case "connected": return CONNECTED;
            case "disconnected": return DISCONNECTED;
            default: throw new IllegalArgumentException("unknown polarity: " + name);
        }
    }
}
