package net.littleredcomputer.relnet.graph;

import net.littleredcomputer.relnet.ProbabilityException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An undirected edge between two distinct vertices (given by their index in
 * the owning {@link Graph}) which is up with the given probability.
 */
public final class Edge {
    private final int u;
    private final int v;
    private final BigDecimal probability;

    Edge(int u, int v, BigDecimal probability) {
        if (u == v) throw new IllegalArgumentException("self-loop at vertex " + u);
        checkProbability(probability);
        this.u = u;
        this.v = v;
        this.probability = probability;
    }

    static void checkProbability(BigDecimal p) {
        if (p.signum() < 0 || p.compareTo(BigDecimal.ONE) > 0) {
            throw new ProbabilityException("probability " + p.toPlainString() + " is outside [0, 1]");
        }
    }

    public int u() { return u; }
    public int v() { return v; }

    /** @return the probability that this edge survives (is "up") */
    public BigDecimal probability() { return probability; }

    /**
     * @param w an endpoint of this edge
     * @return the other endpoint
     */
    public int other(int w) {
        if (w == u) return v;
        if (w == v) return u;
        throw new IllegalArgumentException("vertex " + w + " is not an endpoint of " + this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return u == edge.u && v == edge.v && probability.compareTo(edge.probability) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(u, v, probability.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "(" + u + "," + v + ")@" + probability.toPlainString();
    }
}
