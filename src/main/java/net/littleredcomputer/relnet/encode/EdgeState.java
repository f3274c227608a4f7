package net.littleredcomputer.relnet.encode;

import net.littleredcomputer.relnet.cnf.Circuit;

/**
 * Whether an edge is up, as seen by the connectivity encoder: either a
 * constant (the edge never or always survives, and has no coins) or a literal
 * defined by the edge's coin variables.
 */
public final class EdgeState {
    private final DyadicProbability probability;
    private final int firstCoin;
    private final int literal;

    private EdgeState(DyadicProbability probability, int firstCoin, int literal) {
        this.probability = probability;
        this.firstCoin = firstCoin;
        this.literal = literal;
    }

    static EdgeState constant(DyadicProbability p) {
        if (p.bits() != 0) throw new IllegalArgumentException(p + " is not constant");
        return new EdgeState(p, 0, 0);
    }

    static EdgeState variable(DyadicProbability p, int firstCoin, int literal) {
        if (p.bits() == 0) throw new IllegalArgumentException(p + " needs no coins");
        return new EdgeState(p, firstCoin, literal);
    }

    public DyadicProbability probability() { return probability; }

    public boolean isConstant() { return literal == 0; }

    /** @return the constant value of the edge state; only meaningful if {@link #isConstant()} */
    public boolean value() { return probability.isOne(); }

    /** @return the variable that is true exactly when the edge is up, or 0 for a constant state */
    public int literal() { return literal; }

    /** @return the first of {@link #nCoins()} consecutive coin variables, or 0 if there are none */
    public int firstCoin() { return firstCoin; }
    public int nCoins() { return probability.bits(); }

    /** @return a reference to this state in the given circuit */
    public int in(Circuit c) {
        return isConstant() ? Circuit.constant(value()) : c.input(literal);
    }

    @Override
    public String toString() {
        return isConstant() ? "EdgeState(" + value() + ")"
                : String.format("EdgeState(%d <- coins %d..%d, %s)", literal, firstCoin, firstCoin + nCoins() - 1, probability);
    }
}
