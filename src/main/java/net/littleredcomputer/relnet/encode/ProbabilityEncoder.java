package net.littleredcomputer.relnet.encode;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.relnet.cnf.VariableAllocator;
import net.littleredcomputer.relnet.graph.Edge;
import net.littleredcomputer.relnet.graph.Graph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns each edge's survival probability into coin variables and a state
 * variable. An edge with probability k/2^m gets m coins c_1..c_m (c_1 most
 * significant) and a variable L defined by clauses equivalent to
 * L == (c_1..c_m < k), so exactly k of the 2^m coin assignments make the edge
 * up. Edges with probability 0 or 1 need no coins and no variable; their
 * state is a constant.
 * <p>
 * The coins of all edges are allocated first, in edge order, so they occupy
 * one block of variables starting wherever the allocator stands.
 */
public final class ProbabilityEncoder {
    private static final Logger log = LogManager.getFormatterLogger(ProbabilityEncoder.class);
    private final EncoderOptions options;

    public ProbabilityEncoder(EncoderOptions options) {
        this.options = options;
    }

    /** The output of {@link #encode}: one state per edge plus the clauses defining them. */
    public static final class Encoding {
        private final ImmutableList<EdgeState> edgeStates;
        private final ImmutableList<List<Integer>> clauses;
        private final int firstCoin;
        private final int nCoins;

        private Encoding(List<EdgeState> edgeStates, List<List<Integer>> clauses, int firstCoin, int nCoins) {
            this.edgeStates = ImmutableList.copyOf(edgeStates);
            this.clauses = ImmutableList.copyOf(clauses);
            this.firstCoin = firstCoin;
            this.nCoins = nCoins;
        }

        /** @return the state of each edge, in the graph's edge order */
        public ImmutableList<EdgeState> edgeStates() { return edgeStates; }
        public ImmutableList<List<Integer>> clauses() { return clauses; }

        /** @return the first coin variable; the coins are [firstCoin, firstCoin + nCoins) */
        public int firstCoin() { return firstCoin; }
        public int nCoins() { return nCoins; }
    }

    DyadicProbability dyadic(BigDecimal p) {
        if (!options.round()) return DyadicProbability.exact(p, options.maxBits());
        DyadicProbability d = DyadicProbability.rounded(p, options.maxBits());
        BigDecimal error = d.toBigDecimal().subtract(p).abs();
        if (error.signum() != 0) {
            log.warn("probability %s rounded to %s (%s), error %s",
                    p.toPlainString(), d, d.toBigDecimal().toPlainString(), error.toPlainString());
        }
        return d;
    }

    public Encoding encode(Graph g, VariableAllocator allocator) {
        List<DyadicProbability> ps = new ArrayList<>(g.nEdges());
        for (Edge e : g.edges()) ps.add(dyadic(e.probability()));

        final int firstCoin = allocator.block(0);
        int[] coins = new int[ps.size()];
        for (int i = 0; i < ps.size(); ++i) coins[i] = allocator.block(ps.get(i).bits());
        final int nCoins = allocator.count() - firstCoin + 1;

        List<EdgeState> states = new ArrayList<>(ps.size());
        List<List<Integer>> clauses = new ArrayList<>();
        int constants = 0;
        for (int i = 0; i < ps.size(); ++i) {
            DyadicProbability p = ps.get(i);
            if (p.bits() == 0) {
                states.add(EdgeState.constant(p));
                ++constants;
                continue;
            }
            int l = allocator.next();
            states.add(EdgeState.variable(p, coins[i], l));
            lessThan(l, coins[i], p, clauses);
        }
        log.debug("%d edges: %d coin variables, %d constant edges, %d clauses", ps.size(), nCoins, constants, clauses.size());
        return new Encoding(states, clauses, firstCoin, nCoins);
    }

    /**
     * Emits clauses for l == (the number spelled by the coins is less than k).
     * Every coin assignment either equals k or first differs from it at some
     * position i; each of those m+1 cases gets one clause fixing l, so the
     * clauses determine l from the coins.
     *
     * @param l the state variable
     * @param firstCoin most significant coin; the rest follow consecutively
     * @param p k/2^m
     * @param clauses destination
     */
    private static void lessThan(int l, int firstCoin, DyadicProbability p, List<List<Integer>> clauses) {
        final int m = p.bits();
        // prefix holds the negation of "coins[0..i) agree with k"
        List<Integer> prefix = new ArrayList<>(m);
        for (int i = 0; i < m; ++i) {
            final int c = firstCoin + i;
            List<Integer> clause = new ArrayList<>(m + 1);
            if (p.bit(i)) {
                // coin below k's bit here: the number is less than k
                clause.add(l);
                clause.addAll(prefix);
                clause.add(c);
            } else {
                // coin above k's bit here: the number exceeds k
                clause.add(-l);
                clause.addAll(prefix);
                clause.add(-c);
            }
            clauses.add(clause);
            prefix.add(p.bit(i) ? -c : c);
        }
        // every coin agrees with k: the number equals k
        List<Integer> equal = new ArrayList<>(m + 1);
        equal.add(-l);
        equal.addAll(prefix);
        clauses.add(equal);
    }
}
