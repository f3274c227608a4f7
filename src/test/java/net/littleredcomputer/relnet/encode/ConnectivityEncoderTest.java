package net.littleredcomputer.relnet.encode;

import net.littleredcomputer.relnet.cnf.DpllSolver;
import net.littleredcomputer.relnet.cnf.Formula;
import net.littleredcomputer.relnet.cnf.VariableAllocator;
import net.littleredcomputer.relnet.graph.Graph;
import net.littleredcomputer.relnet.graph.UnionFind;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

/**
 * The edge states are given free variables here, so that the connectivity
 * clauses can be checked under every assignment to them.
 */
public class ConnectivityEncoderTest {
    private static final DyadicProbability half = DyadicProbability.of(1, 1);

    private static boolean connected(Graph g, boolean[] up) {
        UnionFind uf = new UnionFind(g.nVertices());
        for (int i = 0; i < up.length; ++i) {
            if (up[i]) uf.union(g.edges().get(i).u(), g.edges().get(i).v());
        }
        int root = g.terminals().get(0);
        for (int t : g.terminals()) if (!uf.connected(root, t)) return false;
        return true;
    }

    /**
     * Checks the encoding of g against union-find under every assignment of
     * the variable edge states.
     * @param constants per edge: null for a variable state, else its constant value
     */
    private static void check(Graph g, Boolean[] constants, Polarity polarity) {
        VariableAllocator va = new VariableAllocator();
        List<EdgeState> states = new ArrayList<>();
        List<Integer> variableEdges = new ArrayList<>();
        for (int i = 0; i < g.nEdges(); ++i) {
            if (constants[i] == null) {
                states.add(EdgeState.variable(half, 0, va.next()));
                variableEdges.add(i);
            } else {
                states.add(EdgeState.constant(constants[i] ? DyadicProbability.ONE : DyadicProbability.ZERO));
            }
        }
        Formula.Builder b = Formula.builder();
        new ConnectivityEncoder(polarity).encode(g, states, va).forEach(b::addClause);
        DpllSolver solver = new DpllSolver(b.build(va.count()));
        final int n = variableEdges.size();
        for (int a = 0; a < 1 << n; ++a) {
            boolean[] up = new boolean[g.nEdges()];
            for (int i = 0; i < g.nEdges(); ++i) if (constants[i] != null) up[i] = constants[i];
            int[] assumptions = new int[n];
            for (int j = 0; j < n; ++j) {
                boolean bit = ((a >> j) & 1) != 0;
                up[variableEdges.get(j)] = bit;
                assumptions[j] = bit ? j + 1 : -(j + 1);
            }
            boolean expected = connected(g, up) == (polarity == Polarity.CONNECTED);
            assertThat(g + " " + polarity + " at " + a, solver.isSatisfiable(assumptions), is(expected));
        }
    }

    private static Boolean[] allVariable(Graph g) {
        return new Boolean[g.nEdges()];
    }

    @Test
    public void randomGraphs() {
        Random r = new Random(20180707);
        for (int trial = 0; trial < 150; ++trial) {
            int n = 2 + r.nextInt(5);
            int m = 1 + r.nextInt(8);
            Graph.Builder b = Graph.builder();
            Set<String> endpoints = new LinkedHashSet<>();
            for (int i = 0; i < m; ++i) {
                int u = r.nextInt(n);
                int v = (u + 1 + r.nextInt(n - 1)) % n;
                b.edge("v" + u, "v" + v, "0.5");
                endpoints.add("v" + u);
                endpoints.add("v" + v);
            }
            List<String> candidates = new ArrayList<>(endpoints);
            Collections.shuffle(candidates, r);
            int nTerminals = 2 + r.nextInt(Math.min(3, candidates.size() - 1));
            for (String t : candidates.subList(0, nTerminals)) b.terminal(t);
            Graph g = b.build();

            Boolean[] constants = new Boolean[g.nEdges()];
            for (int i = 0; i < constants.length; ++i) {
                int k = r.nextInt(10);
                constants[i] = k < 2 ? Boolean.FALSE : k < 4 ? Boolean.TRUE : null;
            }
            for (Polarity p : Polarity.values()) {
                check(g, constants, p);
                check(g, allVariable(g), p);
            }
        }
    }

    @Test
    public void cycleAwayFromRootDoesNotReachIt() {
        // s's only link is the first edge; t sits on a triangle.
        Graph g = Graph.builder().terminals("s", "t")
                .edge("s", "t", "0.5")
                .edge("t", "a", "0.5")
                .edge("a", "b", "0.5")
                .edge("b", "t", "0.5")
                .build();
        for (Polarity p : Polarity.values()) check(g, allVariable(g), p);

        VariableAllocator va = new VariableAllocator();
        List<EdgeState> states = new ArrayList<>();
        for (int i = 0; i < 4; ++i) states.add(EdgeState.variable(half, 0, va.next()));
        Formula.Builder b = Formula.builder();
        new ConnectivityEncoder(Polarity.CONNECTED).encode(g, states, va).forEach(b::addClause);
        DpllSolver solver = new DpllSolver(b.build(va.count()));
        assertThat(solver.isSatisfiable(-1, 2, 3, 4), is(false));
        assertThat(solver.isSatisfiable(1, -2, -3, -4), is(true));
    }

    @Test
    public void threeTerminals() {
        Graph g = Graph.builder().terminals("x", "y", "z")
                .edge("c", "x", "0.5")
                .edge("c", "y", "0.5")
                .edge("c", "z", "0.5")
                .edge("x", "y", "0.5")
                .build();
        for (Polarity p : Polarity.values()) check(g, allVariable(g), p);
    }

    @Test
    public void terminalsSeparatedByDeadEdge() {
        Graph g = Graph.builder().terminals("a", "c")
                .edge("a", "b", "0")
                .edge("b", "c", "0.5")
                .build();
        Boolean[] constants = {Boolean.FALSE, null};
        for (Polarity p : Polarity.values()) check(g, constants, p);
    }

    @Test
    public void edgeByEdgePath() {
        Graph.Builder b = Graph.builder().terminals("v0", "v7");
        for (int i = 0; i < 7; ++i) b.edge("v" + i, "v" + (i + 1), "0.5");
        Graph g = b.build();
        for (Polarity p : Polarity.values()) check(g, allVariable(g), p);
    }

    @Test(expected = IllegalArgumentException.class)
    public void stateCountMustMatch() {
        Graph g = Graph.builder().terminals("a", "b").edge("a", "b", "0.5").build();
        new ConnectivityEncoder(Polarity.CONNECTED).encode(g, new ArrayList<>(), new VariableAllocator());
    }
}
