package net.littleredcomputer.relnet.encode;

import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.relnet.cnf.Circuit;
import net.littleredcomputer.relnet.cnf.VariableAllocator;
import net.littleredcomputer.relnet.graph.Edge;
import net.littleredcomputer.relnet.graph.Graph;
import net.littleredcomputer.relnet.graph.UnionFind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Produces clauses over the edge states which, for any fixed assignment to
 * the states, are satisfiable exactly when the terminals are connected by up
 * edges ({@link Polarity#CONNECTED}) or exactly when they are not
 * ({@link Polarity#DISCONNECTED}).
 */
public final class ConnectivityEncoder {
    private static final Logger log = LogManager.getFormatterLogger(ConnectivityEncoder.class);
    private final Polarity polarity;

    public ConnectivityEncoder(Polarity polarity) {
        this.polarity = polarity;
    }

    /**
     * @param g the graph
     * @param states state of each edge, in edge order
     * @param allocator source of auxiliary variables
     * @return the clauses, in a deterministic order
     */
    public ImmutableList<List<Integer>> encode(Graph g, List<EdgeState> states, VariableAllocator allocator) {
        if (states.size() != g.nEdges()) {
            throw new IllegalArgumentException(states.size() + " edge states for " + g.nEdges() + " edges");
        }
        List<List<Integer>> clauses = new ArrayList<>();
        final int before = allocator.count();
        switch (polarity) {
            case CONNECTED:
                reachability(g, states, allocator, clauses);
                break;
            case DISCONNECTED:
                cut(g, states, allocator, clauses);
                break;
        }
        log.debug("%s: %d auxiliary variables, %d clauses", polarity, allocator.count() - before, clauses.size());
        return ImmutableList.copyOf(clauses);
    }

    /**
     * Builds the circuit R_t for each terminal t, where R_v^0 holds only at the
     * root (the first terminal) and
     * <pre>
     *   R_v^{d+1} = R_v^d | OR over edges e = (u, v) of (up(e) &amp; R_u^d)
     * </pre>
     * and R_v is the last layer. Each gate is justified only by the layer below
     * it, so a cycle of up edges cannot make its vertices reachable on its own.
     * A shortest path has at most as many edges as the root's component has
     * vertices, less one, which bounds the number of layers; construction also
     * stops at the first layer identical to its predecessor.
     */
    private void reachability(Graph g, List<EdgeState> states, VariableAllocator allocator, List<List<Integer>> clauses) {
        final int n = g.nVertices();
        final int root = g.terminals().get(0);
        Circuit c = new Circuit();
        int[] up = new int[states.size()];
        for (int i = 0; i < up.length; ++i) up[i] = states.get(i).in(c);

        // Vertices that some assignment could connect to the root.
        UnionFind possible = new UnionFind(n);
        for (int i = 0; i < up.length; ++i) {
            Edge e = g.edges().get(i);
            if (up[i] != Circuit.FALSE) possible.union(e.u(), e.v());
        }
        for (int t : g.terminals()) {
            if (!possible.connected(root, t)) {
                log.debug("terminal %s can never reach %s", g.vertexName(t), g.vertexName(root));
                c.assertTrue(Circuit.FALSE, allocator, clauses::add);
                return;
            }
        }

        List<TIntArrayList> incident = new ArrayList<>(n);
        for (int v = 0; v < n; ++v) incident.add(new TIntArrayList());
        for (int i = 0; i < up.length; ++i) {
            if (up[i] == Circuit.FALSE) continue;
            Edge e = g.edges().get(i);
            incident.get(e.u()).add(i);
            incident.get(e.v()).add(i);
        }

        int[] reach = new int[n];
        Arrays.fill(reach, Circuit.FALSE);
        reach[root] = Circuit.TRUE;
        final int maxLayers = possible.sizeOf(root) - 1;
        int layers = 0;
        while (layers < maxLayers) {
            int[] next = new int[n];
            boolean changed = false;
            for (int v = 0; v < n; ++v) {
                TIntArrayList terms = new TIntArrayList();
                terms.add(reach[v]);
                TIntArrayList es = incident.get(v);
                for (int j = 0; j < es.size(); ++j) {
                    int e = es.get(j);
                    terms.add(c.and(up[e], reach[g.edges().get(e).other(v)]));
                }
                next[v] = c.or(terms);
                if (next[v] != reach[v]) changed = true;
            }
            reach = next;
            ++layers;
            if (!changed) break;
        }

        TIntArrayList goal = new TIntArrayList();
        for (int t : g.terminals()) goal.add(reach[t]);
        log.debug("reachability circuit: %d layers, %d gates", layers, c.size());
        c.assertTrue(c.and(goal), allocator, clauses::add);
    }

    /**
     * Marks each vertex, requires the marks to agree across every up edge, and
     * requires the terminals not to be marked alike. Such a marking exists
     * exactly when some component of the up edges holds some but not all of
     * the terminals.
     */
    private void cut(Graph g, List<EdgeState> states, VariableAllocator allocator, List<List<Integer>> clauses) {
        int[] mark = new int[g.nVertices()];
        List<Integer> terminals = g.terminals();
        if (terminals.size() == 2) {
            // Either side may be the marked one; fix it.
            clauses.add(ImmutableList.of(marking(mark, terminals.get(0), allocator)));
            clauses.add(ImmutableList.of(-marking(mark, terminals.get(1), allocator)));
        } else {
            List<Integer> some = new ArrayList<>();
            List<Integer> notAll = new ArrayList<>();
            for (int t : terminals) {
                int x = marking(mark, t, allocator);
                some.add(x);
                notAll.add(-x);
            }
            clauses.add(some);
            clauses.add(notAll);
        }
        for (int i = 0; i < states.size(); ++i) {
            EdgeState s = states.get(i);
            if (s.isConstant() && !s.value()) continue;
            Edge e = g.edges().get(i);
            int xu = marking(mark, e.u(), allocator);
            int xv = marking(mark, e.v(), allocator);
            if (s.isConstant()) {
                clauses.add(ImmutableList.of(-xu, xv));
                clauses.add(ImmutableList.of(xu, -xv));
            } else {
                clauses.add(ImmutableList.of(-xu, -s.literal(), xv));
                clauses.add(ImmutableList.of(xu, -s.literal(), -xv));
            }
        }
    }

    private static int marking(int[] mark, int v, VariableAllocator allocator) {
        if (mark[v] == 0) mark[v] = allocator.next();
        return mark[v];
    }
}
