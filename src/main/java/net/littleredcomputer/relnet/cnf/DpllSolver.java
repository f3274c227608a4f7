package net.littleredcomputer.relnet.cnf;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A small backtracking satisfiability checker (unit propagation plus
 * chronological backtracking) for deciding formulas under assumptions. It is
 * meant for the modest formulas an exact count can afford, not for hard
 * instances.
 * <p>
 * Internally literals use the [2v|2v+1] encoding of TAOCP 7.2.2.2 (57).
 */
public final class DpllSolver {
    private final int nVariables;
    private final int[][] clauses;
    private final byte[] value;  // by variable: 0 unknown, 1 true, -1 false
    private final TIntArrayList trail = new TIntArrayList();
    private long nodeCount;

    public DpllSolver(Formula f) {
        nVariables = f.nVariables();
        clauses = new int[f.nClauses()][];
        for (int i = 0; i < clauses.length; ++i) {
            List<Integer> c = f.getClause(i);
            clauses[i] = new int[c.size()];
            for (int j = 0; j < c.size(); ++j) clauses[i][j] = encodeLiteral(c.get(j));
        }
        value = new byte[nVariables + 1];
    }

    static int encodeLiteral(int l) {
        return l > 0 ? 2 * l : -2 * l + 1;
    }

    /** @return the number of search nodes visited over the life of this solver */
    public long nodeCount() {
        return nodeCount;
    }

    /**
     * @param assumptions DIMACS literals to hold during the search
     * @return a satisfying assignment (element v-1 giving variable v) extending the
     * assumptions, or empty if there is none
     */
    public Optional<boolean[]> solve(int... assumptions) {
        trail.resetQuick();
        Arrays.fill(value, (byte) 0);
        for (int a : assumptions) {
            if (a == 0 || a > nVariables || a < -nVariables) throw new IllegalArgumentException("assumption " + a + " out of bounds");
            int l = encodeLiteral(a);
            int v = valueOf(l);
            if (v < 0) return Optional.empty();  // contradictory assumptions
            if (v == 0) assign(l);
        }
        if (!search()) return Optional.empty();
        boolean[] solution = new boolean[nVariables];
        for (int v = 1; v <= nVariables; ++v) solution[v - 1] = value[v] > 0;
        return Optional.of(solution);
    }

    public boolean isSatisfiable(int... assumptions) {
        return solve(assumptions).isPresent();
    }

    private int valueOf(int l) {
        int v = value[l >> 1];
        return (l & 1) == 0 ? v : -v;
    }

    private void assign(int l) {
        value[l >> 1] = (byte) ((l & 1) == 0 ? 1 : -1);
        trail.add(l >> 1);
    }

    private void undo(int mark) {
        while (trail.size() > mark) value[trail.removeAt(trail.size() - 1)] = 0;
    }

    /** @return false if some clause is falsified */
    private boolean propagate() {
        boolean changed = true;
        while (changed) {
            changed = false;
            CLAUSE:
            for (int[] c : clauses) {
                int unassigned = 0;
                int last = 0;
                for (int l : c) {
                    int v = valueOf(l);
                    if (v > 0) continue CLAUSE;
                    if (v == 0) {
                        ++unassigned;
                        last = l;
                    }
                }
                if (unassigned == 0) return false;
                if (unassigned == 1) {
                    assign(last);
                    changed = true;
                }
            }
        }
        return true;
    }

    /**
     * Depth-first search over the variables in index order, trying true before
     * false. Level d of the search holds the decision variable, the trail
     * length before it was set, and whether its second value is in play.
     */
    private boolean search() {
        final int base = trail.size();
        final int[] decision = new int[nVariables + 1];
        final int[] mark = new int[nVariables + 1];
        final boolean[] flipped = new boolean[nVariables + 1];
        int d = 0;
        while (true) {
            ++nodeCount;
            if (propagate()) {
                // Every variable below the current decision was set before it.
                int v = d == 0 ? 1 : decision[d] + 1;
                while (v <= nVariables && value[v] != 0) ++v;
                if (v > nVariables) return true;
                ++d;
                decision[d] = v;
                mark[d] = trail.size();
                flipped[d] = false;
                assign(2 * v);
                continue;
            }
            // Backtrack.
            while (d > 0 && flipped[d]) --d;
            if (d == 0) {
                undo(base);
                return false;
            }
            undo(mark[d]);
            flipped[d] = true;
            assign(2 * decision[d] + 1);
        }
    }
}
