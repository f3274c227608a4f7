package net.littleredcomputer.relnet.cnf;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;
import com.google.common.primitives.Ints;

import javax.annotation.CheckReturnValue;
import java.util.*;
import java.util.function.Consumer;

/**
 * An and-inverter graph held in an arena of gates indexed by integer id.
 * <p>
 * A reference to a gate is its id, or the negated id for its complement, so
 * negation is free. Gate 1 is the constant {@link #TRUE}; {@link #FALSE} is its
 * complement. Input gates stand for literals of the formula under
 * construction. Constants are folded as gates are built and structurally equal
 * gates are shared, so a constant is never the input of another gate.
 * <p>
 * {@link #assertTrue} turns the cone of a gate into clauses by the Tseitin
 * transformation: one fresh variable per and-gate, defined to be equivalent to
 * the conjunction of its inputs.
 */
public final class Circuit {
    public static final int TRUE = 1;
    public static final int FALSE = -1;

    // Indexed by gate id; slot 0 is unused. A gate with a non-zero literal is an input.
    private final List<int[]> inputs = new ArrayList<>();
    private final TIntArrayList literal = new TIntArrayList();
    private final Map<Integer, Integer> inputGate = new HashMap<>();
    private final Map<List<Integer>, Integer> andGate = new HashMap<>();

    public Circuit() {
        inputs.add(null);
        literal.add(0);
        inputs.add(new int[0]);  // the constant
        literal.add(0);
    }

    /** @return the number of gates, including the constant */
    public int size() {
        return inputs.size() - 1;
    }

    public static boolean isConstant(int ref) {
        return ref == TRUE || ref == FALSE;
    }

    public static int constant(boolean b) {
        return b ? TRUE : FALSE;
    }

    @CheckReturnValue
    public static int not(int ref) {
        return -ref;
    }

    /**
     * @param l a (non-zero) literal of the formula
     * @return a reference evaluating to l
     */
    @CheckReturnValue
    public int input(int l) {
        if (l == 0) throw new IllegalArgumentException("0 is not a literal");
        if (l < 0) return -input(-l);
        return inputGate.computeIfAbsent(l, v -> newGate(new int[0], v));
    }

    @CheckReturnValue
    public int and(int... refs) {
        Set<Integer> distinct = new LinkedHashSet<>();
        for (int r : refs) {
            checkRef(r);
            if (r == FALSE || distinct.contains(-r)) return FALSE;
            if (r != TRUE) distinct.add(r);
        }
        if (distinct.isEmpty()) return TRUE;
        if (distinct.size() == 1) return distinct.iterator().next();
        int[] ins = Ints.toArray(distinct);
        List<Integer> key = new ArrayList<>(distinct);
        Collections.sort(key);
        return andGate.computeIfAbsent(key, k -> newGate(ins, 0));
    }

    @CheckReturnValue
    public int and(TIntArrayList refs) {
        return and(refs.toArray());
    }

    @CheckReturnValue
    public int or(int... refs) {
        int[] negated = new int[refs.length];
        for (int i = 0; i < refs.length; ++i) negated[i] = -refs[i];
        return -and(negated);
    }

    @CheckReturnValue
    public int or(TIntArrayList refs) {
        return or(refs.toArray());
    }

    private int newGate(int[] ins, int l) {
        inputs.add(ins);
        literal.add(l);
        return inputs.size() - 1;
    }

    private void checkRef(int r) {
        if (r == 0 || Math.abs(r) >= inputs.size()) throw new IllegalArgumentException("no such gate: " + r);
    }

    /**
     * @param root a gate
     * @return the non-constant gates reachable from root, each after all of its inputs
     */
    private TIntArrayList cone(int root) {
        TIntArrayList order = new TIntArrayList();
        if (isConstant(root)) return order;
        boolean[] seen = new boolean[inputs.size()];
        TIntStack stack = new TIntArrayStack();
        // Positive entries are gates to visit; negative ones are gates whose inputs are all done.
        stack.push(Math.abs(root));
        while (stack.size() > 0) {
            int g = stack.pop();
            if (g < 0) {
                order.add(-g);
                continue;
            }
            if (seen[g]) continue;
            seen[g] = true;
            stack.push(-g);
            int[] ins = inputs.get(g);
            for (int i = ins.length - 1; i >= 0; --i) {
                if (!seen[Math.abs(ins[i])]) stack.push(Math.abs(ins[i]));
            }
        }
        return order;
    }

    /**
     * Evaluates a gate under an assignment to the formula variables its inputs refer to.
     * @param root the gate
     * @param p p[v-1] gives the value of variable v
     * @return the value of the gate
     */
    public boolean evaluate(int root, boolean[] p) {
        if (isConstant(root)) return root == TRUE;
        boolean[] value = new boolean[inputs.size()];
        TIntArrayList order = cone(root);
        for (int i = 0; i < order.size(); ++i) {
            int g = order.get(i);
            int l = literal.get(g);
            if (l != 0) {
                value[g] = p[l - 1];
            } else {
                boolean v = true;
                for (int in : inputs.get(g)) v &= (in > 0) == value[Math.abs(in)];
                value[g] = v;
            }
        }
        return (root > 0) == value[Math.abs(root)];
    }

    /**
     * Emits clauses satisfiable exactly when root evaluates to true, allocating
     * one variable per and-gate in the cone of root (inputs first). A constant
     * false root yields a contradiction on a fresh variable; a constant true
     * root yields nothing.
     * @param root the gate to assert
     * @param allocator source of the gate variables
     * @param clauses receives the clauses, in a deterministic order
     */
    public void assertTrue(int root, VariableAllocator allocator, Consumer<List<Integer>> clauses) {
        checkRef(root);
        if (root == TRUE) return;
        if (root == FALSE) {
            int f = allocator.next();
            clauses.accept(Collections.singletonList(f));
            clauses.accept(Collections.singletonList(-f));
            return;
        }
        int[] var = new int[inputs.size()];
        TIntArrayList order = cone(root);
        for (int i = 0; i < order.size(); ++i) {
            int g = order.get(i);
            int l = literal.get(g);
            if (l != 0) {
                var[g] = l;
                continue;
            }
            int v = allocator.next();
            var[g] = v;
            int[] ins = inputs.get(g);
            List<Integer> definition = new ArrayList<>(ins.length + 1);
            definition.add(v);
            for (int in : ins) {
                int x = in > 0 ? var[in] : -var[-in];
                clauses.accept(Arrays.asList(-v, x));
                definition.add(-x);
            }
            clauses.accept(definition);
        }
        clauses.accept(Collections.singletonList(root > 0 ? var[root] : -var[-root]));
    }
}
