package net.littleredcomputer.relnet.encode;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import net.littleredcomputer.relnet.cnf.Formula;
import net.littleredcomputer.relnet.cnf.VariableAllocator;
import net.littleredcomputer.relnet.graph.Graph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Reduces a reliability instance to projected model counting. The resulting
 * formula's variables are numbered
 * <ol>
 *     <li>coin variables, edge by edge: these, and only these, form the sampling set;</li>
 *     <li>edge state variables, one per edge whose probability is neither 0 nor 1;</li>
 *     <li>auxiliary variables of the connectivity encoding.</li>
 * </ol>
 * Under a uniformly random assignment to the sampling set, the formula is
 * satisfiable with the probability that the terminals are connected
 * ({@link Polarity#CONNECTED}) or disconnected ({@link Polarity#DISCONNECTED}).
 */
public final class ReliabilityEncoder {
    private static final Logger log = LogManager.getFormatterLogger(ReliabilityEncoder.class);
    private final EncoderOptions options;

    public ReliabilityEncoder(@Nonnull EncoderOptions options) {
        this.options = options;
    }

    public ReliabilityEncoder() {
        this(EncoderOptions.defaults());
    }

    public EncoderOptions options() {
        return options;
    }

    public Formula encode(Graph g) {
        VariableAllocator allocator = new VariableAllocator();
        ProbabilityEncoder.Encoding pe = new ProbabilityEncoder(options).encode(g, allocator);
        if (pe.firstCoin() != 1) throw new IllegalStateException("coin variables must come first");
        List<List<Integer>> connectivity = new ConnectivityEncoder(options.polarity()).encode(g, pe.edgeStates(), allocator);

        Formula.Builder b = Formula.builder();
        pe.clauses().forEach(b::addClause);
        connectivity.forEach(b::addClause);
        if (pe.nCoins() > 0) {
            b.samplingSet(ContiguousSet.create(Range.closedOpen(1, 1 + pe.nCoins()), DiscreteDomain.integers()));
        }
        Formula f = b.build(allocator.count());
        checkNoOrphans(f);
        log.debug("%s: %s (%d probability clauses, %d connectivity clauses)",
                g, f, pe.clauses().size(), connectivity.size());
        return f;
    }

    /** Every variable must occur in some clause or in the sampling set. */
    private static void checkNoOrphans(Formula f) {
        boolean[] used = new boolean[f.nVariables() + 1];
        for (List<Integer> c : f.clauses()) for (int l : c) used[Math.abs(l)] = true;
        for (int v : f.samplingSet()) used[v] = true;
        for (int v = 1; v <= f.nVariables(); ++v) {
            if (!used[v]) throw new IllegalStateException("variable " + v + " occurs nowhere");
        }
    }
}
