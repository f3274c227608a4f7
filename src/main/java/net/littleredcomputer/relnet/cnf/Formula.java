package net.littleredcomputer.relnet.cnf;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A CNF formula over the variables [1, n], together with the sampling set: the
 * variables a model counter should project onto. Literals are DIMACS-style
 * signed integers. Instances are immutable; use {@link Builder} to make one.
 */
public final class Formula {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.onPattern("\\s").trimResults().omitEmptyStrings();
    private final static Joiner spaceJoiner = Joiner.on(' ');
    private final static int samplingVariablesPerLine = 10;

    private final int nVariables;
    private final ImmutableList<ImmutableList<Integer>> clauses;
    private final ImmutableList<Integer> samplingSet;
    private final int nLiterals;

    private Formula(int nVariables, List<ImmutableList<Integer>> clauses, List<Integer> samplingSet) {
        this.nVariables = nVariables;
        this.clauses = ImmutableList.copyOf(clauses);
        this.samplingSet = ImmutableList.copyOf(samplingSet);
        int n = 0;
        for (List<Integer> c : clauses) n += c.size();
        this.nLiterals = n;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int nVariables() { return nVariables; }
    public int nClauses() { return clauses.size(); }
    public int nLiterals() { return nLiterals; }

    public ImmutableList<ImmutableList<Integer>> clauses() { return clauses; }
    public ImmutableList<Integer> getClause(int i) { return clauses.get(i); }

    /** @return the projection variables, in increasing order */
    public ImmutableList<Integer> samplingSet() { return samplingSet; }

    /**
     * Evaluate the boolean function represented by the formula's clauses at the specified point
     * @param p point (i.e., vector of booleans, p[v-1] giving the value of variable v) at which to evaluate
     * @return the truth value of this formula at p
     */
    public boolean evaluate(boolean[] p) {
        if (p.length < nVariables) throw new IllegalArgumentException("assignment covers " + p.length + " of " + nVariables + " variables");
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (p[Math.abs(literal) - 1] == (literal > 0)) continue CLAUSE;
            }
            return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;
    }

    /**
     * Writes the formula in DIMACS CNF. The sampling set follows the header as
     * {@code c ind} lines (as ApproxMC expects), and is written even when it is
     * empty, so that a counter never projects over the whole variable set.
     * @param p destination
     * @param comments lines to emit as comments ahead of the header
     */
    public void write(PrintStream p, String... comments) {
        for (String c : comments) p.print("c " + c + '\n');
        p.print("p cnf " + nVariables + ' ' + clauses.size() + '\n');
        if (samplingSet.isEmpty()) {
            p.print("c ind 0\n");
        } else {
            for (List<Integer> line : Iterables.partition(samplingSet, samplingVariablesPerLine)) {
                p.print("c ind " + spaceJoiner.join(line) + " 0\n");
            }
        }
        for (List<Integer> clause : clauses) p.print(spaceJoiner.join(clause) + " 0\n");
        p.flush();
    }

    public String toDimacs(String... comments) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream p = new PrintStream(bytes, false, StandardCharsets.UTF_8)) {
            write(p, comments);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    public static Formula parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Reads DIMACS CNF, honoring {@code c ind} lines as the sampling set.
     * Clauses may span lines; every clause must be terminated by 0.
     */
    public static Formula parseFrom(Reader r) {
        List<Integer> literals = new ArrayList<>();
        List<Integer> ind = new ArrayList<>();
        Builder b = new Builder();
        int nVar = -1;
        int nClause = -1;
        Iterator<String> ls = new BufferedReader(r).lines().iterator();
        while (ls.hasNext()) {
            String line = ls.next();
            if (line.startsWith("c ind ")) {
                for (String f : splitter.split(line.substring("c ind ".length()))) {
                    int v = Integer.parseInt(f);
                    if (v == 0) break;
                    ind.add(v);
                }
                continue;
            }
            if (line.startsWith("c")) continue;
            if (nVar < 0) {
                Matcher m = pLineRe.matcher(line);
                if (!m.matches()) throw new IllegalArgumentException("invalid p line");
                nVar = Integer.parseInt(m.group(1));
                nClause = Integer.parseInt(m.group(2));
                continue;
            }
            for (String f : splitter.split(line)) {
                int l = Integer.parseInt(f);
                if (l == 0) {
                    if (literals.isEmpty())
                        throw new IllegalArgumentException("Empty clause, so problem is trivially unsatisfiable");
                    b.addClause(literals);
                    literals.clear();
                } else {
                    if (l > nVar || l < -nVar) throw new IllegalArgumentException("literal out of declared bounds");
                    literals.add(l);
                }
            }
        }
        if (nVar < 0) throw new IllegalArgumentException("Missing SAT instance data");
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (b.nClauses() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return b.samplingSet(ind).build(nVar);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Formula formula = (Formula) o;
        return nVariables == formula.nVariables && clauses.equals(formula.clauses) && samplingSet.equals(formula.samplingSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nVariables, clauses, samplingSet);
    }

    @Override
    public String toString() {
        return String.format("Formula(%d variables, %d clauses, %d sampling)", nVariables, clauses.size(), samplingSet.size());
    }

    /**
     * Collects clauses in order. The variable count is supplied last, once
     * whoever is allocating variables knows it.
     */
    public static final class Builder {
        private final List<ImmutableList<Integer>> clauses = new ArrayList<>();
        private final SortedSet<Integer> samplingSet = new TreeSet<>();

        private Builder() {}

        public Builder addClause(Iterable<Integer> literals) {
            ImmutableList<Integer> clause = ImmutableList.copyOf(literals);
            if (clause.isEmpty()) throw new IllegalArgumentException("empty clause");
            clauses.add(clause);
            return this;
        }

        public Builder addClause(Integer... literals) {
            return addClause(Arrays.asList(literals));
        }

        public Builder samplingSet(Iterable<Integer> variables) {
            for (int v : variables) {
                if (!samplingSet.add(v)) throw new IllegalArgumentException("variable " + v + " repeated in sampling set");
            }
            return this;
        }

        public int nClauses() { return clauses.size(); }

        public Formula build(int nVariables) {
            if (nVariables < 0) throw new IllegalArgumentException("negative variable count");
            for (List<Integer> clause : clauses) {
                for (int l : clause) {
                    if (l == 0 || l > nVariables || l < -nVariables) {
                        throw new IllegalArgumentException("literal " + l + " out of declared bounds [1, " + nVariables + "]");
                    }
                }
            }
            if (!samplingSet.isEmpty() && (samplingSet.first() < 1 || samplingSet.last() > nVariables)) {
                throw new IllegalArgumentException("sampling set " + samplingSet + " out of declared bounds [1, " + nVariables + "]");
            }
            return new Formula(nVariables, clauses, new ArrayList<>(samplingSet));
        }
    }
}
