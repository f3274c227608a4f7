package net.littleredcomputer.relnet.graph;

import com.google.common.base.Splitter;
import net.littleredcomputer.relnet.GraphFormatException;
import net.littleredcomputer.relnet.ProbabilityException;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;

/**
 * Reads reliability instances in the line format
 * <pre>
 * c comment
 * p g
 * T 1 4
 * e 1 2 0.5
 * </pre>
 * where each {@code e} line gives an edge and the probability that it is up.
 * The {@code p g} line must come before any {@code T} or {@code e} line.
 */
public final class GraphParser {
    private final static Splitter splitter = Splitter.onPattern("\\s").omitEmptyStrings().trimResults();

    private GraphParser() {}

    public static Graph parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    public static Graph parseFrom(Reader r) {
        Graph.Builder b = Graph.builder();
        boolean sawProblemLine = false;
        int lineNumber = 0;
        Iterator<String> ls = new BufferedReader(r).lines().iterator();
        while (ls.hasNext()) {
            String line = ls.next();
            ++lineNumber;
            if (line.startsWith("c")) continue;
            List<String> fields = splitter.splitToList(line);
            if (fields.isEmpty()) continue;
            switch (fields.get(0)) {
                case "p":
                    if (sawProblemLine) throw new GraphFormatException(lineNumber, "duplicate p line");
                    if (fields.size() != 2 || !fields.get(1).equals("g")) {
                        throw new GraphFormatException(lineNumber, "expected \"p g\", found \"" + line.trim() + '"');
                    }
                    sawProblemLine = true;
                    break;
                case "T":
                    if (!sawProblemLine) throw new GraphFormatException(lineNumber, "T line before p line");
                    for (String t : fields.subList(1, fields.size())) b.terminal(t);
                    break;
                case "e":
                    if (!sawProblemLine) throw new GraphFormatException(lineNumber, "e line before p line");
                    if (fields.size() != 4) {
                        throw new GraphFormatException(lineNumber, "expected \"e <u> <v> <p>\", found \"" + line.trim() + '"');
                    }
                    addEdge(b, lineNumber, fields.get(1), fields.get(2), fields.get(3));
                    break;
                default:
                    throw new GraphFormatException(lineNumber, "unknown line type \"" + fields.get(0) + '"');
            }
        }
        if (!sawProblemLine) throw new GraphFormatException(0, "missing p line");
        return b.build();
    }

    private static void addEdge(Graph.Builder b, int lineNumber, String u, String v, String probability) {
        BigDecimal p;
        try {
            p = new BigDecimal(probability);
        } catch (NumberFormatException e) {
            throw new GraphFormatException(lineNumber, "malformed probability \"" + probability + '"', e);
        }
        try {
            b.edge(u, v, p);
        } catch (ProbabilityException e) {
            throw new ProbabilityException("line " + lineNumber + ": " + e.getMessage(), e);
        } catch (GraphFormatException e) {
            throw new GraphFormatException(lineNumber, e.getMessage(), e);
        }
    }
}
