package net.littleredcomputer.relnet.graph;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.relnet.GraphFormatException;
import net.littleredcomputer.relnet.TerminalException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.*;

/**
 * An instance of the K-terminal reliability problem: an undirected graph whose
 * edges fail independently, together with the set of terminal vertices that
 * are required to stay connected. Instances are immutable.
 * <p>
 * Vertices are opaque names. They are numbered from 0 in order of first
 * appearance as an edge endpoint, and that numbering (along with the order in
 * which edges and terminals were declared) fixes the order in which every
 * encoder visits the graph.
 */
public final class Graph {
    private static final Logger log = LogManager.getFormatterLogger(Graph.class);
    private static final Joiner spaceJoiner = Joiner.on(' ');

    private final ImmutableList<String> vertices;
    private final ImmutableMap<String, Integer> vertexIndex;  // inverse of above mapping
    private final ImmutableList<Integer> terminals;
    private final ImmutableList<Edge> edges;

    private Graph(List<String> vertices, List<Integer> terminals, List<Edge> edges) {
        this.vertices = ImmutableList.copyOf(vertices);
        ImmutableMap.Builder<String, Integer> mb = ImmutableMap.builder();
        for (int i = 0; i < vertices.size(); ++i) mb.put(vertices.get(i), i);
        this.vertexIndex = mb.build();
        this.terminals = ImmutableList.copyOf(terminals);
        this.edges = ImmutableList.copyOf(edges);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int nVertices() { return vertices.size(); }
    public int nEdges() { return edges.size(); }

    public ImmutableList<String> vertices() { return vertices; }
    public ImmutableList<Edge> edges() { return edges; }

    /** @return indices of the terminal vertices, in declaration order */
    public ImmutableList<Integer> terminals() { return terminals; }

    public String vertexName(int v) { return vertices.get(v); }

    public OptionalInt vertexIndex(String name) {
        Integer ix = vertexIndex.get(name);
        return ix == null ? OptionalInt.empty() : OptionalInt.of(ix);
    }

    /**
     * Writes this instance in the line format accepted by {@link GraphParser}.
     * @param p destination
     */
    public void write(PrintStream p) {
        p.println("p g");
        List<String> ts = new ArrayList<>();
        for (int t : terminals) ts.add(vertices.get(t));
        p.println("T " + spaceJoiner.join(ts));
        for (Edge e : edges) {
            p.printf("e %s %s %s%n", vertices.get(e.u()), vertices.get(e.v()), e.probability().toPlainString());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Graph graph = (Graph) o;
        return vertices.equals(graph.vertices) && terminals.equals(graph.terminals) && edges.equals(graph.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vertices, terminals, edges);
    }

    @Override
    public String toString() {
        return String.format("Graph(%d vertices, %d edges, terminals %s)", vertices.size(), edges.size(), terminals);
    }

    /**
     * Accumulates vertices, edges and terminals, and checks the invariants of
     * an instance when it is built. Self-loops are dropped (their endpoint is
     * still a vertex). Redeclaring an edge with the same probability is
     * harmless and ignored; redeclaring it with a different one is an error.
     */
    public static final class Builder {
        private final List<String> vertices = new ArrayList<>();
        private final Map<String, Integer> vertexIndex = new HashMap<>();
        private final Set<String> terminals = new LinkedHashSet<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Map<List<Integer>, Edge> edgeByPair = new HashMap<>();

        private Builder() {}

        private int vertex(String name) {
            return vertexIndex.computeIfAbsent(name, n -> {
                vertices.add(n);
                return vertices.size() - 1;
            });
        }

        public Builder terminal(String name) {
            if (!terminals.add(name)) log.warn("terminal %s declared more than once", name);
            return this;
        }

        public Builder terminals(String... names) {
            for (String n : names) terminal(n);
            return this;
        }

        public Builder edge(String u, String v, String probability) {
            return edge(u, v, new BigDecimal(probability));
        }

        public Builder edge(String u, String v, BigDecimal probability) {
            Edge.checkProbability(probability);
            int iu = vertex(u);
            int iv = vertex(v);
            if (iu == iv) {
                log.warn("ignoring self-loop at vertex %s", u);
                return this;
            }
            List<Integer> pair = ImmutableList.of(Math.min(iu, iv), Math.max(iu, iv));
            Edge previous = edgeByPair.get(pair);
            if (previous != null) {
                if (previous.probability().compareTo(probability) != 0) {
                    throw new GraphFormatException(0, String.format("edge %s-%s redeclared with probability %s (was %s)",
                            u, v, probability.toPlainString(), previous.probability().toPlainString()));
                }
                log.warn("ignoring repeated declaration of edge %s-%s", u, v);
                return this;
            }
            Edge e = new Edge(iu, iv, probability);
            edgeByPair.put(pair, e);
            edges.add(e);
            return this;
        }

        public Graph build() {
            if (terminals.size() < 2) {
                throw new TerminalException("at least two distinct terminals are required, found " + terminals.size());
            }
            List<Integer> ts = new ArrayList<>();
            for (String t : terminals) {
                Integer ix = vertexIndex.get(t);
                if (ix == null) throw new TerminalException("terminal " + t + " is not an endpoint of any edge");
                ts.add(ix);
            }
            return new Graph(vertices, ts, edges);
        }
    }
}
