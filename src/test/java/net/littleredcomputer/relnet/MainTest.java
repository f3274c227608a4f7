package net.littleredcomputer.relnet;

import net.littleredcomputer.relnet.cnf.Formula;
import net.littleredcomputer.relnet.encode.ReliabilityEncoder;
import net.littleredcomputer.relnet.graph.GraphParser;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class MainTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() { return out.toString(StandardCharsets.UTF_8); }
    private String err() { return err.toString(StandardCharsets.UTF_8); }

    private static String resource(String name) throws URISyntaxException {
        return Paths.get(MainTest.class.getClassLoader().getResource(name).toURI()).toString();
    }

    @Test
    public void encode() throws Exception {
        File cnf = folder.newFile("diamond.cnf");
        assertThat(run("-task", "encode", "-graph", resource("diamond.txt"), "-cnf", cnf.getPath()), is(0));
        assertThat(out(), containsString("c CNF file \"" + cnf.getPath() + "\" saved"));
        assertThat(out(), containsString("c Number of sampling variables is 6"));
        assertThat(out(), containsString("c To count: approxmc " + cnf.getPath()));
        String text = new String(Files.readAllBytes(cnf.toPath()), StandardCharsets.UTF_8);
        assertThat(text, containsString("c ind 1 2 3 4 5 6 0\n"));
        Formula f = Formula.parseFrom(text);
        Formula expected = new ReliabilityEncoder().encode(GraphParser.parseFrom(new String(
                Files.readAllBytes(Paths.get(resource("diamond.txt"))), StandardCharsets.UTF_8)));
        assertThat(f, is(expected));
    }

    @Test
    public void encodeToStdout() throws Exception {
        assertThat(run("-task", "encode", "-graph", resource("bridge.txt"), "-cnf", "-", "-polarity", "disconnected"), is(0));
        assertThat(out(), startsWith("c relnet K-terminal reliability, polarity disconnected\np cnf "));
        assertThat(out(), not(containsString("To count")));
    }

    @Test
    public void countWrittenFormula() throws Exception {
        File cnf = folder.newFile("diamond.cnf");
        assertThat(run("-task", "encode", "-graph", resource("diamond.txt"), "-cnf", cnf.getPath()), is(0));
        out.reset();
        assertThat(run("-task", "count", "-cnf", cnf.getPath(), "-counter", "exact"), is(0));
        assertThat(out(), containsString("s mc 33\n"));
        assertThat(out(), containsString("c satisfying fraction 0.515625"));
    }

    @Test
    public void reliability() throws Exception {
        assertThat(run("-task", "reliability", "-graph", resource("diamond.txt"), "-counter", "exact"), is(0));
        assertThat(out(), containsString("s mc 33\n"));
        assertThat(out(), containsString("c reliability 0.484375\n"));
        assertThat(out(), containsString("c unreliability 0.515625\n"));
    }

    @Test
    public void reliabilityConnected() throws Exception {
        assertThat(run("-task", "reliability", "-graph", resource("diamond.txt"), "-counter", "exact", "-polarity", "connected"), is(0));
        assertThat(out(), containsString("s mc 31\n"));
        assertThat(out(), containsString("c reliability 0.484375\n"));
    }

    @Test
    public void bitBudgetExceeded() throws Exception {
        assertThat(run("-task", "encode", "-graph", resource("diamond.txt"), "-cnf", "-", "-bits", "2"), is(1));
        assertThat(err(), containsString("c error EncodingOverflow: probability 0.625"));
    }

    @Test
    public void roundedToBudget() throws Exception {
        assertThat(run("-task", "reliability", "-graph", resource("diamond.txt"), "-counter", "exact", "-bits", "2", "-round"), is(0));
        assertThat(out(), containsString("c reliability 0.4375\n"));
    }

    @Test
    public void badProbability() throws Exception {
        File g = folder.newFile("bad.txt");
        Files.write(g.toPath(), "p g\nT 1 2\ne 1 2 1.5\n".getBytes(StandardCharsets.UTF_8));
        assertThat(run("-task", "encode", "-graph", g.getPath(), "-cnf", "-"), is(1));
        assertThat(err(), containsString("c error ProbabilityError: line 3:"));
    }

    @Test
    public void badTerminals() throws Exception {
        File g = folder.newFile("bad.txt");
        Files.write(g.toPath(), "p g\nT 1\ne 1 2 0.5\n".getBytes(StandardCharsets.UTF_8));
        assertThat(run("-task", "reliability", "-graph", g.getPath(), "-counter", "exact"), is(1));
        assertThat(err(), containsString("c error TerminalError:"));
    }

    @Test
    public void malformedGraph() throws Exception {
        File g = folder.newFile("bad.txt");
        Files.write(g.toPath(), "p g\nT 1 2\ne 1 2\n".getBytes(StandardCharsets.UTF_8));
        assertThat(run("-task", "encode", "-graph", g.getPath(), "-cnf", "-"), is(1));
        assertThat(err(), containsString("c error FormatError: line 3:"));
    }

    @Test
    public void missingGraphFile() {
        assertThat(run("-task", "encode", "-graph", new File(folder.getRoot(), "absent.txt").getPath(), "-cnf", "-"), is(1));
        assertThat(err(), containsString("c error IO:"));
    }

    @Test
    public void missingTask() {
        assertThat(run("-graph", "x.txt"), is(2));
        assertThat(err(), containsString("c usage: Must specify -task"));
    }

    @Test
    public void unknownCounter() throws Exception {
        assertThat(run("-task", "reliability", "-graph", resource("diamond.txt"), "-counter", "magic"), is(2));
        assertThat(err(), containsString("unknown counter: magic"));
    }

    @Test
    public void unknownPolarity() throws Exception {
        assertThat(run("-task", "encode", "-graph", resource("diamond.txt"), "-cnf", "-", "-polarity", "sideways"), is(2));
    }

    @Test
    public void encodeNeedsCnf() throws Exception {
        assertThat(run("-task", "encode", "-graph", resource("diamond.txt")), is(2));
    }
}
