package net.littleredcomputer.relnet;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.relnet.cnf.Formula;
import net.littleredcomputer.relnet.count.ApproxMcCounter;
import net.littleredcomputer.relnet.count.ExactCounter;
import net.littleredcomputer.relnet.count.ModelCount;
import net.littleredcomputer.relnet.count.ModelCounter;
import net.littleredcomputer.relnet.encode.EncoderOptions;
import net.littleredcomputer.relnet.encode.Polarity;
import net.littleredcomputer.relnet.encode.ReliabilityEncoder;
import net.littleredcomputer.relnet.graph.Graph;
import net.littleredcomputer.relnet.graph.GraphParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Command line driver. Tasks:
 * <dl>
 *     <dt>encode</dt><dd>read a graph, write its reliability formula</dd>
 *     <dt>count</dt><dd>count an existing formula over its sampling set</dd>
 *     <dt>reliability</dt><dd>encode, then count, and report the reliability</dd>
 * </dl>
 * Exit status is 0 on success, 1 when the input is rejected or counting
 * fails, and 2 for a malformed command line.
 */
public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);

    private static Options options() {
        return new Options()
                .addOption("task", true, "encode, count or reliability")
                .addOption("graph", true, "filename of graph description (- for stdin)")
                .addOption("cnf", true, "filename of CNF formula to write (encode, reliability) or read (count); - for stdout/stdin")
                .addOption("bits", true, "maximum number of coin variables per edge (default " + EncoderOptions.DEFAULT_MAX_BITS + ")")
                .addOption("polarity", true, "disconnected (default) or connected: the event satisfying assignments represent")
                .addOption("round", false, "round probabilities that need too many bits instead of failing")
                .addOption("counter", true, "approxmc (default) or exact")
                .addOption("approxmc", true, "path of the ApproxMC executable (default approxmc)")
                .addOption("epsilon", true, "ApproxMC tolerance (default " + ApproxMcCounter.DEFAULT_EPSILON + ")")
                .addOption("delta", true, "ApproxMC confidence (default " + ApproxMcCounter.DEFAULT_DELTA + ")")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static String required(CommandLine cmd, String option) throws ParseException {
        if (!cmd.hasOption(option)) throw new ParseException("Must specify -" + option);
        return cmd.getOptionValue(option);
    }

    private static Reader input(String path) throws IOException {
        return new BufferedReader(path.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8));
    }

    private static int intOption(CommandLine cmd, String option, int defaultValue) throws ParseException {
        try {
            return cmd.hasOption(option) ? Integer.parseInt(cmd.getOptionValue(option)) : defaultValue;
        } catch (NumberFormatException e) {
            throw new ParseException("-" + option + " needs an integer");
        }
    }

    private static double doubleOption(CommandLine cmd, String option, double defaultValue) throws ParseException {
        try {
            return cmd.hasOption(option) ? Double.parseDouble(cmd.getOptionValue(option)) : defaultValue;
        } catch (NumberFormatException e) {
            throw new ParseException("-" + option + " needs a number");
        }
    }

    private static Duration logInterval(CommandLine cmd) throws ParseException {
        try {
            return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
        } catch (DateTimeParseException e) {
            throw new ParseException("-loginterval needs an ISO-8601 duration such as PT0.5S");
        }
    }

    static EncoderOptions encoderOptions(CommandLine cmd) throws ParseException {
        try {
            return EncoderOptions.defaults()
                    .withMaxBits(intOption(cmd, "bits", EncoderOptions.DEFAULT_MAX_BITS))
                    .withPolarity(Polarity.fromName(cmd.getOptionValue("polarity", "disconnected")))
                    .withRounding(cmd.hasOption("round"));
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage());
        }
    }

    private static ModelCounter counter(CommandLine cmd, Formula f) throws ParseException {
        String c = cmd.getOptionValue("counter", "approxmc");
        switch (c) {
            case "exact":
                return new ExactCounter().setLogInterval(logInterval(cmd));
            case "approxmc":
                if (f.samplingSet().isEmpty()) {
                    // Nothing to sample: the formula is either satisfiable or not.
                    return new ExactCounter();
                }
                try {
                    return new ApproxMcCounter(cmd.getOptionValue("approxmc", "approxmc"),
                            doubleOption(cmd, "epsilon", ApproxMcCounter.DEFAULT_EPSILON),
                            doubleOption(cmd, "delta", ApproxMcCounter.DEFAULT_DELTA));
                } catch (IllegalArgumentException e) {
                    throw new ParseException(e.getMessage());
                }
            default:
                throw new ParseException("unknown counter: " + c);
        }
    }

    private static Formula encode(CommandLine cmd, EncoderOptions options) throws IOException, ParseException {
        Stopwatch sw = Stopwatch.createStarted();
        Graph g;
        try (Reader r = input(required(cmd, "graph"))) {
            g = GraphParser.parseFrom(r);
        }
        log.info("parsed %s in %s", g, sw);
        sw.reset().start();
        Formula f = new ReliabilityEncoder(options).encode(g);
        log.info("encoded %s with %s in %s", f, options, sw);
        return f;
    }

    private static void write(Formula f, String path, EncoderOptions options, PrintStream out) throws IOException {
        String title = "relnet K-terminal reliability, polarity " + options.polarity().name().toLowerCase();
        if (path.equals("-")) {
            f.write(out, title);
            return;
        }
        try (PrintStream p = new PrintStream(Files.newOutputStream(Paths.get(path)), false, StandardCharsets.UTF_8)) {
            f.write(p, title);
        }
        out.println("c CNF file \"" + path + "\" saved");
    }

    private static ModelCount count(CommandLine cmd, Formula f, PrintStream out) throws IOException, ParseException {
        ModelCounter counter = counter(cmd, f);
        Stopwatch sw = Stopwatch.createStarted();
        ModelCount c = counter.count(f);
        log.info("counted %s in %s", c, sw);
        out.println("s mc " + c.value());
        if (!c.isExact()) out.println("c estimate " + c);
        return c;
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            CommandLine cmd = new DefaultParser().parse(options(), args);
            String task = required(cmd, "task");
            switch (task) {
                case "encode": {
                    EncoderOptions options = encoderOptions(cmd);
                    Formula f = encode(cmd, options);
                    String path = required(cmd, "cnf");
                    write(f, path, options, out);
                    out.println("c Number of sampling variables is " + f.samplingSet().size());
                    if (!path.equals("-")) out.println("c To count: approxmc " + path);
                    break;
                }
                case "count": {
                    Formula f;
                    try (Reader r = input(required(cmd, "cnf"))) {
                        f = Formula.parseFrom(r);
                    }
                    ModelCount c = count(cmd, f, out);
                    out.println("c satisfying fraction " + c.fractionOf(f.samplingSet().size()).toPlainString());
                    break;
                }
                case "reliability": {
                    EncoderOptions options = encoderOptions(cmd);
                    Formula f = encode(cmd, options);
                    if (cmd.hasOption("cnf")) write(f, cmd.getOptionValue("cnf"), options, out);
                    out.println("c Number of sampling variables is " + f.samplingSet().size());
                    ModelCount c = count(cmd, f, out);
                    BigDecimal reliability = options.polarity().reliability(c.fractionOf(f.samplingSet().size()));
                    out.println("c reliability " + reliability.toPlainString());
                    out.println("c unreliability " + BigDecimal.ONE.subtract(reliability).toPlainString());
                    break;
                }
                default:
                    throw new ParseException("unknown task: " + task);
            }
            return 0;
        } catch (ParseException e) {
            err.println("c usage: " + e.getMessage());
            new HelpFormatter().printHelp(new PrintWriter(err, true), 100, "relnet -task <task>", null, options(), 2, 4, null);
            return 2;
        } catch (RelnetException e) {
            err.printf("c error %s: %s%n", e.kind(), e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            err.println("c error IO: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("c error: " + e.getMessage());
            return 1;
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }
}
