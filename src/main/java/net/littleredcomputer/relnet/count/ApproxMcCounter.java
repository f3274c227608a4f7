package net.littleredcomputer.relnet.count;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.relnet.cnf.Formula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.stream.Collectors.toList;

/**
 * Runs the ApproxMC approximate model counter as an external process. The
 * formula is handed over as a DIMACS file with {@code c ind} lines, and the
 * count is read from the counter's output, which depending on the version is
 * either {@code Number of solutions is: a*2**b} or {@code s mc n}.
 */
public final class ApproxMcCounter implements ModelCounter {
    private static final Logger log = LogManager.getFormatterLogger(ApproxMcCounter.class);
    private static final Pattern solutionsRe = Pattern.compile(".*Number of solutions is:\\s*(\\d+)\\s*\\*\\s*2\\s*\\*\\*\\s*(\\d+).*");
    private static final Pattern mcRe = Pattern.compile("s\\s+mc\\s+(\\d+)\\s*");
    private static final Pattern unsatRe = Pattern.compile(".*\\bunsat(isfiable)?\\b.*", Pattern.CASE_INSENSITIVE);
    public static final double DEFAULT_EPSILON = 0.8;
    public static final double DEFAULT_DELTA = 0.2;

    private final String executable;
    private final double epsilon;
    private final double delta;

    public ApproxMcCounter(String executable, double epsilon, double delta) {
        if (!(epsilon > 0)) throw new IllegalArgumentException("epsilon must be positive");
        if (!(delta > 0 && delta < 1)) throw new IllegalArgumentException("delta must lie in (0, 1)");
        this.executable = executable;
        this.epsilon = epsilon;
        this.delta = delta;
    }

    public ApproxMcCounter(String executable) {
        this(executable, DEFAULT_EPSILON, DEFAULT_DELTA);
    }

    List<String> command(Path cnf) {
        return ImmutableList.of(executable, "--epsilon", Double.toString(epsilon), "--delta", Double.toString(delta), cnf.toString());
    }

    @Override
    public ModelCount count(Formula formula) throws IOException {
        Path tmp = Files.createTempFile("relnet", ".cnf");
        try {
            try (PrintStream p = new PrintStream(Files.newOutputStream(tmp), false, StandardCharsets.UTF_8)) {
                formula.write(p);
            }
            return countFile(tmp);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * @param cnf a DIMACS file, whose {@code c ind} lines give the sampling set
     * @return the count reported by the counter
     * @throws IOException if the counter cannot be run, fails, or reports no count
     */
    public ModelCount countFile(Path cnf) throws IOException {
        List<String> cmd = command(cnf);
        log.info("running %s", Joiner.on(' ').join(cmd));
        Stopwatch sw = Stopwatch.createStarted();
        Process p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        List<String> output;
        int exit;
        boolean finished = false;
        try {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                output = br.lines().collect(toList());
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            exit = p.waitFor();
            finished = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted waiting for " + executable);
        } finally {
            if (!finished) p.destroy();
        }
        log.info("%s exited with status %d after %s", executable, exit, sw);
        String tail = output.isEmpty() ? "(no output)" : output.get(output.size() - 1);
        if (exit != 0) {
            throw new IOException(executable + " exited with status " + exit + ": " + tail);
        }
        Optional<ModelCount> count = parseCount(output);
        if (!count.isPresent()) {
            throw new IOException(executable + " exited without reporting a count: " + tail);
        }
        return count.get();
    }

    /**
     * @param lines the counter's output
     * @return the last count reported, if any
     */
    static Optional<ModelCount> parseCount(List<String> lines) {
        Optional<ModelCount> count = Optional.empty();
        for (String line : lines) {
            Matcher m = solutionsRe.matcher(line);
            if (m.matches()) {
                count = Optional.of(ModelCount.approximate(new BigInteger(m.group(1)), Integer.parseInt(m.group(2))));
                continue;
            }
            m = mcRe.matcher(line);
            if (m.matches()) {
                count = Optional.of(ModelCount.approximate(new BigInteger(m.group(1)), 0));
                continue;
            }
            if (unsatRe.matcher(line).matches() && !count.isPresent()) {
                count = Optional.of(ModelCount.approximate(BigInteger.ZERO, 0));
            }
        }
        return count;
    }
}
