package net.littleredcomputer.relnet.count;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.relnet.cnf.DpllSolver;
import net.littleredcomputer.relnet.cnf.Formula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Counts by brute force: every assignment of the sampling set is tried, and
 * the remaining variables are left to {@link DpllSolver}.
 */
public final class ExactCounter implements ModelCounter {
    private static final Logger log = LogManager.getFormatterLogger(ExactCounter.class);
    public static final int MAX_SAMPLING_SET = 30;
    private final int logCheckSteps = 1 << 12;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private long lastStepCount;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public ExactCounter setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    @Override
    public ModelCount count(Formula formula) {
        List<Integer> sampling = formula.samplingSet();
        final int s = sampling.size();
        if (s > MAX_SAMPLING_SET) {
            throw new IllegalArgumentException("sampling set of " + s + " variables is too large to enumerate (limit " + MAX_SAMPLING_SET + ")");
        }
        DpllSolver solver = new DpllSolver(formula);
        int[] assumptions = new int[s];
        long count = 0;
        final long total = 1L << s;
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastStepCount = 0;
        for (long a = 0; a < total; ++a) {
            for (int i = 0; i < s; ++i) {
                int v = sampling.get(i);
                assumptions[i] = ((a >> i) & 1) != 0 ? v : -v;
            }
            if (solver.isSatisfiable(assumptions)) ++count;
            if (a % logCheckSteps == 0) maybeReportProgress(a, total, count);
        }
        stopwatch.stop();
        log.debug("counted %d of %d assignments in %s (%d search nodes)", count, total, stopwatch, solver.nodeCount());
        return ModelCount.exact(count);
    }

    private void maybeReportProgress(long step, long total, long count) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (step - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("exact count %d/%d assignments %s %.0f/sec, %d satisfying so far",
                step, total, stopwatch, perSec, count));
        lastLogTime = now;
        lastStepCount = step;
    }
}
