package net.littleredcomputer.cdcl;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Common plumbing for solvers: progress reporting and the literal encoding.
 * <p>
 * Literals are encoded as 2v (for v) and 2v+1 (for ~v), so that a literal and its
 * complement differ only in the low bit.
 */
public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    final int logCheckSteps = 1000;
    final SATProblem problem;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public void setLogInterval(Duration interval) { logInterval = interval; }

    AbstractSATSolver(String name, SATProblem problem) {
        this.name = name;
        this.problem = problem;
    }

    void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    void stop() {
        if (stopwatch.isRunning()) stopwatch.stop();
    }

    Stopwatch stopwatch() { return stopwatch; }

    String name() { return name; }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    /**
     * Run the solver to completion.
     *
     * @return a satisfying assignment (index i holds the value of variable i+1), or
     * empty if the problem is unsatisfiable
     */
    public abstract Optional<boolean[]> solve();

    static int thevar(int literal) { return literal >> 1; }
    static int poslit(int variable) { return 2*variable; }
    static int neglit(int variable) { return 2*variable+1; }
    static int not(int l) { return l^1; }
    static boolean negated(int l) { return (l & 1) != 0; }

    /** Convert an encoded literal to the signed DIMACS convention. */
    static int toDimacs(int l) { return negated(l) ? -thevar(l) : thevar(l); }
    static int fromDimacs(int d) { return d > 0 ? poslit(d) : neglit(-d); }

    static String literalToString(int l) {
        return (negated(l) ? "~" : "") + thevar(l);
    }
}
