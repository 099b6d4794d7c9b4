package net.littleredcomputer.cdcl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static java.util.stream.Collectors.toList;

/**
 * Conflict-driven clause learning. The search alternates unit propagation with decisions
 * (the lowest-numbered free variable, set false); each conflict is analyzed to a last-UIP
 * clause, which is learned, and the search backjumps to the level at which that clause
 * becomes unit. Deriving the empty clause proves unsatisfiability; the resolution steps
 * recorded along the way then yield an UNSAT core.
 * <p>
 * The solver can be driven one transition at a time with {@link #step()}, so a caller can
 * impose its own budget, or run to completion with {@link #solve()}.
 */
public class CDCLSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger();

    public enum State { SEARCHING, CONFLICT, SAT, UNSAT }

    private final ClauseStore store = new ClauseStore();
    private final Trail trail;
    private final Propagator propagator;
    private final ConflictAnalyzer analyzer;
    private final ResolutionTracer tracer = new ResolutionTracer();
    private final UnsatCoreExtractor extractor;

    private State state = State.SEARCHING;
    private int conflict = -1;  // falsified clause, valid in state CONFLICT
    private ImmutableSortedSet<Integer> core = null;
    private boolean[] model = null;
    private long decisions = 0;
    private long conflicts = 0;

    public CDCLSolver(SATProblem problem) {
        super("CDCL", problem);
        trail = new Trail(problem.nVariables());
        propagator = new Propagator(store, trail);
        analyzer = new ConflictAnalyzer(store, trail, tracer);
        extractor = new UnsatCoreExtractor(store, tracer);
        problem.encodedClauses().forEach(c -> store.add(c, ClauseStore.Kind.ORIGINAL));
    }

    @Override
    public Optional<boolean[]> solve() {
        solve(Long.MAX_VALUE);
        return state == State.SAT ? Optional.of(model.clone()) : Optional.empty();
    }

    /**
     * Run the search until it finishes or has met maxConflicts conflicts in all. A solver
     * stopped short can be resumed by another call.
     *
     * @return the state reached; SEARCHING or CONFLICT if the budget ran out
     */
    public State solve(long maxConflicts) {
        start();
        log.info("%s: %d variables, %d clauses", name(), problem.nVariables(), problem.nClauses());
        while (!isDone() && conflicts < maxConflicts) step();
        stop();
        log.info("%s: %s after %d decisions, %d conflicts, %d propagations (%d passes) in %s",
                name(), state, decisions, conflicts, propagator.propagations(), propagator.passes(), stopwatch());
        return state;
    }

    /**
     * Make one transition of the search. From SEARCHING: propagate, then either note a
     * conflict, recognize a satisfying assignment, or make a decision. From CONFLICT:
     * learn a clause and backjump, or conclude UNSAT. Terminal states are left unchanged.
     *
     * @return the state after the transition
     */
    public State step() {
        ++stepCount;
        if (stepCount % logCheckSteps == 0) maybeReportProgress(this::progress);
        switch (state) {
            case SEARCHING: {
                OptionalInt c = propagator.propagate();
                if (c.isPresent()) {
                    conflict = c.getAsInt();
                    state = State.CONFLICT;
                    break;
                }
                OptionalInt v = pick();
                if (!v.isPresent()) {
                    model = trail.model();
                    state = State.SAT;
                    break;
                }
                ++decisions;
                trail.pushDecisionMarker();
                trail.assign(v.getAsInt(), false, trail.currentLevel(), Trail.DECISION);
                break;
            }
            case CONFLICT: {
                ++conflicts;
                ConflictAnalyzer.Analysis a = analyzer.analyze(conflict);
                conflict = -1;
                if (a.isEmpty()) {
                    core = extractor.extract(a.learned);
                    log.debug("empty clause %d derived; core has %d clauses", a.learned, core.size());
                    state = State.UNSAT;
                    break;
                }
                trail.backjumpTo(a.backjumpLevel);
                trail.assignLiteral(a.uip, a.backjumpLevel, a.learned);
                state = State.SEARCHING;
                break;
            }
            case SAT:
            case UNSAT:
                break;
        }
        return state;
    }

    /** The first unassigned variable in ascending order, if any. */
    OptionalInt pick() {
        for (int v = 1; v <= trail.nVariables(); ++v) {
            if (!trail.isAssigned(v)) return OptionalInt.of(v);
        }
        return OptionalInt.empty();
    }

    public State state() { return state; }

    public boolean isDone() { return state == State.SAT || state == State.UNSAT; }

    /** The satisfying assignment found; index i holds variable i+1. */
    public boolean[] model() {
        Preconditions.checkState(state == State.SAT, "no model: solver is in state %s", state);
        return model.clone();
    }

    /** Indices (in the problem) of an unsatisfiable subset of the original clauses. */
    public ImmutableSortedSet<Integer> core() {
        Preconditions.checkState(state == State.UNSAT, "no core: solver is in state %s", state);
        return core;
    }

    /** The clauses of {@link #core()}, in DIMACS notation. */
    public List<List<Integer>> coreClauses() {
        return core().stream().map(problem::getClause).collect(ImmutableList.toImmutableList());
    }

    public long decisions() { return decisions; }
    public long conflicts() { return conflicts; }
    public long propagations() { return propagator.propagations(); }
    public long propagationPasses() { return propagator.passes(); }
    public int learnedClauses() { return store.learnedCount(); }

    // Visible for tests.
    Trail trail() { return trail; }
    ClauseStore store() { return store; }
    ResolutionTracer tracer() { return tracer; }

    /** The literals of a stored clause, in DIMACS notation. */
    List<Integer> clause(int id) {
        int[] c = store.get(id);
        return Arrays.stream(c).map(AbstractSATSolver::toDimacs).boxed().collect(toList());
    }

    private String progress() {
        return String.format("level %d trail %d/%d decisions %d conflicts %d learned %d passes %d",
                trail.currentLevel(), trail.size(), trail.nVariables(), decisions, conflicts, store.learnedCount(),
                propagator.passes());
    }
}
