package net.littleredcomputer.cdcl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static net.littleredcomputer.cdcl.AbstractSATSolver.not;
import static net.littleredcomputer.cdcl.AbstractSATSolver.thevar;

/**
 * Derives a learned clause from a conflict by resolution, stopping at the last unique
 * implication point (UIP) of the current decision level.
 */
class ConflictAnalyzer {
    private static final Logger log = LogManager.getFormatterLogger();

    /** The outcome of analyzing one conflict. */
    static final class Analysis {
        final int learned;  // id of the learned clause in the store
        final int[] literals;  // the learned clause, UIP first
        final int backjumpLevel;
        final int uip;  // the asserting literal (false now; to be made true after backjumping), or -1 if the clause is empty

        Analysis(int learned, int[] literals, int backjumpLevel, int uip) {
            this.learned = learned;
            this.literals = literals;
            this.backjumpLevel = backjumpLevel;
            this.uip = uip;
        }

        boolean isEmpty() { return literals.length == 0; }
    }

    private final ClauseStore store;
    private final Trail trail;
    private final ResolutionTracer tracer;
    private final boolean[] inClause;  // membership of encoded literals in the working clause
    private long resolutions = 0;

    ConflictAnalyzer(ClauseStore store, Trail trail, ResolutionTracer tracer) {
        this.store = store;
        this.trail = trail;
        this.tracer = tracer;
        this.inClause = new boolean[2 * trail.nVariables() + 2];
    }

    /**
     * Resolve backward from the falsified clause until exactly one of the working clause's
     * literals belongs to the current level. At level 0 there are no decisions, so
     * resolution continues until the clause is empty.
     * <p>
     * The learned clause is added to the store and its derivation to the tracer.
     *
     * @param conflict id of a clause all of whose literals are false
     * @return the learned clause and where to backjump
     */
    Analysis analyze(int conflict) {
        final int level = trail.currentLevel();
        TIntArrayList work = new TIntArrayList(store.get(conflict));
        for (int i = 0; i < work.size(); ++i) inClause[work.get(i)] = true;
        ImmutableList.Builder<ResolutionTracer.Step> steps = ImmutableList.builder();
        try {
            while (true) {
                int latest = -1;
                int latestPosition = -1;
                int atLevel = 0;
                for (int i = 0; i < work.size(); ++i) {
                    int l = work.get(i);
                    Preconditions.checkState(trail.literalValue(l) == Trail.Value.FALSE,
                            "literal %s of conflict clause is not false", AbstractSATSolver.literalToString(l));
                    int v = thevar(l);
                    if (trail.levelOf(v) != level) continue;
                    ++atLevel;
                    if (trail.positionOf(v) > latestPosition) {
                        latestPosition = trail.positionOf(v);
                        latest = l;
                    }
                }
                if (level > 0) {
                    Preconditions.checkState(atLevel > 0, "conflict clause %s has no literal at level %s", conflict, level);
                    if (atLevel == 1) break;
                } else if (atLevel == 0) {
                    break;
                }
                int antecedent = trail.antecedentOf(thevar(latest));
                Preconditions.checkState(antecedent != Trail.DECISION,
                        "cannot resolve on decision %s", AbstractSATSolver.literalToString(latest));
                resolve(work, latest, antecedent);
                steps.add(new ResolutionTracer.Step(antecedent, latest));
            }
        } finally {
            for (int i = 0; i < work.size(); ++i) inClause[work.get(i)] = false;
        }

        // Put the UIP first; the backjump level is the highest level among the rest.
        int[] literals = new int[work.size()];
        int uip = -1;
        int backjump = 0;
        int k = 1;
        for (int i = 0; i < work.size(); ++i) {
            int l = work.get(i);
            int lv = trail.levelOf(thevar(l));
            if (lv == level && uip < 0) {
                uip = l;
                literals[0] = l;
            } else {
                if (lv > backjump) backjump = lv;
                literals[k++] = l;
            }
        }
        int id = store.add(literals, ClauseStore.Kind.LEARNED);
        ResolutionTracer.Record record = new ResolutionTracer.Record(conflict, steps.build());
        tracer.record(id, record);
        resolutions += record.steps.size();
        if (log.isDebugEnabled()) {
            log.debug("conflict %s at level %d: learned %s via %s, backjump to %d",
                    store.toString(conflict), level, store.toString(id), record, backjump);
        }
        return new Analysis(id, store.get(id), backjump, uip);
    }

    /**
     * Replace the working clause with its resolvent against the antecedent on pivot: the
     * union of both, less pivot and its complement, without repeats.
     */
    private void resolve(TIntArrayList work, int pivot, int antecedent) {
        work.remove(pivot);
        inClause[pivot] = false;
        for (int l : store.get(antecedent)) {
            if (l == not(pivot) || inClause[l]) continue;
            inClause[l] = true;
            work.add(l);
        }
    }

    long resolutions() { return resolutions; }
}
