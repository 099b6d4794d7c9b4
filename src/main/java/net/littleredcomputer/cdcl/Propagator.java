package net.littleredcomputer.cdcl;

import javax.annotation.CheckReturnValue;
import java.util.OptionalInt;

/**
 * Unit propagation by repeated linear scans over every clause in the store. There is
 * no watch list: each pass examines every clause, and passes repeat until one makes no
 * assignment.
 */
class Propagator {
    private final ClauseStore store;
    private final Trail trail;
    private long propagations = 0;
    private long passes = 0;

    Propagator(ClauseStore store, Trail trail) {
        this.store = store;
        this.trail = trail;
    }

    /**
     * Extend the trail with every literal forced by a unit clause, at the current level,
     * until nothing more is forced or some clause is falsified.
     *
     * @return the id of a falsified clause, or empty if a fixed point was reached
     */
    @CheckReturnValue
    OptionalInt propagate() {
        boolean changed = true;
        while (changed) {
            changed = false;
            ++passes;
            for (int id = 0; id < store.size(); ++id) {
                int[] c = store.get(id);
                int free = -1;
                int nFree = 0;
                boolean satisfied = false;
                for (int l : c) {
                    Trail.Value v = trail.literalValue(l);
                    if (v == Trail.Value.TRUE) {
                        satisfied = true;
                        break;
                    }
                    if (v == Trail.Value.UNASSIGNED) {
                        free = l;
                        ++nFree;
                    }
                }
                if (satisfied || nFree > 1) continue;
                if (nFree == 0) return OptionalInt.of(id);
                trail.assignLiteral(free, trail.currentLevel(), id);
                ++propagations;
                changed = true;
            }
        }
        return OptionalInt.empty();
    }

    long propagations() { return propagations; }

    long passes() { return passes; }
}
