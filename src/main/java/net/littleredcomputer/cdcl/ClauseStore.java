package net.littleredcomputer.cdcl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Append-only store of clauses. Each clause is an array of encoded literals and is
 * identified by its position in order of creation. Nothing is ever removed.
 */
class ClauseStore {
    enum Kind { ORIGINAL, LEARNED }

    private final List<int[]> clauses = new ArrayList<>();
    private final List<Kind> kinds = new ArrayList<>();
    private int nLearned = 0;

    /**
     * Add a clause. Repeated literals are dropped; the order of first occurrence is kept.
     *
     * @param literals encoded literals; may be empty (the empty clause)
     * @param kind provenance of the clause
     * @return the new clause's id
     */
    int add(int[] literals, Kind kind) {
        int[] c = Arrays.stream(literals).distinct().toArray();
        clauses.add(c);
        kinds.add(kind);
        if (kind == Kind.LEARNED) ++nLearned;
        return clauses.size() - 1;
    }

    int add(List<Integer> literals, Kind kind) {
        return add(literals.stream().mapToInt(Integer::intValue).toArray(), kind);
    }

    /** The literals of clause id. Callers must not modify the returned array. */
    int[] get(int id) {
        Preconditions.checkElementIndex(id, clauses.size(), "clause id");
        return clauses.get(id);
    }

    Kind kind(int id) {
        Preconditions.checkElementIndex(id, kinds.size(), "clause id");
        return kinds.get(id);
    }

    ImmutableSortedSet<Integer> allOriginal() {
        ImmutableSortedSet.Builder<Integer> b = ImmutableSortedSet.naturalOrder();
        for (int i = 0; i < kinds.size(); ++i) if (kinds.get(i) == Kind.ORIGINAL) b.add(i);
        return b.build();
    }

    int size() { return clauses.size(); }

    int learnedCount() { return nLearned; }

    String toString(int id) {
        StringBuilder sb = new StringBuilder().append(kind(id) == Kind.LEARNED ? 'L' : 'C').append(id).append('(');
        int[] c = get(id);
        for (int i = 0; i < c.length; ++i) {
            if (i > 0) sb.append(' ');
            sb.append(AbstractSATSolver.literalToString(c[i]));
        }
        return sb.append(')').toString();
    }
}
