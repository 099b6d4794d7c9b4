package net.littleredcomputer.cdcl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records how each learned clause was derived. A clause with no record is a leaf of
 * the proof: an original clause.
 */
class ResolutionTracer {
    /** One resolution: the working clause was resolved with clause {@code antecedent} on {@code pivot}. */
    static final class Step {
        final int antecedent;
        final int pivot;  // the encoded literal removed from the working clause; its complement left the antecedent

        Step(int antecedent, int pivot) {
            this.antecedent = antecedent;
            this.pivot = pivot;
        }

        @Override
        public String toString() {
            return antecedent + "/" + AbstractSATSolver.literalToString(pivot);
        }
    }

    /** A derivation: start from the conflict clause and apply the steps in order. */
    static final class Record {
        final int conflict;
        final ImmutableList<Step> steps;

        Record(int conflict, ImmutableList<Step> steps) {
            this.conflict = conflict;
            this.steps = steps;
        }

        /** Every clause consumed by the derivation, conflict clause first. */
        ImmutableList<Integer> antecedents() {
            ImmutableList.Builder<Integer> b = ImmutableList.builder();
            b.add(conflict);
            steps.forEach(s -> b.add(s.antecedent));
            return b.build();
        }

        @Override
        public String toString() {
            return conflict + " " + steps;
        }
    }

    private final Map<Integer, Record> records = new HashMap<>();

    void record(int learned, @Nonnull Record derivation) {
        Preconditions.checkState(records.putIfAbsent(learned, derivation) == null,
                "clause %s already has a derivation", learned);
    }

    Optional<Record> lookup(int clause) {
        return Optional.ofNullable(records.get(clause));
    }

    int size() { return records.size(); }
}
