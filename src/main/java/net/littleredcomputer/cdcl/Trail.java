package net.littleredcomputer.cdcl;

import com.google.common.base.Preconditions;
import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;

/**
 * The assignment trail: the variables in the order they were assigned, partitioned
 * into decision levels. For each assigned variable we keep its value, level, position
 * on the trail and antecedent (the clause that forced it, or {@link #DECISION}).
 */
class Trail {
    enum Value { TRUE, FALSE, UNASSIGNED }

    static final int DECISION = -1;
    private static final int UNASSIGNED = -1;

    private final int nVariables;
    private final int[] x;  // -1 unassigned, else 0 (false) or 1 (true), indexed by variable
    private final int[] level;
    private final int[] antecedent;
    private final int[] position;
    private final TIntArrayList trail;
    private final TIntArrayList markers = new TIntArrayList();  // markers[d-1] is where level d begins

    Trail(int nVariables) {
        this.nVariables = nVariables;
        x = new int[nVariables + 1];
        level = new int[nVariables + 1];
        antecedent = new int[nVariables + 1];
        position = new int[nVariables + 1];
        trail = new TIntArrayList(nVariables);
        Arrays.fill(x, UNASSIGNED);
    }

    /**
     * Record an assignment at the end of the trail.
     *
     * @throws IllegalStateException if the variable is already assigned
     * @throws IllegalArgumentException if level is not the current level
     */
    void assign(int variable, boolean value, int level, int antecedent) {
        Preconditions.checkElementIndex(variable - 1, nVariables, "variable");
        Preconditions.checkState(x[variable] == UNASSIGNED, "variable %s is already assigned", variable);
        Preconditions.checkArgument(level == currentLevel(), "assignment at level %s but current level is %s", level, currentLevel());
        x[variable] = value ? 1 : 0;
        this.level[variable] = level;
        this.antecedent[variable] = antecedent;
        position[variable] = trail.size();
        trail.add(variable);
    }

    /** Make the encoded literal l true. */
    void assignLiteral(int l, int level, int antecedent) {
        assign(AbstractSATSolver.thevar(l), !AbstractSATSolver.negated(l), level, antecedent);
    }

    Value valueOf(int variable) {
        switch (x[variable]) {
            case UNASSIGNED: return Value.UNASSIGNED;
            case 0: return Value.FALSE;
            default: return Value.TRUE;
        }
    }

    /** Value of the encoded literal l under the current assignment. */
    Value literalValue(int l) {
        int v = x[l >> 1];
        if (v == UNASSIGNED) return Value.UNASSIGNED;
        return v == (l & 1) ? Value.FALSE : Value.TRUE;
    }

    boolean isAssigned(int variable) { return x[variable] != UNASSIGNED; }

    int levelOf(int variable) {
        Preconditions.checkState(isAssigned(variable), "variable %s is unassigned", variable);
        return level[variable];
    }

    int antecedentOf(int variable) {
        Preconditions.checkState(isAssigned(variable), "variable %s is unassigned", variable);
        return antecedent[variable];
    }

    int positionOf(int variable) {
        Preconditions.checkState(isAssigned(variable), "variable %s is unassigned", variable);
        return position[variable];
    }

    void pushDecisionMarker() {
        markers.add(trail.size());
    }

    int currentLevel() { return markers.size(); }

    /**
     * Unassign, latest first, every variable assigned at a level above the given one, and
     * make that level current.
     */
    void backjumpTo(int target) {
        Preconditions.checkArgument(target >= 0 && target <= currentLevel(),
                "cannot backjump to level %s from level %s", target, currentLevel());
        if (target == currentLevel()) return;
        int keep = markers.get(target);
        for (int i = trail.size() - 1; i >= keep; --i) x[trail.get(i)] = UNASSIGNED;
        trail.remove(keep, trail.size() - keep);
        markers.remove(target, markers.size() - target);
    }

    int size() { return trail.size(); }

    /** The variable at trail position i. */
    int get(int i) { return trail.get(i); }

    boolean isComplete() { return trail.size() == nVariables; }

    int nVariables() { return nVariables; }

    /** The current assignment; index i holds variable i+1. Unassigned variables read false. */
    boolean[] model() {
        boolean[] bs = new boolean[nVariables];
        for (int j = 1; j <= nVariables; ++j) bs[j-1] = x[j] == 1;
        return bs;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int d = 0;
        for (int i = 0; i < trail.size(); ++i) {
            while (d < markers.size() && markers.get(d) == i) {
                sb.append(" |");
                ++d;
            }
            int v = trail.get(i);
            sb.append(' ').append(x[v] == 1 ? "" : "~").append(v);
            if (antecedent[v] != DECISION) sb.append('<').append(antecedent[v]);
        }
        return sb.toString().trim();
    }
}
