package net.littleredcomputer.cdcl;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class TrailTest {
    private final Trail t = new Trail(5);

    @Test
    public void freshTrailIsEmptyAtLevelZero() {
        assertThat(t.currentLevel(), is(0));
        assertThat(t.size(), is(0));
        for (int v = 1; v <= 5; ++v) assertThat(t.valueOf(v), is(Trail.Value.UNASSIGNED));
    }

    @Test
    public void assignRecordsValueLevelAntecedentAndPosition() {
        t.assign(3, true, 0, 7);
        t.pushDecisionMarker();
        t.assign(1, false, 1, Trail.DECISION);
        assertThat(t.valueOf(3), is(Trail.Value.TRUE));
        assertThat(t.valueOf(1), is(Trail.Value.FALSE));
        assertThat(t.levelOf(3), is(0));
        assertThat(t.levelOf(1), is(1));
        assertThat(t.antecedentOf(3), is(7));
        assertThat(t.antecedentOf(1), is(Trail.DECISION));
        assertThat(t.positionOf(3), is(0));
        assertThat(t.positionOf(1), is(1));
        assertThat(t.get(1), is(1));
    }

    @Test
    public void literalValues() {
        t.assign(2, false, 0, 0);
        assertThat(t.literalValue(AbstractSATSolver.poslit(2)), is(Trail.Value.FALSE));
        assertThat(t.literalValue(AbstractSATSolver.neglit(2)), is(Trail.Value.TRUE));
        assertThat(t.literalValue(AbstractSATSolver.poslit(4)), is(Trail.Value.UNASSIGNED));
        t.assignLiteral(AbstractSATSolver.neglit(4), 0, 1);
        assertThat(t.valueOf(4), is(Trail.Value.FALSE));
    }

    @Test(expected = IllegalStateException.class)
    public void doubleAssignmentIsFatal() {
        t.assign(2, true, 0, 0);
        t.assign(2, false, 0, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void assignmentBelowCurrentLevelIsFatal() {
        t.pushDecisionMarker();
        t.assign(2, true, 0, 0);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void unknownVariableIsFatal() {
        t.assign(6, true, 0, 0);
    }

    @Test(expected = IllegalStateException.class)
    public void levelOfUnassignedVariableIsFatal() {
        t.levelOf(1);
    }

    @Test
    public void backjumpKeepsExactlyTheLowerLevels() {
        t.assign(5, true, 0, 0);
        t.pushDecisionMarker();
        t.assign(1, false, 1, Trail.DECISION);
        t.assign(2, true, 1, 1);
        t.pushDecisionMarker();
        t.assign(3, false, 2, Trail.DECISION);
        t.pushDecisionMarker();
        t.assign(4, false, 3, Trail.DECISION);
        assertThat(t.currentLevel(), is(3));

        t.backjumpTo(1);
        assertThat(t.currentLevel(), is(1));
        assertThat(t.size(), is(3));
        assertThat(t.valueOf(5), is(Trail.Value.TRUE));
        assertThat(t.valueOf(1), is(Trail.Value.FALSE));
        assertThat(t.valueOf(2), is(Trail.Value.TRUE));
        assertThat(t.valueOf(3), is(Trail.Value.UNASSIGNED));
        assertThat(t.valueOf(4), is(Trail.Value.UNASSIGNED));

        // The freed variables may be assigned again, at the level we returned to.
        t.assign(4, true, 1, 2);
        assertThat(t.positionOf(4), is(3));

        t.backjumpTo(0);
        assertThat(t.currentLevel(), is(0));
        assertThat(t.size(), is(1));
        assertThat(t.valueOf(4), is(Trail.Value.UNASSIGNED));
    }

    @Test
    public void backjumpToCurrentLevelChangesNothing() {
        t.pushDecisionMarker();
        t.assign(1, true, 1, Trail.DECISION);
        t.backjumpTo(1);
        assertThat(t.size(), is(1));
        assertThat(t.currentLevel(), is(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void backjumpAboveCurrentLevelIsFatal() {
        t.backjumpTo(1);
    }

    @Test
    public void model() {
        t.assign(1, true, 0, 0);
        t.assign(4, true, 0, 0);
        t.assign(2, false, 0, 0);
        assertThat(t.isComplete(), is(false));
        assertThat(t.model(), is(new boolean[]{true, false, false, true, false}));
    }

    @Test
    public void rendering() {
        t.assign(5, true, 0, 3);
        t.pushDecisionMarker();
        t.assign(1, false, 1, Trail.DECISION);
        assertThat(t.toString(), is("5<3 | ~1"));
    }
}
