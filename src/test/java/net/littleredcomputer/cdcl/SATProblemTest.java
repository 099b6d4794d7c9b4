package net.littleredcomputer.cdcl;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.io.StringReader;
import java.util.Arrays;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SATProblemTest {

    @Test
    public void simple() {
        SATProblem p = SATProblem.parseFrom(new StringReader("c simple test\nc heh\np cnf 3 2\n1 -3 0\n2 3 -1 0"));
        assertThat(p.nVariables(), is(3));
        assertThat(p.nClauses(), is(2));
        assertThat(p.nLiterals(), is(5));
        assertThat(p.getClause(1), is(Arrays.asList(2, 3, -1)));
    }

    @Test
    public void clausesMaySpanLines() {
        SATProblem p = SATProblem.parseFrom("p cnf 3 2\n1\n -3 0 2\t3\n\n-1 0\n");
        assertThat(p.getClause(0), is(Arrays.asList(1, -3)));
        assertThat(p.getClause(1), is(Arrays.asList(2, 3, -1)));
    }

    @Test
    public void emptyClauseIsAccepted() {
        SATProblem p = SATProblem.parseFrom(new StringReader("c empty clause\np cnf 3 3\n1 2 3 0 0 1 2 0"));
        assertThat(p.nClauses(), is(3));
        assertThat(p.getClause(1), is(ImmutableList.<Integer>of()));
    }

    @Test
    public void satlibTrailerEndsClauses() {
        SATProblem p = SATProblem.parseFrom("c uf-style\np cnf 3 2\n 1 -3 0\n 2 3 -1 0\n%\n0\n\n");
        assertThat(p.nClauses(), is(2));
        assertThat(p.getClause(1), is(Arrays.asList(2, 3, -1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void literalOutOfBounds() {
        SATProblem.parseFrom(new StringReader("c oob literal\np cnf 3 2\n1 2 3 0\n2 3 4 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooManyClauses() {
        SATProblem.parseFrom(new StringReader("c oob clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void danglingClause() {
        SATProblem.parseFrom(new StringReader("c unclosed clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingHeader() {
        SATProblem.parseFrom("1 2 0\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void noData() {
        SATProblem.parseFrom("c nothing here\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void notANumber() {
        SATProblem.parseFrom("p cnf 2 1\n1 x 0\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void noVariables() {
        SATProblem.parseFrom("p cnf 0 0\n");
    }

    @Test
    public void knuthFormat() {
        SATProblem p = SATProblem.parseKnuth("~ a comment\nx ~y\ny z\n~z ~x\n");
        assertThat(p.nVariables(), is(3));
        assertThat(p.nClauses(), is(3));
        assertThat(p.getClause(0), is(Arrays.asList(1, -2)));
        assertThat(p.getClause(2), is(Arrays.asList(-3, -1)));
    }

    @Test
    public void evaluate() {
        SATProblem p = SATProblem.parseFrom("p cnf 3 2\n1 -3 0\n2 3 -1 0");
        assertThat(p.evaluate(new boolean[]{true, true, false}), is(true));
        assertThat(p.evaluate(new boolean[]{false, false, true}), is(false));
        assertThat(p.evaluate(new boolean[]{true, false, false}), is(false));
    }

    @Test
    public void restrictTo() {
        SATProblem p = SATProblem.parseFrom("p cnf 3 4\n1 0 -1 2 0 -2 3 0 -3 0");
        SATProblem q = p.restrictTo(Arrays.asList(3, 0));
        assertThat(q.nVariables(), is(3));
        assertThat(q.nClauses(), is(2));
        assertThat(q.getClause(0), is(Arrays.asList(1)));
        assertThat(q.getClause(1), is(Arrays.asList(-3)));
    }

    @Test
    public void waerden() {
        // waerden(3, 3; 9): for each spacing d, 9 - 2d progressions of each color.
        SATProblem p = SATProblem.waerden(3, 3, 9);
        assertThat(p.nVariables(), is(9));
        assertThat(p.nClauses(), is(2 * (7 + 5 + 3 + 1)));
        assertThat(p.getClause(0), is(Arrays.asList(1, 2, 3)));
        assertThat(p.getClause(16), is(Arrays.asList(-1, -2, -3)));
    }

    @Test
    public void langford() {
        SATProblem p = SATProblem.langford(3);
        // Digit i can start in 2n-i-2 places.
        assertThat(p.nVariables(), is(4 + 3 + 2));
    }

    @Test
    public void pigeonhole() {
        SATProblem p = SATProblem.pigeonhole(3);
        assertThat(p.nVariables(), is(12));
        assertThat(p.nClauses(), is(4 + 3 * 6));
        assertThat(p.getClause(0), is(Arrays.asList(1, 2, 3)));
        assertThat(p.getClause(4), is(Arrays.asList(-1, -4)));
    }

    @Test
    public void randomInstanceIsReproducible() {
        SATProblem p = SATProblem.randomInstance(3, 10, 5, 42);
        SATProblem q = SATProblem.randomInstance(3, 10, 5, 42);
        assertThat(p.nClauses(), is(10));
        for (int i = 0; i < p.nClauses(); ++i) {
            assertThat(p.getClause(i), is(q.getClause(i)));
            assertThat(p.getClause(i).stream().map(Math::abs).distinct().count(), is(3L));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void randomInstanceNeedsEnoughVariables() {
        SATProblem.randomInstance(4, 10, 3, 0);
    }
}
