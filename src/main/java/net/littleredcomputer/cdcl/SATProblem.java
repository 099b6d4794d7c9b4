package net.littleredcomputer.cdcl;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.StreamSupport;

import static java.util.stream.Collectors.toList;

/**
 * A CNF formula over the variables [1, nVariables]. Clauses are kept in the order they
 * were added; the index of a clause in that order is its identity everywhere else
 * (in particular, in an UNSAT core).
 */
public class SATProblem {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(Pattern.compile("\\s+")).trimResults().omitEmptyStrings();
    private final int nVariables;
    private final List<List<Integer>> clauses = new ArrayList<>();
    private int nLiterals = 0;

    SATProblem(int nVariables) {
        if (nVariables < 1) throw new IllegalArgumentException("Must have at least one variable");
        this.nVariables = nVariables;
    }

    public int nClauses() {
        return clauses.size();
    }

    /** Clauses in the solver's [2v|2v+1] literal encoding. */
    List<List<Integer>> encodedClauses() { return Collections.unmodifiableList(clauses); }

    public int nVariables() {
        return nVariables;
    }

    public int nLiterals() {
        return nLiterals;
    }

    /** The ith clause, in DIMACS (signed) notation. */
    public List<Integer> getClause(int i) {
        return clauses.get(i).stream().map(AbstractSATSolver::toDimacs).collect(toList());
    }

    void addClause(Iterable<Integer> literals) {
        ImmutableList.Builder<Integer> b = ImmutableList.builder();
        for (int l : literals) {
            if (l == 0 || l > nVariables || l < -nVariables) {
                throw new IllegalArgumentException("literal " + l + " out of declared bounds");
            }
            b.add(AbstractSATSolver.fromDimacs(l));
        }
        List<Integer> clause = b.build();
        nLiterals += clause.size();
        clauses.add(clause);
    }

    /**
     * Evaluate the boolean function represented by the problem's clauses at the specified point
     * @param p point (i.e., vector of booleans) at which to evaluate; p[i] is the value of variable i+1
     * @return the truth value of this problem at p
     */
    public boolean evaluate(boolean[] p) {
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (p[(literal >> 1) - 1] == ((literal & 1) == 0)) continue CLAUSE;
            }
            return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;
    }

    /**
     * Build the problem consisting only of the given clauses of this one, over the same
     * variables. Clause order follows ascending index.
     *
     * @param clauseIndices indices of clauses in this problem
     * @return the sub-problem
     */
    public SATProblem restrictTo(Collection<Integer> clauseIndices) {
        SATProblem q = new SATProblem(nVariables);
        new TreeSet<>(clauseIndices).forEach(i -> q.addClause(getClause(i)));
        return q;
    }

    public static SATProblem parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Parse a problem in DIMACS CNF format. A clause may span lines and several clauses may
     * share a line; a 0 with no preceding literals is the empty clause.
     */
    public static SATProblem parseFrom(Reader r) {
        List<Integer> literals = new ArrayList<>();
        // SATLIB files end the clause data with a line beginning %, which may be followed by junk.
        Iterator<String> ls = new BufferedReader(r).lines()
                .takeWhile(s -> !s.startsWith("%"))
                .filter(s -> !s.startsWith("c") && !s.trim().isEmpty())
                .iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing SAT instance data");
        Matcher m = pLineRe.matcher(ls.next().trim());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nClause = Integer.parseInt(m.group(2));
        SATProblem p = new SATProblem(nVar);
        ls.forEachRemaining(line -> StreamSupport.stream(splitter.split(line).spliterator(), false)
                .mapToInt(SATProblem::parseLiteral)
                .forEach(l -> {
                    if (l == 0) {
                        p.addClause(literals);
                        literals.clear();
                    } else {
                        if (l > nVar || l < -nVar) throw new IllegalArgumentException("literal out of declared bounds");
                        literals.add(l);
                    }
                }));
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (p.nClauses() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return p;
    }

    private static int parseLiteral(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a literal: " + s, e);
        }
    }

    public static SATProblem parseKnuth(String s) { return parseKnuth(new StringReader(s)); }

    /**
     * Parse a problem in the format of Knuth's SAT programs: one clause per line, named
     * variables, ~ for negation; lines beginning with "~ " are comments. Variables are
     * numbered in order of first appearance.
     */
    public static SATProblem parseKnuth(Reader r) {
        Map<String, Integer> varMap = new HashMap<>();
        List<List<Integer>> clauses = new ArrayList<>();
        new BufferedReader(r).lines()
                .filter(s -> !s.startsWith("~ ") && !s.trim().isEmpty())
                .forEach(line -> {
                    List<Integer> clause = new ArrayList<>();
                    for (String lit : splitter.split(line)) {
                        boolean negated = lit.startsWith("~");
                        String name = negated ? lit.substring(1) : lit;
                        if (name.isEmpty()) throw new IllegalArgumentException("bare negation in: " + line);
                        int v = varMap.computeIfAbsent(name, k -> varMap.size() + 1);
                        clause.add(negated ? -v : v);
                    }
                    clauses.add(clause);
                });
        if (varMap.isEmpty()) throw new IllegalArgumentException("Missing SAT instance data");
        SATProblem p = new SATProblem(varMap.size());
        clauses.forEach(p::addClause);
        return p;
    }

    /**
     * Generate the SAT problem waerden(j, k; n), defined by 7.2.2.2 (10): no j equally
     * spaced 0s and no k equally spaced 1s in a binary string of length n. It is
     * satisfiable iff n &lt; W(j, k).
     *
     * @param j Number of equally spaced 0s to forbid
     * @param k Number of equally spaced 1s to forbid
     * @param n Length of binary string
     * @return the problem
     */
    public static SATProblem waerden(int j, int k, int n) {
        SATProblem p = new SATProblem(n);
        addProgressions(p, j, n, 1);
        addProgressions(p, k, n, -1);
        return p;
    }

    private static void addProgressions(SATProblem p, int length, int n, int sign) {
        // A progression of length 1 has no spacing, so only d = 1 contributes.
        for (int d = 1; d == 1 || (length > 1 && 1 + (length - 1) * d <= n); ++d) {
            for (int i = 1; i + (length - 1) * d <= n; ++i) {
                List<Integer> clause = new ArrayList<>(length);
                for (int h = 0; h < length; ++h) clause.add(sign * (i + d * h));
                p.addClause(clause);
            }
        }
    }

    /**
     * Langford's problem of order n posed as exact cover, 7.2.2.2 (11). Each option
     * (placement of a digit i in positions j and j+i+1) is a variable; each item must be
     * covered exactly once. Solvable iff n mod 4 is 0 or 3.
     */
    public static SATProblem langford(int n) {
        // The first n items are the digits; the next 2n the slots.
        List<List<Integer>> items = new ArrayList<>(3 * n);
        for (int i = 0; i < 3 * n; ++i) items.add(new ArrayList<>());
        int option = 0;
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j + i + 2 < 2 * n; ++j) {
                ++option;
                items.get(i).add(option);
                items.get(n + j).add(option);
                items.get(n + j + i + 2).add(option);
            }
        }
        SATProblem p = new SATProblem(option);
        items.forEach(options -> exactlyOne(p, options));
        return p;
    }

    /** Clauses for S1(y_1...y_k), eq. 7.2.2.2 (13). */
    private static void exactlyOne(SATProblem p, List<Integer> vars) {
        p.addClause(vars);
        for (int a = 0; a < vars.size(); ++a) {
            for (int b = a + 1; b < vars.size(); ++b) {
                p.addClause(Arrays.asList(-vars.get(a), -vars.get(b)));
            }
        }
    }

    /**
     * The pigeonhole problem: n+1 pigeons, n holes, every pigeon in some hole, no two
     * pigeons sharing one. Always unsatisfiable. Variable i*n+j+1 means pigeon i is in hole j.
     */
    public static SATProblem pigeonhole(int n) {
        if (n < 1) throw new IllegalArgumentException("need at least one hole");
        SATProblem p = new SATProblem((n + 1) * n);
        for (int i = 0; i <= n; ++i) {
            List<Integer> somewhere = new ArrayList<>(n);
            for (int j = 0; j < n; ++j) somewhere.add(i * n + j + 1);
            p.addClause(somewhere);
        }
        for (int j = 0; j < n; ++j) {
            for (int i = 0; i <= n; ++i) {
                for (int ii = i + 1; ii <= n; ++ii) {
                    p.addClause(Arrays.asList(-(i * n + j + 1), -(ii * n + j + 1)));
                }
            }
        }
        return p;
    }

    /**
     * Generate a random k-SAT instance: m clauses, each of k distinct variables drawn
     * uniformly from [1, n] with random signs.
     */
    public static SATProblem randomInstance(int k, int m, int n, long seed) {
        if (k <= 0) throw new IllegalArgumentException("k must be positive!");
        if (m <= 0) throw new IllegalArgumentException("m must be positive!");
        if (n <= 0) throw new IllegalArgumentException("n must be positive!");
        if (k > n) throw new IllegalArgumentException("k mustn't exceed n!");
        Random R = new Random(seed);
        SATProblem p = new SATProblem(n);
        for (int c = 0; c < m; ++c) {
            Set<Integer> vars = new LinkedHashSet<>();
            while (vars.size() < k) vars.add(1 + R.nextInt(n));
            p.addClause(vars.stream().map(v -> R.nextBoolean() ? v : -v).collect(toList()));
        }
        return p;
    }
}
