package net.littleredcomputer.cdcl;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Command line front end. Prints the result in the style of the SAT competitions and
 * exits with 10 (satisfiable), 20 (unsatisfiable), 0 (budget exhausted) or 1 (bad input).
 */
public class Main {
    private static final Logger log = LogManager.getFormatterLogger();
    static final int EXIT_SAT = 10;
    static final int EXIT_UNSAT = 20;
    static final int EXIT_UNKNOWN = 0;
    static final int EXIT_ERROR = 1;

    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final Splitter commaSplitter = Splitter.on(',').trimResults();
    private static final Pattern langfordRe = Pattern.compile("langford(\\d+)");
    private static final Pattern waerdenRe = Pattern.compile("waerden(\\d+,\\d+,\\d+)");
    private static final Pattern holeRe = Pattern.compile("hole(\\d+)");

    private static Options options() {
        return new Options()
                .addOption("problem", true, "filename of problem description, - for stdin, or langfordN, waerdenJ,K,N, holeN")
                .addOption("format", true, "format of problem file: cnf (default) or knuth")
                .addOption("core", false, "print the UNSAT core as a DIMACS problem")
                .addOption("maxconflicts", true, "give up after this many conflicts")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(p), StandardCharsets.UTF_8));
    }

    static SATProblem satProblem(CommandLine cmd) throws IOException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        Matcher lm = langfordRe.matcher(p);
        if (lm.matches()) return SATProblem.langford(Integer.parseInt(lm.group(1)));
        Matcher hm = holeRe.matcher(p);
        if (hm.matches()) return SATProblem.pigeonhole(Integer.parseInt(hm.group(1)));
        Matcher wm = waerdenRe.matcher(p);
        if (wm.matches()) {
            List<String> jkn = commaSplitter.splitToList(wm.group(1));
            return SATProblem.waerden(Integer.parseInt(jkn.get(0)), Integer.parseInt(jkn.get(1)), Integer.parseInt(jkn.get(2)));
        }
        // Didn't match a canned problem generator; try a file
        try (Reader r = problem(cmd)) {
            switch (cmd.getOptionValue("format", "cnf")) {
                case "cnf": return SATProblem.parseFrom(r);
                case "knuth": return SATProblem.parseKnuth(r);
                default: throw new IllegalArgumentException("unknown problem format");
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    /**
     * Solve the problem described by args, writing the result to out.
     *
     * @return the process exit status
     */
    static int run(String[] args, PrintStream out) {
        CommandLine cmd;
        SATProblem p;
        long maxConflicts;
        Duration logInterval;
        try {
            cmd = new DefaultParser().parse(options(), args);
            p = satProblem(cmd);
            maxConflicts = Long.parseLong(cmd.getOptionValue("maxconflicts", Long.toString(Long.MAX_VALUE)));
            logInterval = logInterval(cmd);
        } catch (ParseException | IllegalArgumentException | DateTimeParseException e) {
            System.err.println("c error: " + e.getMessage());
            new HelpFormatter().printHelp("cdcl", options());
            return EXIT_ERROR;
        } catch (IOException e) {
            log.error("cannot read problem", e);
            System.err.println("c error: " + e.getMessage());
            return EXIT_ERROR;
        }

        CDCLSolver s = new CDCLSolver(p);
        s.setLogInterval(logInterval);
        Stopwatch sw = Stopwatch.createStarted();
        s.solve(maxConflicts);
        sw.stop();
        out.println("c " + sw);
        out.printf("c %d decisions, %d conflicts, %d propagations in %d passes, %d learned clauses%n",
                s.decisions(), s.conflicts(), s.propagations(), s.propagationPasses(), s.learnedClauses());
        switch (s.state()) {
            case SAT: {
                out.println("s SATISFIABLE");
                StringBuilder v = new StringBuilder("v ");
                boolean[] bs = s.model();
                for (int i = 0; i < bs.length; ++i) v.append(bs[i] ? i + 1 : -i - 1).append(' ');
                out.println(v.append('0'));
                return EXIT_SAT;
            }
            case UNSAT: {
                out.println("s UNSATISFIABLE");
                out.println("c core " + spaceJoiner.join(s.core()));
                if (cmd.hasOption("core")) {
                    List<List<Integer>> core = s.coreClauses();
                    out.printf("p cnf %d %d%n", p.nVariables(), core.size());
                    core.forEach(c -> out.println(c.isEmpty() ? "0" : spaceJoiner.join(c) + " 0"));
                }
                return EXIT_UNSAT;
            }
            default:
                out.println("s UNKNOWN");
                return EXIT_UNKNOWN;
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }
}
