// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import com.google.common.base.Splitter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

public class Main {
    private static final String IMPOSSIBLE = "IMPOSSIBLE";
    private static Splitter commaSplitter = Splitter.on(',').trimResults().omitEmptyStrings();

    private static Options options() {
        return new Options()
                .addOption("problem", true, "filename of problem cases (- for standard input, the default)")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format")
                .addOption("trace", true, "comma-separated trace categories: FILTER, SEARCH, SOLUTION");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        String p = cmd.getOptionValue("problem", "-");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static EnumSet<LimitedCorrespondence.Trace> tracing(CommandLine cmd) {
        EnumSet<LimitedCorrespondence.Trace> t = EnumSet.noneOf(LimitedCorrespondence.Trace.class);
        if (cmd.hasOption("trace")) {
            for (String s : commaSplitter.split(cmd.getOptionValue("trace"))) {
                t.add(LimitedCorrespondence.Trace.valueOf(s.toUpperCase()));
            }
        }
        return t;
    }

    /**
     * Solve each case read from {@code in}, writing one {@code Case k: result} line per case.
     */
    static void run(Reader in, PrintStream out, Duration logInterval, EnumSet<LimitedCorrespondence.Trace> tracing) {
        List<CorrespondenceProblem> problems = CorrespondenceProblem.parseFrom(in);
        for (int k = 0; k < problems.size(); ++k) {
            String result = new LimitedCorrespondence(problems.get(k))
                    .setLogInterval(logInterval)
                    .setTracing(tracing)
                    .solve()
                    .orElse(IMPOSSIBLE);
            out.println("Case " + (k + 1) + ": " + result);
        }
    }

    public static void main(String[] args) throws ParseException, FileNotFoundException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        run(problem(cmd), System.out, logInterval(cmd), tracing(cmd));
    }
}
