// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Solver for the limited correspondence problem: find the shortest, and among those the
 * lexicographically least, text which is both a concatenation of a-strings and the
 * concatenation of the corresponding b-strings, each pair being used at most once.
 * <p>
 * Candidate sets of pairs are first winnowed by the {@link CombinationFilters}; the
 * survivors are then ordered by {@link CorrespondenceMatcher}, shortest first. The
 * work is done once, on the first request for the result.
 */
public class LimitedCorrespondence {
    private static final Logger log = LogManager.getFormatterLogger(LimitedCorrespondence.class);

    public enum Trace {
        FILTER,
        SEARCH,
        SOLUTION,
    }

    private final CorrespondenceProblem problem;
    private final SearchProgress progress = new SearchProgress("correspondence");
    private EnumSet<Trace> tracing = EnumSet.noneOf(Trace.class);
    private Optional<Match> outcome;  // null until solved

    public LimitedCorrespondence(CorrespondenceProblem problem) {
        this.problem = problem;
    }

    public LimitedCorrespondence setLogInterval(Duration interval) {
        progress.setLogInterval(interval);
        return this;
    }

    public LimitedCorrespondence setTracing(EnumSet<Trace> tracing) {
        this.tracing = EnumSet.copyOf(tracing);
        return this;
    }

    /**
     * @return the text of the solution, or empty if the problem is impossible
     */
    public Optional<String> solve() {
        return match().map(Match::text);
    }

    /**
     * @return the solution along with the sequence of pairs producing it, or empty if
     * the problem is impossible
     */
    public Optional<Match> match() {
        if (outcome == null) {
            progress.start();
            outcome = search();
            progress.stop();
            log.debug("%s: %s after %d steps in %s", problem, outcome.map(Match::toString).orElse("impossible"),
                    progress.steps(), progress.elapsed());
        }
        return outcome;
    }

    private void trace(String format, Object... args) {
        if (tracing.contains(Trace.FILTER)) log.trace(format, args);
    }

    private Optional<Match> search() {
        StringTrie aTrie = StringTrie.build(problem.aStrings());
        StringTrie bTrie = StringTrie.build(problem.bStrings());

        ImmutableSortedSet<Integer> beginning = CombinationFilters.prefixCandidates(problem);
        trace("prefix filter: %s", beginning);
        if (beginning.isEmpty()) return Optional.empty();

        ImmutableSortedSet<Integer> ending = CombinationFilters.postfixCandidates(problem);
        trace("postfix filter: %s", ending);
        if (ending.isEmpty()) return Optional.empty();

        ImmutableSortedMap<Integer, List<ImmutableSortedSet<Integer>>> balanced =
                CombinationFilters.lengthBalanced(problem, beginning, ending);
        trace("length balance filter: %s", balanced);
        if (balanced.isEmpty()) return Optional.empty();

        ImmutableSortedMap<Integer, List<ImmutableSortedSet<Integer>>> combinations =
                CombinationFilters.elementBalanced(problem, balanced);
        trace("element balance filter: %s", combinations);
        if (combinations.isEmpty()) return Optional.empty();

        CorrespondenceMatcher matcher = new CorrespondenceMatcher(problem, aTrie, bTrie, beginning, progress, tracing);
        for (Map.Entry<Integer, List<ImmutableSortedSet<Integer>>> e : combinations.entrySet()) {
            // The least text over all combinations of this length wins.
            Optional<Match> best = Optional.empty();
            for (ImmutableSortedSet<Integer> c : e.getValue()) {
                best = matcher.match(c, best);
            }
            if (best.isPresent()) return best;
            trace("no match of length %d", e.getKey());
        }
        return Optional.empty();
    }
}
