// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Depth-first search for the lexicographically least ordering of a fixed combination
 * of pairs under which the a-strings and b-strings concatenate to the same text.
 * <p>
 * At each step the unmatched tail of the longer concatenation is looked up in the
 * trie of the other side, so that only pairs which agree with that tail are tried.
 */
class CorrespondenceMatcher {
    private static final Logger log = LogManager.getFormatterLogger(CorrespondenceMatcher.class);

    private final CorrespondenceProblem problem;
    private final StringTrie aTrie;
    private final StringTrie bTrie;
    private final Set<Integer> beginning;
    private final SearchProgress progress;
    private final EnumSet<LimitedCorrespondence.Trace> tracing;

    private Set<Integer> combination;
    private Match best;

    /**
     * A partial solution: the two concatenations so far and the pairs that produced
     * them. The shorter concatenation is always a prefix of the longer. States are never
     * modified; extending one yields a new state.
     */
    private static final class State {
        final String a;
        final String b;
        final ImmutableList<Integer> taken;

        State(String a, String b, ImmutableList<Integer> taken) {
            this.a = a;
            this.b = b;
            this.taken = taken;
        }

        State extend(int i, String ai, String bi) {
            return new State(a + ai, b + bi, ImmutableList.<Integer>builder().addAll(taken).add(i).build());
        }

        int agreed() { return Math.min(a.length(), b.length()); }

        @Override
        public String toString() {
            return a + "/" + b + " " + taken;
        }
    }

    CorrespondenceMatcher(CorrespondenceProblem problem, StringTrie aTrie, StringTrie bTrie, Set<Integer> beginning,
                          SearchProgress progress, EnumSet<LimitedCorrespondence.Trace> tracing) {
        this.problem = problem;
        this.aTrie = aTrie;
        this.bTrie = bTrie;
        this.beginning = beginning;
        this.progress = progress;
        this.tracing = tracing;
    }

    Optional<Match> match(Set<Integer> combination) {
        return match(combination, Optional.empty());
    }

    /**
     * Search every ordering of {@code combination} that uses each of its pairs exactly once.
     * @param combination the pairs to use
     * @param incumbent best match already known, of the same length as any match of the
     *                  combination; branches that cannot beat it are abandoned
     * @return the lesser of the incumbent and the least match of this combination
     */
    @CheckReturnValue
    Optional<Match> match(Set<Integer> combination, Optional<Match> incumbent) {
        if (combination.isEmpty()) throw new IllegalArgumentException("empty combination");
        this.combination = combination;
        this.best = incumbent.orElse(null);
        extend(new State("", "", ImmutableList.of()));
        this.combination = null;
        return Optional.ofNullable(best);
    }

    private Set<Integer> candidates(State s) {
        if (s.a.length() < s.b.length()) return aTrie.search(s.b.substring(s.a.length()));
        if (s.a.length() > s.b.length()) return bTrie.search(s.a.substring(s.b.length()));
        return beginning;
    }

    private void extend(State s) {
        progress.step(() -> combination + " " + s);
        final int start = s.agreed();
        for (int i : candidates(s)) {
            if (!combination.contains(i) || s.taken.contains(i)) continue;
            State t = s.extend(i, problem.a(i), problem.b(i));
            final int end = t.agreed();
            if (!t.a.regionMatches(start, t.b, start, end - start)) continue;
            if (best != null && beyondBest(t.a, end)) continue;
            if (tracing.contains(LimitedCorrespondence.Trace.SEARCH)) log.trace("%s", t);
            if (t.a.length() == t.b.length()) {
                // The concatenations have come into register: this branch ends here.
                if (t.taken.size() == combination.size()) offer(t);
                continue;
            }
            extend(t);
        }
    }

    private boolean beyondBest(String a, int end) {
        String b = best.text();
        int n = Math.min(end, b.length());
        return a.substring(0, n).compareTo(b.substring(0, n)) > 0;
    }

    private void offer(State t) {
        Match m = new Match(t.a, t.taken);
        if (best == null || m.precedes(best)) {
            if (tracing.contains(LimitedCorrespondence.Trace.SOLUTION)) log.trace("new best %s", m);
            best = m;
        }
    }
}
