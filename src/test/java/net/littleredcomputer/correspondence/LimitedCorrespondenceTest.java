// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.io.InputStreamReader;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

public class LimitedCorrespondenceTest {
    private static List<CorrespondenceProblem> fromResource(String name) {
        return CorrespondenceProblem.parseFrom(new InputStreamReader(
                LimitedCorrespondenceTest.class.getClassLoader().getResourceAsStream(name)));
    }

    private static Optional<String> solve(List<String> a, List<String> b) {
        return new LimitedCorrespondence(CorrespondenceProblem.of(a, b)).solve();
    }

    @Test
    public void sampleCases() {
        assertThat(fromResource("sample-01.in").stream()
                        .map(p -> new LimitedCorrespondence(p).solve().orElse("IMPOSSIBLE"))
                        .collect(Collectors.toList()),
                is(Arrays.asList("dearalanhowareyou", "ienjoycorresponding", "abcd")));
    }

    @Test
    public void noPossibleBeginning() {
        assertThat(solve(Arrays.asList("a"), Arrays.asList("b")), isEmpty());
    }

    @Test
    public void noPossibleEnding() {
        assertThat(solve(Arrays.asList("ab"), Arrays.asList("a")), isEmpty());
    }

    @Test
    public void unbalancedElements() {
        assertThat(solve(Arrays.asList("a", "ab", "bba"), Arrays.asList("baa", "a", "ab")), isEmpty());
    }

    @Test
    public void balancedButUnorderable() {
        assertThat(solve(Arrays.asList("abc", "d"), Arrays.asList("ab", "dc")), isEmpty());
    }

    @Test
    public void singlePair() {
        assertThat(solve(Arrays.asList("ab"), Arrays.asList("ab")), isPresentAndIs("ab"));
    }

    @Test
    public void shorterBeatsLexicographicallySmaller() {
        // aba (pairs 1, 2) precedes b, but is longer.
        assertThat(solve(Arrays.asList("b", "a", "ba"), Arrays.asList("b", "ab", "a")), isPresentAndIs("b"));
    }

    @Test
    public void leastOverAllCombinationsOfTheSameLength() {
        // {0} gives efgh and {1, 2} gives abcd; both have length 4.
        assertThat(solve(Arrays.asList("efgh", "d", "abc"), Arrays.asList("efgh", "cd", "ab")), isPresentAndIs("abcd"));
        assertThat(solve(Arrays.asList("d", "abc", "efgh"), Arrays.asList("cd", "ab", "efgh")), isPresentAndIs("abcd"));
    }

    @Test
    public void matchReportsSequence() {
        CorrespondenceProblem p = fromResource("sample-01.in").get(0);
        Match m = new LimitedCorrespondence(p).match().get();
        assertThat(m.text(), is("dearalanhowareyou"));
        assertThat(m.sequence(), is(ImmutableList.of(4, 3, 2, 0, 1)));
    }

    @Test
    public void solvedOnce() {
        LimitedCorrespondence c = new LimitedCorrespondence(fromResource("sample-01.in").get(1))
                .setLogInterval(Duration.ofMillis(10))
                .setTracing(EnumSet.of(LimitedCorrespondence.Trace.FILTER));
        Optional<Match> first = c.match();
        assertThat(c.match(), is(sameInstance(first)));
        assertThat(c.solve(), isPresentAndIs("ienjoycorresponding"));
    }

    @Test
    public void idempotent() {
        CorrespondenceProblem p = fromResource("sample-01.in").get(2);
        assertThat(new LimitedCorrespondence(p).solve(), is(new LimitedCorrespondence(p).solve()));
    }

    @Test
    public void agreesWithExhaustiveSearch() {
        Random r = new Random(271828);
        int solvable = 0;
        for (int t = 0; t < 200; ++t) {
            CorrespondenceProblem p = BruteForce.random(r, 2 + r.nextInt(5), 3, t % 2 == 0 ? "ab" : "abc");
            Optional<String> expected = BruteForce.solve(p);
            assertThat(p.toString(), new LimitedCorrespondence(p).solve(), is(expected));
            if (expected.isPresent()) ++solvable;
        }
        assertThat(solvable > 0, is(true));
    }
}
