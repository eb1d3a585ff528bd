// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Range;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * An instance of the limited correspondence problem: N pairs (a<sub>i</sub>, b<sub>i</sub>) of
 * nonempty strings, indexed from zero. Instances are immutable.
 */
public class CorrespondenceProblem {
    private static final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final ImmutableList<String> a;
    private final ImmutableList<String> b;
    private final ImmutableSortedSet<Integer> indices;

    private CorrespondenceProblem(ImmutableList<String> a, ImmutableList<String> b) {
        this.a = a;
        this.b = b;
        this.indices = ContiguousSet.create(Range.closedOpen(0, a.size()), DiscreteDomain.integers());
    }

    public static CorrespondenceProblem of(List<String> a, List<String> b) {
        if (a.size() != b.size()) throw new IllegalArgumentException("a and b must have the same number of strings");
        if (a.isEmpty()) throw new IllegalArgumentException("There must be at least one pair");
        for (int i = 0; i < a.size(); ++i) {
            if (a.get(i).isEmpty() || b.get(i).isEmpty()) throw new IllegalArgumentException("empty string in pair " + i);
        }
        return new CorrespondenceProblem(ImmutableList.copyOf(a), ImmutableList.copyOf(b));
    }

    public int size() { return a.size(); }
    public String a(int i) { return a.get(i); }
    public String b(int i) { return b.get(i); }
    ImmutableList<String> aStrings() { return a; }
    ImmutableList<String> bStrings() { return b; }

    /**
     * @return the set {0, ..., N-1} of pair indices
     */
    public ImmutableSortedSet<Integer> indices() { return indices; }

    public static List<CorrespondenceProblem> parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Parses a sequence of problem instances. Each instance is a line holding the
     * number of pairs N, followed by N lines each containing the two strings of a
     * pair separated by whitespace. Input is read until exhausted.
     * @param r source of problem text
     * @return the problems in input order
     */
    public static List<CorrespondenceProblem> parseFrom(Reader r) {
        BufferedReader br = new BufferedReader(r);
        List<CorrespondenceProblem> problems = new ArrayList<>();
        try {
            String line;
            while ((line = br.readLine()) != null) {
                if (line.trim().isEmpty()) continue;
                int n;
                try {
                    n = Integer.parseInt(line.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid pair count: " + line, e);
                }
                if (n < 1) throw new IllegalArgumentException("pair count must be positive: " + n);
                List<String> as = new ArrayList<>(n);
                List<String> bs = new ArrayList<>(n);
                for (int i = 0; i < n; ++i) {
                    String pair = br.readLine();
                    if (pair == null) throw new IllegalArgumentException("expected " + n + " pairs, found " + i);
                    List<String> ab = splitter.splitToList(pair);
                    if (ab.size() != 2) throw new IllegalArgumentException("malformed pair: " + pair);
                    as.add(ab.get(0));
                    bs.add(ab.get(1));
                }
                problems.add(of(as, bs));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return problems;
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < a.size(); ++i) {
            if (i > 0) s.append(' ');
            s.append(a.get(i)).append('/').append(b.get(i));
        }
        return s.toString();
    }
}
