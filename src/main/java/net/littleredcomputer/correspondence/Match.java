// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A solution of a correspondence problem: the common text of the two concatenations
 * together with the sequence of pair indices which produces it.
 */
public final class Match {
    private final String text;
    private final ImmutableList<Integer> sequence;

    Match(String text, List<Integer> sequence) {
        this.text = text;
        this.sequence = ImmutableList.copyOf(sequence);
    }

    public String text() { return text; }
    public ImmutableList<Integer> sequence() { return sequence; }

    /**
     * @return true if this match's text precedes the other's lexicographically
     */
    boolean precedes(Match other) {
        return text.compareTo(other.text) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Match)) return false;
        Match m = (Match) o;
        return text.equals(m.text) && sequence.equals(m.sequence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, sequence);
    }

    @Override
    public String toString() {
        return text + " " + sequence;
    }
}
