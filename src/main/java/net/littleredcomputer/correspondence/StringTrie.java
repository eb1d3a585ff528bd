// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A prefix tree over an indexed list of strings. Each node records the indices of the
 * strings which end exactly there, and of those for which the node is a strict prefix.
 * The trie is read-only once built.
 */
class StringTrie {
    private static class Node {
        final Map<Character, Node> children = new TreeMap<>();
        final SortedSet<Integer> end = new TreeSet<>();
        final SortedSet<Integer> part = new TreeSet<>();
    }

    private final Node root = new Node();

    private StringTrie() {}

    /**
     * Build the trie for the given strings; string i is recorded under index i.
     * @param strings nonempty strings
     * @return the trie
     */
    static StringTrie build(List<String> strings) {
        StringTrie t = new StringTrie();
        for (int i = 0; i < strings.size(); ++i) {
            String s = strings.get(i);
            if (s.isEmpty()) throw new IllegalArgumentException("cannot index empty string " + i);
            // Every string is still in progress before its first character is read.
            t.root.part.add(i);
            Node node = t.root;
            for (int k = 0; k < s.length(); ++k) {
                node = node.children.computeIfAbsent(s.charAt(k), c -> new Node());
                node.part.add(i);
            }
            node.part.remove(i);
            node.end.add(i);
        }
        return t;
    }

    /**
     * Find the strings which could be laid against {@code substring}: those which are a
     * prefix of it (ending somewhere along its path), together with those of which it is a
     * strict prefix (provided the whole of the substring is present in the trie).
     * @param substring nonempty text to match
     * @return indices of matching strings, in ascending order
     */
    SortedSet<Integer> search(@Nonnull String substring) {
        if (substring.isEmpty()) throw new IllegalArgumentException("cannot search for the empty string");
        SortedSet<Integer> found = new TreeSet<>();
        Node node = root;
        int k = 0;
        while (k < substring.length()) {
            Node next = node.children.get(substring.charAt(k));
            if (next == null) break;
            node = next;
            found.addAll(node.end);
            ++k;
        }
        if (k == substring.length()) found.addAll(node.part);
        return found;
    }

    /**
     * @return indices of strings ending exactly at the node reached by {@code path}, or
     * the empty set if there is no such node
     */
    Set<Integer> endsAt(String path) {
        Node n = find(path);
        return n == null ? Collections.emptySet() : Collections.unmodifiableSet(n.end);
    }

    /**
     * @return indices of strings which have {@code path} as a strict prefix
     */
    Set<Integer> continuesPast(String path) {
        Node n = find(path);
        return n == null ? Collections.emptySet() : Collections.unmodifiableSet(n.part);
    }

    private Node find(String path) {
        Node node = root;
        for (int k = 0; k < path.length() && node != null; ++k) node = node.children.get(path.charAt(k));
        return node;
    }
}
