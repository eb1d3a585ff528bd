// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiPredicate;
import java.util.function.IntFunction;

/**
 * Necessary conditions on the pairs (and sets of pairs) that can take part in a
 * solution. These are the prefix, postfix, length balance and element balance filters
 * of R. J. Lorentz, "Creating Difficult Instances of the Post Correspondence Problem".
 * <p>
 * Combinations are grouped by the common length of their a- and b-concatenations,
 * in ascending order of that length.
 */
final class CombinationFilters {
    private CombinationFilters() {}

    private static ImmutableSortedSet<Integer> pairsWhere(CorrespondenceProblem p, BiPredicate<String, String> related) {
        ImmutableSortedSet.Builder<Integer> b = ImmutableSortedSet.naturalOrder();
        for (int i : p.indices()) {
            String a = p.a(i);
            String bb = p.b(i);
            if (related.test(a, bb) || related.test(bb, a)) b.add(i);
        }
        return b.build();
    }

    /**
     * @return indices of pairs in which one string is a prefix of the other. Only these
     * can begin a solution.
     */
    static ImmutableSortedSet<Integer> prefixCandidates(CorrespondenceProblem p) {
        return pairsWhere(p, String::startsWith);
    }

    /**
     * @return indices of pairs in which one string is a suffix of the other. Only these
     * can end a solution.
     */
    static ImmutableSortedSet<Integer> postfixCandidates(CorrespondenceProblem p) {
        return pairsWhere(p, String::endsWith);
    }

    /**
     * Enumerate every nonempty subset of the pairs, retaining those whose a-strings and
     * b-strings have the same total length and which contain at least one possible
     * beginning and one possible ending pair. There are 2<sup>N</sup>-1 subsets, so this is
     * only feasible for small N.
     * @return surviving combinations keyed by total length
     */
    static ImmutableSortedMap<Integer, List<ImmutableSortedSet<Integer>>> lengthBalanced(
            CorrespondenceProblem p, Set<Integer> beginning, Set<Integer> ending) {
        if (p.size() == 0) throw new IllegalArgumentException("no pairs to combine");
        int[] aLength = new int[p.size()];
        int[] bLength = new int[p.size()];
        for (int i : p.indices()) {
            aLength[i] = p.a(i).length();
            bLength[i] = p.b(i).length();
        }
        Map<Integer, List<ImmutableSortedSet<Integer>>> byLength = new TreeMap<>();
        for (int k = 1; k <= p.size(); ++k) {
            for (Set<Integer> c : Sets.combinations(p.indices(), k)) {
                int aSum = 0;
                int bSum = 0;
                for (int i : c) {
                    aSum += aLength[i];
                    bSum += bLength[i];
                }
                if (aSum != bSum) continue;
                if (Collections.disjoint(c, beginning) || Collections.disjoint(c, ending)) continue;
                byLength.computeIfAbsent(aSum, x -> new ArrayList<>()).add(ImmutableSortedSet.copyOf(c));
            }
        }
        return freeze(byLength);
    }

    /**
     * Retain only those combinations in which the a-strings and the b-strings, taken
     * together, use each character the same number of times.
     */
    static ImmutableSortedMap<Integer, List<ImmutableSortedSet<Integer>>> elementBalanced(
            CorrespondenceProblem p, Map<Integer, List<ImmutableSortedSet<Integer>>> combinations) {
        Map<Integer, List<ImmutableSortedSet<Integer>>> byLength = new TreeMap<>();
        combinations.forEach((length, cs) -> {
            for (ImmutableSortedSet<Integer> c : cs) {
                if (characters(p::a, c).equals(characters(p::b, c))) {
                    byLength.computeIfAbsent(length, x -> new ArrayList<>()).add(c);
                }
            }
        });
        return freeze(byLength);
    }

    private static ImmutableMultiset<Character> characters(IntFunction<String> side, Set<Integer> c) {
        ImmutableMultiset.Builder<Character> m = ImmutableMultiset.builder();
        for (int i : c) m.addAll(Lists.charactersOf(side.apply(i)));
        return m.build();
    }

    private static ImmutableSortedMap<Integer, List<ImmutableSortedSet<Integer>>> freeze(
            Map<Integer, List<ImmutableSortedSet<Integer>>> byLength) {
        ImmutableSortedMap.Builder<Integer, List<ImmutableSortedSet<Integer>>> b = ImmutableSortedMap.naturalOrder();
        byLength.forEach((length, cs) -> b.put(length, ImmutableList.copyOf(cs)));
        return b.build();
    }
}
