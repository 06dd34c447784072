package guraa.refcompare.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gestalt pattern matching (Ratcliff/Obershelp) similarity between two strings.
 * The longest common block is found first, then the same search is repeated
 * on the pieces to its left and right. The ratio is {@code 2*M/T} where M is
 * the number of matched characters and T the combined length.
 *
 * <p>Characters occurring in more than 1% of a second string of 200 or more
 * characters are treated as too common to start a block, although blocks may
 * still be extended over them.</p>
 */
public final class SequenceMatcher {

    private static final int AUTOJUNK_MIN_LENGTH = 200;

    private final int[] a;
    private final int[] b;
    private final Map<Integer, List<Integer>> b2j = new HashMap<>();

    private SequenceMatcher(String first, String second) {
        this.a = first.codePoints().toArray();
        this.b = second.codePoints().toArray();
        indexSecond();
    }

    /**
     * Similarity ratio between two strings, 1.0 for identical input
     * (including two empty strings) and 0.0 when nothing is shared.
     *
     * @param first First string
     * @param second Second string
     * @return Similarity between 0.0 and 1.0
     */
    public static double ratio(String first, String second) {
        if (first == null || second == null) {
            return 0.0;
        }
        return new SequenceMatcher(first, second).ratio();
    }

    private double ratio() {
        int total = a.length + b.length;
        if (total == 0) {
            return 1.0;
        }
        int matches = 0;
        for (int[] block : matchingBlocks()) {
            matches += block[2];
        }
        return 2.0 * matches / total;
    }

    private void indexSecond() {
        for (int j = 0; j < b.length; j++) {
            b2j.computeIfAbsent(b[j], key -> new ArrayList<>()).add(j);
        }

        if (b.length >= AUTOJUNK_MIN_LENGTH) {
            int limit = b.length / 100 + 1;
            Set<Integer> popular = new HashSet<>();
            b2j.forEach((element, positions) -> {
                if (positions.size() > limit) {
                    popular.add(element);
                }
            });
            b2j.keySet().removeAll(popular);
        }
    }

    /**
     * Matching blocks as {@code [i, j, size]} triples ordered by position.
     */
    List<int[]> matchingBlocks() {
        List<int[]> blocks = new ArrayList<>();
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length, 0, b.length});

        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];
            int[] match = findLongestMatch(alo, ahi, blo, bhi);
            int i = match[0], j = match[1], k = match[2];

            if (k > 0) {
                blocks.add(match);
                if (alo < i && blo < j) {
                    queue.push(new int[]{alo, i, blo, j});
                }
                if (i + k < ahi && j + k < bhi) {
                    queue.push(new int[]{i + k, ahi, j + k, bhi});
                }
            }
        }

        blocks.sort((x, y) -> x[0] != y[0] ? Integer.compare(x[0], y[0]) : Integer.compare(x[1], y[1]));
        return blocks;
    }

    /**
     * Longest block with {@code a[i..i+k) == b[j..j+k)} inside the given ranges.
     * Ties go to the block starting earliest in {@code a}, then earliest in {@code b}.
     */
    private int[] findLongestMatch(int alo, int ahi, int blo, int bhi) {
        int besti = alo, bestj = blo, bestSize = 0;
        Map<Integer, Integer> j2len = new HashMap<>();

        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> newJ2len = new HashMap<>();
            for (int j : b2j.getOrDefault(a[i], Collections.emptyList())) {
                if (j < blo) {
                    continue;
                }
                if (j >= bhi) {
                    break;
                }
                int k = j2len.getOrDefault(j - 1, 0) + 1;
                newJ2len.put(j, k);
                if (k > bestSize) {
                    besti = i - k + 1;
                    bestj = j - k + 1;
                    bestSize = k;
                }
            }
            j2len = newJ2len;
        }

        // popular characters were left out of the index, extend over them here
        while (besti > alo && bestj > blo && a[besti - 1] == b[bestj - 1]) {
            besti--;
            bestj--;
            bestSize++;
        }
        while (besti + bestSize < ahi && bestj + bestSize < bhi
                && a[besti + bestSize] == b[bestj + bestSize]) {
            bestSize++;
        }

        return new int[]{besti, bestj, bestSize};
    }
}
