package com.factryl.backend.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gestalt pattern matching between two strings, compared code point by code point.
 * <p>
 * The ratio is twice the number of matched characters over the combined length. Matches are
 * found by taking the longest common block and recursing on the pieces to its left and right.
 * When the second string is 200 characters or longer, characters that make up more than 1% of
 * it are not used to seed a match (they can still extend one).
 */
public final class SequenceMatcher {

    private static final int AUTOJUNK_MIN_LENGTH = 200;

    private final int[] a;
    private final int[] b;
    private final Map<Integer, List<Integer>> b2j = new HashMap<>();

    private SequenceMatcher(int[] a, int[] b) {
        this.a = a;
        this.b = b;
        indexSecond();
    }

    /**
     * Similarity in [0, 1]; two empty strings are identical.
     */
    public static double ratio(String a, String b) {
        int[] left = a != null ? a.codePoints().toArray() : new int[0];
        int[] right = b != null ? b.codePoints().toArray() : new int[0];
        int total = left.length + right.length;
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * new SequenceMatcher(left, right).matchedCharacters() / total;
    }

    private void indexSecond() {
        for (int j = 0; j < b.length; j++) {
            b2j.computeIfAbsent(b[j], c -> new ArrayList<>()).add(j);
        }
        int n = b.length;
        if (n >= AUTOJUNK_MIN_LENGTH) {
            int popularAbove = n / 100 + 1;
            b2j.values().removeIf(positions -> positions.size() > popularAbove);
        }
    }

    private int matchedCharacters() {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length, 0, b.length});

        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];

            int[] match = findLongestMatch(alo, ahi, blo, bhi);
            int i = match[0], j = match[1], size = match[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (alo < i && blo < j) {
                pending.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                pending.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    private int[] findLongestMatch(int alo, int ahi, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;

        // j2len[j] = length of the longest match ending at a[i-1] and b[j]
        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> next = new HashMap<>();
            List<Integer> positions = b2j.get(a[i]);
            if (positions != null) {
                for (int j : positions) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = j2len.getOrDefault(j - 1, 0) + 1;
                    next.put(j, k);
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            j2len = next;
        }

        while (bestI > alo && bestJ > blo && a[bestI - 1] == b[bestJ - 1]) {
            bestI--;
            bestJ--;
            bestSize++;
        }
        while (bestI + bestSize < ahi && bestJ + bestSize < bhi
                && a[bestI + bestSize] == b[bestJ + bestSize]) {
            bestSize++;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
