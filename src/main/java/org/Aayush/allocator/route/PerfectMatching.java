package org.Aayush.allocator.route;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Minimum-weight perfect matching over an even vertex subset.
 *
 * <p>Exact by bitmask dynamic programming up to {@link #EXACT_LIMIT} vertices; greedy
 * (lightest available pair first) above that.</p>
 */
final class PerfectMatching {
    static final int EXACT_LIMIT = 16;

    /**
     * Pair weight lookup over original vertex ids.
     */
    @FunctionalInterface
    interface Weight {
        double between(int a, int b);
    }

    /**
     * @param pairs matched vertex pairs.
     * @param exact true when the matching is provably minimal.
     */
    record Result(int[][] pairs, boolean exact) {
    }

    private PerfectMatching() {
    }

    static Result match(int[] vertices, Weight weight) {
        if (vertices.length % 2 != 0) {
            throw new IllegalArgumentException("perfect matching needs an even vertex count");
        }
        if (vertices.length <= EXACT_LIMIT) {
            return new Result(exact(vertices, weight), true);
        }
        return new Result(greedy(vertices, weight), false);
    }

    private static int[][] exact(int[] vertices, Weight weight) {
        int m = vertices.length;
        if (m == 0) {
            return new int[0][];
        }
        int full = (1 << m) - 1;
        double[] best = new double[1 << m];
        int[] partner = new int[1 << m];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        best[0] = 0.0d;
        for (int mask = 0; mask < full; mask++) {
            if (best[mask] == Double.POSITIVE_INFINITY) {
                continue;
            }
            int first = Integer.numberOfTrailingZeros(~mask);
            for (int second = first + 1; second < m; second++) {
                if ((mask & (1 << second)) != 0) {
                    continue;
                }
                int next = mask | (1 << first) | (1 << second);
                double cost = best[mask] + weight.between(vertices[first], vertices[second]);
                if (cost < best[next]) {
                    best[next] = cost;
                    partner[next] = (first << 8) | second;
                }
            }
        }

        int[][] pairs = new int[m / 2][];
        int mask = full;
        int cursor = 0;
        while (mask != 0) {
            int encoded = partner[mask];
            int first = encoded >>> 8;
            int second = encoded & 0xFF;
            pairs[cursor++] = new int[]{vertices[first], vertices[second]};
            mask &= ~((1 << first) | (1 << second));
        }
        return pairs;
    }

    private static int[][] greedy(int[] vertices, Weight weight) {
        int m = vertices.length;
        List<double[]> candidates = new ArrayList<>(m * (m - 1) / 2);
        for (int a = 0; a < m; a++) {
            for (int b = a + 1; b < m; b++) {
                candidates.add(new double[]{weight.between(vertices[a], vertices[b]), a, b});
            }
        }
        candidates.sort(Comparator
                .<double[]>comparingDouble(c -> c[0])
                .thenComparingDouble(c -> c[1])
                .thenComparingDouble(c -> c[2]));

        boolean[] used = new boolean[m];
        int[][] pairs = new int[m / 2][];
        int cursor = 0;
        for (double[] candidate : candidates) {
            int a = (int) candidate[1];
            int b = (int) candidate[2];
            if (used[a] || used[b]) {
                continue;
            }
            used[a] = true;
            used[b] = true;
            pairs[cursor++] = new int[]{vertices[a], vertices[b]};
            if (cursor == pairs.length) {
                break;
            }
        }
        return pairs;
    }
}
