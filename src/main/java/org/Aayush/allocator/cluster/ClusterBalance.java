package org.Aayush.allocator.cluster;

import lombok.Builder;
import lombok.Value;

/**
 * Observational balance report of a clustering.
 *
 * <p>Nothing enforces balance; the report only measures it. {@code imbalanceRatio} is
 * {@code max / ceil(n / k)}, so 1.0 means the largest cluster is no bigger than ideal.</p>
 */
@Value
@Builder
public class ClusterBalance {
    int[] sizes;
    int minSize;
    int maxSize;
    int idealSize;
    double imbalanceRatio;
    /** Standard deviation of sizes divided by the mean size. */
    double coefficientOfVariation;

    public int[] getSizes() {
        return sizes.clone();
    }

    /**
     * Measures a size vector over {@code n} points.
     */
    public static ClusterBalance of(int[] sizes, int n) {
        int k = sizes.length;
        if (k == 0) {
            throw new IllegalArgumentException("sizes must be non-empty");
        }
        int min = Integer.MAX_VALUE;
        int max = 0;
        for (int size : sizes) {
            min = Math.min(min, size);
            max = Math.max(max, size);
        }
        int ideal = Math.max(1, (n + k - 1) / k);
        double mean = (double) n / k;
        double variance = 0.0d;
        for (int size : sizes) {
            double delta = size - mean;
            variance += delta * delta;
        }
        variance /= k;
        double cv = mean == 0.0d ? 0.0d : Math.sqrt(variance) / mean;
        return ClusterBalance.builder()
                .sizes(sizes.clone())
                .minSize(min)
                .maxSize(max)
                .idealSize(ideal)
                .imbalanceRatio((double) max / ideal)
                .coefficientOfVariation(cv)
                .build();
    }
}
