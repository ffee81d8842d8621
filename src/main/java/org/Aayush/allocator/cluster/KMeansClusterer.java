package org.Aayush.allocator.cluster;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.distance.CoordinateDistance;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.distance.DistanceMetric;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Coordinate;
import org.Aayush.allocator.model.Located;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Seeded Lloyd k-means with k-means++ initialization and restarts.
 *
 * <p>Initialization samples centers from the distance matrix; assignment and relocation
 * work on coordinates, with planar distance for planar matrices and great-circle
 * distance otherwise. An empty cluster keeps its previous centroid.</p>
 *
 * <p>Assignment ties go to the cluster with fewer members so far in the current pass,
 * then to the lower cluster id. Balance is measured, never enforced.</p>
 */
@Slf4j
public final class KMeansClusterer implements Clusterer {
    static final String REASON_INVALID_CONFIG = "CLUSTER_INVALID_CONFIG";

    private final KMeansConfig config;

    public KMeansClusterer() {
        this(KMeansConfig.defaults());
    }

    public KMeansClusterer(KMeansConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.getMaxIterations() <= 0) {
            throw new ValidationException(REASON_INVALID_CONFIG, "maxIterations", "maxIterations must be positive");
        }
        if (config.getNInit() <= 0) {
            throw new ValidationException(REASON_INVALID_CONFIG, "nInit", "nInit must be positive");
        }
    }

    @Override
    public ClusteringMethod method() {
        return ClusteringMethod.KMEANS;
    }

    @Override
    public ClusterResult partition(List<? extends Located> points, DistanceMatrix matrix, int k, long seed) {
        ClusterPreconditions.validate(points, matrix, k);
        boolean planar = matrix.metric() == DistanceMetric.PLANAR;
        Random master = new Random(seed);

        Run best = null;
        for (int run = 0; run < config.getNInit(); run++) {
            Run candidate = runOnce(points, matrix, k, planar, new Random(master.nextLong()));
            log.debug(
                    "k-means run {}: iterations={}, converged={}, inertia={}",
                    run,
                    candidate.iterations,
                    candidate.converged,
                    candidate.inertia
            );
            if (best == null || candidate.inertia < best.inertia) {
                best = candidate;
            }
        }

        return ClusterResult.fromLabels(
                ClusteringMethod.KMEANS,
                points,
                best.labels,
                k,
                best.centroids,
                best.iterations,
                best.converged,
                best.inertia,
                "lloyd k-means++ nInit=" + config.getNInit()
        );
    }

    private Run runOnce(List<? extends Located> points, DistanceMatrix matrix, int k, boolean planar, Random random) {
        int n = points.size();
        Coordinate[] centroids = initialCentroids(points, matrix, k, random);
        int[] labels = new int[n];
        Arrays.fill(labels, -1);
        int[] counts = new int[k];
        int iterations = 0;
        boolean converged = false;

        while (iterations < config.getMaxIterations()) {
            iterations++;
            Arrays.fill(counts, 0);
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                Located point = points.get(i);
                int bestCluster = -1;
                double bestDistance = Double.POSITIVE_INFINITY;
                for (int c = 0; c < k; c++) {
                    double d = distance(point, centroids[c], planar);
                    if (bestCluster < 0 || d < bestDistance || (d == bestDistance && counts[c] < counts[bestCluster])) {
                        bestCluster = c;
                        bestDistance = d;
                    }
                }
                counts[bestCluster]++;
                if (labels[i] != bestCluster) {
                    labels[i] = bestCluster;
                    changed = true;
                }
            }
            if (!changed) {
                converged = true;
                break;
            }
            relocate(points, labels, centroids, k);
        }

        double inertia = 0.0d;
        for (int i = 0; i < n; i++) {
            double d = distance(points.get(i), centroids[labels[i]], planar);
            inertia += d * d;
        }
        return new Run(labels, centroids, iterations, converged, inertia);
    }

    /**
     * k-means++ seeding over matrix distances.
     */
    private static Coordinate[] initialCentroids(List<? extends Located> points, DistanceMatrix matrix, int k, Random random) {
        int n = points.size();
        boolean[] chosen = new boolean[n];
        Coordinate[] centroids = new Coordinate[k];
        double[] nearestSquared = new double[n];
        Arrays.fill(nearestSquared, Double.POSITIVE_INFINITY);

        int current = random.nextInt(n);
        for (int c = 0; c < k; c++) {
            if (c > 0) {
                current = sampleNext(nearestSquared, chosen, random);
            }
            chosen[current] = true;
            centroids[c] = Coordinate.of(points.get(current));
            for (int i = 0; i < n; i++) {
                double d = matrix.distance(i, current);
                nearestSquared[i] = Math.min(nearestSquared[i], d * d);
            }
        }
        return centroids;
    }

    private static int sampleNext(double[] nearestSquared, boolean[] chosen, Random random) {
        double total = 0.0d;
        for (int i = 0; i < nearestSquared.length; i++) {
            if (!chosen[i]) {
                total += nearestSquared[i];
            }
        }
        if (total <= 0.0d) {
            // Every remaining point coincides with a chosen center.
            int remaining = 0;
            for (boolean taken : chosen) {
                if (!taken) {
                    remaining++;
                }
            }
            int pick = random.nextInt(remaining);
            for (int i = 0; i < chosen.length; i++) {
                if (!chosen[i] && pick-- == 0) {
                    return i;
                }
            }
        }
        double target = random.nextDouble() * total;
        double cumulative = 0.0d;
        int lastPositive = -1;
        for (int i = 0; i < nearestSquared.length; i++) {
            if (chosen[i] || nearestSquared[i] <= 0.0d) {
                continue;
            }
            cumulative += nearestSquared[i];
            lastPositive = i;
            if (cumulative > target) {
                return i;
            }
        }
        return lastPositive;
    }

    private static void relocate(List<? extends Located> points, int[] labels, Coordinate[] centroids, int k) {
        double[] lonSum = new double[k];
        double[] latSum = new double[k];
        int[] sizes = new int[k];
        for (int i = 0; i < labels.length; i++) {
            Located point = points.get(i);
            lonSum[labels[i]] += point.getLongitude();
            latSum[labels[i]] += point.getLatitude();
            sizes[labels[i]]++;
        }
        for (int c = 0; c < k; c++) {
            if (sizes[c] > 0) {
                centroids[c] = new Coordinate(lonSum[c] / sizes[c], latSum[c] / sizes[c]);
            }
        }
    }

    private static double distance(Located point, Coordinate centroid, boolean planar) {
        Coordinate position = Coordinate.of(point);
        return planar
                ? CoordinateDistance.planar(position, centroid)
                : CoordinateDistance.haversineMeters(position, centroid);
    }

    private record Run(int[] labels, Coordinate[] centroids, int iterations, boolean converged, double inertia) {
    }
}
