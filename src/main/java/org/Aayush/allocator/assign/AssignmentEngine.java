package org.Aayush.allocator.assign;

import it.unimi.dsi.fastutil.ints.IntArrays;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.error.CapacityExhaustedException;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Located;
import org.Aayush.allocator.model.Worker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Capacity-aware nearest assignment.
 *
 * <p>Points are processed in input order, first come first served: each point takes the
 * nearest worker that still has capacity. This greedy pass is not globally optimal; a
 * point early in the input can take a worker that a later point needed more.</p>
 *
 * <p>A point that finds no worker does not stop the pass. Every unplaceable point is
 * collected and reported together; no partial result is returned.</p>
 */
@Slf4j
public final class AssignmentEngine {
    public static final String REASON_MATRIX_SHAPE = "ASSIGN_MATRIX_SHAPE";
    public static final String REASON_CAPACITY_SHAPE = "ASSIGN_CAPACITY_SHAPE";
    public static final String REASON_NEGATIVE_CAPACITY = "ASSIGN_NEGATIVE_CAPACITY";
    public static final String REASON_NO_WORKERS = "ASSIGN_NO_WORKERS";

    /**
     * Assigns every point using worker capacities.
     */
    public List<Assignment> assign(List<? extends Located> points, List<Worker> workers, DistanceMatrix matrix) {
        return assign(points, workers, matrix, null);
    }

    /**
     * Assigns every point.
     *
     * @param matrix {@code points x workers} distances.
     * @param capacities optional per-worker override list; a null entry means unbounded.
     *                   When the list is given it replaces worker capacities entirely.
     * @throws ValidationException on shape or capacity contract violations.
     * @throws CapacityExhaustedException when any point cannot be placed.
     */
    public List<Assignment> assign(
            List<? extends Located> points,
            List<Worker> workers,
            DistanceMatrix matrix,
            List<Integer> capacities
    ) {
        validateShape(points, workers, matrix);
        int n = points.size();
        int m = workers.size();
        if (n == 0) {
            return List.of();
        }
        if (m == 0) {
            throw new ValidationException(REASON_NO_WORKERS, "assignment needs at least one worker for " + n + " points");
        }

        boolean[] unbounded = new boolean[m];
        int[] remaining = new int[m];
        resolveCapacities(workers, capacities, unbounded, remaining);

        List<Assignment> assignments = new ArrayList<>(n);
        List<String> unassigned = new ArrayList<>();
        for (int p = 0; p < n; p++) {
            int[] order = workersByDistance(matrix, p);
            Assignment placed = null;
            for (int position = 0; position < m; position++) {
                int w = order[position];
                if (!unbounded[w] && remaining[w] <= 0) {
                    continue;
                }
                if (!unbounded[w]) {
                    remaining[w]--;
                }
                placed = Assignment.builder()
                        .pointIndex(p)
                        .pointId(points.get(p).getId())
                        .workerIndex(w)
                        .workerId(workers.get(w).getId())
                        .distance(matrix.distance(p, w))
                        .rank(position + 1)
                        .build();
                break;
            }
            if (placed == null) {
                unassigned.add(points.get(p).getId());
            } else {
                assignments.add(placed);
            }
        }

        if (!unassigned.isEmpty()) {
            log.info("assignment left {} of {} points unplaced", unassigned.size(), n);
            throw new CapacityExhaustedException(unassigned);
        }
        log.info("assigned {} points to {} workers", n, m);
        return List.copyOf(assignments);
    }

    /**
     * Ranks all workers for every point, nearest first.
     */
    public List<WorkerRanking> rankWorkersByPoint(
            List<? extends Located> points,
            List<? extends Located> workers,
            DistanceMatrix matrix
    ) {
        validateShape(points, workers, matrix);
        List<WorkerRanking> rankings = new ArrayList<>(points.size());
        for (int p = 0; p < points.size(); p++) {
            WorkerRanking.WorkerRankingBuilder builder = WorkerRanking.builder()
                    .pointIndex(p)
                    .pointId(points.get(p).getId());
            int[] order = workersByDistance(matrix, p);
            for (int position = 0; position < order.length; position++) {
                int w = order[position];
                builder.worker(new RankedEntry(w, workers.get(w).getId(), position + 1, matrix.distance(p, w)));
            }
            rankings.add(builder.build());
        }
        return List.copyOf(rankings);
    }

    /**
     * Ranks all points for every worker, nearest first.
     */
    public List<PointRanking> rankPointsByWorker(
            List<? extends Located> points,
            List<? extends Located> workers,
            DistanceMatrix matrix
    ) {
        validateShape(points, workers, matrix);
        int n = points.size();
        List<PointRanking> rankings = new ArrayList<>(workers.size());
        for (int w = 0; w < workers.size(); w++) {
            int[] order = identity(n);
            int worker = w;
            IntArrays.stableSort(order, (a, b) -> Double.compare(matrix.distance(a, worker), matrix.distance(b, worker)));
            PointRanking.PointRankingBuilder builder = PointRanking.builder()
                    .workerIndex(w)
                    .workerId(workers.get(w).getId());
            for (int position = 0; position < n; position++) {
                int p = order[position];
                builder.point(new RankedEntry(p, points.get(p).getId(), position + 1, matrix.distance(p, w)));
            }
            rankings.add(builder.build());
        }
        return List.copyOf(rankings);
    }

    private static int[] workersByDistance(DistanceMatrix matrix, int point) {
        int[] order = identity(matrix.cols());
        IntArrays.stableSort(order, (a, b) -> Double.compare(matrix.distance(point, a), matrix.distance(point, b)));
        return order;
    }

    private static int[] identity(int size) {
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        return order;
    }

    private static void resolveCapacities(
            List<Worker> workers,
            List<Integer> capacities,
            boolean[] unbounded,
            int[] remaining
    ) {
        int m = workers.size();
        if (capacities != null && capacities.size() != m) {
            throw new ValidationException(
                    REASON_CAPACITY_SHAPE,
                    "capacity list has " + capacities.size() + " entries for " + m + " workers"
            );
        }
        for (int w = 0; w < m; w++) {
            Integer capacity = capacities != null ? capacities.get(w) : workers.get(w).getCapacity();
            if (capacity == null) {
                unbounded[w] = true;
                continue;
            }
            if (capacity < 0) {
                throw new ValidationException(
                        REASON_NEGATIVE_CAPACITY,
                        workers.get(w).getId(),
                        "capacity must be non-negative but was " + capacity
                );
            }
            remaining[w] = capacity;
        }
    }

    private static void validateShape(
            List<? extends Located> points,
            List<? extends Located> workers,
            DistanceMatrix matrix
    ) {
        Objects.requireNonNull(points, "points");
        Objects.requireNonNull(workers, "workers");
        Objects.requireNonNull(matrix, "matrix");
        if (matrix.rows() != points.size() || matrix.cols() != workers.size()) {
            throw new ValidationException(
                    REASON_MATRIX_SHAPE,
                    "matrix must be " + points.size() + "x" + workers.size()
                            + " but was " + matrix.rows() + "x" + matrix.cols()
            );
        }
    }
}
