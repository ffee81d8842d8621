package org.Aayush.allocator.distance;

import org.Aayush.allocator.error.SolverException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable dense distance matrix with an optional parallel duration matrix.
 *
 * <p>Rows are sources and columns are targets, both in input order. Every cell is an
 * explicit finite non-negative value. Square matrices carry a zero diagonal, and
 * symmetric metrics additionally guarantee {@code M[i][j] == M[j][i]}.</p>
 */
public final class DistanceMatrix {
    public static final String REASON_INVALID_CELL = "DIST_INVALID_CELL";
    public static final String REASON_NON_ZERO_DIAGONAL = "DIST_NON_ZERO_DIAGONAL";
    public static final String REASON_ASYMMETRIC = "DIST_ASYMMETRIC";
    public static final String REASON_SHAPE_MISMATCH = "DIST_SHAPE_MISMATCH";

    private static final String STAGE = "distance-matrix";

    private final int rows;
    private final int cols;
    private final double[] distances;
    private final double[] durations;
    private final DistanceMetric metric;

    private DistanceMatrix(int rows, int cols, double[] distances, double[] durations, DistanceMetric metric) {
        this.rows = rows;
        this.cols = cols;
        this.distances = distances;
        this.durations = durations;
        this.metric = metric;
    }

    /**
     * Creates a validated matrix from row-major arrays.
     *
     * @param distances row-major distances; copied.
     * @param durations optional row-major durations in seconds; copied when present.
     * @throws SolverException when any cell is negative/non-finite or square invariants fail.
     */
    public static DistanceMatrix of(
            DistanceMetric metric,
            int rows,
            int cols,
            double[] distances,
            double[] durations
    ) {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(distances, "distances");
        if (rows < 0 || cols < 0 || distances.length != rows * cols) {
            throw new SolverException(
                    REASON_SHAPE_MISMATCH,
                    STAGE,
                    "distance array length " + distances.length + " does not match " + rows + "x" + cols
            );
        }
        if (durations != null && durations.length != distances.length) {
            throw new SolverException(
                    REASON_SHAPE_MISMATCH,
                    STAGE,
                    "duration array length " + durations.length + " does not match " + rows + "x" + cols
            );
        }
        DistanceMatrix matrix = new DistanceMatrix(
                rows,
                cols,
                distances.clone(),
                durations == null ? null : durations.clone(),
                metric
        );
        matrix.checkInvariants();
        return matrix;
    }

    /**
     * Creates a validated matrix from a nested array of distances.
     */
    public static DistanceMatrix of(DistanceMetric metric, double[][] distances) {
        Objects.requireNonNull(distances, "distances");
        int rows = distances.length;
        int cols = rows == 0 ? 0 : distances[0].length;
        double[] flat = new double[rows * cols];
        for (int i = 0; i < rows; i++) {
            if (distances[i].length != cols) {
                throw new SolverException(REASON_SHAPE_MISMATCH, STAGE, "ragged distance rows");
            }
            System.arraycopy(distances[i], 0, flat, i * cols, cols);
        }
        return of(metric, rows, cols, flat, null);
    }

    /**
     * Returns an empty {@code rows x cols} matrix where one dimension is zero.
     */
    static DistanceMatrix empty(DistanceMetric metric, int rows, int cols) {
        return new DistanceMatrix(rows, cols, new double[0], null, metric);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public boolean square() {
        return rows == cols;
    }

    public DistanceMetric metric() {
        return metric;
    }

    public boolean hasDurations() {
        return durations != null;
    }

    /**
     * Distance from row {@code i} to column {@code j}.
     */
    public double distance(int i, int j) {
        return distances[index(i, j)];
    }

    /**
     * Duration in seconds from row {@code i} to column {@code j}.
     *
     * @throws IllegalStateException when durations were not requested.
     */
    public double duration(int i, int j) {
        if (durations == null) {
            throw new IllegalStateException("durations were not computed for this matrix");
        }
        return durations[index(i, j)];
    }

    /**
     * Returns a defensive copy of one distance row.
     */
    public double[] row(int i) {
        int start = index(i, 0);
        return Arrays.copyOfRange(distances, start, start + cols);
    }

    /**
     * Returns a defensive deep copy as nested arrays.
     */
    public double[][] toArray() {
        double[][] copy = new double[rows][];
        for (int i = 0; i < rows; i++) {
            copy[i] = Arrays.copyOfRange(distances, i * cols, (i + 1) * cols);
        }
        return copy;
    }

    /**
     * Extracts the square sub-matrix over the given indices, preserving their order.
     */
    public DistanceMatrix subMatrix(int[] indices) {
        if (!square()) {
            throw new IllegalStateException("sub-matrix extraction requires a square matrix");
        }
        int n = indices.length;
        double[] sub = new double[n * n];
        double[] subDurations = durations == null ? null : new double[n * n];
        for (int a = 0; a < n; a++) {
            for (int b = 0; b < n; b++) {
                sub[a * n + b] = distance(indices[a], indices[b]);
                if (subDurations != null) {
                    subDurations[a * n + b] = durations[index(indices[a], indices[b])];
                }
            }
        }
        return new DistanceMatrix(n, n, sub, subDurations, metric);
    }

    private int index(int i, int j) {
        if (i < 0 || i >= rows || j < 0 || j >= cols) {
            throw new IndexOutOfBoundsException("cell (" + i + "," + j + ") outside " + rows + "x" + cols);
        }
        return i * cols + j;
    }

    private void checkInvariants() {
        for (int i = 0; i < distances.length; i++) {
            double value = distances[i];
            if (!Double.isFinite(value) || value < 0.0d) {
                throw new SolverException(
                        REASON_INVALID_CELL,
                        STAGE,
                        "cell (" + (i / cols) + "," + (i % cols) + ") is not a finite non-negative distance: " + value
                );
            }
            if (durations != null && (!Double.isFinite(durations[i]) || durations[i] < 0.0d)) {
                throw new SolverException(
                        REASON_INVALID_CELL,
                        STAGE,
                        "cell (" + (i / cols) + "," + (i % cols) + ") has invalid duration: " + durations[i]
                );
            }
        }
        if (!square()) {
            return;
        }
        for (int i = 0; i < rows; i++) {
            if (distances[i * cols + i] != 0.0d) {
                throw new SolverException(
                        REASON_NON_ZERO_DIAGONAL,
                        STAGE,
                        "diagonal cell " + i + " must be zero but was " + distances[i * cols + i]
                );
            }
        }
        if (!metric.symmetric()) {
            return;
        }
        for (int i = 0; i < rows; i++) {
            for (int j = i + 1; j < cols; j++) {
                if (distances[i * cols + j] != distances[j * cols + i]) {
                    throw new SolverException(
                            REASON_ASYMMETRIC,
                            STAGE,
                            "symmetric metric " + metric.id() + " produced asymmetric cells (" + i + "," + j + ")"
                    );
                }
            }
        }
    }
}
