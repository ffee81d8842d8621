package org.Aayush.allocator.distance;

import org.Aayush.allocator.error.SolverException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DistanceMatrix Tests")
class DistanceMatrixTest {

    @Test
    @DisplayName("Nested factory copies input and exposes row-major cells")
    void testNestedFactoryCopiesInput() {
        double[][] source = {
                {0.0d, 1.0d, 2.0d},
                {1.0d, 0.0d, 3.0d},
                {2.0d, 3.0d, 0.0d}
        };
        DistanceMatrix matrix = DistanceMatrix.of(DistanceMetric.PLANAR, source);
        source[0][1] = 99.0d;

        assertEquals(3, matrix.rows());
        assertTrue(matrix.square());
        assertEquals(1.0d, matrix.distance(0, 1), 0.0d);
        assertEquals(3.0d, matrix.distance(2, 1), 0.0d);
        assertArrayEquals(new double[]{1.0d, 0.0d, 3.0d}, matrix.row(1), 0.0d);
        assertFalse(matrix.hasDurations());
    }

    @Test
    @DisplayName("Returned rows and nested copies are defensive")
    void testDefensiveCopies() {
        DistanceMatrix matrix = DistanceMatrix.of(DistanceMetric.PLANAR, new double[][]{{0.0d, 5.0d}, {5.0d, 0.0d}});

        matrix.row(0)[1] = -1.0d;
        matrix.toArray()[1][0] = -1.0d;

        assertEquals(5.0d, matrix.distance(0, 1), 0.0d);
        assertEquals(5.0d, matrix.distance(1, 0), 0.0d);
    }

    @Test
    @DisplayName("Negative, NaN and infinite cells are rejected")
    void testRejectsInvalidCells() {
        SolverException negative = assertThrows(
                SolverException.class,
                () -> DistanceMatrix.of(DistanceMetric.EXTERNAL_ROUTING, 1, 2, new double[]{1.0d, -2.0d}, null)
        );
        assertEquals(DistanceMatrix.REASON_INVALID_CELL, negative.reasonCode());

        assertThrows(
                SolverException.class,
                () -> DistanceMatrix.of(DistanceMetric.EXTERNAL_ROUTING, 1, 1, new double[]{Double.NaN}, null)
        );
        assertThrows(
                SolverException.class,
                () -> DistanceMatrix.of(
                        DistanceMetric.EXTERNAL_ROUTING, 1, 2, new double[]{1.0d, Double.POSITIVE_INFINITY}, null)
        );
    }

    @Test
    @DisplayName("Square matrices must have a zero diagonal")
    void testNonZeroDiagonalRejected() {
        SolverException ex = assertThrows(
                SolverException.class,
                () -> DistanceMatrix.of(DistanceMetric.EXTERNAL_ROUTING, new double[][]{{0.0d, 1.0d}, {2.0d, 0.5d}})
        );
        assertEquals(DistanceMatrix.REASON_NON_ZERO_DIAGONAL, ex.reasonCode());
    }

    @Test
    @DisplayName("Symmetric metrics reject asymmetric cells while external metrics accept them")
    void testSymmetryDependsOnMetric() {
        double[][] asymmetric = {{0.0d, 1.0d}, {2.0d, 0.0d}};

        SolverException ex = assertThrows(
                SolverException.class,
                () -> DistanceMatrix.of(DistanceMetric.PLANAR, asymmetric)
        );
        assertEquals(DistanceMatrix.REASON_ASYMMETRIC, ex.reasonCode());

        DistanceMatrix routed = DistanceMatrix.of(DistanceMetric.EXTERNAL_ROUTING, asymmetric);
        assertEquals(2.0d, routed.distance(1, 0), 0.0d);
    }

    @Test
    @DisplayName("Shape mismatches are rejected for distances and durations")
    void testShapeMismatch() {
        assertThrows(
                SolverException.class,
                () -> DistanceMatrix.of(DistanceMetric.PLANAR, 2, 2, new double[3], null)
        );
        assertThrows(
                SolverException.class,
                () -> DistanceMatrix.of(DistanceMetric.PLANAR, 1, 2, new double[2], new double[1])
        );
    }

    @Test
    @DisplayName("Duration access without durations fails fast")
    void testDurationsRequired() {
        DistanceMatrix withDurations = DistanceMatrix.of(
                DistanceMetric.EXTERNAL_ROUTING, 1, 2, new double[]{10.0d, 20.0d}, new double[]{1.0d, 2.0d});
        assertTrue(withDurations.hasDurations());
        assertEquals(2.0d, withDurations.duration(0, 1), 0.0d);

        DistanceMatrix plain = DistanceMatrix.of(DistanceMetric.EXTERNAL_ROUTING, 1, 1, new double[]{3.0d}, null);
        assertThrows(IllegalStateException.class, () -> plain.duration(0, 0));
    }

    @Test
    @DisplayName("Sub-matrix keeps the given index order")
    void testSubMatrix() {
        DistanceMatrix matrix = DistanceMatrix.of(DistanceMetric.PLANAR, new double[][]{
                {0.0d, 1.0d, 2.0d},
                {1.0d, 0.0d, 3.0d},
                {2.0d, 3.0d, 0.0d}
        });

        DistanceMatrix sub = matrix.subMatrix(new int[]{2, 0});

        assertEquals(2, sub.rows());
        assertEquals(2.0d, sub.distance(0, 1), 0.0d);
        assertEquals(0.0d, sub.distance(0, 0), 0.0d);
        assertEquals(DistanceMetric.PLANAR, sub.metric());
    }

    @Test
    @DisplayName("Out-of-range cell access throws")
    void testIndexBounds() {
        DistanceMatrix matrix = DistanceMatrix.of(DistanceMetric.PLANAR, new double[][]{{0.0d}});
        assertThrows(IndexOutOfBoundsException.class, () -> matrix.distance(0, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> matrix.distance(-1, 0));
    }
}
