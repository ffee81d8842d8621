package org.Aayush.allocator.cluster;

import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.Aayush.allocator.distance.DistanceMatrix;

import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;

/**
 * Undirected k-nearest-neighbor graph in CSR form.
 *
 * <p>Each vertex links to its {@code nClosest} nearest neighbors (ties to the smaller
 * index); links are symmetrized. Edge weight is the mean of both directed distances,
 * scaled so the longest edge weighs {@link #WEIGHT_RESOLUTION} and rounded to a positive
 * integer; partitioners only accept integer weights.</p>
 */
public final class ProximityGraph {
    /** Integer weight of the longest edge. */
    public static final int WEIGHT_RESOLUTION = 1_000;

    private final int vertexCount;
    private final int edgeCount;
    private final int[] firstEdge;
    private final int[] edgeTarget;
    private final int[] edgeWeight;

    private ProximityGraph(int vertexCount, int edgeCount, int[] firstEdge, int[] edgeTarget, int[] edgeWeight) {
        this.vertexCount = vertexCount;
        this.edgeCount = edgeCount;
        this.firstEdge = firstEdge;
        this.edgeTarget = edgeTarget;
        this.edgeWeight = edgeWeight;
    }

    /**
     * Builds the graph from a square matrix.
     */
    public static ProximityGraph build(DistanceMatrix matrix, int nClosest) {
        if (!matrix.square()) {
            throw new IllegalArgumentException("proximity graph requires a square matrix");
        }
        if (nClosest <= 0) {
            throw new IllegalArgumentException("nClosest must be positive");
        }
        int n = matrix.rows();
        int degree = Math.min(nClosest, n - 1);
        IntOpenHashSet[] adjacency = new IntOpenHashSet[n];
        for (int i = 0; i < n; i++) {
            adjacency[i] = new IntOpenHashSet();
        }

        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                order[j] = j;
            }
            int source = i;
            IntArrays.stableSort(order, (a, b) -> Double.compare(matrix.distance(source, a), matrix.distance(source, b)));
            int taken = 0;
            for (int p = 0; p < n && taken < degree; p++) {
                int j = order[p];
                if (j == i) {
                    continue;
                }
                adjacency[i].add(j);
                adjacency[j].add(i);
                taken++;
            }
        }

        int[] firstEdge = new int[n + 1];
        for (int i = 0; i < n; i++) {
            firstEdge[i + 1] = firstEdge[i] + adjacency[i].size();
        }
        int[] edgeTarget = new int[firstEdge[n]];
        double[] edgeLength = new double[firstEdge[n]];
        double longest = 0.0d;
        for (int i = 0; i < n; i++) {
            int[] neighbors = adjacency[i].toIntArray();
            Arrays.sort(neighbors);
            int cursor = firstEdge[i];
            for (int j : neighbors) {
                edgeTarget[cursor] = j;
                edgeLength[cursor] = (matrix.distance(i, j) + matrix.distance(j, i)) * 0.5d;
                longest = Math.max(longest, edgeLength[cursor]);
                cursor++;
            }
        }

        double scale = longest > 0.0d ? WEIGHT_RESOLUTION / longest : 0.0d;
        int[] edgeWeight = new int[edgeLength.length];
        for (int e = 0; e < edgeLength.length; e++) {
            edgeWeight[e] = (int) Math.max(1L, Math.round(edgeLength[e] * scale));
        }
        return new ProximityGraph(n, firstEdge[n] / 2, firstEdge, edgeTarget, edgeWeight);
    }

    public int vertexCount() {
        return vertexCount;
    }

    /**
     * Number of undirected edges.
     */
    public int edgeCount() {
        return edgeCount;
    }

    public int degree(int vertex) {
        return firstEdge[vertex + 1] - firstEdge[vertex];
    }

    /**
     * Returns a defensive copy of sorted neighbors of {@code vertex}.
     */
    public int[] neighbors(int vertex) {
        return Arrays.copyOfRange(edgeTarget, firstEdge[vertex], firstEdge[vertex + 1]);
    }

    /**
     * Weight of the edge between {@code vertex} and its {@code position}-th neighbor.
     */
    public int weight(int vertex, int position) {
        return edgeWeight[firstEdge[vertex] + position];
    }

    /**
     * Writes the graph in METIS text format with edge weights ({@code fmt = 1}).
     *
     * <p>Vertex ids are 1-based; each line lists {@code neighbor weight} pairs.</p>
     */
    public void writeMetis(Writer writer) throws IOException {
        writer.write(vertexCount + " " + edgeCount + " 1\n");
        StringBuilder line = new StringBuilder();
        for (int v = 0; v < vertexCount; v++) {
            line.setLength(0);
            for (int e = firstEdge[v]; e < firstEdge[v + 1]; e++) {
                if (line.length() > 0) {
                    line.append(' ');
                }
                line.append(edgeTarget[e] + 1).append(' ').append(edgeWeight[e]);
            }
            line.append('\n');
            writer.write(line.toString());
        }
    }
}
