package org.Aayush.allocator.route;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.Aayush.allocator.distance.DistanceMatrix;

import java.util.Arrays;

/**
 * Dense Prim minimum spanning tree over a square matrix.
 *
 * <p>Runs in {@code O(n^2)}. Among equal keys the smaller vertex index is attached first,
 * and a vertex keeps its earlier parent unless a strictly lighter edge appears.</p>
 */
public final class MinimumSpanningTree {
    private final int root;
    private final int[] parent;
    private final double totalWeight;
    private final IntArrayList[] children;

    private MinimumSpanningTree(int root, int[] parent, double totalWeight, IntArrayList[] children) {
        this.root = root;
        this.parent = parent;
        this.totalWeight = totalWeight;
        this.children = children;
    }

    /**
     * Builds the tree rooted at {@code root}.
     */
    public static MinimumSpanningTree of(DistanceMatrix matrix, int root) {
        if (!matrix.square()) {
            throw new IllegalArgumentException("minimum spanning tree requires a square matrix");
        }
        int n = matrix.rows();
        if (n == 0) {
            return new MinimumSpanningTree(root, new int[0], 0.0d, new IntArrayList[0]);
        }
        if (root < 0 || root >= n) {
            throw new IllegalArgumentException("root must be in [0, " + n + ")");
        }
        int[] parent = new int[n];
        double[] key = new double[n];
        boolean[] inTree = new boolean[n];
        Arrays.fill(parent, -1);
        Arrays.fill(key, Double.POSITIVE_INFINITY);
        key[root] = 0.0d;

        IntArrayList[] children = new IntArrayList[n];
        for (int i = 0; i < n; i++) {
            children[i] = new IntArrayList();
        }
        double total = 0.0d;
        for (int step = 0; step < n; step++) {
            int next = -1;
            for (int v = 0; v < n; v++) {
                if (!inTree[v] && (next < 0 || key[v] < key[next])) {
                    next = v;
                }
            }
            inTree[next] = true;
            if (parent[next] >= 0) {
                total += key[next];
                children[parent[next]].add(next);
            }
            for (int v = 0; v < n; v++) {
                if (inTree[v]) {
                    continue;
                }
                double w = RouteCostEvaluator.undirectedWeight(matrix, next, v);
                if (w < key[v]) {
                    key[v] = w;
                    parent[v] = next;
                }
            }
        }
        for (IntArrayList list : children) {
            IntArrays.quickSort(list.elements(), 0, list.size());
        }
        return new MinimumSpanningTree(root, parent, total, children);
    }

    /**
     * Sum of tree edge weights.
     */
    public static double weight(DistanceMatrix matrix) {
        return matrix.rows() == 0 ? 0.0d : of(matrix, 0).totalWeight();
    }

    public int root() {
        return root;
    }

    public double totalWeight() {
        return totalWeight;
    }

    public int vertexCount() {
        return parent.length;
    }

    /**
     * Parent of {@code vertex}, or -1 for the root.
     */
    public int parent(int vertex) {
        return parent[vertex];
    }

    /**
     * Degree of {@code vertex} in the tree.
     */
    public int degree(int vertex) {
        return children[vertex].size() + (parent[vertex] >= 0 ? 1 : 0);
    }

    /**
     * Children of {@code vertex} in ascending index order.
     */
    public int[] children(int vertex) {
        return children[vertex].toIntArray();
    }

    /**
     * Depth-first preorder from the root, visiting children in ascending index order.
     */
    public int[] preorder() {
        int n = parent.length;
        int[] order = new int[n];
        int cursor = 0;
        IntArrayList stack = new IntArrayList();
        stack.add(root);
        while (!stack.isEmpty()) {
            int v = stack.popInt();
            order[cursor++] = v;
            IntArrayList kids = children[v];
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.add(kids.getInt(i));
            }
        }
        return order;
    }
}
