package org.Aayush.allocator.route;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Hierholzer circuit over an undirected multigraph with every vertex of even degree.
 *
 * <p>At each step the unused edge to the smallest neighbor index is taken.</p>
 */
final class EulerianCircuit {
    private final int vertexCount;
    private final IntArrayList edgeFrom = new IntArrayList();
    private final IntArrayList edgeTo = new IntArrayList();

    EulerianCircuit(int vertexCount) {
        this.vertexCount = vertexCount;
    }

    void addEdge(int a, int b) {
        edgeFrom.add(a);
        edgeTo.add(b);
    }

    /**
     * Returns the vertex sequence of the circuit, starting and ending at {@code start}.
     */
    int[] circuit(int start) {
        int edges = edgeFrom.size();
        IntArrayList[] incident = new IntArrayList[vertexCount];
        for (int v = 0; v < vertexCount; v++) {
            incident[v] = new IntArrayList();
        }
        for (int e = 0; e < edges; e++) {
            incident[edgeFrom.getInt(e)].add(e);
            incident[edgeTo.getInt(e)].add(e);
        }
        for (int v = 0; v < vertexCount; v++) {
            if (incident[v].size() % 2 != 0) {
                throw new IllegalStateException("vertex " + v + " has odd degree");
            }
        }

        boolean[] used = new boolean[edges];
        IntArrayList stack = new IntArrayList();
        IntArrayList reversed = new IntArrayList(edges + 1);
        stack.add(start);
        while (!stack.isEmpty()) {
            int v = stack.getInt(stack.size() - 1);
            int edge = nextUnused(v, incident[v], used);
            if (edge < 0) {
                reversed.add(stack.popInt());
                continue;
            }
            used[edge] = true;
            stack.add(other(edge, v));
        }

        int[] walk = new int[reversed.size()];
        for (int i = 0; i < walk.length; i++) {
            walk[i] = reversed.getInt(walk.length - 1 - i);
        }
        return walk;
    }

    /**
     * Drops repeated vertices from a walk, keeping first occurrences.
     */
    static int[] shortcut(int[] walk, int vertexCount) {
        boolean[] seen = new boolean[vertexCount];
        int[] order = new int[vertexCount];
        int size = 0;
        for (int v : walk) {
            if (!seen[v]) {
                seen[v] = true;
                order[size++] = v;
            }
        }
        if (size != vertexCount) {
            throw new IllegalStateException("walk visits " + size + " of " + vertexCount + " vertices");
        }
        return order;
    }

    private int nextUnused(int v, IntArrayList edgesOfV, boolean[] used) {
        int bestEdge = -1;
        int bestNeighbor = Integer.MAX_VALUE;
        for (int i = 0; i < edgesOfV.size(); i++) {
            int e = edgesOfV.getInt(i);
            if (used[e]) {
                continue;
            }
            int neighbor = other(e, v);
            if (neighbor < bestNeighbor) {
                bestNeighbor = neighbor;
                bestEdge = e;
            }
        }
        return bestEdge;
    }

    private int other(int edge, int v) {
        int from = edgeFrom.getInt(edge);
        return from == v ? edgeTo.getInt(edge) : from;
    }
}
