package org.Aayush.allocator.route;

/**
 * Tour construction used by the approximation backend.
 */
public enum ApproximationMode {
    /** Preorder walk of the minimum spanning tree (2-approximation). */
    DOUBLE_TREE,
    /** MST plus minimum-weight perfect matching on odd-degree vertices. */
    CHRISTOFIDES
}
