package org.Aayush.allocator.route;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.model.Located;

import java.util.List;

/**
 * Minimum-spanning-tree tour construction.
 *
 * <p>{@link ApproximationMode#DOUBLE_TREE} shortcuts a preorder walk of the tree.
 * {@link ApproximationMode#CHRISTOFIDES} adds a minimum-weight perfect matching on
 * odd-degree tree vertices, walks an Eulerian circuit and shortcuts it. When the matching
 * falls back to greedy, the double-tree tour is built too and the shorter one is kept,
 * so the tour never exceeds twice the tree weight on metric input.</p>
 */
@Slf4j
public final class ApproximationRouteSolver implements RouteSolver {

    @Override
    public RouteBackend backend() {
        return RouteBackend.APPROXIMATION;
    }

    @Override
    public Route solve(List<? extends Located> points, DistanceMatrix matrix, RouteOptions options) {
        RouteCostEvaluator.validate(points, matrix, options);
        int n = points.size();
        if (n == 1) {
            return RouteCostEvaluator.singlePoint(options, backend());
        }
        int start = RouteCostEvaluator.startOrFirst(options);
        MinimumSpanningTree tree = MinimumSpanningTree.of(matrix, start);
        int[] doubleTree = tree.preorder();

        if (options.getApproximationMode() == ApproximationMode.DOUBLE_TREE) {
            return RouteCostEvaluator.finish(doubleTree, matrix, options, backend(), "mst double-tree");
        }

        IntArrayList odd = new IntArrayList();
        for (int v = 0; v < n; v++) {
            if (tree.degree(v) % 2 != 0) {
                odd.add(v);
            }
        }
        PerfectMatching.Result matching = PerfectMatching.match(
                odd.toIntArray(),
                (a, b) -> RouteCostEvaluator.undirectedWeight(matrix, a, b)
        );

        EulerianCircuit multigraph = new EulerianCircuit(n);
        for (int v = 0; v < n; v++) {
            if (tree.parent(v) >= 0) {
                multigraph.addEdge(tree.parent(v), v);
            }
        }
        for (int[] pair : matching.pairs()) {
            multigraph.addEdge(pair[0], pair[1]);
        }
        int[] christofides = EulerianCircuit.shortcut(multigraph.circuit(start), n);

        if (matching.exact()) {
            return RouteCostEvaluator.finish(christofides, matrix, options, backend(), "christofides exact-matching");
        }
        double christofidesCost = RouteCostEvaluator.distance(christofides, matrix, options.isClosed());
        double doubleTreeCost = RouteCostEvaluator.distance(doubleTree, matrix, options.isClosed());
        log.debug(
                "greedy matching over {} odd vertices: christofides={}, double-tree={}",
                odd.size(),
                christofidesCost,
                doubleTreeCost
        );
        if (doubleTreeCost < christofidesCost) {
            return RouteCostEvaluator.finish(
                    doubleTree, matrix, options, backend(), "christofides greedy-matching; double-tree kept"
            );
        }
        return RouteCostEvaluator.finish(christofides, matrix, options, backend(), "christofides greedy-matching");
    }
}
