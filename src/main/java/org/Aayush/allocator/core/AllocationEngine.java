package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.assign.Assignment;
import org.Aayush.allocator.assign.AssignmentEngine;
import org.Aayush.allocator.assign.PointRanking;
import org.Aayush.allocator.assign.WorkerRanking;
import org.Aayush.allocator.cluster.Cluster;
import org.Aayush.allocator.cluster.ClusterPreconditions;
import org.Aayush.allocator.cluster.ClusterResult;
import org.Aayush.allocator.cluster.ClusterStatistics;
import org.Aayush.allocator.cluster.Clusterer;
import org.Aayush.allocator.cluster.GraphPartitionClusterer;
import org.Aayush.allocator.cluster.GraphPartitioner;
import org.Aayush.allocator.cluster.KMeansClusterer;
import org.Aayush.allocator.cluster.KaffpaProcessPartitioner;
import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.distance.DistanceMatrix;
import org.Aayush.allocator.distance.DistanceMatrixProvider;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Point;
import org.Aayush.allocator.route.Route;
import org.Aayush.allocator.route.RouteCostEvaluator;
import org.Aayush.allocator.route.RouteOptions;
import org.Aayush.allocator.route.RouteSolver;
import org.Aayush.allocator.route.RouteSolverRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Main allocation entry point.
 *
 * <p>Every operation follows the same flow:</p>
 * <ul>
 * <li>Validate the request, index caller ids and build the stage, all before any
 * distance is computed.</li>
 * <li>Compute the distance matrix under the requested metric.</li>
 * <li>Dispatch to the clustering, routing or assignment stage.</li>
 * <li>Attach invocation metadata (method, metric, timing, convergence).</li>
 * </ul>
 *
 * <p>The engine holds no per-call state and may be shared across threads.</p>
 */
@Slf4j
public final class AllocationEngine {
    public static final String REASON_REQUEST_REQUIRED = "CORE_REQUEST_REQUIRED";
    public static final String REASON_INVALID_OPTIONS = "CORE_INVALID_OPTIONS";

    private final DistanceMatrixProvider distanceProvider;
    private final AssignmentEngine assignmentEngine;
    private final GraphPartitioner graphPartitioner;
    private final List<RouteSolver> customRouteSolvers;

    /**
     * Creates the engine; null collaborators fall back to built-ins.
     *
     * @param distanceProvider matrix provider override.
     * @param graphPartitioner graph partitioner override (defaults to kaffpa).
     * @param customRouteSolvers solvers replacing built-in backends.
     */
    @Builder
    public AllocationEngine(
            DistanceMatrixProvider distanceProvider,
            GraphPartitioner graphPartitioner,
            List<RouteSolver> customRouteSolvers
    ) {
        this.distanceProvider = distanceProvider == null ? new DistanceMatrixProvider() : distanceProvider;
        this.graphPartitioner = graphPartitioner == null ? new KaffpaProcessPartitioner() : graphPartitioner;
        this.customRouteSolvers = customRouteSolvers == null ? List.of() : List.copyOf(customRouteSolvers);
        this.assignmentEngine = new AssignmentEngine();
    }

    /**
     * Engine with all built-in collaborators.
     */
    public static AllocationEngine createDefault() {
        return AllocationEngine.builder().build();
    }

    /**
     * Partitions points into {@code k} clusters.
     */
    public ClusterResponse cluster(ClusterRequest request) {
        requireRequest(request);
        long startNanos = System.nanoTime();
        List<Point> points = request.getPoints();
        PointIdIndex.of(points, "point");
        ClusterPreconditions.validateClusterCount(points.size(), request.getK());
        Clusterer clusterer = clustererFor(request);

        DistanceMatrix matrix = distanceProvider.compute(points, request.getMetric(), request.getDistanceConfig());
        ClusterResult result = clusterer.partition(points, matrix, request.getK(), request.getSeed());
        List<ClusterStatistics> statistics = ClusterStatistics.of(result, matrix);

        InvocationMetadata metadata = clusterMetadata("cluster", request, result, startNanos);
        log.info(
                "cluster: method={}, metric={}, n={}, k={}, iterations={}, converged={}, {} ms",
                result.getMethod().id(),
                request.getMetric().id(),
                points.size(),
                request.getK(),
                result.getIterations(),
                result.isConverged(),
                metadata.getElapsedMillis()
        );
        return ClusterResponse.builder()
                .result(result)
                .statistics(statistics)
                .metadata(metadata)
                .build();
    }

    /**
     * Orders points into one route.
     */
    public RouteResponse route(RouteRequest request) {
        requireRequest(request);
        long startNanos = System.nanoTime();
        List<Point> points = request.getPoints();
        PointIdIndex ids = PointIdIndex.of(points, "point");
        RouteOptions options = Objects.requireNonNull(request.getOptions(), "options");
        if (request.getStartPointId() != null) {
            options = options.toBuilder().startIndex(ids.indexOf(request.getStartPointId())).build();
        }
        RouteCostEvaluator.validateOptions(points.size(), options);
        RouteSolver solver = routeSolvers(request.getDistanceConfig()).solver(options.getBackend());
        solver.preflight(points.size(), options);

        DistanceMatrix matrix = distanceProvider.compute(points, request.getMetric(), request.getDistanceConfig());
        Route route = solver.solve(points, matrix, options);

        InvocationMetadata metadata = InvocationMetadata.builder()
                .operation("route")
                .method(route.getBackend().id())
                .metric(request.getMetric())
                .pointCount(points.size())
                .elapsedMillis(elapsedMillis(startNanos))
                .implementationNote(route.getImplementationNote())
                .build();
        log.info(
                "route: backend={}, metric={}, n={}, distance={}, {} ms",
                route.getBackend().id(),
                request.getMetric().id(),
                points.size(),
                route.getTotalDistance(),
                metadata.getElapsedMillis()
        );
        return RouteResponse.builder().route(route).metadata(metadata).build();
    }

    /**
     * Clusters points, then solves one route per non-empty cluster.
     *
     * @param routeOptions per-cluster route options; a fixed start index is not allowed.
     */
    public ClusterRouteResponse clusterAndRoute(ClusterRequest request, RouteOptions routeOptions) {
        requireRequest(request);
        Objects.requireNonNull(routeOptions, "routeOptions");
        if (routeOptions.getStartIndex() != null) {
            throw new ValidationException(
                    REASON_INVALID_OPTIONS,
                    "startIndex",
                    "a fixed start index cannot be applied to every cluster"
            );
        }
        long startNanos = System.nanoTime();
        List<Point> points = request.getPoints();
        PointIdIndex.of(points, "point");
        ClusterPreconditions.validateClusterCount(points.size(), request.getK());
        RouteCostEvaluator.validateOptions(points.size(), routeOptions);
        Clusterer clusterer = clustererFor(request);
        RouteSolver solver = routeSolvers(request.getDistanceConfig()).solver(routeOptions.getBackend());

        DistanceMatrix matrix = distanceProvider.compute(points, request.getMetric(), request.getDistanceConfig());
        ClusterResult clusters = clusterer.partition(points, matrix, request.getK(), request.getSeed());

        List<ClusterRoute> routes = new ArrayList<>(clusters.clusterCount());
        for (Cluster cluster : clusters.getClusters()) {
            int[] members = cluster.getMemberIndices();
            if (members.length == 0) {
                continue;
            }
            List<Point> subset = new ArrayList<>(members.length);
            for (int index : members) {
                subset.add(points.get(index));
            }
            Route route = solver.solve(subset, matrix.subMatrix(members), routeOptions);
            int[] local = route.getOrder();
            int[] global = new int[local.length];
            for (int i = 0; i < local.length; i++) {
                global[i] = members[local[i]];
            }
            routes.add(ClusterRoute.builder()
                    .clusterId(cluster.getId())
                    .route(route)
                    .pointIndices(global)
                    .build());
        }

        InvocationMetadata metadata = clusterMetadata("cluster-and-route", request, clusters, startNanos);
        log.info(
                "cluster-and-route: method={}, backend={}, n={}, k={}, {} ms",
                clusters.getMethod().id(),
                routeOptions.getBackend().id(),
                points.size(),
                request.getK(),
                metadata.getElapsedMillis()
        );
        return ClusterRouteResponse.builder()
                .clusters(clusters)
                .routes(List.copyOf(routes))
                .metadata(metadata)
                .build();
    }

    /**
     * Assigns every point to its nearest worker with spare capacity.
     */
    public AssignmentResponse assign(AssignmentRequest request) {
        requireRequest(request);
        long startNanos = System.nanoTime();
        PointIdIndex.of(request.getPoints(), "point");
        PointIdIndex.of(request.getWorkers(), "worker");

        DistanceMatrix matrix = distanceProvider.compute(
                request.getPoints(),
                request.getWorkers(),
                request.getMetric(),
                request.getDistanceConfig()
        );
        List<Assignment> assignments = assignmentEngine.assign(
                request.getPoints(),
                request.getWorkers(),
                matrix,
                request.getCapacities()
        );

        InvocationMetadata metadata = InvocationMetadata.builder()
                .operation("assign")
                .method("greedy-nearest")
                .metric(request.getMetric())
                .pointCount(request.getPoints().size())
                .elapsedMillis(elapsedMillis(startNanos))
                .implementationNote("first-come-first-served capacitated nearest worker")
                .build();
        return AssignmentResponse.builder().assignments(assignments).metadata(metadata).build();
    }

    /**
     * Ranks every worker for every point, nearest first.
     */
    public List<WorkerRanking> rankWorkersByPoint(AssignmentRequest request) {
        requireRequest(request);
        PointIdIndex.of(request.getPoints(), "point");
        PointIdIndex.of(request.getWorkers(), "worker");
        DistanceMatrix matrix = distanceProvider.compute(
                request.getPoints(), request.getWorkers(), request.getMetric(), request.getDistanceConfig());
        return assignmentEngine.rankWorkersByPoint(request.getPoints(), request.getWorkers(), matrix);
    }

    /**
     * Ranks every point for every worker, nearest first.
     */
    public List<PointRanking> rankPointsByWorker(AssignmentRequest request) {
        requireRequest(request);
        PointIdIndex.of(request.getPoints(), "point");
        PointIdIndex.of(request.getWorkers(), "worker");
        DistanceMatrix matrix = distanceProvider.compute(
                request.getPoints(), request.getWorkers(), request.getMetric(), request.getDistanceConfig());
        return assignmentEngine.rankPointsByWorker(request.getPoints(), request.getWorkers(), matrix);
    }

    private Clusterer clustererFor(ClusterRequest request) {
        return switch (request.getMethod()) {
            case KMEANS -> new KMeansClusterer(request.getKMeansConfig());
            case GRAPH_PARTITION -> new GraphPartitionClusterer(request.getGraphPartitionConfig(), graphPartitioner);
        };
    }

    private RouteSolverRegistry routeSolvers(DistanceConfig distanceConfig) {
        return new RouteSolverRegistry(distanceConfig, customRouteSolvers);
    }

    private static InvocationMetadata clusterMetadata(
            String operation,
            ClusterRequest request,
            ClusterResult result,
            long startNanos
    ) {
        return InvocationMetadata.builder()
                .operation(operation)
                .method(result.getMethod().id())
                .metric(request.getMetric())
                .pointCount(request.getPoints().size())
                .elapsedMillis(elapsedMillis(startNanos))
                .iterations(result.getIterations())
                .converged(result.isConverged())
                .balance(result.getBalance())
                .implementationNote(result.getImplementationNote())
                .build();
    }

    private static void requireRequest(Object request) {
        if (request == null) {
            throw new ValidationException(REASON_REQUEST_REQUIRED, "request must be provided");
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
