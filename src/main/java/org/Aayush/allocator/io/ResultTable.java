package org.Aayush.allocator.io;

import org.Aayush.allocator.assign.Assignment;
import org.Aayush.allocator.cluster.ClusterBalance;
import org.Aayush.allocator.core.AssignmentResponse;
import org.Aayush.allocator.core.ClusterResponse;
import org.Aayush.allocator.core.ClusterRoute;
import org.Aayush.allocator.core.ClusterRouteResponse;
import org.Aayush.allocator.core.InvocationMetadata;
import org.Aayush.allocator.core.RouteResponse;
import org.Aayush.allocator.model.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Input records augmented with engine output, plus an ordered metadata block.
 *
 * <p>Records keep input order. Cells hold {@link String}, {@link Number} or
 * {@link Boolean} values, or null for an empty cell.</p>
 */
public final class ResultTable {
    public static final String CLUSTER = "cluster";
    public static final String ROUTE_ORDER = "route_order";
    public static final String ASSIGNED_WORKER = "assigned_worker";
    public static final String DISTANCE = "distance";
    public static final String RANK = "rank";

    private final List<String> columns;
    private final List<List<Object>> records;
    private final Map<String, Object> metadata;

    private ResultTable(List<String> columns, List<List<Object>> records, Map<String, Object> metadata) {
        this.columns = List.copyOf(columns);
        this.records = Collections.unmodifiableList(records);
        this.metadata = Collections.unmodifiableMap(metadata);
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> records() {
        return records;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public static ResultTable ofClusters(List<Point> points, ClusterResponse response) {
        int[] labels = response.getResult().getLabels();
        Builder builder = new Builder(points, List.of(CLUSTER));
        for (int i = 0; i < points.size(); i++) {
            builder.record(i, labels[i]);
        }
        return builder.build(response.getMetadata());
    }

    public static ResultTable ofClusterRoutes(List<Point> points, ClusterRouteResponse response) {
        int[] labels = response.getClusters().getLabels();
        Integer[] positions = new Integer[points.size()];
        double total = 0.0d;
        for (ClusterRoute clusterRoute : response.getRoutes()) {
            int[] visiting = clusterRoute.getPointIndices();
            for (int position = 0; position < visiting.length; position++) {
                positions[visiting[position]] = position;
            }
            total += clusterRoute.getRoute().getTotalDistance();
        }
        Builder builder = new Builder(points, List.of(CLUSTER, ROUTE_ORDER));
        for (int i = 0; i < points.size(); i++) {
            builder.record(i, labels[i], positions[i]);
        }
        builder.meta("total_distance", total);
        return builder.build(response.getMetadata());
    }

    public static ResultTable ofRoute(List<Point> points, RouteResponse response) {
        int[] order = response.getRoute().getOrder();
        Integer[] positions = new Integer[points.size()];
        for (int position = 0; position < order.length; position++) {
            positions[order[position]] = position;
        }
        Builder builder = new Builder(points, List.of(ROUTE_ORDER));
        for (int i = 0; i < points.size(); i++) {
            builder.record(i, positions[i]);
        }
        builder.meta("total_distance", response.getRoute().getTotalDistance());
        builder.meta("closed", response.getRoute().isClosed());
        return builder.build(response.getMetadata());
    }

    public static ResultTable ofAssignments(List<Point> points, AssignmentResponse response) {
        Assignment[] byPoint = new Assignment[points.size()];
        for (Assignment assignment : response.getAssignments()) {
            byPoint[assignment.getPointIndex()] = assignment;
        }
        Builder builder = new Builder(points, List.of(ASSIGNED_WORKER, DISTANCE, RANK));
        for (int i = 0; i < points.size(); i++) {
            Assignment assignment = byPoint[i];
            if (assignment == null) {
                builder.record(i, null, null, null);
            } else {
                builder.record(i, assignment.getWorkerId(), assignment.getDistance(), assignment.getRank());
            }
        }
        return builder.build(response.getMetadata());
    }

    private static final class Builder {
        private final List<Point> points;
        private final List<String> attributeKeys;
        private final List<String> columns = new ArrayList<>();
        private final List<List<Object>> records = new ArrayList<>();
        private final Map<String, Object> extraMetadata = new LinkedHashMap<>();

        Builder(List<Point> points, List<String> outputColumns) {
            this.points = Objects.requireNonNull(points, "points");
            Set<String> keys = new LinkedHashSet<>();
            for (Point point : points) {
                keys.addAll(point.getAttributes().keySet());
            }
            keys.removeAll(outputColumns);
            keys.removeAll(List.of("id", "longitude", "latitude"));
            this.attributeKeys = List.copyOf(keys);
            columns.add("id");
            columns.add("longitude");
            columns.add("latitude");
            columns.addAll(attributeKeys);
            columns.addAll(outputColumns);
        }

        void record(int index, Object... outputs) {
            Point point = points.get(index);
            List<Object> record = new ArrayList<>(columns.size());
            record.add(point.getId());
            record.add(point.getLongitude());
            record.add(point.getLatitude());
            for (String key : attributeKeys) {
                record.add(point.getAttributes().get(key));
            }
            record.addAll(Arrays.asList(outputs));
            records.add(record);
        }

        void meta(String key, Object value) {
            extraMetadata.put(key, value);
        }

        ResultTable build(InvocationMetadata source) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("operation", source.getOperation());
            metadata.put("method", source.getMethod());
            metadata.put("metric", source.getMetric() == null ? null : source.getMetric().id());
            metadata.put("point_count", source.getPointCount());
            metadata.put("elapsed_millis", source.getElapsedMillis());
            if (source.getIterations() != null) {
                metadata.put("iterations", source.getIterations());
            }
            if (source.getConverged() != null) {
                metadata.put("converged", source.getConverged());
            }
            ClusterBalance balance = source.getBalance();
            if (balance != null) {
                metadata.put("cluster_sizes", Arrays.toString(balance.getSizes()));
                metadata.put("imbalance_ratio", balance.getImbalanceRatio());
                metadata.put("size_cv", balance.getCoefficientOfVariation());
            }
            metadata.putAll(extraMetadata);
            if (source.getImplementationNote() != null) {
                metadata.put("implementation_note", source.getImplementationNote());
            }
            return new ResultTable(columns, records, metadata);
        }
    }
}
