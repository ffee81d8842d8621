package org.Aayush.allocator.external;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.Aayush.allocator.error.ExternalServiceException;
import org.Aayush.allocator.model.Located;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * OSRM HTTP client covering the {@code table} and {@code trip} services.
 *
 * <p>Coordinates are sent as {@code lon,lat} pairs separated by {@code ;}. Table
 * requests list sources first and targets after them, addressed through the
 * {@code sources} and {@code destinations} parameters.</p>
 */
public final class OsrmClient implements TableServiceClient {
    public static final String SERVICE_NAME = "osrm";
    public static final String REASON_SERVICE_STATUS = "EXT_OSRM_STATUS";

    private final HttpJsonTransport transport;
    private final String baseUrl;
    private final String profile;
    private final int maxTableSize;

    /**
     * @param transport shared HTTP transport.
     * @param baseUrl service root, for example {@code http://router.project-osrm.org}.
     * @param profile routing profile segment.
     * @param maxTableSize max sources and max targets per table request.
     */
    public OsrmClient(HttpJsonTransport transport, String baseUrl, String profile, int maxTableSize) {
        if (maxTableSize <= 0) {
            throw new IllegalArgumentException("maxTableSize must be positive");
        }
        this.transport = Objects.requireNonNull(transport, "transport");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.profile = Objects.requireNonNull(profile, "profile");
        this.maxTableSize = maxTableSize;
    }

    @Override
    public String serviceName() {
        return SERVICE_NAME;
    }

    @Override
    public int maxSourcesPerRequest() {
        return maxTableSize;
    }

    @Override
    public int maxTargetsPerRequest() {
        return maxTableSize;
    }

    @Override
    public TableBlock fetch(List<? extends Located> sources, List<? extends Located> targets, boolean includeDurations) {
        int rows = sources.size();
        int cols = targets.size();
        List<Located> all = new ArrayList<>(rows + cols);
        all.addAll(sources);
        all.addAll(targets);

        StringJoiner sourceIndices = new StringJoiner(";");
        for (int i = 0; i < rows; i++) {
            sourceIndices.add(Integer.toString(i));
        }
        StringJoiner targetIndices = new StringJoiner(";");
        for (int j = 0; j < cols; j++) {
            targetIndices.add(Integer.toString(rows + j));
        }
        URI uri = URI.create(baseUrl + "/table/v1/" + profile + "/" + coordinates(all)
                + "?sources=" + sourceIndices
                + "&destinations=" + targetIndices
                + "&annotations=" + (includeDurations ? "distance,duration" : "distance"));

        JsonObject body = transport.get(SERVICE_NAME, uri);
        requireOk(body);
        double[] distances = readTable(ServiceJson.requireArray(body, "distances", SERVICE_NAME), rows, cols);
        double[] durations = includeDurations
                ? readTable(ServiceJson.requireArray(body, "durations", SERVICE_NAME), rows, cols)
                : null;
        return new TableBlock(rows, cols, distances, durations);
    }

    /**
     * Requests a round trip over all locations.
     *
     * @param locations locations in input order.
     * @param fixFirst when true the first location is pinned as trip source.
     * @return visiting order of input indices as returned by the service, unrotated.
     */
    public TripPlan trip(List<? extends Located> locations, boolean fixFirst) {
        int n = locations.size();
        URI uri = URI.create(baseUrl + "/trip/v1/" + profile + "/" + coordinates(locations)
                + "?roundtrip=true"
                + "&source=" + (fixFirst ? "first" : "any")
                + "&destination=any"
                + "&steps=false"
                + "&overview=false");

        JsonObject body = transport.get(SERVICE_NAME, uri);
        requireOk(body);
        JsonArray waypoints = ServiceJson.requireArray(body, "waypoints", SERVICE_NAME);
        JsonArray trips = ServiceJson.requireArray(body, "trips", SERVICE_NAME);
        if (waypoints.size() != n) {
            throw ServiceJson.malformed(SERVICE_NAME, "trip returned " + waypoints.size() + " waypoints for " + n + " locations");
        }
        if (trips.size() == 0) {
            throw ServiceJson.malformed(SERVICE_NAME, "trip response has no trips");
        }

        int[] order = new int[n];
        Arrays.fill(order, -1);
        for (int i = 0; i < n; i++) {
            JsonObject waypoint = ServiceJson.requireObject(waypoints.get(i), "waypoint " + i, SERVICE_NAME);
            int position = (int) ServiceJson.requireNumber(waypoint, "waypoint_index", SERVICE_NAME);
            if (position < 0 || position >= n || order[position] != -1) {
                throw ServiceJson.malformed(SERVICE_NAME, "trip waypoint_index " + position + " is out of range or repeated");
            }
            order[position] = i;
        }

        double distance = 0.0d;
        double duration = 0.0d;
        for (JsonElement element : trips) {
            JsonObject trip = ServiceJson.requireObject(element, "trip", SERVICE_NAME);
            distance += ServiceJson.requireNumber(trip, "distance", SERVICE_NAME);
            duration += ServiceJson.requireNumber(trip, "duration", SERVICE_NAME);
        }
        return new TripPlan(order, distance, duration, trips.size());
    }

    private static void requireOk(JsonObject body) {
        String code = ServiceJson.requireString(body, "code", SERVICE_NAME);
        if (!"Ok".equals(code)) {
            String message = ServiceJson.optionalString(body, "message");
            throw new ExternalServiceException(
                    REASON_SERVICE_STATUS,
                    SERVICE_NAME,
                    "service returned code " + code + (message == null ? "" : ": " + message),
                    false
            );
        }
    }

    private static double[] readTable(JsonArray table, int rows, int cols) {
        if (table.size() != rows) {
            throw ServiceJson.malformed(SERVICE_NAME, "table has " + table.size() + " rows, expected " + rows);
        }
        double[] flat = new double[rows * cols];
        for (int i = 0; i < rows; i++) {
            JsonElement rowElement = table.get(i);
            if (!rowElement.isJsonArray() || rowElement.getAsJsonArray().size() != cols) {
                throw ServiceJson.malformed(SERVICE_NAME, "table row " + i + " does not have " + cols + " cells");
            }
            JsonArray row = rowElement.getAsJsonArray();
            for (int j = 0; j < cols; j++) {
                flat[i * cols + j] = ServiceJson.numberOrNaN(row.get(j), SERVICE_NAME);
            }
        }
        return flat;
    }

    private static String coordinates(List<? extends Located> locations) {
        StringJoiner joiner = new StringJoiner(";");
        for (Located location : locations) {
            joiner.add(ServiceJson.plain(location.getLongitude()) + "," + ServiceJson.plain(location.getLatitude()));
        }
        return joiner.toString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Raw trip service answer.
     *
     * @param order input indices in visiting order, starting at the trip source.
     * @param distance reported total distance in meters.
     * @param duration reported total duration in seconds.
     * @param tripCount number of disjoint trips; more than one means the input is not connected.
     */
    public record TripPlan(int[] order, double distance, double duration, int tripCount) {
    }
}
