package org.Aayush.allocator.external;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.Aayush.allocator.model.Located;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Google Directions API client planning an optimized round trip.
 *
 * <p>The first location is both origin and destination; the remaining locations are
 * sent as {@code optimize:true} waypoints and the service reorders them. At most
 * {@link #MAX_LOCATIONS} locations fit in one request.</p>
 */
public final class GoogleDirectionsClient {
    public static final String SERVICE_NAME = "google-directions";
    public static final int MAX_LOCATIONS = 25;

    private final HttpJsonTransport transport;
    private final String endpoint;
    private final String apiKey;

    public GoogleDirectionsClient(HttpJsonTransport transport, String endpoint, String apiKey) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    }

    /**
     * Requests a loop starting and ending at the first location.
     *
     * @param locations at least two locations; the first one is the fixed origin.
     * @return visiting order of input indices, starting at 0.
     */
    public LoopPlan optimizeLoop(List<? extends Located> locations) {
        int n = locations.size();
        if (n < 2 || n > MAX_LOCATIONS) {
            throw new IllegalArgumentException("directions loop needs 2.." + MAX_LOCATIONS + " locations but got " + n);
        }
        String origin = latLon(locations.get(0));
        StringJoiner waypoints = new StringJoiner("|", "optimize:true|", "");
        for (Located location : locations.subList(1, n)) {
            waypoints.add(latLon(location));
        }
        URI uri = URI.create(endpoint
                + "?origin=" + encode(origin)
                + "&destination=" + encode(origin)
                + "&waypoints=" + encode(waypoints.toString())
                + "&mode=driving"
                + "&units=metric"
                + "&key=" + encode(apiKey));

        JsonObject body = transport.get(SERVICE_NAME, uri);
        GoogleDistanceMatrixClient.requireOk(body, SERVICE_NAME);

        JsonArray routes = ServiceJson.requireArray(body, "routes", SERVICE_NAME);
        if (routes.size() == 0) {
            throw ServiceJson.malformed(SERVICE_NAME, "directions response has no routes");
        }
        JsonObject route = ServiceJson.requireObject(routes.get(0), "route", SERVICE_NAME);
        JsonArray waypointOrder = ServiceJson.requireArray(route, "waypoint_order", SERVICE_NAME);
        if (waypointOrder.size() != n - 1) {
            throw ServiceJson.malformed(
                    SERVICE_NAME,
                    "waypoint_order has " + waypointOrder.size() + " entries for " + (n - 1) + " waypoints"
            );
        }

        int[] order = new int[n];
        boolean[] seen = new boolean[n];
        seen[0] = true;
        for (int i = 0; i < n - 1; i++) {
            JsonElement element = waypointOrder.get(i);
            int waypoint = element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber() ? element.getAsInt() : -1;
            if (waypoint < 0 || waypoint >= n - 1 || seen[waypoint + 1]) {
                throw ServiceJson.malformed(SERVICE_NAME, "waypoint_order entry " + element + " is out of range or repeated");
            }
            seen[waypoint + 1] = true;
            order[i + 1] = waypoint + 1;
        }

        double distance = 0.0d;
        double duration = 0.0d;
        for (JsonElement element : ServiceJson.requireArray(route, "legs", SERVICE_NAME)) {
            JsonObject leg = ServiceJson.requireObject(element, "leg", SERVICE_NAME);
            distance += measure(leg, "distance");
            duration += measure(leg, "duration");
        }
        return new LoopPlan(order, distance, duration);
    }

    private static double measure(JsonObject leg, String field) {
        JsonObject value = ServiceJson.requireObject(leg.get(field), field, SERVICE_NAME);
        return ServiceJson.requireNumber(value, "value", SERVICE_NAME);
    }

    private static String latLon(Located location) {
        return ServiceJson.plain(location.getLatitude()) + "," + ServiceJson.plain(location.getLongitude());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Optimized loop as reported by the service.
     *
     * @param order input indices in visiting order; {@code order[0] == 0}.
     * @param distance summed leg distance in meters, closing leg included.
     * @param duration summed leg duration in seconds.
     */
    public record LoopPlan(int[] order, double distance, double duration) {
    }
}
