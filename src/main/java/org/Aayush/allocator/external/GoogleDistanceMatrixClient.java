package org.Aayush.allocator.external;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.Aayush.allocator.error.ExternalServiceException;
import org.Aayush.allocator.model.Located;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Google Distance Matrix API client.
 *
 * <p>Locations are sent as {@code lat,lon} pairs separated by {@code |}. The API limits
 * one request to 25 origins, 25 destinations and 100 elements. Elements with status
 * {@code NOT_FOUND} or {@code ZERO_RESULTS} come back as NaN cells.</p>
 */
public final class GoogleDistanceMatrixClient implements TableServiceClient {
    public static final String SERVICE_NAME = "google-distance-matrix";
    public static final String REASON_SERVICE_STATUS = "EXT_MAPPING_STATUS";

    public static final int MAX_ORIGINS = 25;
    public static final int MAX_DESTINATIONS = 25;
    public static final int MAX_ELEMENTS = 100;

    private static final Set<String> TRANSIENT_STATUSES = Set.of("OVER_QUERY_LIMIT", "UNKNOWN_ERROR");

    private final HttpJsonTransport transport;
    private final String endpoint;
    private final String apiKey;

    public GoogleDistanceMatrixClient(HttpJsonTransport transport, String endpoint, String apiKey) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    }

    @Override
    public String serviceName() {
        return SERVICE_NAME;
    }

    @Override
    public int maxSourcesPerRequest() {
        return MAX_ORIGINS;
    }

    @Override
    public int maxTargetsPerRequest() {
        return MAX_DESTINATIONS;
    }

    @Override
    public int maxElementsPerRequest() {
        return MAX_ELEMENTS;
    }

    /**
     * One request at a time; a full block already uses the per-second element quota.
     */
    @Override
    public int maxConcurrentRequests() {
        return 1;
    }

    @Override
    public TableBlock fetch(List<? extends Located> sources, List<? extends Located> targets, boolean includeDurations) {
        int rows = sources.size();
        int cols = targets.size();
        URI uri = URI.create(endpoint
                + "?origins=" + encode(locations(sources))
                + "&destinations=" + encode(locations(targets))
                + "&units=metric"
                + "&key=" + encode(apiKey));

        JsonObject body = transport.get(SERVICE_NAME, uri);
        requireOk(body, SERVICE_NAME);

        JsonArray rowArray = ServiceJson.requireArray(body, "rows", SERVICE_NAME);
        if (rowArray.size() != rows) {
            throw ServiceJson.malformed(SERVICE_NAME, "response has " + rowArray.size() + " rows, expected " + rows);
        }
        double[] distances = new double[rows * cols];
        double[] durations = includeDurations ? new double[rows * cols] : null;
        for (int i = 0; i < rows; i++) {
            JsonObject row = ServiceJson.requireObject(rowArray.get(i), "row " + i, SERVICE_NAME);
            JsonArray elements = ServiceJson.requireArray(row, "elements", SERVICE_NAME);
            if (elements.size() != cols) {
                throw ServiceJson.malformed(SERVICE_NAME, "row " + i + " has " + elements.size() + " elements, expected " + cols);
            }
            for (int j = 0; j < cols; j++) {
                JsonObject element = ServiceJson.requireObject(elements.get(j), "element", SERVICE_NAME);
                String status = ServiceJson.requireString(element, "status", SERVICE_NAME);
                int cell = i * cols + j;
                if (!"OK".equals(status)) {
                    distances[cell] = Double.NaN;
                    if (durations != null) {
                        durations[cell] = Double.NaN;
                    }
                    continue;
                }
                distances[cell] = valueOf(element, "distance");
                if (durations != null) {
                    durations[cell] = valueOf(element, "duration");
                }
            }
        }
        return new TableBlock(rows, cols, distances, durations);
    }

    /**
     * Checks the top-level status shared by Google web service responses.
     *
     * <p>{@code OVER_QUERY_LIMIT} and {@code UNKNOWN_ERROR} are transient; every other
     * non-OK status is permanent.</p>
     */
    static void requireOk(JsonObject body, String service) {
        String status = ServiceJson.requireString(body, "status", service);
        if ("OK".equals(status)) {
            return;
        }
        String detail = ServiceJson.optionalString(body, "error_message");
        throw new ExternalServiceException(
                REASON_SERVICE_STATUS,
                service,
                "service returned status " + status + (detail == null ? "" : ": " + detail),
                TRANSIENT_STATUSES.contains(status)
        );
    }

    private static double valueOf(JsonObject element, String field) {
        JsonObject measure = ServiceJson.requireObject(element.get(field), field, SERVICE_NAME);
        return ServiceJson.requireNumber(measure, "value", SERVICE_NAME);
    }

    private static String locations(List<? extends Located> locations) {
        StringJoiner joiner = new StringJoiner("|");
        for (Located location : locations) {
            joiner.add(ServiceJson.plain(location.getLatitude()) + "," + ServiceJson.plain(location.getLongitude()));
        }
        return joiner.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
