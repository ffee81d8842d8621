package org.Aayush.allocator.distance;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.external.RetryPolicy;

import java.time.Duration;

/**
 * Per-invocation settings for distance computation.
 *
 * <p>Only the external metrics read the service fields; planar and great-circle
 * computation ignores them.</p>
 */
@Value
@Builder(toBuilder = true)
public class DistanceConfig {
    public static final String PUBLIC_OSRM_BASE_URL = "http://router.project-osrm.org";
    public static final String GOOGLE_DISTANCE_MATRIX_URL = "https://maps.googleapis.com/maps/api/distancematrix/json";
    public static final String GOOGLE_DIRECTIONS_URL = "https://maps.googleapis.com/maps/api/directions/json";

    /** Service-imposed maximum sources (and targets) per table request. */
    @Builder.Default
    int maxTableSize = 100;

    /** OSRM base url used by the external-routing metric and trip backend. */
    @Builder.Default
    String routingBaseUrl = PUBLIC_OSRM_BASE_URL;

    /** OSRM profile segment, for example {@code driving}. */
    @Builder.Default
    String routingProfile = "driving";

    /** Distance Matrix endpoint used by the external-mapping metric. */
    @Builder.Default
    String mappingBaseUrl = GOOGLE_DISTANCE_MATRIX_URL;

    /** Directions endpoint used by the google-directions route backend. */
    @Builder.Default
    String directionsBaseUrl = GOOGLE_DIRECTIONS_URL;

    /** Credential for the external-mapping metric and the google-directions backend. */
    String mappingApiKey;

    /** Attach a parallel duration matrix (external metrics only). */
    @Builder.Default
    boolean includeDurations = false;

    /** Timeout applied to every single service call. */
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30L);

    /** Upper bound of concurrently in-flight service calls. */
    @Builder.Default
    int maxConcurrentRequests = 4;

    /** Retry policy for transient service failures. */
    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.defaults();

    /**
     * Default configuration instance.
     */
    public static DistanceConfig defaults() {
        return DistanceConfig.builder().build();
    }
}
