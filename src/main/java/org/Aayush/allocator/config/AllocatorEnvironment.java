package org.Aayush.allocator.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.Aayush.allocator.cluster.GraphPartitionConfig;
import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.external.RetryPolicy;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves runtime overrides for service and partitioner settings.
 *
 * <p>Each key is looked up as an {@code allocator.*} system property first, then as a
 * process environment variable, then in a {@code .env} file in the working directory.
 * Keys that are absent everywhere fall back to the builder defaults.</p>
 */
public final class AllocatorEnvironment {
    public static final String REASON_INVALID_VALUE = "CONFIG_INVALID_VALUE";

    public static final String MAPPING_API_KEY = "ALLOCATOR_MAPPING_API_KEY";
    public static final String MAPPING_BASE_URL = "ALLOCATOR_MAPPING_BASE_URL";
    public static final String DIRECTIONS_BASE_URL = "ALLOCATOR_DIRECTIONS_BASE_URL";
    public static final String ROUTING_BASE_URL = "ALLOCATOR_ROUTING_BASE_URL";
    public static final String ROUTING_PROFILE = "ALLOCATOR_ROUTING_PROFILE";
    public static final String MAX_TABLE_SIZE = "ALLOCATOR_MAX_TABLE_SIZE";
    public static final String REQUEST_TIMEOUT_MS = "ALLOCATOR_REQUEST_TIMEOUT_MS";
    public static final String MAX_CONCURRENT_REQUESTS = "ALLOCATOR_MAX_CONCURRENT_REQUESTS";
    public static final String RETRY_MAX_ATTEMPTS = "ALLOCATOR_RETRY_MAX_ATTEMPTS";
    public static final String RETRY_INITIAL_BACKOFF_MS = "ALLOCATOR_RETRY_INITIAL_BACKOFF_MS";
    public static final String KAFFPA_EXECUTABLE = "ALLOCATOR_KAFFPA_EXECUTABLE";
    public static final String KAFFPA_TIMEOUT_MS = "ALLOCATOR_KAFFPA_TIMEOUT_MS";

    private final Function<String, String> lookup;

    private AllocatorEnvironment(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    /**
     * Loads from system properties, process environment and an optional {@code .env} file.
     */
    public static AllocatorEnvironment load() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        return fromSources(System::getProperty, System.getenv(), dotenv::get);
    }

    /**
     * Builds an environment from explicit sources, highest precedence first.
     */
    public static AllocatorEnvironment fromSources(
            Function<String, String> systemProperties,
            Map<String, String> runtimeEnv,
            Function<String, String> dotenvLookup
    ) {
        Objects.requireNonNull(systemProperties, "systemProperties");
        Objects.requireNonNull(runtimeEnv, "runtimeEnv");
        Objects.requireNonNull(dotenvLookup, "dotenvLookup");
        return new AllocatorEnvironment(key -> {
            String value = normalize(systemProperties.apply(propertyName(key)));
            if (value == null) {
                value = normalize(runtimeEnv.get(key));
            }
            if (value == null) {
                value = normalize(dotenvLookup.apply(key));
            }
            return value;
        });
    }

    /**
     * Raw value of one key, or null when unset everywhere.
     */
    public String get(String key) {
        return lookup.apply(key);
    }

    /**
     * Distance settings with overrides applied on top of defaults.
     */
    public DistanceConfig distanceConfig() {
        DistanceConfig defaults = DistanceConfig.defaults();
        RetryPolicy retryDefaults = defaults.getRetryPolicy();
        RetryPolicy retryPolicy = retryDefaults.toBuilder()
                .maxAttempts(intValue(RETRY_MAX_ATTEMPTS, retryDefaults.getMaxAttempts()))
                .initialBackoff(Duration.ofMillis(
                        longValue(RETRY_INITIAL_BACKOFF_MS, retryDefaults.getInitialBackoff().toMillis())))
                .build();
        return defaults.toBuilder()
                .mappingApiKey(get(MAPPING_API_KEY))
                .mappingBaseUrl(stringValue(MAPPING_BASE_URL, defaults.getMappingBaseUrl()))
                .directionsBaseUrl(stringValue(DIRECTIONS_BASE_URL, defaults.getDirectionsBaseUrl()))
                .routingBaseUrl(stringValue(ROUTING_BASE_URL, defaults.getRoutingBaseUrl()))
                .routingProfile(stringValue(ROUTING_PROFILE, defaults.getRoutingProfile()))
                .maxTableSize(intValue(MAX_TABLE_SIZE, defaults.getMaxTableSize()))
                .requestTimeout(Duration.ofMillis(longValue(REQUEST_TIMEOUT_MS, defaults.getRequestTimeout().toMillis())))
                .maxConcurrentRequests(intValue(MAX_CONCURRENT_REQUESTS, defaults.getMaxConcurrentRequests()))
                .retryPolicy(retryPolicy)
                .build();
    }

    /**
     * Graph-partition settings with overrides applied on top of defaults.
     */
    public GraphPartitionConfig graphPartitionConfig() {
        GraphPartitionConfig defaults = GraphPartitionConfig.defaults();
        return defaults.toBuilder()
                .executable(stringValue(KAFFPA_EXECUTABLE, defaults.getExecutable()))
                .timeout(Duration.ofMillis(longValue(KAFFPA_TIMEOUT_MS, defaults.getTimeout().toMillis())))
                .build();
    }

    /**
     * System property name for an environment key, e.g.
     * {@code ALLOCATOR_MAX_TABLE_SIZE -> allocator.max.table.size}.
     */
    static String propertyName(String key) {
        return key.toLowerCase(Locale.ROOT).replace('_', '.');
    }

    private String stringValue(String key, String fallback) {
        String value = get(key);
        return value == null ? fallback : value;
    }

    private int intValue(String key, int fallback) {
        long value = longValue(key, fallback);
        if (value > Integer.MAX_VALUE) {
            throw new ValidationException(REASON_INVALID_VALUE, key, "value " + value + " is too large");
        }
        return (int) value;
    }

    private long longValue(String key, long fallback) {
        String raw = get(key);
        if (raw == null) {
            return fallback;
        }
        long value;
        try {
            value = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new ValidationException(REASON_INVALID_VALUE, key, "expected an integer but got '" + raw + "'");
        }
        if (value <= 0L) {
            throw new ValidationException(REASON_INVALID_VALUE, key, "value must be positive but was " + value);
        }
        return value;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
