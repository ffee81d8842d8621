package org.Aayush.allocator.external;

import org.Aayush.allocator.model.Located;

import java.util.List;

/**
 * Remote many-to-many distance table contract.
 *
 * <p>Implementations issue exactly one request per call and must respect their own
 * per-request limits, which the caller uses to chunk larger inputs.</p>
 */
public interface TableServiceClient {
    /**
     * Stable service name used in logs and error subjects.
     */
    String serviceName();

    /**
     * Maximum number of sources per request.
     */
    int maxSourcesPerRequest();

    /**
     * Maximum number of targets per request.
     */
    int maxTargetsPerRequest();

    /**
     * Maximum number of source/target cells per request.
     */
    default int maxElementsPerRequest() {
        return Integer.MAX_VALUE;
    }

    /**
     * Upper bound on concurrent requests the service tolerates; the configured
     * concurrency never exceeds it.
     */
    default int maxConcurrentRequests() {
        return Integer.MAX_VALUE;
    }

    /**
     * Fetches one table chunk.
     *
     * @throws org.Aayush.allocator.error.ExternalServiceException on classified failure.
     */
    TableBlock fetch(List<? extends Located> sources, List<? extends Located> targets, boolean includeDurations);
}
