package org.Aayush.allocator.error;

/**
 * Failure of a remote routing/mapping service call.
 *
 * <p>Transient failures (timeouts, rate limits, server errors) are retried with backoff
 * by the external call executor. Permanent failures (auth, quota, malformed payloads)
 * surface immediately.</p>
 */
public final class ExternalServiceException extends AllocatorException {
    private final boolean transientFailure;

    public ExternalServiceException(String reasonCode, String service, String message, boolean transientFailure) {
        super(ErrorKind.EXTERNAL_SERVICE, reasonCode, service, message);
        this.transientFailure = transientFailure;
    }

    public ExternalServiceException(
            String reasonCode,
            String service,
            String message,
            boolean transientFailure,
            Throwable cause
    ) {
        super(ErrorKind.EXTERNAL_SERVICE, reasonCode, service, message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * @return true when retrying the same call may succeed.
     */
    public boolean transientFailure() {
        return transientFailure;
    }
}
