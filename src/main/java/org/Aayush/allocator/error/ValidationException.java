package org.Aayush.allocator.error;

/**
 * Input or configuration contract violation detected before any computation starts.
 *
 * <p>Never retried.</p>
 */
public final class ValidationException extends AllocatorException {

    public ValidationException(String reasonCode, String message) {
        super(ErrorKind.VALIDATION, reasonCode, null, message);
    }

    public ValidationException(String reasonCode, String subjectId, String message) {
        super(ErrorKind.VALIDATION, reasonCode, subjectId, message);
    }
}
