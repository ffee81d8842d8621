package org.Aayush.allocator.error;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base reason-coded failure raised by allocation stages.
 *
 * <p>Messages are prefixed with {@code [REASON_CODE]}. The subject id names the
 * offending input (point id, cluster id, worker id, or stage name) and may be null
 * when a failure is not tied to one input.</p>
 */
@Getter
@Accessors(fluent = true)
public abstract class AllocatorException extends RuntimeException {
    private final ErrorKind kind;
    private final String reasonCode;
    private final String subjectId;

    protected AllocatorException(ErrorKind kind, String reasonCode, String subjectId, String message) {
        super(formatMessage(reasonCode, subjectId, message));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reasonCode = requireReasonCode(reasonCode);
        this.subjectId = subjectId;
    }

    protected AllocatorException(
            ErrorKind kind,
            String reasonCode,
            String subjectId,
            String message,
            Throwable cause
    ) {
        super(formatMessage(reasonCode, subjectId, message), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reasonCode = requireReasonCode(reasonCode);
        this.subjectId = subjectId;
    }

    private static String formatMessage(String reasonCode, String subjectId, String message) {
        String text = "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
        if (subjectId != null) {
            text = text + " (subject=" + subjectId + ")";
        }
        return text;
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
