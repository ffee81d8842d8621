package org.Aayush.allocator.error;

/**
 * Top-level failure taxonomy surfaced by every allocation stage.
 *
 * <p>Each kind maps to a distinct process exit code on the command surface.</p>
 */
public enum ErrorKind {
    VALIDATION(2),
    EXTERNAL_SERVICE(3),
    SOLVER(4),
    CAPACITY_EXHAUSTED(5);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * @return non-zero process exit code for this failure kind.
     */
    public int exitCode() {
        return exitCode;
    }
}
