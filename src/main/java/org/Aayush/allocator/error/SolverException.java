package org.Aayush.allocator.error;

/**
 * A route or partition backend failed to produce a usable result.
 *
 * <p>The subject id names the failing stage; messages carry the input size.</p>
 */
public final class SolverException extends AllocatorException {

    public SolverException(String reasonCode, String stage, String message) {
        super(ErrorKind.SOLVER, reasonCode, stage, message);
    }

    public SolverException(String reasonCode, String stage, String message, Throwable cause) {
        super(ErrorKind.SOLVER, reasonCode, stage, message, cause);
    }
}
