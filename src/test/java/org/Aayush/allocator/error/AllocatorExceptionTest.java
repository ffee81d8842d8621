package org.Aayush.allocator.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AllocatorException Tests")
class AllocatorExceptionTest {

    @Test
    @DisplayName("Messages carry the reason code prefix and subject suffix")
    void testMessageFormat() {
        ValidationException withSubject = new ValidationException("CLUSTER_INVALID_K", "7", "k must not exceed n");
        ValidationException withoutSubject = new ValidationException("CLI_USAGE", "missing input");

        assertEquals("[CLUSTER_INVALID_K] k must not exceed n (subject=7)", withSubject.getMessage());
        assertEquals("[CLI_USAGE] missing input", withoutSubject.getMessage());
        assertNull(withoutSubject.subjectId());
    }

    @Test
    @DisplayName("Each kind maps to a distinct exit code")
    void testKindsAndExitCodes() {
        assertEquals(ErrorKind.VALIDATION, new ValidationException("X", "m").kind());
        assertEquals(ErrorKind.SOLVER, new SolverException("X", "stage", "m").kind());
        assertEquals(ErrorKind.EXTERNAL_SERVICE, new ExternalServiceException("X", "svc", "m", true).kind());
        assertEquals(ErrorKind.CAPACITY_EXHAUSTED, new CapacityExhaustedException(List.of("p")).kind());

        assertEquals(2, ErrorKind.VALIDATION.exitCode());
        assertEquals(3, ErrorKind.EXTERNAL_SERVICE.exitCode());
        assertEquals(4, ErrorKind.SOLVER.exitCode());
        assertEquals(5, ErrorKind.CAPACITY_EXHAUSTED.exitCode());
    }

    @Test
    @DisplayName("Capacity exhaustion names the first point and lists every unassigned point")
    void testCapacityExhausted() {
        CapacityExhaustedException ex = new CapacityExhaustedException(List.of("p1", "p2"));

        assertEquals("p1", ex.subjectId());
        assertEquals(List.of("p1", "p2"), ex.unassignedPointIds());
        assertEquals(CapacityExhaustedException.REASON_CAPACITY_EXHAUSTED, ex.reasonCode());
        assertThrows(IllegalArgumentException.class, () -> new CapacityExhaustedException(List.of()));
    }

    @Test
    @DisplayName("Cause is preserved and blank reason codes are rejected")
    void testCauseAndReasonCode() {
        RuntimeException cause = new RuntimeException("io");
        SolverException ex = new SolverException("ROUTE_NO_SOLUTION", "exact-route", "no tour", cause);

        assertSame(cause, ex.getCause());
        assertTrue(ex.getMessage().startsWith("[ROUTE_NO_SOLUTION]"));
        assertThrows(IllegalArgumentException.class, () -> new ValidationException(" ", "m"));
        assertThrows(NullPointerException.class, () -> new ValidationException(null, "m"));
    }
}
