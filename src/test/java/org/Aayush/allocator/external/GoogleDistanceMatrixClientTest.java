package org.Aayush.allocator.external;

import org.Aayush.allocator.error.ExternalServiceException;
import org.Aayush.allocator.model.Point;
import org.Aayush.allocator.testutil.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GoogleDistanceMatrixClient Tests")
class GoogleDistanceMatrixClientTest {
    private StubHttpServer server;
    private GoogleDistanceMatrixClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = StubHttpServer.start();
        client = new GoogleDistanceMatrixClient(
                new HttpJsonTransport(Duration.ofSeconds(5L)),
                server.baseUrl() + "/maps/api/distancematrix/json",
                "test-key"
        );
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Limits follow the service quota")
    void testLimits() {
        assertEquals(25, client.maxSourcesPerRequest());
        assertEquals(25, client.maxTargetsPerRequest());
        assertEquals(100, client.maxElementsPerRequest());
        assertEquals(1, client.maxConcurrentRequests());
    }

    @Test
    @DisplayName("Element values are read and non-OK elements become NaN")
    void testElements() {
        server.reply(200, "{\"status\":\"OK\",\"rows\":[{\"elements\":["
                + "{\"status\":\"OK\",\"distance\":{\"value\":1500},\"duration\":{\"value\":120}},"
                + "{\"status\":\"ZERO_RESULTS\"}]}]}");

        TableBlock block = client.fetch(
                List.of(Point.of("a", 77.59d, 12.97d)),
                List.of(Point.of("b", 77.61d, 12.93d), Point.of("island", 72.0d, 10.0d)),
                true
        );

        assertEquals(1500.0d, block.distances()[0], 0.0d);
        assertEquals(120.0d, block.durations()[0], 0.0d);
        assertTrue(Double.isNaN(block.distances()[1]));

        String query = server.requests().get(0).getRawQuery();
        assertTrue(query.contains("origins=12.97%2C77.59"));
        assertTrue(query.contains("destinations=12.93%2C77.61%7C10%2C72"));
        assertTrue(query.contains("key=test-key"));
    }

    @Test
    @DisplayName("Over-query-limit status is transient and request-denied is permanent")
    void testStatusClassification() {
        server.reply(200, "{\"status\":\"OVER_QUERY_LIMIT\",\"rows\":[]}");
        ExternalServiceException limited = assertThrows(
                ExternalServiceException.class,
                () -> client.fetch(List.of(Point.of("a", 1.0d, 1.0d)), List.of(Point.of("b", 2.0d, 2.0d)), false)
        );
        assertTrue(limited.transientFailure());
        assertEquals(GoogleDistanceMatrixClient.REASON_SERVICE_STATUS, limited.reasonCode());

        server.reply(200, "{\"status\":\"REQUEST_DENIED\",\"error_message\":\"invalid key\"}");
        ExternalServiceException denied = assertThrows(
                ExternalServiceException.class,
                () -> client.fetch(List.of(Point.of("a", 1.0d, 1.0d)), List.of(Point.of("b", 2.0d, 2.0d)), false)
        );
        assertFalse(denied.transientFailure());
        assertTrue(denied.getMessage().contains("invalid key"));
    }
}
