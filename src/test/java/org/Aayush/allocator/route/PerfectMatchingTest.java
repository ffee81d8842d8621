package org.Aayush.allocator.route;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PerfectMatching and EulerianCircuit Tests")
class PerfectMatchingTest {

    @Test
    @DisplayName("Exact matching pairs neighbors on a line")
    void testExactMatching() {
        int[] positions = {0, 1, 10, 11};
        PerfectMatching.Result result = PerfectMatching.match(
                new int[]{0, 1, 2, 3},
                (a, b) -> Math.abs(positions[a] - positions[b])
        );

        assertTrue(result.exact());
        assertEquals(2, result.pairs().length);
        double total = 0.0d;
        for (int[] pair : result.pairs()) {
            total += Math.abs(positions[pair[0]] - positions[pair[1]]);
        }
        assertEquals(2.0d, total, 0.0d);
    }

    @Test
    @DisplayName("Large vertex sets fall back to greedy matching")
    void testGreedyFallback() {
        int[] vertices = new int[PerfectMatching.EXACT_LIMIT + 2];
        for (int i = 0; i < vertices.length; i++) {
            vertices[i] = i;
        }

        PerfectMatching.Result result = PerfectMatching.match(vertices, (a, b) -> Math.abs(a - b));

        assertFalse(result.exact());
        assertEquals(vertices.length / 2, result.pairs().length);
        assertArrayEquals(new int[]{0, 1}, result.pairs()[0]);
        assertThrows(IllegalArgumentException.class, () -> PerfectMatching.match(new int[]{1, 2, 3}, (a, b) -> 1.0d));
    }

    @Test
    @DisplayName("Circuit takes the smallest neighbor first and shortcut keeps first visits")
    void testCircuitAndShortcut() {
        EulerianCircuit graph = new EulerianCircuit(4);
        graph.addEdge(0, 1);
        graph.addEdge(1, 2);
        graph.addEdge(0, 3);
        graph.addEdge(2, 3);

        int[] walk = graph.circuit(0);

        assertArrayEquals(new int[]{0, 1, 2, 3, 0}, walk);
        assertArrayEquals(new int[]{0, 1, 2, 3}, EulerianCircuit.shortcut(walk, 4));

        EulerianCircuit odd = new EulerianCircuit(2);
        odd.addEdge(0, 1);
        assertThrows(IllegalStateException.class, () -> odd.circuit(0));
    }
}
