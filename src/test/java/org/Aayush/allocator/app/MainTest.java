package org.Aayush.allocator.app;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.Aayush.allocator.config.AllocatorEnvironment;
import org.Aayush.allocator.core.AllocationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Main Tests")
class MainTest {
    private static final AllocatorEnvironment EMPTY_ENV = AllocatorEnvironment.fromSources(key -> null, Map.of(), key -> null);

    @TempDir
    Path dir;

    private Path points;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() throws IOException {
        points = dir.resolve("points.csv");
        Files.writeString(points, "id,longitude,latitude,name\n"
                + "a,0,0,alpha\n"
                + "b,0,1,beta\n"
                + "c,1,0,gamma\n"
                + "d,50,50,delta\n"
                + "e,50,51,epsilon\n"
                + "f,51,50,zeta\n", StandardCharsets.UTF_8);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    @DisplayName("Cluster command prints a labelled CSV")
    void testClusterCommand() {
        int status = run("cluster", points.toString(), "-k", "2", "--seed", "4");

        assertEquals(Main.EXIT_OK, status);
        String csv = stdout();
        assertTrue(csv.startsWith("# operation=cluster"));
        assertTrue(csv.contains("id,longitude,latitude,name,cluster\n"));
        assertTrue(csv.contains("# cluster_sizes=[3, 3]\n"));
    }

    @Test
    @DisplayName("Cluster command with a backend routes each cluster")
    void testClusterAndRouteCommand() {
        int status = run("cluster", points.toString(), "-k", "2", "--backend", "nearest-neighbor", "--open");

        assertEquals(Main.EXIT_OK, status);
        assertTrue(stdout().contains("id,longitude,latitude,name,cluster,route_order\n"));
        assertTrue(stdout().contains("# operation=cluster-and-route\n"));
    }

    @Test
    @DisplayName("Route command writes JSON to the output file")
    void testRouteToJsonFile() throws IOException {
        Path output = dir.resolve("route.json");

        int status = run("route", points.toString(), "--start", "d", "--backend", "greedy",
                "--format", "json", "--output", output.toString());

        assertEquals(Main.EXIT_OK, status);
        assertEquals("", stdout());
        JsonObject root = JsonParser.parseString(Files.readString(output, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals("route", root.getAsJsonObject("metadata").get("operation").getAsString());
        JsonObject fourth = root.getAsJsonArray("records").get(3).getAsJsonObject();
        assertEquals("d", fourth.get("id").getAsString());
        assertEquals(0, fourth.get("route_order").getAsInt());
    }

    @Test
    @DisplayName("Assignment running out of capacity exits with the capacity status")
    void testAssignCapacityExhausted() throws IOException {
        Path workers = dir.resolve("workers.csv");
        Files.writeString(workers, "id,lon,lat,capacity\nw1,0,0,2\nw2,50,50,2\n", StandardCharsets.UTF_8);

        int status = run("assign", points.toString(), "--workers", workers.toString());

        assertEquals(5, status);
        assertTrue(stderr().contains("[ASSIGN_CAPACITY_EXHAUSTED]"));
        assertTrue(stderr().contains("points [e, f]"));
    }

    @Test
    @DisplayName("Assignment with enough capacity prints worker columns")
    void testAssignCommand() throws IOException {
        Path workers = dir.resolve("workers.csv");
        Files.writeString(workers, "id,lon,lat\nw1,0,0\nw2,50,50\n", StandardCharsets.UTF_8);

        int status = run("assign", points.toString(), "--workers", workers.toString());

        assertEquals(Main.EXIT_OK, status);
        assertTrue(stdout().contains("id,longitude,latitude,name,assigned_worker,distance,rank\n"));
        assertTrue(stdout().contains("d,50.0,50.0,delta,w2,0.0,1\n"));
    }

    @Test
    @DisplayName("Usage errors print usage and exit with status 2")
    void testUsageErrors() {
        assertEquals(Main.EXIT_USAGE, run());
        assertTrue(stderr().contains("usage: allocator"));

        assertEquals(Main.EXIT_USAGE, run("cluster", points.toString(), "-k", "2", "--colour", "red"));
        assertEquals(Main.EXIT_USAGE, run("cluster", points.toString()));
        assertEquals(Main.EXIT_USAGE, run("cluster", points.toString(), "-k", "two"));
        assertEquals(Main.EXIT_USAGE, run("cluster", points.toString(), "-k", "2", "--start", "a"));
        assertEquals(Main.EXIT_USAGE, run("assign", points.toString()));
        assertEquals(Main.EXIT_USAGE, run("explode", points.toString()));
    }

    @Test
    @DisplayName("Engine validation failures and missing files exit with status 2")
    void testValidationFailures() {
        assertEquals(2, run("cluster", points.toString(), "-k", "0"));
        assertTrue(stderr().contains("(subject=0)"));

        assertEquals(2, run("route", dir.resolve("missing.csv").toString()));
        assertTrue(stderr().contains("[" + Main.REASON_INPUT_NOT_FOUND + "]"));

        assertEquals(2, run("route", points.toString(), "--metric", "manhattan"));
    }

    private int run(String... args) {
        return Main.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                EMPTY_ENV,
                AllocationEngine.createDefault()
        );
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
