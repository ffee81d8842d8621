package org.Aayush.allocator.cluster;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.error.SolverException;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs the KaHIP {@code kaffpa} executable as a child process.
 *
 * <p>Each run gets its own scratch directory holding the METIS graph, the partition
 * output and the process log. The process is destroyed on timeout or interruption, and
 * the directory is removed afterwards.</p>
 */
@Slf4j
public final class KaffpaProcessPartitioner implements GraphPartitioner {
    public static final String REASON_PARTITION_FAILED = "CLUSTER_PARTITION_FAILED";
    public static final String REASON_PARTITION_TIMEOUT = "CLUSTER_PARTITION_TIMEOUT";

    private static final String STAGE = "graph-partition";
    private static final int MAX_LOG_EXCERPT = 512;

    @Override
    public String name() {
        return "kaffpa";
    }

    @Override
    public int[] partition(ProximityGraph graph, int k, long seed, GraphPartitionConfig config) {
        Path workDir = createWorkDirectory(config);
        try {
            return runIn(workDir, graph, k, seed, config);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private int[] runIn(Path workDir, ProximityGraph graph, int k, long seed, GraphPartitionConfig config) {
        Path graphFile = workDir.resolve("graph.metis");
        Path outputFile = workDir.resolve("partition.txt");
        Path logFile = workDir.resolve("kaffpa.log");
        try (Writer writer = Files.newBufferedWriter(graphFile, StandardCharsets.US_ASCII)) {
            graph.writeMetis(writer);
        } catch (IOException ex) {
            throw failure("could not write METIS graph for n=" + graph.vertexCount(), ex);
        }

        List<String> command = command(graphFile, outputFile, k, seed, config);
        log.info("running {} for n={}, m={}, k={}", config.getExecutable(), graph.vertexCount(), graph.edgeCount(), k);
        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile());

        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw failure("could not start " + config.getExecutable() + ": " + ex.getMessage(), ex);
        }

        try {
            long timeoutMillis = config.getTimeout().toMillis();
            if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new SolverException(
                        REASON_PARTITION_TIMEOUT,
                        STAGE,
                        config.getExecutable() + " exceeded " + timeoutMillis + " ms for n=" + graph.vertexCount()
                );
            }
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw failure("interrupted while waiting for " + config.getExecutable(), ex);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new SolverException(
                    REASON_PARTITION_FAILED,
                    STAGE,
                    config.getExecutable() + " exited with " + exitCode + " for n=" + graph.vertexCount()
                            + ": " + logExcerpt(logFile)
            );
        }
        return readLabels(outputFile, graph.vertexCount());
    }

    static List<String> command(Path graphFile, Path outputFile, int k, long seed, GraphPartitionConfig config) {
        List<String> command = new ArrayList<>();
        command.add(config.getExecutable());
        command.add(graphFile.toString());
        command.add("--k=" + k);
        // kaffpa parses the seed as a C int.
        command.add("--seed=" + Math.floorMod(seed, (long) Integer.MAX_VALUE));
        command.add("--preconfiguration=" + config.getPreconfiguration());
        command.add("--imbalance=" + BigDecimal.valueOf(config.getImbalance()).movePointRight(2).stripTrailingZeros().toPlainString());
        command.add("--output_filename=" + outputFile);
        if (config.isBalanceEdges()) {
            command.add("--balance_edges");
        }
        return command;
    }

    private static int[] readLabels(Path outputFile, int n) {
        List<String> lines;
        try {
            lines = Files.readAllLines(outputFile, StandardCharsets.US_ASCII);
        } catch (IOException ex) {
            throw failure("partition output missing for n=" + n, ex);
        }
        List<String> values = new ArrayList<>(lines.size());
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        if (values.size() != n) {
            throw new SolverException(
                    REASON_PARTITION_FAILED,
                    STAGE,
                    "partition output has " + values.size() + " labels for n=" + n
            );
        }
        int[] labels = new int[n];
        for (int i = 0; i < n; i++) {
            try {
                labels[i] = Integer.parseInt(values.get(i));
            } catch (NumberFormatException ex) {
                throw failure("partition output line " + (i + 1) + " is not an integer: " + values.get(i), ex);
            }
        }
        return labels;
    }

    private static Path createWorkDirectory(GraphPartitionConfig config) {
        try {
            if (config.getWorkDirectory() != null) {
                Files.createDirectories(config.getWorkDirectory());
                return Files.createTempDirectory(config.getWorkDirectory(), "kaffpa-");
            }
            return Files.createTempDirectory("kaffpa-");
        } catch (IOException ex) {
            throw failure("could not create partitioner scratch directory", ex);
        }
    }

    private static String logExcerpt(Path logFile) {
        try {
            String text = Files.readString(logFile, StandardCharsets.UTF_8).trim();
            return text.length() <= MAX_LOG_EXCERPT ? text : text.substring(text.length() - MAX_LOG_EXCERPT);
        } catch (IOException ex) {
            return "<log unavailable: " + ex.getMessage() + ">";
        }
    }

    private static void deleteQuietly(Path workDir) {
        try (Stream<Path> paths = Files.walk(workDir)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        } catch (IOException ex) {
            log.warn("could not remove partitioner scratch directory {}: {}", workDir, ex.getMessage());
        }
    }

    private static SolverException failure(String message, Throwable cause) {
        return new SolverException(REASON_PARTITION_FAILED, STAGE, message, cause);
    }
}
