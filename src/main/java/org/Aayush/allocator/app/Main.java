package org.Aayush.allocator.app;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.cluster.ClusteringMethod;
import org.Aayush.allocator.config.AllocatorEnvironment;
import org.Aayush.allocator.core.AllocationEngine;
import org.Aayush.allocator.core.AssignmentRequest;
import org.Aayush.allocator.core.ClusterRequest;
import org.Aayush.allocator.core.RouteRequest;
import org.Aayush.allocator.distance.DistanceConfig;
import org.Aayush.allocator.distance.DistanceMetric;
import org.Aayush.allocator.error.AllocatorException;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.io.OutputFormat;
import org.Aayush.allocator.io.PointCsvReader;
import org.Aayush.allocator.io.ResultTable;
import org.Aayush.allocator.io.ResultWriter;
import org.Aayush.allocator.model.Point;
import org.Aayush.allocator.model.Worker;
import org.Aayush.allocator.route.RouteBackend;
import org.Aayush.allocator.route.RouteOptions;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * <pre>
 * allocator &lt;cluster|route|assign&gt; &lt;input.csv&gt; [options]
 * </pre>
 *
 * <p>Exit status is 0 on success, the {@link org.Aayush.allocator.error.ErrorKind} exit
 * code for engine failures, and 1 for anything unexpected.</p>
 */
@Slf4j
public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_UNEXPECTED = 1;
    static final int EXIT_USAGE = 2;

    static final String REASON_USAGE = "CLI_USAGE";
    static final String REASON_INPUT_NOT_FOUND = "IO_INPUT_NOT_FOUND";

    static final String USAGE = String.join(System.lineSeparator(),
            "usage: allocator <cluster|route|assign> <input.csv> [options]",
            "  --metric <planar|great-circle|external-routing|external-mapping>",
            "  --output <file>            write results to a file instead of stdout",
            "  --format <csv|json>        result format (default csv)",
            "  -k <n>                     cluster count (cluster)",
            "  --seed <n>                 random seed (cluster, default 0)",
            "  --method <kmeans|graph-partition>",
            "  --backend <exact|approximation|external-service|nearest-neighbor|google-directions>",
            "                             route backend; on cluster, routes every cluster",
            "  --start <point id>         fixed first point (route)",
            "  --time-limit-ms <n>        exact backend search budget",
            "  --open                     do not return to the start point",
            "  --workers <workers.csv>    worker locations (assign)");

    private static final Set<String> FLAGS = Set.of("--open");
    private static final Set<String> VALUED = Set.of(
            "--metric", "--output", "--format", "-k", "--seed", "--method",
            "--backend", "--start", "--time-limit-ms", "--workers");

    private Main() {
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err, AllocatorEnvironment.load(), AllocationEngine.createDefault());
        System.exit(status);
    }

    /**
     * Runs one command and returns its exit status; never calls {@link System#exit}.
     */
    static int run(
            String[] args,
            PrintStream out,
            PrintStream err,
            AllocatorEnvironment environment,
            AllocationEngine engine
    ) {
        try {
            Arguments arguments = Arguments.parse(args);
            ResultTable table = execute(arguments, environment, engine);
            ResultWriter writer = new ResultWriter(arguments.format());
            String output = arguments.option("--output");
            if (output == null) {
                Writer stdout = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                writer.write(table, stdout);
            } else {
                writer.write(table, Path.of(output));
            }
            return EXIT_OK;
        } catch (AllocatorException ex) {
            err.println(ex.getMessage());
            if (REASON_USAGE.equals(ex.reasonCode())) {
                err.println(USAGE);
            }
            return ex.kind().exitCode();
        } catch (NoSuchFileException ex) {
            err.println("[" + REASON_INPUT_NOT_FOUND + "] file not found: " + ex.getFile());
            return EXIT_USAGE;
        } catch (IOException | RuntimeException ex) {
            log.error("allocator failed unexpectedly", ex);
            err.println("unexpected failure: " + ex);
            return EXIT_UNEXPECTED;
        }
    }

    private static ResultTable execute(
            Arguments arguments,
            AllocatorEnvironment environment,
            AllocationEngine engine
    ) throws IOException {
        PointCsvReader reader = new PointCsvReader();
        List<Point> points = reader.readPoints(Path.of(arguments.input()));
        DistanceMetric metric = arguments.metric();
        DistanceConfig distanceConfig = environment.distanceConfig();

        switch (arguments.command()) {
            case "cluster" -> {
                ClusterRequest request = ClusterRequest.builder()
                        .points(points)
                        .k(arguments.requiredInt("-k"))
                        .seed(arguments.longOption("--seed", 0L))
                        .metric(metric)
                        .method(arguments.option("--method") == null
                                ? ClusteringMethod.KMEANS
                                : ClusteringMethod.fromId(arguments.option("--method")))
                        .distanceConfig(distanceConfig)
                        .graphPartitionConfig(environment.graphPartitionConfig())
                        .build();
                if (arguments.option("--start") != null) {
                    throw usage("--start applies to the route command only");
                }
                if (arguments.option("--backend") == null) {
                    return ResultTable.ofClusters(points, engine.cluster(request));
                }
                return ResultTable.ofClusterRoutes(points, engine.clusterAndRoute(request, arguments.routeOptions()));
            }
            case "route" -> {
                RouteRequest request = RouteRequest.builder()
                        .points(points)
                        .startPointId(arguments.option("--start"))
                        .metric(metric)
                        .options(arguments.routeOptions())
                        .distanceConfig(distanceConfig)
                        .build();
                return ResultTable.ofRoute(points, engine.route(request));
            }
            case "assign" -> {
                String workersFile = arguments.option("--workers");
                if (workersFile == null) {
                    throw usage("assign requires --workers <workers.csv>");
                }
                List<Worker> workers = reader.readWorkers(Path.of(workersFile));
                AssignmentRequest request = AssignmentRequest.builder()
                        .points(points)
                        .workers(workers)
                        .metric(metric)
                        .distanceConfig(distanceConfig)
                        .build();
                return ResultTable.ofAssignments(points, engine.assign(request));
            }
            default -> throw usage("unknown command '" + arguments.command() + "'");
        }
    }

    private static ValidationException usage(String message) {
        return new ValidationException(REASON_USAGE, message);
    }

    /**
     * Parsed command line: command, input path, and options keyed by flag.
     */
    private static final class Arguments {
        private final String command;
        private final String input;
        private final Map<String, String> options;

        private Arguments(String command, String input, Map<String, String> options) {
            this.command = command;
            this.input = input;
            this.options = options;
        }

        static Arguments parse(String[] args) {
            if (args == null || args.length < 2) {
                throw usage("expected a command and an input file");
            }
            Map<String, String> options = new HashMap<>();
            for (int i = 2; i < args.length; i++) {
                String flag = args[i];
                if (FLAGS.contains(flag)) {
                    options.put(flag, "true");
                } else if (VALUED.contains(flag)) {
                    if (i + 1 >= args.length) {
                        throw usage(flag + " requires a value");
                    }
                    options.put(flag, args[++i]);
                } else {
                    throw usage("unknown option '" + flag + "'");
                }
            }
            return new Arguments(args[0], args[1], options);
        }

        String command() {
            return command;
        }

        String input() {
            return input;
        }

        String option(String flag) {
            return options.get(flag);
        }

        DistanceMetric metric() {
            String value = option("--metric");
            return value == null ? DistanceMetric.PLANAR : DistanceMetric.fromId(value);
        }

        OutputFormat format() {
            String value = option("--format");
            return value == null ? OutputFormat.CSV : OutputFormat.fromId(value);
        }

        RouteOptions routeOptions() {
            RouteOptions.RouteOptionsBuilder builder = RouteOptions.builder()
                    .closed(option("--open") == null);
            String backend = option("--backend");
            if (backend != null) {
                builder.backend(RouteBackend.fromId(backend));
            }
            if (option("--time-limit-ms") != null) {
                builder.timeLimit(Duration.ofMillis(longOption("--time-limit-ms", 0L)));
            }
            return builder.build();
        }

        int requiredInt(String flag) {
            String value = option(flag);
            if (value == null) {
                throw usage("missing required option " + flag);
            }
            long parsed = longOption(flag, 0L);
            if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
                throw usage(flag + " is out of range: " + value);
            }
            return (int) parsed;
        }

        long longOption(String flag, long fallback) {
            String value = option(flag);
            if (value == null) {
                return fallback;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException ex) {
                throw usage(flag + " expects an integer but got '" + value + "'");
            }
        }
    }
}
