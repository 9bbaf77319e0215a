package flowsim.cmd;

import flowsim.config.JsonModelCodec;
import flowsim.simulation.SimulationConfig;
import flowsim.simulation.SimulationEngine;
import flowsim.simulation.SimulationEvent;
import flowsim.simulation.SimulationListener;
import flowsim.simulation.SimulationStatus;
import flowsim.stats.CounterSnapshot;
import flowsim.topology.NodeId;
import flowsim.topology.Topology;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Command-line runner: loads a JSON flow model, runs it to completion and prints counter statistics.
 */
public class SimulationApplication {

    private final Options options;
    private final PrintStream out;
    private final JsonModelCodec codec = new JsonModelCodec();

    public SimulationApplication(Options options, PrintStream out) {
        this.options = options;
        this.out = out;
    }

    /**
     * Parsed command-line options.
     */
    public static final class Options {
        Path model;
        long seed = SimulationConfig.defaults().seed();
        double speed = 1.0;
        boolean paced = true;
        boolean quiet = false;
        String report = "text";
        boolean help = false;

        public Path model() {
            return model;
        }

        public long seed() {
            return seed;
        }

        public double speed() {
            return speed;
        }

        public boolean paced() {
            return paced;
        }

        public boolean quiet() {
            return quiet;
        }

        public String report() {
            return report;
        }

        public boolean help() {
            return help;
        }

        SimulationConfig toConfig() {
            return SimulationConfig.builder()
                    .seed(seed)
                    .speedMultiplier(speed)
                    .pacingEnabled(paced)
                    .build();
        }
    }

    /**
     * Parses command-line arguments.
     *
     * @throws IllegalArgumentException on unknown options or missing values
     */
    public static Options parseArguments(String[] args) {
        Options options = new Options();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--model":
                    options.model = Path.of(requireValue(args, ++i, "--model"));
                    break;
                case "--seed":
                    options.seed = Long.parseLong(requireValue(args, ++i, "--seed"));
                    break;
                case "--speed":
                    options.speed = Double.parseDouble(requireValue(args, ++i, "--speed"));
                    break;
                case "--unpaced":
                    options.paced = false;
                    break;
                case "--quiet":
                    options.quiet = true;
                    break;
                case "--report":
                    String report = requireValue(args, ++i, "--report");
                    if (!report.equals("text") && !report.equals("json")) {
                        throw new IllegalArgumentException("Unknown report format: " + report);
                    }
                    options.report = report;
                    break;
                case "--help":
                    options.help = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        if (!options.help && options.model == null) {
            throw new IllegalArgumentException("--model is required");
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index];
    }

    /**
     * Runs the model to completion (or until the process is asked to stop).
     *
     * @return the final status of the run
     */
    public SimulationStatus run() throws IOException {
        Topology topology = codec.read(options.model());
        SimulationEngine engine = new SimulationEngine(options.toConfig());
        engine.initialize(topology);

        if (!options.quiet()) {
            engine.addListener(new ConsoleListener(out));
        }

        // Add shutdown hook for graceful termination
        Thread shutdownHook = new Thread(() -> {
            out.println("\nShutdown signal received, stopping simulation...");
            engine.stop();
        });
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        out.println("Running " + options.model() + " (" + topology.size() + " nodes, seed=" + options.seed() + ")");
        SimulationStatus status = engine.start();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // shutdown already in progress, the hook has run
        }

        printReport(engine);
        return status;
    }

    private void printReport(SimulationEngine engine) {
        Map<NodeId, CounterSnapshot> counters = engine.allCounterStatistics();
        if (options.report().equals("json")) {
            out.println(new String(codec.encodeReport(engine.clockTime(), counters), StandardCharsets.UTF_8));
            return;
        }
        out.println();
        out.println("=== FINAL SIMULATION STATISTICS ===");
        out.printf("Simulation time: %.3f (%s)%n", engine.clockTime(), engine.status());
        for (CounterSnapshot counter : counters.values()) {
            out.printf("%s: %d total %s | inter-arrival avg=%.3f min=%.3f max=%.3f sd=%.3f | throughput=%.4f%n",
                    counter.nodeId(), counter.totalCount(), counter.countByType(),
                    counter.averageInterArrival(), counter.minInterArrival(), counter.maxInterArrival(),
                    counter.stdDevInterArrival(), counter.throughput());
        }
    }

    /**
     * Prints every simulation event as a log line.
     */
    static final class ConsoleListener implements SimulationListener {
        private final PrintStream out;

        ConsoleListener(PrintStream out) {
            this.out = out;
        }

        @Override
        public void onSimulationEvent(SimulationEvent event) {
            out.printf("[%10.3f] %-15s %-8s %s%n", event.simulationTime(), event.eventType(), event.nodeId(),
                    event.message());
        }

        @Override
        public void onStopped(SimulationStatus finalStatus) {
            out.println("Simulation " + finalStatus.name().toLowerCase());
        }
    }

    /**
     * Main method for running a model from the command line.
     */
    public static void main(String[] args) {
        Options options;
        try {
            options = parseArguments(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }
        if (options.help()) {
            printUsage();
            return;
        }

        try {
            new SimulationApplication(options, System.out).run();
        } catch (IOException e) {
            System.err.println("Failed to read model " + options.model() + ": " + e.getMessage());
            System.exit(1);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid model or options: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.out.println("Flow Simulation Runner");
        System.out.println("Usage: SimulationApplication --model <file.json> [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --model <file>        JSON flow model to simulate (required)");
        System.out.println("  --seed <number>       Random seed for deterministic runs (default: 42)");
        System.out.println("  --speed <multiplier>  Playback speed, simulated units per second (default: 1)");
        System.out.println("  --unpaced             Run as fast as possible, ignoring --speed");
        System.out.println("  --report <text|json>  Format of the final statistics (default: text)");
        System.out.println("  --quiet               Do not print individual events");
        System.out.println("  --help                Show this help message");
    }
}
