package io.surfworks.tracegraph.cli;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.tracegraph.core.TraceGraphException;
import io.surfworks.tracegraph.core.graph.GraphConverter;
import io.surfworks.tracegraph.core.graph.StaticGraph;
import io.surfworks.tracegraph.core.metatype.MetatypeRegistry;
import io.surfworks.tracegraph.core.metatype.OperatorMetatype;
import io.surfworks.tracegraph.core.metatype.PyTorchMetatypes;
import io.surfworks.tracegraph.core.passes.NodeRemovalPass;
import io.surfworks.tracegraph.io.GraphDotWriter;
import io.surfworks.tracegraph.io.GraphJsonWriter;
import io.surfworks.tracegraph.io.TraceDocument;
import io.surfworks.tracegraph.io.TraceJsonReader;

/**
 * TraceGraph CLI - converts captured model traces into static graphs.
 *
 * <p>Commands:
 * <ul>
 *   <li>convert - Convert a trace file, optionally removing pass-through nodes</li>
 *   <li>metatypes - List the registered operator metatypes</li>
 *   <li>config - Show the effective configuration</li>
 * </ul>
 *
 * <p>Exit codes: 0 on success, 1 when the trace cannot be read, converted or rewritten,
 * 2 on usage errors.
 */
public final class TraceGraphMain {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String VERSION = "0.1.0";
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    // Held strongly so the configured level survives garbage collection of unused loggers
    private static final Logger LIBRARY_LOGGER = Logger.getLogger("io.surfworks.tracegraph");
    private static boolean verboseHandlerInstalled;

    private TraceGraphMain() {
    }

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one command.
     *
     * @return the process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || args[0].equals("--help") || args[0].equals("-h")) {
            printHelp(out);
            return EXIT_OK;
        }
        if (args[0].equals("--version") || args[0].equals("-v")) {
            out.println("tracegraph " + VERSION);
            return EXIT_OK;
        }

        String command = args[0];
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        try {
            switch (command) {
                case "convert" -> handleConvert(commandArgs, out);
                case "metatypes" -> handleMetatypes(commandArgs, out);
                case "config" -> handleConfig(commandArgs, out);
                default -> throw new UsageException("Unknown command: " + command);
            }
            return EXIT_OK;
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println("Run 'tracegraph --help' for usage.");
            return EXIT_USAGE;
        } catch (TraceGraphException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    // ==================== Commands ====================

    private static void handleConvert(String[] args, PrintStream out) throws UsageException, IOException {
        ConvertOptions options = ConvertOptions.parse(args);
        if (options.help) {
            printConvertHelp(out);
            return;
        }

        TraceGraphConfig config = loadConfig(options.configFile);
        if (options.format != null) {
            config = withFormat(config, options.format);
        }
        if (options.removeMetatypes != null) {
            config = config.withRemoveMetatypes(options.removeMetatypes);
        }
        if (options.verbose) {
            config = config.withVerbose(true);
        }
        configureLogging(config.verbose());

        MetatypeRegistry registry = PyTorchMetatypes.registry();
        Set<OperatorMetatype> removals = resolveMetatypes(registry, config.removeMetatypes());

        TraceDocument document = new TraceJsonReader().read(options.traceFile);
        StaticGraph graph = new GraphConverter(registry).convert(document.trace(), document.inputs());

        int removed = 0;
        if (!removals.isEmpty()) {
            NodeRemovalPass pass = new NodeRemovalPass(removals);
            pass.apply(graph);
            removed = pass.lastRemovedCount();
        }

        if (options.outputFile != null) {
            writeGraph(graph, config.outputFormat(), options.outputFile);
            out.printf("Wrote %s graph with %d nodes and %d edges to %s (%d nodes removed)%n",
                    config.outputFormat(), graph.nodeCount(), graph.edgeCount(), options.outputFile, removed);
        } else {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            writeGraph(graph, config.outputFormat(), writer);
            writer.flush();
        }
    }

    private static void handleMetatypes(String[] args, PrintStream out) throws UsageException, IOException {
        boolean json = false;
        for (String arg : args) {
            switch (arg) {
                case "--json" -> json = true;
                default -> throw new UsageException("Unknown option for metatypes: " + arg);
            }
        }

        MetatypeRegistry registry = PyTorchMetatypes.registry();
        if (json) {
            ArrayNode array = JSON.createArrayNode();
            for (OperatorMetatype metatype : registry.metatypes()) {
                ObjectNode entry = array.addObject();
                entry.put("id", metatype.id());
                entry.put("name", metatype.name());
                entry.put("subtype", metatype.isSubtype());
                ArrayNode aliases = entry.putArray("operatorNames");
                metatype.aliases().forEach(aliases::add);
            }
            out.println(JSON.writeValueAsString(array));
            return;
        }

        out.printf("%-28s %-20s %s%n", "ID", "NAME", "OPERATOR NAMES");
        for (OperatorMetatype metatype : registry.metatypes()) {
            out.printf("%-28s %-20s %s%n", metatype.id(), metatype.name(), String.join(", ", metatype.aliases()));
        }
    }

    private static void handleConfig(String[] args, PrintStream out) throws UsageException, IOException {
        Path configFile = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> configFile = Path.of(requireValue(args, ++i, "--config"));
                default -> throw new UsageException("Unknown option for config: " + args[i]);
            }
        }
        out.println("Config file: " + (configFile != null ? configFile : TraceGraphConfig.configFile()));
        out.println(TraceGraphConfigLoader.toJsonString(loadConfig(configFile)));
    }

    // ==================== Internal Helpers ====================

    private static TraceGraphConfig loadConfig(Path configFile) {
        return configFile != null ? TraceGraphConfigLoader.load(configFile) : TraceGraphConfigLoader.load();
    }

    private static TraceGraphConfig withFormat(TraceGraphConfig config, String format) throws UsageException {
        try {
            return config.withOutputFormat(format);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static Set<OperatorMetatype> resolveMetatypes(MetatypeRegistry registry, List<String> ids)
            throws UsageException {
        Set<OperatorMetatype> metatypes = new LinkedHashSet<>();
        for (String id : ids) {
            OperatorMetatype metatype = registry.lookupById(id)
                    .orElseThrow(() -> new UsageException("Unknown metatype id: " + id));
            metatypes.add(metatype);
        }
        return metatypes;
    }

    private static void writeGraph(StaticGraph graph, String format, Path file) throws IOException {
        if (TraceGraphConfig.FORMAT_DOT.equals(format)) {
            new GraphDotWriter().write(graph, file);
        } else {
            new GraphJsonWriter().write(graph, file);
        }
    }

    private static void writeGraph(StaticGraph graph, String format, Writer writer) throws IOException {
        if (TraceGraphConfig.FORMAT_DOT.equals(format)) {
            new GraphDotWriter().write(graph, writer);
        } else {
            writer.write(new GraphJsonWriter().toJsonString(graph));
            writer.write('\n');
        }
    }

    static synchronized void configureLogging(boolean verbose) {
        if (!verbose) {
            return;
        }
        LIBRARY_LOGGER.setLevel(Level.FINE);
        if (!verboseHandlerInstalled) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            LIBRARY_LOGGER.addHandler(handler);
            verboseHandlerInstalled = true;
        }
    }

    private static String requireValue(String[] args, int index, String flag) throws UsageException {
        if (index >= args.length) {
            throw new UsageException(flag + " requires a value");
        }
        return args[index];
    }

    /**
     * Parsed arguments of the convert command.
     */
    private static final class ConvertOptions {
        Path traceFile;
        Path outputFile;
        Path configFile;
        String format;
        List<String> removeMetatypes;
        boolean verbose;
        boolean help;

        static ConvertOptions parse(String[] args) throws UsageException {
            ConvertOptions options = new ConvertOptions();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--output", "-o" -> options.outputFile = Path.of(requireValue(args, ++i, arg));
                    case "--format" -> options.format = requireValue(args, ++i, arg);
                    case "--remove" -> options.removeMetatypes = splitList(requireValue(args, ++i, arg));
                    case "--config" -> options.configFile = Path.of(requireValue(args, ++i, arg));
                    case "--verbose" -> options.verbose = true;
                    case "--help", "-h" -> options.help = true;
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new UsageException("Unknown option for convert: " + arg);
                        }
                        if (options.traceFile != null) {
                            throw new UsageException("Only one trace file may be given");
                        }
                        options.traceFile = Path.of(arg);
                    }
                }
            }
            if (options.traceFile == null && !options.help) {
                throw new UsageException("convert requires a trace file");
            }
            return options;
        }

        private static List<String> splitList(String value) {
            List<String> items = new ArrayList<>();
            for (String item : value.split(",")) {
                if (!item.isBlank()) {
                    items.add(item.trim());
                }
            }
            return items;
        }
    }

    /**
     * Invalid command line.
     */
    private static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    // ===== Help output =====

    private static void printHelp(PrintStream out) {
        out.println("TraceGraph - converts captured model traces into static graphs");
        out.println();
        out.println("Usage: tracegraph <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  convert       Convert a trace file into a graph");
        out.println("  metatypes     List the registered operator metatypes");
        out.println("  config        Show the effective configuration");
        out.println();
        out.println("Options:");
        out.println("  -h, --help    Show help");
        out.println("  -v, --version Show version");
        out.println();
        out.println("Examples:");
        out.println("  tracegraph convert trace.json --output graph.json");
        out.println("  tracegraph convert trace.json --format dot --remove dropout -o graph.dot");
        out.println("  tracegraph metatypes --json");
    }

    private static void printConvertHelp(PrintStream out) {
        out.println("Usage: tracegraph convert <trace.json> [options]");
        out.println();
        out.println("Convert a trace file into a static graph.");
        out.println();
        out.println("Options:");
        out.println("  -o, --output <path>   Write the graph to a file (default: stdout)");
        out.println("  --format <fmt>        Output format: json or dot (default: json)");
        out.println("  --remove <ids>        Comma-separated metatype ids whose nodes are removed");
        out.println("  --config <path>       Config file (default: ~/.config/tracegraph/tracegraph.json)");
        out.println("  --verbose             Log conversion details");
    }
}
