package io.surfworks.tracegraph.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for the tracegraph command line.
 *
 * <p>Configuration is resolved in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/tracegraph/tracegraph.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param outputFormat    graph output format, {@code json} or {@code dot}
 * @param removeMetatypes ids of metatypes whose nodes are removed after conversion
 * @param verbose         whether library logging is enabled at {@code FINE}
 */
public record TraceGraphConfig(
        String outputFormat,
        List<String> removeMetatypes,
        boolean verbose
) {

    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_DOT = "dot";

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "tracegraph"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "tracegraph.json";

    public TraceGraphConfig {
        Objects.requireNonNull(outputFormat, "outputFormat cannot be null");
        if (!outputFormat.equals(FORMAT_JSON) && !outputFormat.equals(FORMAT_DOT)) {
            throw new IllegalArgumentException("outputFormat must be 'json' or 'dot', got '" + outputFormat + "'");
        }
        removeMetatypes = removeMetatypes == null ? List.of() : List.copyOf(removeMetatypes);
    }

    /**
     * JSON output, no removals, quiet.
     */
    public static TraceGraphConfig defaults() {
        return new TraceGraphConfig(FORMAT_JSON, List.of(), false);
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public TraceGraphConfig withOutputFormat(String format) {
        return new TraceGraphConfig(format, removeMetatypes, verbose);
    }

    public TraceGraphConfig withRemoveMetatypes(List<String> metatypeIds) {
        return new TraceGraphConfig(outputFormat, metatypeIds, verbose);
    }

    public TraceGraphConfig withVerbose(boolean verbose) {
        return new TraceGraphConfig(outputFormat, removeMetatypes, verbose);
    }
}
