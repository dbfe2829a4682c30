package io.surfworks.tracegraph.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Loads and saves {@link TraceGraphConfig}.
 *
 * <p>A missing config file yields the defaults. A file that cannot be parsed is reported
 * at {@code WARNING} and also yields the defaults. A field with an invalid value is reported
 * at {@code WARNING} and keeps its default, while the other fields still apply. CLI arguments
 * are merged by the caller.
 */
public final class TraceGraphConfigLoader {

    private static final Logger LOG = Logger.getLogger(TraceGraphConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private TraceGraphConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static TraceGraphConfig load() {
        return load(TraceGraphConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static TraceGraphConfig load(Path configFile) {
        TraceGraphConfig config = TraceGraphConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    /**
     * Saves configuration to a specific file.
     *
     * @throws IOException if saving fails
     */
    public static void save(TraceGraphConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }
        JSON.writeValue(configFile.toFile(), toJson(config));
    }

    static ObjectNode toJson(TraceGraphConfig config) {
        ObjectNode root = JSON.createObjectNode();
        root.put("outputFormat", config.outputFormat());
        ArrayNode remove = root.putArray("removeMetatypes");
        config.removeMetatypes().forEach(remove::add);
        root.put("verbose", config.verbose());
        return root;
    }

    static String toJsonString(TraceGraphConfig config) throws IOException {
        return JSON.writeValueAsString(toJson(config));
    }

    private static TraceGraphConfig loadFromFile(Path configFile, TraceGraphConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning(() -> "Ignoring config file " + configFile + ": expected a JSON object");
                return base;
            }

            TraceGraphConfig config = base;
            if (root.hasNonNull("outputFormat")) {
                String format = root.get("outputFormat").asText();
                try {
                    config = config.withOutputFormat(format);
                } catch (IllegalArgumentException e) {
                    warnSkipped(configFile, "outputFormat", e.getMessage());
                }
            }
            if (root.has("removeMetatypes")) {
                JsonNode remove = root.get("removeMetatypes");
                if (remove.isArray()) {
                    List<String> ids = new ArrayList<>();
                    for (JsonNode id : remove) {
                        ids.add(id.asText());
                    }
                    config = config.withRemoveMetatypes(ids);
                } else {
                    warnSkipped(configFile, "removeMetatypes", "expected an array of metatype ids");
                }
            }
            if (root.has("verbose")) {
                JsonNode verbose = root.get("verbose");
                if (verbose.isBoolean()) {
                    config = config.withVerbose(verbose.booleanValue());
                } else {
                    warnSkipped(configFile, "verbose", "expected true or false");
                }
            }
            return config;

        } catch (IOException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable config file " + configFile, e);
            return base;
        }
    }

    private static void warnSkipped(Path configFile, String field, String reason) {
        LOG.warning(() -> String.format("Ignoring '%s' in config file %s: %s", field, configFile, reason));
    }
}
