package io.surfworks.tracegraph.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.surfworks.tracegraph.core.attributes.LayerAttributes;
import io.surfworks.tracegraph.core.tensor.ScalarType;
import io.surfworks.tracegraph.core.trace.ModelInputSpec;
import io.surfworks.tracegraph.core.trace.OperationAddress;
import io.surfworks.tracegraph.core.trace.Scope;
import io.surfworks.tracegraph.core.trace.Trace;
import io.surfworks.tracegraph.core.trace.TraceEdge;
import io.surfworks.tracegraph.core.trace.TraceNode;

/**
 * Reads a materialized trace from its JSON form.
 *
 * <p>Document layout:
 * <pre>{@code
 * {
 *   "nodes":  [{"id": 0, "operator": "model_input", "scope": "Net", "callOrder": 0,
 *               "moduleId": null, "inIterationScope": false, "ignoredAlgorithms": [],
 *               "layerAttributes": {"type": "conv", "inChannels": 3, "outChannels": 8, ...}}],
 *   "edges":  [{"from": 0, "to": 1, "shape": [1, 3, 8, 8], "dtype": "f32",
 *               "inputPort": 0, "outputPort": 0, "parallelInputPorts": []}],
 *   "inputs": [{"shape": [1, 3, 8, 8], "dtype": "f32"}]
 * }
 * }</pre>
 *
 * <p>Only {@code nodes[].id}, {@code nodes[].operator}, and the endpoints, shape and dtype of
 * each edge are required. {@code inputs} may be omitted, in which case no input declarations
 * are available to the converter.
 *
 * <p>The reader enforces the trace contract: node ids are unique and every edge endpoint
 * names a node of the document.
 */
public final class TraceJsonReader {

    private static final Logger LOG = Logger.getLogger(TraceJsonReader.class.getName());

    private final ObjectMapper json;

    public TraceJsonReader() {
        this(new ObjectMapper());
    }

    public TraceJsonReader(ObjectMapper json) {
        this.json = json;
    }

    /**
     * Reads a trace file.
     *
     * @throws IOException          if the file cannot be read
     * @throws TraceFormatException if the content is not a valid trace document
     */
    public TraceDocument read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file)) {
            TraceDocument document = read(reader);
            LOG.fine(() -> String.format("Read %s from %s", document.trace(), file));
            return document;
        }
    }

    /**
     * Reads a trace document from a character stream. The reader is not closed.
     *
     * @throws IOException          if the stream cannot be read
     * @throws TraceFormatException if the content is not a valid trace document
     */
    public TraceDocument read(Reader reader) throws IOException {
        JsonNode root;
        try {
            root = json.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new TraceFormatException("$", "malformed JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    /**
     * Parses a trace document held in a string.
     *
     * @throws TraceFormatException if the content is not a valid trace document
     */
    public TraceDocument parse(String content) {
        JsonNode root;
        try {
            root = json.readTree(content);
        } catch (JsonProcessingException e) {
            throw new TraceFormatException("$", "malformed JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    /**
     * Converts an already parsed JSON tree.
     *
     * @throws TraceFormatException if the tree is not a valid trace document
     */
    public TraceDocument parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new TraceFormatException("$", "expected a JSON object");
        }

        JsonNode nodesArray = JsonFields.requireArray(root, "nodes", "$");
        List<TraceNode> nodes = new ArrayList<>(nodesArray.size());
        Set<Integer> nodeIds = new HashSet<>();
        for (int i = 0; i < nodesArray.size(); i++) {
            String location = "nodes[" + i + "]";
            TraceNode node = readNode(nodesArray.get(i), location);
            if (!nodeIds.add(node.id())) {
                throw new TraceFormatException(location + ".id", "duplicate node id " + node.id());
            }
            nodes.add(node);
        }

        List<TraceEdge> edges = new ArrayList<>();
        JsonNode edgesArray = root.get("edges");
        if (edgesArray != null && !edgesArray.isNull()) {
            if (!edgesArray.isArray()) {
                throw new TraceFormatException("edges", "expected an array");
            }
            for (int i = 0; i < edgesArray.size(); i++) {
                String location = "edges[" + i + "]";
                TraceEdge edge = readEdge(edgesArray.get(i), location);
                requireKnownNode(nodeIds, edge.fromNodeId(), location + ".from");
                requireKnownNode(nodeIds, edge.toNodeId(), location + ".to");
                edges.add(edge);
            }
        }

        List<ModelInputSpec> inputs = null;
        JsonNode inputsArray = root.get("inputs");
        if (inputsArray != null && !inputsArray.isNull()) {
            if (!inputsArray.isArray()) {
                throw new TraceFormatException("inputs", "expected an array");
            }
            inputs = new ArrayList<>(inputsArray.size());
            for (int i = 0; i < inputsArray.size(); i++) {
                inputs.add(readInput(inputsArray.get(i), "inputs[" + i + "]"));
            }
        }

        return new TraceDocument(new Trace(nodes, edges), inputs);
    }

    // ==================== Element Readers ====================

    private TraceNode readNode(JsonNode node, String location) {
        requireObject(node, location);
        int id = JsonFields.requireInt(node, "id", location);
        String operator = JsonFields.requireText(node, "operator", location);
        Scope scope = Scope.parse(JsonFields.optionalText(node, "scope", "", location));
        int callOrder = JsonFields.optionalInt(node, "callOrder", 0, location);
        Long moduleId = JsonFields.optionalLong(node, "moduleId", location);
        boolean inIterationScope = JsonFields.optionalBoolean(node, "inIterationScope", false, location);
        Set<String> ignored = new LinkedHashSet<>(JsonFields.optionalTextList(node, "ignoredAlgorithms", location));
        LayerAttributes attributes = LayerAttributesCodec.read(node.get("layerAttributes"),
                location + ".layerAttributes", json);

        return new TraceNode(id, new OperationAddress(operator, scope, callOrder),
                moduleId, attributes, inIterationScope, ignored);
    }

    private static TraceEdge readEdge(JsonNode edge, String location) {
        requireObject(edge, location);
        return new TraceEdge(
                JsonFields.requireInt(edge, "from", location),
                JsonFields.requireInt(edge, "to", location),
                JsonFields.requireIntList(edge, "shape", location),
                readDtype(edge, location),
                JsonFields.optionalInt(edge, "inputPort", 0, location),
                JsonFields.optionalInt(edge, "outputPort", 0, location),
                new LinkedHashSet<>(JsonFields.optionalIntList(edge, "parallelInputPorts", location)));
    }

    private static ModelInputSpec readInput(JsonNode input, String location) {
        requireObject(input, location);
        return new ModelInputSpec(JsonFields.requireIntList(input, "shape", location), readDtype(input, location));
    }

    private static ScalarType readDtype(JsonNode node, String location) {
        String dtype = JsonFields.requireText(node, "dtype", location);
        try {
            return ScalarType.fromName(dtype);
        } catch (IllegalArgumentException e) {
            throw new TraceFormatException(location + ".dtype", e.getMessage(), e);
        }
    }

    private static void requireObject(JsonNode node, String location) {
        if (node == null || !node.isObject()) {
            throw new TraceFormatException(location, "expected an object");
        }
    }

    private static void requireKnownNode(Set<Integer> nodeIds, int nodeId, String location) {
        if (!nodeIds.contains(nodeId)) {
            throw new TraceFormatException(location, "references unknown node " + nodeId);
        }
    }
}
