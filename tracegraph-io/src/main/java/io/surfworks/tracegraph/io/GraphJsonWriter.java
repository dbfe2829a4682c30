package io.surfworks.tracegraph.io;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.tracegraph.core.graph.StaticEdge;
import io.surfworks.tracegraph.core.graph.StaticGraph;
import io.surfworks.tracegraph.core.graph.StaticNode;

/**
 * Serializes a {@link StaticGraph} as JSON.
 *
 * <p>Nodes are written in id order, edges in graph order. Edge fields use the same names
 * as the trace format so a graph dump can be diffed against its source trace.
 */
public final class GraphJsonWriter {

    private final ObjectMapper json;

    public GraphJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public GraphJsonWriter(ObjectMapper json) {
        this.json = json;
    }

    public ObjectNode toJson(StaticGraph graph) {
        ObjectNode root = json.createObjectNode();

        ArrayNode nodes = root.putArray("nodes");
        for (StaticNode node : graph.nodes()) {
            ObjectNode out = nodes.addObject();
            out.put("id", node.id());
            out.put("name", node.name());
            out.put("type", node.nodeType());
            out.put("metatype", node.metatype().id());
            out.put("metatypeName", node.metatype().name());
            out.put("layerName", node.layerName());
            out.put("shared", node.isShared());
            out.put("integerInput", node.isIntegerInput());
            out.put("inIterationScope", node.isInIterationScope());
            ArrayNode ignored = out.putArray("ignoredAlgorithms");
            node.ignoredAlgorithms().stream().sorted().forEach(ignored::add);
            LayerAttributesCodec.write(out, "layerAttributes", node.layerAttributes(), json);
        }

        ArrayNode edges = root.putArray("edges");
        for (StaticEdge edge : graph.edges()) {
            ObjectNode out = edges.addObject();
            out.put("from", edge.fromNodeId());
            out.put("to", edge.toNodeId());
            JsonFields.putInts(out.putArray("shape"), edge.tensorShape());
            out.put("dtype", edge.dtype().shortName());
            out.put("inputPort", edge.inputPortId());
            out.put("outputPort", edge.outputPortId());
            JsonFields.putInts(out.putArray("parallelInputPorts"),
                    JsonFields.sortedInts(edge.parallelInputPortIds()));
        }

        return root;
    }

    public String toJsonString(StaticGraph graph) throws IOException {
        return json.writeValueAsString(toJson(graph));
    }

    public void write(StaticGraph graph, Writer writer) throws IOException {
        json.writeValue(writer, toJson(graph));
    }

    public void write(StaticGraph graph, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        json.writeValue(file.toFile(), toJson(graph));
    }
}
