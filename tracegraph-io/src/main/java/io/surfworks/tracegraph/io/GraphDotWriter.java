package io.surfworks.tracegraph.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import io.surfworks.tracegraph.core.graph.StaticEdge;
import io.surfworks.tracegraph.core.graph.StaticGraph;
import io.surfworks.tracegraph.core.graph.StaticNode;

/**
 * Renders a {@link StaticGraph} as a Graphviz digraph for structure analysis.
 *
 * <p>Each node is keyed {@code "<id> <name>"} and carries its operator type and metatype.
 * Each edge is labelled with the tensor shape, the output and input ports, and any
 * parallel input ports. Repeated edges between the same pair of nodes are all drawn:
 * <pre>
 * digraph {
 *   "0 Net/model_input_0" [id=0, type="model_input", metatype="input_noop"];
 *   "0 Net/model_input_0" -> "1 Net/Conv2d[conv]/conv2d_0" [label="[1, 3, 8, 8] f32\n0 -> 0"];
 * }
 * </pre>
 */
public final class GraphDotWriter {

    public String toDot(StaticGraph graph) {
        StringWriter out = new StringWriter();
        try {
            write(graph, out);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new IllegalStateException(e);
        }
        return out.toString();
    }

    public void write(StaticGraph graph, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (Writer writer = Files.newBufferedWriter(file)) {
            write(graph, writer);
        }
    }

    public void write(StaticGraph graph, Writer out) throws IOException {
        out.write("digraph {\n");
        for (StaticNode node : graph.nodes()) {
            out.write(String.format("  %s [id=%d, type=%s, metatype=%s%s];\n",
                    quote(node.key()), node.id(), quote(node.nodeType()), quote(node.metatype().id()),
                    node.isShared() ? ", shared=true" : ""));
        }
        for (StaticEdge edge : graph.edges()) {
            out.write(String.format("  %s -> %s [label=%s];\n",
                    quote(graph.node(edge.fromNodeId()).key()),
                    quote(graph.node(edge.toNodeId()).key()),
                    quote(edgeLabel(edge))));
        }
        out.write("}\n");
    }

    static String edgeLabel(StaticEdge edge) {
        StringBuilder label = new StringBuilder()
                .append(edge.tensorShape()).append(' ').append(edge.dtype().shortName())
                .append('\n')
                .append(edge.outputPortId()).append(" -> ").append(edge.inputPortId());
        if (edge.hasParallelInputPorts()) {
            List<Integer> ports = JsonFields.sortedInts(edge.parallelInputPortIds());
            label.append(" (parallel ")
                    .append(ports.stream().map(String::valueOf).collect(Collectors.joining(", ")))
                    .append(')');
        }
        return label.toString();
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    }
}
