package io.surfworks.tracegraph.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.surfworks.tracegraph.core.attributes.GenericLayerAttributes;
import io.surfworks.tracegraph.core.attributes.LayerAttributes;
import io.surfworks.tracegraph.core.graph.GraphConverter;
import io.surfworks.tracegraph.core.graph.StaticEdge;
import io.surfworks.tracegraph.core.graph.StaticGraph;
import io.surfworks.tracegraph.core.graph.StaticNode;
import io.surfworks.tracegraph.core.metatype.PyTorchMetatypes;
import io.surfworks.tracegraph.core.tensor.ScalarType;

@DisplayName("GraphJsonWriter")
class GraphJsonWriterTest {

    private final GraphJsonWriter writer = new GraphJsonWriter();

    private static StaticGraph convertFixture() throws IOException {
        TraceDocument document = TraceJsonReaderTest.loadFixture("mobile_block.json");
        return GraphConverter.defaults().convert(document.trace(), document.inputs());
    }

    private static JsonNode nodeById(JsonNode root, int id) {
        for (JsonNode node : root.get("nodes")) {
            if (node.get("id").asInt() == id) {
                return node;
            }
        }
        fail("node " + id + " not written");
        return null;
    }

    @Test
    @DisplayName("writes converted nodes")
    void writesConvertedNodes() throws IOException {
        ObjectNode root = writer.toJson(convertFixture());

        assertEquals(8, root.get("nodes").size());
        JsonNode conv = nodeById(root, 2);
        assertEquals("depthwise_conv2d", conv.get("metatype").asText());
        assertEquals("Conv2DOp", conv.get("metatypeName").asText());
        assertEquals("conv2d", conv.get("type").asText());
        assertEquals("MobileBlock/Conv2d[dw]/conv2d_0", conv.get("name").asText());
        assertEquals("MobileBlock/Conv2d[dw]", conv.get("layerName").asText());
        assertEquals("conv", conv.get("layerAttributes").get("type").asText());
        assertEquals(8, conv.get("layerAttributes").get("groups").asInt());

        assertTrue(nodeById(root, 1).get("integerInput").asBoolean());
        assertFalse(nodeById(root, 0).get("integerInput").asBoolean());
        assertTrue(nodeById(root, 0).get("layerAttributes").isNull());
        assertEquals("quantization", nodeById(root, 4).get("ignoredAlgorithms").get(0).asText());
        assertEquals(0.1, nodeById(root, 3).get("layerAttributes").get("p").asDouble(), 1e-9);
    }

    @Test
    @DisplayName("writes edges in trace format")
    void writesEdgesInTraceFormat() {
        StaticGraph graph = new StaticGraph();
        graph.addNode(StaticNode.builder(0, "model_input", PyTorchMetatypes.INPUT_NOOP).build());
        graph.addNode(StaticNode.builder(1, "cat", PyTorchMetatypes.CAT).build());
        graph.addEdge(new StaticEdge(0, 1, List.of(2, 3), ScalarType.BF16, 0, 1, Set.of(2, 1)));

        JsonNode edge = writer.toJson(graph).get("edges").get(0);

        assertEquals(0, edge.get("from").asInt());
        assertEquals(1, edge.get("to").asInt());
        assertEquals("[2,3]", edge.get("shape").toString());
        assertEquals("bf16", edge.get("dtype").asText());
        assertEquals(1, edge.get("outputPort").asInt());
        assertEquals("[1,2]", edge.get("parallelInputPorts").toString());
    }

    @Test
    @DisplayName("generic attribute named type does not replace kind")
    void genericAttributeNamedTypeDoesNotReplaceKind() {
        StaticGraph graph = new StaticGraph();
        graph.addNode(StaticNode.builder(0, "custom", PyTorchMetatypes.UNKNOWN)
                .layerAttributes(new GenericLayerAttributes(Map.of("type", "x", "p", 1)))
                .build());

        JsonNode written = writer.toJson(graph).get("nodes").get(0).get("layerAttributes");
        assertEquals("generic", written.get("type").asText());

        ObjectNode asTrace = new ObjectMapper().createObjectNode();
        asTrace.putArray("nodes").addObject()
                .put("id", 0)
                .put("operator", "custom")
                .set("layerAttributes", written);
        asTrace.putArray("edges");

        LayerAttributes reread = new TraceJsonReader().parse(asTrace).trace().nodes().get(0).layerAttributes();

        GenericLayerAttributes generic = assertInstanceOf(GenericLayerAttributes.class, reread);
        assertEquals(Map.of("p", 1), generic.values());
    }

    @Test
    @DisplayName("written edges read back as trace")
    void writtenEdgesReadBackAsTrace(@TempDir Path tempDir) throws IOException {
        StaticGraph graph = convertFixture();
        Path file = tempDir.resolve("out/graph.json");
        writer.write(graph, file);

        ObjectMapper json = new ObjectMapper();
        JsonNode written = json.readTree(file.toFile());
        ObjectNode asTrace = json.createObjectNode();
        ArrayNode nodes = asTrace.putArray("nodes");
        for (JsonNode node : written.get("nodes")) {
            nodes.addObject()
                    .put("id", node.get("id").asInt())
                    .put("operator", node.get("type").asText());
        }
        asTrace.set("edges", written.get("edges"));

        TraceDocument reread = new TraceJsonReader().parse(asTrace);

        assertEquals(graph.edgeCount(), reread.trace().edges().size());
        for (int i = 0; i < graph.edgeCount(); i++) {
            StaticEdge expected = graph.edges().get(i);
            assertEquals(expected.tensorShape(), reread.trace().edges().get(i).tensorShape());
            assertEquals(expected.dtype(), reread.trace().edges().get(i).dtype());
        }
    }
}
