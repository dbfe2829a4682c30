package io.surfworks.tracegraph.core.passes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.tracegraph.core.graph.StaticEdge;
import io.surfworks.tracegraph.core.graph.StaticGraph;
import io.surfworks.tracegraph.core.graph.StaticNode;
import io.surfworks.tracegraph.core.metatype.OperatorMetatype;
import io.surfworks.tracegraph.core.metatype.PyTorchMetatypes;
import io.surfworks.tracegraph.core.tensor.ScalarType;

@DisplayName("NodeRemovalPass")
class NodeRemovalPassTest {

    private static final Set<OperatorMetatype> DROPOUT = Set.of(PyTorchMetatypes.DROPOUT);

    private static final int INPUT = 0;
    private static final int DROP = 1;
    private static final int LINEAR = 2;
    private static final int OUTPUT = 3;

    private static void addNode(StaticGraph graph, int id, OperatorMetatype metatype) {
        graph.addNode(StaticNode.builder(id, metatype.name(), metatype).build());
    }

    private static StaticEdge edge(int from, int to, List<Integer> shape, int inputPort, int outputPort,
                                   Set<Integer> parallelPorts) {
        return new StaticEdge(from, to, shape, ScalarType.F32, inputPort, outputPort, parallelPorts);
    }

    /**
     * Input -> Dropout -> Linear -> Output.
     */
    private static StaticGraph chain(List<Integer> dropoutOutShape, Set<Integer> incomingParallelPorts) {
        StaticGraph graph = new StaticGraph();
        addNode(graph, INPUT, PyTorchMetatypes.INPUT_NOOP);
        addNode(graph, DROP, PyTorchMetatypes.DROPOUT);
        addNode(graph, LINEAR, PyTorchMetatypes.MODULE_LINEAR);
        addNode(graph, OUTPUT, PyTorchMetatypes.OUTPUT_NOOP);
        graph.addEdge(edge(INPUT, DROP, List.of(1, 10), 0, 0, incomingParallelPorts));
        graph.addEdge(edge(DROP, LINEAR, dropoutOutShape, 0, 0, Set.of()));
        graph.addEdge(edge(LINEAR, OUTPUT, List.of(1, 4), 0, 0, Set.of()));
        return graph;
    }

    private static void assertUnchanged(StaticGraph before, StaticGraph after) {
        assertEquals(before.nodes().stream().map(StaticNode::id).toList(),
                after.nodes().stream().map(StaticNode::id).toList());
        assertEquals(before.edges(), after.edges());
    }

    @Nested
    @DisplayName("reconnection")
    class Reconnection {

        @Test
        @DisplayName("removes dropout from chain")
        void removesDropoutFromChain() {
            StaticGraph graph = chain(List.of(1, 10), Set.of());

            NodeRemovalPass.removeNodesAndReconnect(graph, DROPOUT);

            assertEquals(Set.of(INPUT, LINEAR, OUTPUT),
                    Set.copyOf(graph.nodes().stream().map(StaticNode::id).toList()));
            assertEquals(2, graph.edgeCount());

            List<StaticEdge> linearInputs = graph.inputEdges(LINEAR);
            assertEquals(1, linearInputs.size());
            StaticEdge bypass = linearInputs.get(0);
            assertEquals(INPUT, bypass.fromNodeId());
            assertEquals(List.of(1, 10), bypass.tensorShape());
            assertEquals(ScalarType.F32, bypass.dtype());
            assertEquals(0, bypass.inputPortId());
            assertEquals(0, bypass.outputPortId());
            assertTrue(bypass.parallelInputPortIds().isEmpty());
        }

        @Test
        @DisplayName("ports come from the right edges")
        void portsComeFromTheRightEdges() {
            StaticGraph graph = new StaticGraph();
            addNode(graph, INPUT, PyTorchMetatypes.SPLIT_OP);
            addNode(graph, DROP, PyTorchMetatypes.DROPOUT);
            addNode(graph, LINEAR, PyTorchMetatypes.CAT);
            graph.addEdge(edge(INPUT, DROP, List.of(2, 8), 0, 3, Set.of()));
            graph.addEdge(edge(DROP, LINEAR, List.of(2, 8), 2, 0, Set.of()));

            NodeRemovalPass.removeNodesAndReconnect(graph, DROPOUT);

            StaticEdge bypass = graph.inputEdges(LINEAR).get(0);
            assertEquals(3, bypass.outputPortId(), "producer port of the incoming edge");
            assertEquals(2, bypass.inputPortId(), "consumer port of the outgoing edge");
        }

        @Test
        @DisplayName("fan out creates one edge per consumer")
        void fanOutCreatesOneEdgePerConsumer() {
            StaticGraph graph = chain(List.of(1, 10), Set.of());
            addNode(graph, 4, PyTorchMetatypes.RELU);
            graph.addEdge(edge(DROP, 4, List.of(1, 10), 0, 0, Set.of()));

            NodeRemovalPass pass = new NodeRemovalPass(DROPOUT);
            pass.apply(graph);

            assertEquals(1, pass.lastRemovedCount());
            assertEquals(List.of(LINEAR, 4), graph.successors(INPUT).stream().map(StaticNode::id).toList());
        }

        @Test
        @DisplayName("dead end is dropped")
        void deadEndIsDropped() {
            StaticGraph graph = new StaticGraph();
            addNode(graph, INPUT, PyTorchMetatypes.INPUT_NOOP);
            addNode(graph, DROP, PyTorchMetatypes.DROPOUT);
            graph.addEdge(edge(INPUT, DROP, List.of(1, 10), 0, 0, Set.of()));

            NodeRemovalPass.removeNodesAndReconnect(graph, DROPOUT);

            assertEquals(1, graph.nodeCount());
            assertEquals(0, graph.edgeCount());
        }

        @Test
        @DisplayName("chained removable nodes collapse")
        void chainedRemovableNodesCollapse() {
            StaticGraph graph = new StaticGraph();
            addNode(graph, INPUT, PyTorchMetatypes.INPUT_NOOP);
            addNode(graph, DROP, PyTorchMetatypes.DROPOUT);
            addNode(graph, 5, PyTorchMetatypes.DROPOUT);
            addNode(graph, LINEAR, PyTorchMetatypes.MODULE_LINEAR);
            graph.addEdge(edge(INPUT, DROP, List.of(1, 10), 0, 1, Set.of()));
            graph.addEdge(edge(DROP, 5, List.of(1, 10), 0, 0, Set.of()));
            graph.addEdge(edge(5, LINEAR, List.of(1, 10), 0, 0, Set.of()));

            NodeRemovalPass pass = new NodeRemovalPass(DROPOUT);
            pass.apply(graph);

            assertEquals(2, pass.lastRemovedCount());
            assertEquals(List.of(edge(INPUT, LINEAR, List.of(1, 10), 0, 1, Set.of())), graph.edges());
        }

        @Test
        @DisplayName("graph without targets is untouched")
        void graphWithoutTargetsIsUntouched() {
            StaticGraph graph = chain(List.of(1, 10), Set.of());
            StaticGraph reference = chain(List.of(1, 10), Set.of());

            NodeRemovalPass pass = new NodeRemovalPass(Set.of(PyTorchMetatypes.SOFTMAX));
            pass.apply(graph);

            assertEquals(0, pass.lastRemovedCount());
            assertUnchanged(reference, graph);
        }
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        @DisplayName("rejects shape mismatch")
        void shapeMismatch() {
            StaticGraph graph = chain(List.of(1, 5), Set.of());
            StaticGraph reference = chain(List.of(1, 5), Set.of());

            UnsafeRewriteException e = assertThrows(UnsafeRewriteException.class,
                    () -> NodeRemovalPass.removeNodesAndReconnect(graph, DROPOUT));

            assertEquals(DROP, e.getNodeId());
            assertTrue(e.getMessage().contains("[1, 5]"));
            assertUnchanged(reference, graph);
        }

        @Test
        @DisplayName("parallel ports on incoming edge")
        void parallelPortsOnIncomingEdge() {
            StaticGraph graph = chain(List.of(1, 10), Set.of(1));
            StaticGraph reference = chain(List.of(1, 10), Set.of(1));

            assertThrows(UnsafeRewriteException.class,
                    () -> NodeRemovalPass.removeNodesAndReconnect(graph, DROPOUT));
            assertUnchanged(reference, graph);
        }

        @Test
        @DisplayName("parallel ports on outgoing edge")
        void parallelPortsOnOutgoingEdge() {
            StaticGraph graph = new StaticGraph();
            addNode(graph, INPUT, PyTorchMetatypes.INPUT_NOOP);
            addNode(graph, DROP, PyTorchMetatypes.DROPOUT);
            addNode(graph, LINEAR, PyTorchMetatypes.ADD_OP);
            graph.addEdge(edge(INPUT, DROP, List.of(1, 10), 0, 0, Set.of()));
            graph.addEdge(edge(DROP, LINEAR, List.of(1, 10), 0, 0, Set.of(1)));

            assertThrows(UnsafeRewriteException.class,
                    () -> NodeRemovalPass.removeNodesAndReconnect(graph, DROPOUT));
            assertEquals(3, graph.nodeCount());
        }

        @Test
        @DisplayName("no incoming edge")
        void noIncomingEdge() {
            StaticGraph graph = new StaticGraph();
            addNode(graph, DROP, PyTorchMetatypes.DROPOUT);
            addNode(graph, LINEAR, PyTorchMetatypes.MODULE_LINEAR);
            graph.addEdge(edge(DROP, LINEAR, List.of(1, 10), 0, 0, Set.of()));

            UnsafeRewriteException e = assertThrows(UnsafeRewriteException.class,
                    () -> NodeRemovalPass.removeNodesAndReconnect(graph, DROPOUT));
            assertTrue(e.getMessage().contains("found 0"));
            assertEquals(2, graph.nodeCount());
        }

        @Test
        @DisplayName("two incoming edges")
        void twoIncomingEdges() {
            StaticGraph graph = chain(List.of(1, 10), Set.of());
            addNode(graph, 4, PyTorchMetatypes.INPUT_NOOP);
            graph.addEdge(edge(4, DROP, List.of(1, 10), 1, 0, Set.of()));

            assertThrows(UnsafeRewriteException.class,
                    () -> NodeRemovalPass.removeNodesAndReconnect(graph, DROPOUT));
        }

        @Test
        @DisplayName("later failure leaves earlier candidates in place")
        void laterFailureLeavesEarlierCandidatesInPlace() {
            // First dropout is removable, second one is not
            StaticGraph graph = chain(List.of(1, 10), Set.of());
            addNode(graph, 4, PyTorchMetatypes.DROPOUT);
            addNode(graph, 5, PyTorchMetatypes.RELU);
            graph.addEdge(edge(OUTPUT, 4, List.of(1, 4), 0, 0, Set.of()));
            graph.addEdge(edge(4, 5, List.of(2, 2), 0, 0, Set.of()));
            int edgesBefore = graph.edgeCount();

            assertThrows(UnsafeRewriteException.class,
                    () -> NodeRemovalPass.removeNodesAndReconnect(graph, DROPOUT));
            assertTrue(graph.containsNode(DROP));
            assertEquals(edgesBefore, graph.edgeCount());
        }
    }
}
