package io.surfworks.tracegraph.core.passes;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.tracegraph.core.graph.StaticEdge;
import io.surfworks.tracegraph.core.graph.StaticGraph;
import io.surfworks.tracegraph.core.graph.StaticNode;
import io.surfworks.tracegraph.core.metatype.OperatorMetatype;

/**
 * Removes pass-through nodes of selected metatypes and reconnects their neighbours.
 *
 * <p>A node is removed when its metatype is one of the targets. It must have exactly one
 * incoming edge {@code P}, every outgoing edge must carry the same tensor shape as {@code P},
 * and neither {@code P} nor any outgoing edge may have parallel input ports. For each
 * outgoing edge {@code O} a replacement edge runs from {@code P}'s producer to {@code O}'s
 * consumer; it keeps the producer's output port from {@code P}, the consumer's input port
 * from {@code O}, and the shape and dtype of {@code P}. A node without outgoing edges is
 * simply dropped.
 *
 * <p>Every selected node is validated before the graph is touched, so a failing call leaves
 * the graph unchanged. Nodes are rewritten producer-first, which lets chains of removable
 * nodes collapse in one call.
 *
 * <p>Example:
 * <pre>{@code
 * NodeRemovalPass pass = new NodeRemovalPass(Set.of(PyTorchMetatypes.DROPOUT));
 * pass.apply(graph);
 * System.out.println("Removed: " + pass.lastRemovedCount());
 * }</pre>
 */
public final class NodeRemovalPass {

    private static final Logger LOG = Logger.getLogger(NodeRemovalPass.class.getName());

    private final Set<OperatorMetatype> targetMetatypes;
    private int lastRemovedCount;

    /**
     * @param targetMetatypes metatypes whose nodes are removed
     */
    public NodeRemovalPass(Set<OperatorMetatype> targetMetatypes) {
        this.targetMetatypes = Set.copyOf(targetMetatypes);
    }

    /**
     * Removes all nodes of the given metatypes from {@code graph} in place.
     *
     * @throws UnsafeRewriteException if a selected node is not a structural pass-through
     */
    public static void removeNodesAndReconnect(StaticGraph graph, Set<OperatorMetatype> targetMetatypes) {
        new NodeRemovalPass(targetMetatypes).apply(graph);
    }

    /**
     * Applies the pass to a graph in place.
     *
     * @param graph the graph to rewrite
     * @throws UnsafeRewriteException if a selected node is not a structural pass-through;
     *                                the graph is left unmodified
     * @throws io.surfworks.tracegraph.core.graph.GraphCycleException if the graph is cyclic
     */
    public void apply(StaticGraph graph) {
        lastRemovedCount = 0;

        List<StaticNode> selected = new ArrayList<>();
        for (StaticNode node : graph.topologicalSort()) {
            if (targetMetatypes.contains(node.metatype())) {
                validate(graph, node);
                selected.add(node);
            }
        }

        for (StaticNode node : selected) {
            bypass(graph, node);
            lastRemovedCount++;
        }

        if (lastRemovedCount > 0) {
            LOG.fine(() -> String.format("Removed %d nodes of metatypes %s, graph is now %s",
                    lastRemovedCount, targetMetatypes, graph));
        }
    }

    private static void validate(StaticGraph graph, StaticNode node) {
        List<StaticEdge> inputs = graph.inputEdges(node.id());
        if (inputs.size() != 1) {
            throw new UnsafeRewriteException(node.id(), String.format(
                    "expected exactly one incoming edge, found %d", inputs.size()));
        }
        StaticEdge input = inputs.get(0);
        if (input.hasParallelInputPorts()) {
            throw new UnsafeRewriteException(node.id(), String.format(
                    "incoming edge %s has parallel input ports %s", input, input.parallelInputPortIds()));
        }
        for (StaticEdge output : graph.outputEdges(node.id())) {
            if (!output.tensorShape().equals(input.tensorShape())) {
                throw new UnsafeRewriteException(node.id(), String.format(
                        "output shape %s differs from input shape %s", output.tensorShape(), input.tensorShape()));
            }
            if (output.hasParallelInputPorts()) {
                throw new UnsafeRewriteException(node.id(), String.format(
                        "outgoing edge %s has parallel input ports %s", output, output.parallelInputPortIds()));
            }
        }
    }

    private static void bypass(StaticGraph graph, StaticNode node) {
        StaticEdge input = graph.inputEdges(node.id()).get(0);
        List<StaticEdge> outputs = graph.outputEdges(node.id());

        graph.removeNode(node.id());
        for (StaticEdge output : outputs) {
            graph.addEdge(new StaticEdge(
                    input.fromNodeId(),
                    output.toNodeId(),
                    input.tensorShape(),
                    input.dtype(),
                    output.inputPortId(),
                    input.outputPortId(),
                    Set.of()));
        }

        LOG.fine(() -> String.format("Removed %s, reconnected %d consumers to node %d",
                node, outputs.size(), input.fromNodeId()));
    }

    /**
     * Returns the number of nodes removed by the last {@link #apply} call.
     */
    public int lastRemovedCount() {
        return lastRemovedCount;
    }

    public Set<OperatorMetatype> targetMetatypes() {
        return targetMetatypes;
    }

    @Override
    public String toString() {
        return String.format("NodeRemovalPass[targets=%s, lastRemoved=%d]", targetMetatypes, lastRemovedCount);
    }
}
