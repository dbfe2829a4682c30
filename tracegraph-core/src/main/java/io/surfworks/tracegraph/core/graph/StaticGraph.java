package io.surfworks.tracegraph.core.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeMap;

import io.surfworks.tracegraph.core.metatype.OperatorMetatype;
import io.surfworks.tracegraph.core.metatype.PyTorchMetatypes;

/**
 * Directed multigraph of {@link StaticNode}s connected by {@link StaticEdge}s.
 *
 * <p>Edges live in an arena of numbered slots. Removing an edge invalidates its slot;
 * slots are never reused, so a slot index identifies one edge for the graph's lifetime.
 * Per-node adjacency lists hold slot indices.
 *
 * <p>Invariants:
 * <ul>
 *   <li>node ids are unique and never change</li>
 *   <li>every live edge references two existing nodes</li>
 * </ul>
 *
 * <p>Not thread-safe. A graph is owned by one caller at a time.
 */
public final class StaticGraph {

    private static final Comparator<StaticEdge> INPUT_ORDER =
            Comparator.comparingInt(StaticEdge::inputPortId).thenComparingInt(StaticEdge::fromNodeId);
    private static final Comparator<StaticEdge> OUTPUT_ORDER =
            Comparator.comparingInt(StaticEdge::toNodeId).thenComparingInt(StaticEdge::inputPortId);

    private final Map<Integer, StaticNode> nodes = new TreeMap<>();
    private final List<StaticEdge> edgeSlots = new ArrayList<>();
    private final Map<Integer, List<Integer>> outgoing = new HashMap<>();
    private final Map<Integer, List<Integer>> incoming = new HashMap<>();
    private int liveEdgeCount;

    // ==================== Mutation ====================

    /**
     * Adds a node.
     *
     * @throws IllegalArgumentException if a node with the same id exists
     */
    public void addNode(StaticNode node) {
        if (nodes.containsKey(node.id())) {
            throw new IllegalArgumentException("Node " + node.id() + " already exists");
        }
        nodes.put(node.id(), node);
        outgoing.put(node.id(), new ArrayList<>());
        incoming.put(node.id(), new ArrayList<>());
    }

    /**
     * Adds an edge between two existing nodes.
     *
     * @return the slot index of the new edge
     * @throws IllegalArgumentException if either endpoint does not exist
     */
    public int addEdge(StaticEdge edge) {
        requireNode(edge.fromNodeId());
        requireNode(edge.toNodeId());
        int slot = edgeSlots.size();
        edgeSlots.add(edge);
        outgoing.get(edge.fromNodeId()).add(slot);
        incoming.get(edge.toNodeId()).add(slot);
        liveEdgeCount++;
        return slot;
    }

    /**
     * Removes one edge equal to {@code edge}.
     *
     * @return true if an edge was removed
     */
    public boolean removeEdge(StaticEdge edge) {
        List<Integer> candidates = outgoing.get(edge.fromNodeId());
        if (candidates == null) {
            return false;
        }
        for (int slot : candidates) {
            if (edge.equals(edgeSlots.get(slot))) {
                invalidate(slot);
                return true;
            }
        }
        return false;
    }

    /**
     * Removes a node together with all of its incoming and outgoing edges.
     *
     * @throws IllegalArgumentException if the node does not exist
     */
    public void removeNode(int nodeId) {
        requireNode(nodeId);
        for (int slot : new ArrayList<>(incoming.get(nodeId))) {
            invalidate(slot);
        }
        for (int slot : new ArrayList<>(outgoing.get(nodeId))) {
            invalidate(slot);
        }
        nodes.remove(nodeId);
        incoming.remove(nodeId);
        outgoing.remove(nodeId);
    }

    private void invalidate(int slot) {
        StaticEdge edge = edgeSlots.get(slot);
        edgeSlots.set(slot, null);
        outgoing.get(edge.fromNodeId()).remove(Integer.valueOf(slot));
        incoming.get(edge.toNodeId()).remove(Integer.valueOf(slot));
        liveEdgeCount--;
    }

    // ==================== Queries ====================

    /**
     * Returns the node with the given id.
     *
     * @throws IllegalArgumentException if the node does not exist
     */
    public StaticNode node(int nodeId) {
        return requireNode(nodeId);
    }

    public Optional<StaticNode> findNode(int nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean containsNode(int nodeId) {
        return nodes.containsKey(nodeId);
    }

    /**
     * All nodes, ordered by id.
     */
    public List<StaticNode> nodes() {
        return List.copyOf(nodes.values());
    }

    /**
     * All live edges in insertion order.
     */
    public List<StaticEdge> edges() {
        List<StaticEdge> result = new ArrayList<>(liveEdgeCount);
        for (StaticEdge edge : edgeSlots) {
            if (edge != null) {
                result.add(edge);
            }
        }
        return result;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return liveEdgeCount;
    }

    /**
     * Edges consumed by a node, ordered by input port.
     */
    public List<StaticEdge> inputEdges(int nodeId) {
        requireNode(nodeId);
        return collect(incoming.get(nodeId), INPUT_ORDER);
    }

    /**
     * Edges produced by a node, ordered by consumer id and input port.
     */
    public List<StaticEdge> outputEdges(int nodeId) {
        requireNode(nodeId);
        return collect(outgoing.get(nodeId), OUTPUT_ORDER);
    }

    public List<StaticNode> predecessors(int nodeId) {
        return inputEdges(nodeId).stream()
                .map(StaticEdge::fromNodeId)
                .distinct()
                .map(nodes::get)
                .toList();
    }

    public List<StaticNode> successors(int nodeId) {
        return outputEdges(nodeId).stream()
                .map(StaticEdge::toNodeId)
                .distinct()
                .map(nodes::get)
                .toList();
    }

    /**
     * Nodes whose metatype is one of {@code metatypes}, ordered by id.
     */
    public List<StaticNode> nodesByMetatypes(Collection<OperatorMetatype> metatypes) {
        return nodes.values().stream()
                .filter(node -> metatypes.contains(node.metatype()))
                .toList();
    }

    public List<StaticNode> inputNodes() {
        return nodesByMetatypes(PyTorchMetatypes.INPUT_NOOP_METATYPES);
    }

    public List<StaticNode> outputNodes() {
        return nodesByMetatypes(PyTorchMetatypes.OUTPUT_NOOP_METATYPES);
    }

    /**
     * Orders all nodes so that every producer precedes its consumers.
     *
     * <p>Among nodes that are ready at the same time the smallest id comes first, which makes
     * the order deterministic.
     *
     * @throws GraphCycleException if the graph contains a cycle
     */
    public List<StaticNode> topologicalSort() {
        Map<Integer, Integer> pendingInputs = new HashMap<>();
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int nodeId : nodes.keySet()) {
            int degree = incoming.get(nodeId).size();
            pendingInputs.put(nodeId, degree);
            if (degree == 0) {
                ready.add(nodeId);
            }
        }

        List<StaticNode> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            int nodeId = ready.poll();
            order.add(nodes.get(nodeId));
            for (int slot : outgoing.get(nodeId)) {
                int consumer = edgeSlots.get(slot).toNodeId();
                int remaining = pendingInputs.merge(consumer, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(consumer);
                }
            }
        }

        if (order.size() != nodes.size()) {
            List<Integer> unordered = nodes.keySet().stream()
                    .filter(nodeId -> pendingInputs.get(nodeId) > 0)
                    .toList();
            throw new GraphCycleException(unordered);
        }
        return order;
    }

    // ==================== Internal Helpers ====================

    private StaticNode requireNode(int nodeId) {
        StaticNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return node;
    }

    private List<StaticEdge> collect(List<Integer> slots, Comparator<StaticEdge> order) {
        List<StaticEdge> result = new ArrayList<>(slots.size());
        for (int slot : slots) {
            result.add(edgeSlots.get(slot));
        }
        result.sort(order);
        return result;
    }

    @Override
    public String toString() {
        return String.format("StaticGraph[nodes=%d, edges=%d]", nodes.size(), liveEdgeCount);
    }
}
