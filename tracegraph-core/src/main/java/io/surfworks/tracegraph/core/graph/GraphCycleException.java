package io.surfworks.tracegraph.core.graph;

import java.util.List;

import io.surfworks.tracegraph.core.TraceGraphException;

/**
 * Thrown when a graph that must be acyclic contains a cycle.
 */
public class GraphCycleException extends TraceGraphException {

    private final List<Integer> nodeIds;

    /**
     * @param nodeIds ids of the nodes that could not be ordered, ascending
     */
    public GraphCycleException(List<Integer> nodeIds) {
        super("Graph contains a cycle through nodes " + nodeIds);
        this.nodeIds = List.copyOf(nodeIds);
    }

    /**
     * Ids of the nodes on or downstream of a cycle.
     */
    public List<Integer> getNodeIds() {
        return nodeIds;
    }
}
