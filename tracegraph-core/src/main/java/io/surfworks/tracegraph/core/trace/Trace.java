package io.surfworks.tracegraph.core.trace;

import java.util.List;

/**
 * An already materialized trace of one forward execution.
 *
 * <p>The tracer guarantees that node ids are unique and that every edge endpoint
 * references a node in {@link #nodes()}.
 *
 * @param nodes operator invocations in execution order
 * @param edges tensors passed between them
 */
public record Trace(List<TraceNode> nodes, List<TraceEdge> edges) {

    public Trace {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    @Override
    public String toString() {
        return String.format("Trace[nodes=%d, edges=%d]", nodes.size(), edges.size());
    }
}
