package io.surfworks.tracegraph.core.passes;

import io.surfworks.tracegraph.core.TraceGraphException;

/**
 * Thrown when a node selected for removal is not a structural pass-through.
 */
public class UnsafeRewriteException extends TraceGraphException {

    private final int nodeId;

    public UnsafeRewriteException(int nodeId, String message) {
        super(String.format("Cannot remove node %d: %s", nodeId, message));
        this.nodeId = nodeId;
    }

    public int getNodeId() {
        return nodeId;
    }
}
