package io.surfworks.tracegraph.core.graph;

/**
 * Post-conversion pass that derives per-node layer attributes from each node's metatype
 * and the shapes and dtypes of its edges.
 *
 * <p>Implementations may only replace node layer attributes; they must not add or remove
 * nodes or edges.
 */
@FunctionalInterface
public interface AttributeDerivationPass {

    /** Leaves every node's attributes as captured by the tracer. */
    AttributeDerivationPass NONE = graph -> { };

    void apply(StaticGraph graph);
}
