package io.surfworks.tracegraph.core.metatype;

import io.surfworks.tracegraph.core.trace.TraceNode;

/**
 * Flags describing how an operator was invoked, consulted by subtype matchers.
 *
 * @param calledInsideModule true when the call was issued while executing a stateful module
 * @param inIterationScope   true when the call happened inside a loop body
 */
public record CallContext(boolean calledInsideModule, boolean inIterationScope) {

    public static final CallContext FREE_FUNCTION = new CallContext(false, false);
    public static final CallContext MODULE_CALL = new CallContext(true, false);

    /**
     * Derive the context of a traced call: it is module-bound iff the node has an owning module.
     */
    public static CallContext of(TraceNode node) {
        return new CallContext(node.hasOwningModule(), node.inIterationScope());
    }
}
