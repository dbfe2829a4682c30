package io.surfworks.tracegraph.core.trace;

import java.util.Objects;
import java.util.Set;

import io.surfworks.tracegraph.core.attributes.LayerAttributes;

/**
 * One operator invocation recorded by the tracer.
 *
 * @param id                 node id, unique within the trace
 * @param address            operator name, call-site scope and call order
 * @param owningModuleId     identity of the module instance that issued the call, or null for free functions
 * @param layerAttributes    structural attributes of the call, or null when none were captured
 * @param inIterationScope   whether the call happened inside a loop body
 * @param ignoredAlgorithms  algorithm tags that must skip this node
 */
public record TraceNode(
        int id,
        OperationAddress address,
        Long owningModuleId,
        LayerAttributes layerAttributes,
        boolean inIterationScope,
        Set<String> ignoredAlgorithms
) {

    public TraceNode {
        Objects.requireNonNull(address, "address cannot be null");
        ignoredAlgorithms = ignoredAlgorithms == null ? Set.of() : Set.copyOf(ignoredAlgorithms);
    }

    /**
     * Node for a free-function call with no attributes.
     */
    public static TraceNode of(int id, String operatorName, Scope scope, int callOrder) {
        return new TraceNode(id, new OperationAddress(operatorName, scope, callOrder),
                null, null, false, Set.of());
    }

    /**
     * Node for a call issued from inside a module.
     */
    public static TraceNode ofModule(int id, String operatorName, Scope scope, int callOrder,
                                     long moduleId, LayerAttributes attributes) {
        return new TraceNode(id, new OperationAddress(operatorName, scope, callOrder),
                moduleId, attributes, false, Set.of());
    }

    public String operatorName() {
        return address.operatorName();
    }

    public Scope scope() {
        return address.scopeInModel();
    }

    public int callOrder() {
        return address.callOrder();
    }

    public boolean hasOwningModule() {
        return owningModuleId != null;
    }
}
