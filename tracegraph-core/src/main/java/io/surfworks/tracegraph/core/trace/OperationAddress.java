package io.surfworks.tracegraph.core.trace;

import java.util.Objects;

/**
 * Identifies one traced operator invocation.
 *
 * @param operatorName the traced operator name, e.g. {@code conv2d} or {@code __add__}
 * @param scopeInModel the scope of the call site
 * @param callOrder    invocation index of this operator within the scope; for model input
 *                     nodes this is the position of the declared input
 */
public record OperationAddress(String operatorName, Scope scopeInModel, int callOrder) {

    public OperationAddress {
        Objects.requireNonNull(operatorName, "operatorName cannot be null");
        Objects.requireNonNull(scopeInModel, "scopeInModel cannot be null");
    }

    /**
     * Formats as {@code <scope>/<operator>_<callOrder>}.
     */
    @Override
    public String toString() {
        return scopeInModel + "/" + operatorName + "_" + callOrder;
    }
}
