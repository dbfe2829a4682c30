package io.surfworks.tracegraph.core.trace;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.surfworks.tracegraph.core.tensor.ScalarType;

/**
 * A tensor flowing from one traced operator to another.
 *
 * @param fromNodeId           producer node id
 * @param toNodeId             consumer node id
 * @param tensorShape          activation shape
 * @param dtype                activation element type
 * @param inputPortId          consumer input slot
 * @param outputPortId         producer output slot
 * @param parallelInputPortIds further consumer slots fed by the same produced value
 */
public record TraceEdge(
        int fromNodeId,
        int toNodeId,
        List<Integer> tensorShape,
        ScalarType dtype,
        int inputPortId,
        int outputPortId,
        Set<Integer> parallelInputPortIds
) {

    public TraceEdge {
        tensorShape = List.copyOf(tensorShape);
        Objects.requireNonNull(dtype, "dtype cannot be null");
        parallelInputPortIds = parallelInputPortIds == null ? Set.of() : Set.copyOf(parallelInputPortIds);
    }

    public static TraceEdge of(int fromNodeId, int toNodeId, List<Integer> shape, ScalarType dtype) {
        return new TraceEdge(fromNodeId, toNodeId, shape, dtype, 0, 0, Set.of());
    }
}
