package io.surfworks.tracegraph.core.graph;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.surfworks.tracegraph.core.tensor.ScalarType;

/**
 * A tensor edge of a {@link StaticGraph}.
 *
 * @param fromNodeId           producer node id
 * @param toNodeId             consumer node id
 * @param tensorShape          activation shape
 * @param dtype                activation element type
 * @param inputPortId          consumer input slot
 * @param outputPortId         producer output slot
 * @param parallelInputPortIds further consumer slots fed by the same produced value
 */
public record StaticEdge(
        int fromNodeId,
        int toNodeId,
        List<Integer> tensorShape,
        ScalarType dtype,
        int inputPortId,
        int outputPortId,
        Set<Integer> parallelInputPortIds
) {

    public StaticEdge {
        tensorShape = List.copyOf(tensorShape);
        Objects.requireNonNull(dtype, "dtype cannot be null");
        parallelInputPortIds = parallelInputPortIds == null ? Set.of() : Set.copyOf(parallelInputPortIds);
    }

    public boolean hasParallelInputPorts() {
        return !parallelInputPortIds.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("%d:%d -> %d:%d %s %s", fromNodeId, outputPortId, toNodeId, inputPortId,
                tensorShape, dtype.shortName());
    }
}
