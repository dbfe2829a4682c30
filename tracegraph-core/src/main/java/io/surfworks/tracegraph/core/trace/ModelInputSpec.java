package io.surfworks.tracegraph.core.trace;

import java.util.List;
import java.util.Objects;

import io.surfworks.tracegraph.core.tensor.ScalarType;

/**
 * Declared model input at one input position.
 *
 * @param shape input tensor shape
 * @param dtype input element type
 */
public record ModelInputSpec(List<Integer> shape, ScalarType dtype) {

    public ModelInputSpec {
        shape = List.copyOf(shape);
        Objects.requireNonNull(dtype, "dtype cannot be null");
    }

    public static ModelInputSpec of(ScalarType dtype, Integer... shape) {
        return new ModelInputSpec(List.of(shape), dtype);
    }

    /**
     * Whether the input carries integer values (token ids, indices) rather than activations.
     */
    public boolean isIntegerInput() {
        return dtype.isInteger();
    }
}
