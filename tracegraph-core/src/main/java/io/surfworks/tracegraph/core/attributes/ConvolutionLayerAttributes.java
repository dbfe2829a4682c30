package io.surfworks.tracegraph.core.attributes;

import java.util.List;

/**
 * Attributes of a (possibly transposed) convolution call.
 *
 * @param weightRequiresGrad whether the weight is trainable
 * @param inChannels         input channel count
 * @param outChannels        output channel count
 * @param kernelSize         kernel extent per spatial dimension
 * @param stride             stride per spatial dimension
 * @param groups             number of channel groups
 * @param transpose          true for transposed convolutions
 * @param paddingValues      padding per spatial dimension
 */
public record ConvolutionLayerAttributes(
        boolean weightRequiresGrad,
        int inChannels,
        int outChannels,
        List<Integer> kernelSize,
        List<Integer> stride,
        int groups,
        boolean transpose,
        List<Integer> paddingValues
) implements LayerAttributes {

    public ConvolutionLayerAttributes {
        if (inChannels < 0 || outChannels < 0) {
            throw new IllegalArgumentException("Channel counts must be non-negative");
        }
        if (groups < 1) {
            throw new IllegalArgumentException("groups must be positive, got " + groups);
        }
        kernelSize = List.copyOf(kernelSize);
        stride = List.copyOf(stride);
        paddingValues = List.copyOf(paddingValues);
    }

    /**
     * Non-transposed 2D convolution with unit stride and no padding.
     */
    public static ConvolutionLayerAttributes conv2d(int inChannels, int outChannels, int kernel, int groups) {
        return new ConvolutionLayerAttributes(true, inChannels, outChannels,
                List.of(kernel, kernel), List.of(1, 1), groups, false, List.of(0, 0));
    }

    /**
     * A convolution is depthwise when every input channel forms its own group.
     */
    public boolean isDepthwise() {
        return groups == inChannels && inChannels > 1;
    }
}
