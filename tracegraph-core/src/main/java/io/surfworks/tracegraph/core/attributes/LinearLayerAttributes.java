package io.surfworks.tracegraph.core.attributes;

/**
 * Attributes of a fully connected layer call.
 */
public record LinearLayerAttributes(
        boolean weightRequiresGrad,
        int inFeatures,
        int outFeatures,
        boolean withBias
) implements LayerAttributes {
}
