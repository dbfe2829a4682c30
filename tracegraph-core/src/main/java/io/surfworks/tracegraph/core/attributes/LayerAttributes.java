package io.surfworks.tracegraph.core.attributes;

/**
 * Structural attributes captured for an operator call.
 *
 * <p>Subtype matchers inspect these to refine a node's metatype, for example to detect
 * depthwise convolutions.
 */
public sealed interface LayerAttributes
        permits ConvolutionLayerAttributes, LinearLayerAttributes, GenericLayerAttributes {
}
