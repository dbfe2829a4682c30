package io.surfworks.tracegraph.core.metatype;

import java.util.Objects;
import java.util.function.BiPredicate;

import io.surfworks.tracegraph.core.attributes.ConvolutionLayerAttributes;
import io.surfworks.tracegraph.core.attributes.LayerAttributes;

/**
 * Match predicate attached to a subtype metatype.
 *
 * <p>Matchers are pure functions of the node's layer attributes and its call context.
 * Either argument may be null; a matcher that needs missing information does not match.
 */
public sealed interface SubtypeMatcher
        permits SubtypeMatcher.ModuleCall, SubtypeMatcher.DepthwiseConvolution, SubtypeMatcher.Custom {

    SubtypeMatcher MODULE_CALL = new ModuleCall();
    SubtypeMatcher DEPTHWISE_CONVOLUTION = new DepthwiseConvolution();

    boolean matches(LayerAttributes attributes, CallContext context);

    String description();

    static SubtypeMatcher custom(String description, BiPredicate<LayerAttributes, CallContext> predicate) {
        return new Custom(description, predicate);
    }

    /**
     * Matches calls issued from inside a stateful module (as opposed to bare functional calls).
     */
    record ModuleCall() implements SubtypeMatcher {
        @Override
        public boolean matches(LayerAttributes attributes, CallContext context) {
            return context != null && context.calledInsideModule();
        }

        @Override
        public String description() {
            return "module call";
        }
    }

    /**
     * Matches convolutions where {@code groups == inChannels} and {@code inChannels > 1}.
     */
    record DepthwiseConvolution() implements SubtypeMatcher {
        @Override
        public boolean matches(LayerAttributes attributes, CallContext context) {
            return attributes instanceof ConvolutionLayerAttributes conv && conv.isDepthwise();
        }

        @Override
        public String description() {
            return "depthwise convolution";
        }
    }

    /**
     * Named user-supplied predicate.
     */
    record Custom(String description, BiPredicate<LayerAttributes, CallContext> predicate)
            implements SubtypeMatcher {

        public Custom {
            Objects.requireNonNull(description, "description cannot be null");
            Objects.requireNonNull(predicate, "predicate cannot be null");
        }

        @Override
        public boolean matches(LayerAttributes attributes, CallContext context) {
            return predicate.test(attributes, context);
        }
    }
}
