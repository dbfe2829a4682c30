package io.surfworks.tracegraph.core.metatype;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.tracegraph.core.attributes.ConvolutionLayerAttributes;

@DisplayName("PyTorchMetatypes")
class PyTorchMetatypesTest {

    private final MetatypeRegistry registry = PyTorchMetatypes.registry();

    @Test
    @DisplayName("shared registry is frozen")
    void sharedRegistryIsFrozen() {
        assertTrue(registry.isFrozen());
        assertSame(registry, PyTorchMetatypes.registry());
    }

    @Test
    @DisplayName("create registry succeeds")
    void createRegistrySucceeds() {
        MetatypeRegistry fresh = PyTorchMetatypes.createRegistry();

        assertEquals(registry.operatorNames(), fresh.operatorNames());
        assertEquals(PyTorchMetatypes.UNKNOWN, fresh.fallback());
    }

    @Test
    @DisplayName("metatype ids are unique")
    void metatypeIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (OperatorMetatype metatype : registry.metatypes()) {
            assertTrue(ids.add(metatype.id()), "duplicate id " + metatype.id());
        }
    }

    @Test
    @DisplayName("depthwise module convolution")
    void depthwiseModuleConvolution() {
        ConvolutionLayerAttributes attrs = ConvolutionLayerAttributes.conv2d(16, 16, 3, 16);

        OperatorMetatype root = registry.lookupByOperatorName("conv2d");
        assertEquals(PyTorchMetatypes.CONV2D, root);
        assertEquals(PyTorchMetatypes.DEPTHWISE_CONV2D,
                registry.determineSubtype(root, attrs, CallContext.MODULE_CALL).orElseThrow());
    }

    @Test
    @DisplayName("regular module convolution")
    void regularModuleConvolution() {
        ConvolutionLayerAttributes attrs = ConvolutionLayerAttributes.conv2d(16, 32, 3, 1);

        assertEquals(PyTorchMetatypes.MODULE_CONV2D,
                registry.resolve("conv2d", attrs, CallContext.MODULE_CALL));
    }

    @Test
    @DisplayName("free function convolution stays root")
    void freeFunctionConvolutionStaysRoot() {
        ConvolutionLayerAttributes attrs = ConvolutionLayerAttributes.conv2d(16, 16, 3, 16);

        assertTrue(registry.determineSubtype(PyTorchMetatypes.CONV2D, attrs, CallContext.FREE_FUNCTION).isEmpty());
    }

    @Test
    @DisplayName("single channel grouped convolution is not depthwise")
    void singleChannelGroupedConvolutionIsNotDepthwise() {
        ConvolutionLayerAttributes attrs = ConvolutionLayerAttributes.conv2d(1, 8, 3, 1);

        assertEquals(PyTorchMetatypes.MODULE_CONV2D,
                registry.resolve("conv2d", attrs, CallContext.MODULE_CALL));
    }

    @Test
    @DisplayName("arithmetic aliases")
    void arithmeticAliases() {
        for (String name : new String[] {"add", "__add__", "__iadd__", "__radd__"}) {
            assertEquals(PyTorchMetatypes.ADD_OP, registry.lookupByOperatorName(name), name);
        }
    }

    @Test
    @DisplayName("boundary operators")
    void boundaryOperators() {
        assertEquals(PyTorchMetatypes.INPUT_NOOP,
                registry.lookupByOperatorName(PyTorchMetatypes.MODEL_INPUT_OPERATOR));
        assertEquals(PyTorchMetatypes.OUTPUT_NOOP,
                registry.lookupByOperatorName(PyTorchMetatypes.MODEL_OUTPUT_OPERATOR));
    }

    @Test
    @DisplayName("linear resolves to module subtype inside module")
    void linearResolvesToModuleSubtypeInsideModule() {
        assertEquals(PyTorchMetatypes.MODULE_LINEAR, registry.resolve("linear", null, CallContext.MODULE_CALL));
        assertEquals(PyTorchMetatypes.LINEAR, registry.resolve("linear", null, CallContext.FREE_FUNCTION));
    }

    @Test
    @DisplayName("one dimensional max pool is not registered")
    void oneDimensionalMaxPoolIsNotRegistered() {
        assertEquals(PyTorchMetatypes.UNKNOWN, registry.lookupByOperatorName("max_pool1d"));
        assertEquals(PyTorchMetatypes.UNKNOWN, registry.lookupByOperatorName("adaptive_max_pool1d"));
        assertEquals(PyTorchMetatypes.MAX_POOL2D, registry.lookupByOperatorName("max_pool2d"));
    }

    @Test
    @DisplayName("baddbmm ignores its bias port")
    void baddbmmIgnoresBiasPort() {
        assertEquals(Set.of(0), PyTorchMetatypes.BADDBMM.ignoredInputPorts());
    }

    @Test
    @DisplayName("weighted operator names")
    void weightedOperatorNames() {
        Set<String> names = PyTorchMetatypes.opNamesWithWeights();

        assertTrue(names.contains("conv2d"));
        assertTrue(names.contains("linear"));
        assertFalse(names.contains("relu"));
    }
}
