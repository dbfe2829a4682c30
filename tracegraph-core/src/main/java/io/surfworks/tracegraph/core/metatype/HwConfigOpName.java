package io.surfworks.tracegraph.core.metatype;

/**
 * Operation names used by hardware configuration descriptions.
 *
 * <p>A metatype lists the hardware operation names it maps to so that
 * device-specific settings can be looked up per operator group.
 */
public enum HwConfigOpName {
    CONVOLUTION("Convolution"),
    DEPTHWISECONVOLUTION("DepthWiseConvolution"),
    MATMUL("MatMul"),
    ADD("Add"),
    SUBTRACT("Subtract"),
    MULTIPLY("Multiply"),
    DIVIDE("Divide"),
    MAXIMUM("Maximum"),
    MINIMUM("Minimum"),
    LESS("Less"),
    LESSEQUAL("LessEqual"),
    GREATER("Greater"),
    GREATEREQUAL("GreaterEqual"),
    EQUAL("Equal"),
    NOTEQUAL("NotEqual"),
    FLOORMOD("FloorMod"),
    LOGICALOR("LogicalOr"),
    LOGICALXOR("LogicalXor"),
    LOGICALAND("LogicalAnd"),
    LOGICALNOT("LogicalNot"),
    POWER("Power"),
    MVN("MVN"),
    GELU("Gelu"),
    AVGPOOL("AvgPool"),
    MAXPOOL("MaxPool"),
    REDUCEMEAN("ReduceMean"),
    REDUCEMAX("ReduceMax"),
    REDUCESUM("ReduceSum"),
    REDUCEL2("ReduceL2"),
    CONCAT("Concat"),
    TRANSPOSE("Transpose"),
    RESHAPE("Reshape"),
    UNSQUEEZE("Unsqueeze"),
    FLATTEN("Flatten"),
    SQUEEZE("Squeeze"),
    SPLIT("Split"),
    CHUNK("Chunk"),
    INTERPOLATE("Interpolate"),
    TILE("Tile"),
    EMBEDDING("Embedding"),
    EMBEDDINGBAG("EmbeddingBag");

    private final String configName;

    HwConfigOpName(String configName) {
        this.configName = configName;
    }

    /**
     * The name as it appears in hardware configuration files.
     */
    public String configName() {
        return configName;
    }
}
