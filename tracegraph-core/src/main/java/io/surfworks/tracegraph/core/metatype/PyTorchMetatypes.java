package io.surfworks.tracegraph.core.metatype;

import static io.surfworks.tracegraph.core.metatype.HwConfigOpName.*;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Operator metatypes for traced PyTorch models.
 *
 * <p>Metatypes whose operators may run either as bare functional calls or inside a module
 * (convolutions, linear, normalizations, embeddings) declare a module-bound subtype;
 * convolutions additionally nest a depthwise subtype below it.
 *
 * <p>{@link #registry()} returns the shared, frozen registry built by {@link #createRegistry()}.
 */
public final class PyTorchMetatypes {

    private PyTorchMetatypes() {} // Utility class

    /** Operator name recorded by the tracer for model inputs. */
    public static final String MODEL_INPUT_OPERATOR = "model_input";

    /** Operator name recorded by the tracer for model outputs. */
    public static final String MODEL_OUTPUT_OPERATOR = "model_output";

    // ==================== Fallback and Graph Boundaries ====================

    public static final OperatorMetatype UNKNOWN = OperatorMetatype.builder("unknown", "unknown").build();

    public static final OperatorMetatype INPUT_NOOP = OperatorMetatype.builder("input_noop", "input_noop")
            .external("input_noop", MODEL_INPUT_OPERATOR)
            .build();

    public static final OperatorMetatype OUTPUT_NOOP = OperatorMetatype.builder("output_noop", "output_noop")
            .external("output_noop", MODEL_OUTPUT_OPERATOR)
            .build();

    public static final OperatorMetatype NOOP = OperatorMetatype.builder("noop", "noop")
            .external("noop")
            .torch("contiguous", "clone")
            .build();

    // ==================== Convolutions ====================

    public static final OperatorMetatype DEPTHWISE_CONV1D = depthwiseConv("depthwise_conv1d", "Conv1DOp", "conv1d");
    public static final OperatorMetatype MODULE_CONV1D = moduleConv("module_conv1d", "Conv1DOp", "conv1d",
            DEPTHWISE_CONV1D);
    public static final OperatorMetatype CONV1D = conv("conv1d", "Conv1DOp", "conv1d", MODULE_CONV1D);

    public static final OperatorMetatype DEPTHWISE_CONV2D = depthwiseConv("depthwise_conv2d", "Conv2DOp", "conv2d");
    public static final OperatorMetatype MODULE_CONV2D = moduleConv("module_conv2d", "Conv2DOp", "conv2d",
            DEPTHWISE_CONV2D);
    public static final OperatorMetatype CONV2D = conv("conv2d", "Conv2DOp", "conv2d", MODULE_CONV2D);

    public static final OperatorMetatype DEPTHWISE_CONV3D = depthwiseConv("depthwise_conv3d", "Conv3DOp", "conv3d");
    public static final OperatorMetatype MODULE_CONV3D = moduleConv("module_conv3d", "Conv3DOp", "conv3d",
            DEPTHWISE_CONV3D);
    public static final OperatorMetatype CONV3D = conv("conv3d", "Conv3DOp", "conv3d", MODULE_CONV3D);

    public static final OperatorMetatype MODULE_CONV_TRANSPOSE1D = moduleConv("module_conv_transpose1d",
            "ConvTranspose1DOp", "conv_transpose1d");
    public static final OperatorMetatype CONV_TRANSPOSE1D = conv("conv_transpose1d", "ConvTranspose1DOp",
            "conv_transpose1d", MODULE_CONV_TRANSPOSE1D);

    public static final OperatorMetatype MODULE_CONV_TRANSPOSE2D = moduleConv("module_conv_transpose2d",
            "ConvTranspose2DOp", "conv_transpose2d");
    public static final OperatorMetatype CONV_TRANSPOSE2D = conv("conv_transpose2d", "ConvTranspose2DOp",
            "conv_transpose2d", MODULE_CONV_TRANSPOSE2D);

    public static final OperatorMetatype MODULE_CONV_TRANSPOSE3D = moduleConv("module_conv_transpose3d",
            "ConvTranspose3DOp", "conv_transpose3d");
    public static final OperatorMetatype CONV_TRANSPOSE3D = conv("conv_transpose3d", "ConvTranspose3DOp",
            "conv_transpose3d", MODULE_CONV_TRANSPOSE3D);

    public static final OperatorMetatype MODULE_DEFORM_CONV2D = OperatorMetatype
            .builder("module_deform_conv2d", "DeformConv2dOp")
            .functional("deform_conv2d")
            .matcher(SubtypeMatcher.MODULE_CALL)
            .build();
    public static final OperatorMetatype DEFORM_CONV2D = OperatorMetatype.builder("deform_conv2d", "DeformConv2dOp")
            .functional("deform_conv2d")
            .subtypes(MODULE_DEFORM_CONV2D)
            .build();

    // ==================== Linear Algebra ====================

    public static final OperatorMetatype MODULE_LINEAR = OperatorMetatype.builder("module_linear", "LinearOp")
            .functional("linear")
            .torch("addmm")
            .hwConfigNames(MATMUL)
            .matcher(SubtypeMatcher.MODULE_CALL)
            .outputChannelAxis(-1)
            .build();
    public static final OperatorMetatype LINEAR = OperatorMetatype.builder("linear", "LinearOp")
            .functional("linear")
            .torch("addmm")
            .hwConfigNames(MATMUL)
            .subtypes(MODULE_LINEAR)
            .outputChannelAxis(-1)
            .build();

    public static final OperatorMetatype MATMUL_OP = OperatorMetatype.builder("matmul", "MatMulOp")
            .tensorMethods("matmul", "__matmul__")
            .torch("matmul", "bmm", "mm")
            .hwConfigNames(MATMUL)
            .build();

    // Port 0 of baddbmm is the bias added to the batched product; runtimes fuse it into the matmul.
    public static final OperatorMetatype BADDBMM = OperatorMetatype.builder("baddbmm", "MatMulOp")
            .torch("baddbmm")
            .hwConfigNames(MATMUL)
            .ignoredInputPorts(0)
            .build();

    // ==================== Activations ====================

    public static final OperatorMetatype HARDTANH = simple("hardtanh", "HardTanhOP").functional("hardtanh").build();
    public static final OperatorMetatype HARDSWISH = simple("hardswish", "HardSwishOp").functional("hardswish").build();
    public static final OperatorMetatype HARDSIGMOID = simple("hardsigmoid", "HardSigmoidOp")
            .functional("hardsigmoid").build();
    public static final OperatorMetatype TANH = simple("tanh", "TanhOp").functional("tanh").torch("tanh").build();
    public static final OperatorMetatype ELU = simple("elu", "EluOp").functional("elu", "elu_").build();
    public static final OperatorMetatype PRELU = simple("prelu", "PReluOp").functional("prelu").build();
    public static final OperatorMetatype LEAKY_RELU = simple("leaky_relu", "LeakyReluOp")
            .functional("leaky_relu").build();
    public static final OperatorMetatype GELU_OP = simple("gelu", "GeluOp").functional("gelu")
            .hwConfigNames(GELU).build();
    public static final OperatorMetatype SILU = simple("silu", "SiluOp").functional("silu").build();
    public static final OperatorMetatype SIGMOID = simple("sigmoid", "SigmoidOp")
            .functional("sigmoid").tensorMethods("sigmoid").torch("sigmoid").build();
    public static final OperatorMetatype RELU = simple("relu", "ReluOp").torch("relu", "relu_").build();
    public static final OperatorMetatype RELU6 = simple("relu6", "Relu6Op").functional("relu6").build();
    public static final OperatorMetatype THRESHOLD = simple("threshold", "ThresholdOp").functional("threshold").build();
    public static final OperatorMetatype SOFTMAX = simple("softmax", "SoftmaxOp").functional("softmax").build();

    // ==================== Normalization ====================

    public static final OperatorMetatype MODULE_LAYER_NORM = moduleBound("module_layer_norm", "LayerNormOp")
            .functional("layer_norm").hwConfigNames(MVN).build();
    public static final OperatorMetatype LAYER_NORM = simple("layer_norm", "LayerNormOp")
            .functional("layer_norm").hwConfigNames(MVN).subtypes(MODULE_LAYER_NORM).build();

    public static final OperatorMetatype MODULE_GROUP_NORM = moduleBound("module_group_norm", "GroupNormOp")
            .functional("group_norm").hwConfigNames(MVN).build();
    public static final OperatorMetatype GROUP_NORM = simple("group_norm", "GroupNormOp")
            .functional("group_norm").hwConfigNames(MVN).subtypes(MODULE_GROUP_NORM).build();

    public static final OperatorMetatype MODULE_BATCH_NORM = moduleBound("module_batch_norm", "BatchNormOp")
            .functional("batch_norm").build();
    public static final OperatorMetatype BATCH_NORM = simple("batch_norm", "BatchNormOp")
            .functional("batch_norm").subtypes(MODULE_BATCH_NORM).build();

    // ==================== Elementwise Arithmetic ====================

    public static final OperatorMetatype ADD_OP = simple("add", "AddOp")
            .tensorMethods("add", "__add__", "__iadd__", "__radd__").torch("add").hwConfigNames(ADD).build();
    public static final OperatorMetatype SUB = simple("sub", "SubOp")
            .tensorMethods("sub", "__sub__", "__isub__", "__rsub__").torch("sub").hwConfigNames(SUBTRACT).build();
    public static final OperatorMetatype MUL = simple("mul", "MulOp")
            .tensorMethods("mul", "__mul__", "__imul__", "__rmul__").torch("mul").hwConfigNames(MULTIPLY).build();
    public static final OperatorMetatype DIV = simple("div", "DivOp")
            .tensorMethods("__div__", "__idiv__", "__truediv__").torch("div").hwConfigNames(DIVIDE).build();
    public static final OperatorMetatype FLOOR_DIV = simple("floordiv", "FloordivOp")
            .tensorMethods("__floordiv__", "__ifloordiv__", "__rfloordiv__").build();
    public static final OperatorMetatype EXP = simple("exp", "ExpOp").torch("exp").build();
    public static final OperatorMetatype LOG = simple("log", "LogOp").torch("log").build();
    public static final OperatorMetatype ABS = simple("abs", "AbsOp").torch("abs").build();
    public static final OperatorMetatype ERF = simple("erf", "ErfOp").torch("erf").build();
    public static final OperatorMetatype ROUND = simple("round", "RoundOp").tensorMethods("round").build();
    public static final OperatorMetatype POWER_OP = simple("pow", "PowerOp")
            .tensorMethods("__pow__", "pow").torch("pow").hwConfigNames(POWER).build();
    public static final OperatorMetatype SQRT = simple("sqrt", "SqrtOp")
            .tensorMethods("sqrt", "sqrt_").torch("sqrt", "sqrt_").hwConfigNames(POWER).build();
    public static final OperatorMetatype MAX = simple("max", "MaxOp").torch("max")
            .hwConfigNames(MAXIMUM, REDUCEMAX).build();
    public static final OperatorMetatype MIN = simple("min", "MinOp").torch("min").hwConfigNames(MINIMUM).build();

    // ==================== Reductions ====================

    public static final OperatorMetatype MEAN = simple("mean", "MeanOp").tensorMethods("mean")
            .hwConfigNames(REDUCEMEAN).build();
    public static final OperatorMetatype SUM = simple("sum", "SumOp").tensorMethods("sum").torch("sum")
            .hwConfigNames(REDUCESUM).build();
    // normalize covers general L_p normalization
    public static final OperatorMetatype REDUCE_L2 = simple("reduce_l2", "ReduceL2").functional("normalize")
            .hwConfigNames(REDUCEL2).build();

    // ==================== Pooling ====================

    public static final OperatorMetatype AVG_POOL2D = simple("avg_pool2d", "AvgPool2DOp")
            .functional("avg_pool2d", "adaptive_avg_pool2d").hwConfigNames(AVGPOOL).build();
    public static final OperatorMetatype AVG_POOL3D = simple("avg_pool3d", "AvgPool3DOp")
            .functional("avg_pool3d", "adaptive_avg_pool3d").hwConfigNames(AVGPOOL).build();
    public static final OperatorMetatype MAX_POOL2D = simple("max_pool2d", "MaxPool2DOp")
            .functional("max_pool2d", "adaptive_max_pool2d").hwConfigNames(MAXPOOL).build();
    public static final OperatorMetatype MAX_POOL3D = simple("max_pool3d", "MaxPool3DOp")
            .functional("max_pool3d", "adaptive_max_pool3d").hwConfigNames(MAXPOOL).build();
    public static final OperatorMetatype MAX_UNPOOL1D = simple("max_unpool1d", "MaxUnPool1DOp")
            .functional("max_unpool1d").build();
    public static final OperatorMetatype MAX_UNPOOL2D = simple("max_unpool2d", "MaxUnPool2DOp")
            .functional("max_unpool2d").build();
    public static final OperatorMetatype MAX_UNPOOL3D = simple("max_unpool3d", "MaxUnPool3DOp")
            .functional("max_unpool3d").build();

    // ==================== Shape and Data Movement ====================

    public static final OperatorMetatype PAD = simple("pad", "PadOp").functional("pad").build();
    public static final OperatorMetatype CAT = simple("cat", "CatOp").torch("cat", "stack")
            .hwConfigNames(CONCAT).build();
    public static final OperatorMetatype TRANSPOSE_OP = simple("transpose", "TransposeOp")
            .tensorMethods("transpose", "permute", "transpose_").torch("transpose")
            .hwConfigNames(TRANSPOSE).build();
    public static final OperatorMetatype GATHER = simple("gather", "GatherOp")
            .tensorMethods("index_select", "__getitem__").torch("gather", "index_select", "where").build();
    public static final OperatorMetatype SCATTER = simple("scatter", "ScatterOp")
            .tensorMethods("scatter", "masked_fill", "masked_fill_").build();
    public static final OperatorMetatype RESHAPE_OP = simple("reshape", "ReshapeOp")
            .tensorMethods("reshape", "view", "flatten", "unsqueeze").torch("flatten", "unsqueeze")
            .hwConfigNames(RESHAPE, UNSQUEEZE, FLATTEN).build();
    public static final OperatorMetatype SQUEEZE_OP = simple("squeeze", "SqueezeOp")
            .tensorMethods("squeeze").torch("squeeze").hwConfigNames(SQUEEZE).build();
    public static final OperatorMetatype SPLIT_OP = simple("split", "SplitOp")
            .functional("split", "chunk", "unbind").hwConfigNames(SPLIT, CHUNK).build();
    public static final OperatorMetatype EXPAND = simple("expand", "ExpandOp").tensorMethods("expand").build();
    public static final OperatorMetatype EXPAND_AS = simple("expand_as", "ExpandAsOp")
            .tensorMethods("expand_as").build();
    public static final OperatorMetatype INTERPOLATE_OP = simple("interpolate", "InterpolateOp")
            .functional("interpolate").hwConfigNames(INTERPOLATE).build();
    public static final OperatorMetatype REPEAT = simple("repeat", "RepeatOp").torch("repeat_interleave")
            .hwConfigNames(TILE).build();
    public static final OperatorMetatype PIXEL_SHUFFLE = simple("pixel_shuffle", "PixelShuffleOp")
            .functional("pixel_shuffle").build();
    public static final OperatorMetatype DROPOUT = simple("dropout", "DropoutOp").functional("dropout").build();

    // ==================== Embeddings ====================

    public static final OperatorMetatype MODULE_EMBEDDING = moduleBound("module_embedding", "EmbeddingOp")
            .functional("embedding").hwConfigNames(EMBEDDING).build();
    public static final OperatorMetatype EMBEDDING_OP = simple("embedding", "EmbeddingOp")
            .functional("embedding").hwConfigNames(EMBEDDING).subtypes(MODULE_EMBEDDING).build();

    public static final OperatorMetatype MODULE_EMBEDDING_BAG = moduleBound("module_embedding_bag", "EmbeddingBagOp")
            .functional("embedding_bag").hwConfigNames(EMBEDDINGBAG).build();
    public static final OperatorMetatype EMBEDDING_BAG = simple("embedding_bag", "EmbeddingBagOp")
            .functional("embedding_bag").hwConfigNames(EMBEDDINGBAG).subtypes(MODULE_EMBEDDING_BAG).build();

    // ==================== Comparison and Logic ====================

    public static final OperatorMetatype LESS_OP = simple("less", "LessOp").tensorMethods("__lt__")
            .hwConfigNames(LESS).build();
    public static final OperatorMetatype LESS_EQUAL = simple("less_equal", "LessEqualOp").tensorMethods("__le__")
            .hwConfigNames(LESSEQUAL).build();
    public static final OperatorMetatype GREATER_OP = simple("greater", "GreaterOp").tensorMethods("__gt__")
            .hwConfigNames(GREATER).build();
    public static final OperatorMetatype GREATER_EQUAL = simple("greater_equal", "GreaterEqualOp")
            .tensorMethods("__ge__").hwConfigNames(GREATEREQUAL).build();
    public static final OperatorMetatype MOD = simple("mod", "ModOp").tensorMethods("__mod__")
            .hwConfigNames(FLOORMOD).build();
    public static final OperatorMetatype EQUALS = simple("equals", "EqualsOp").tensorMethods("__eq__")
            .hwConfigNames(EQUAL).build();
    public static final OperatorMetatype NOT_EQUAL = simple("not_equal", "NotEqualOp").tensorMethods("__ne__")
            .hwConfigNames(NOTEQUAL).build();
    public static final OperatorMetatype LOGICAL_OR = simple("logical_or", "LogicalOrOp").tensorMethods("__or__")
            .hwConfigNames(LOGICALOR).build();
    public static final OperatorMetatype LOGICAL_XOR = simple("logical_xor", "LogicalXorOp").tensorMethods("__xor__")
            .hwConfigNames(LOGICALXOR).build();
    public static final OperatorMetatype LOGICAL_AND = simple("logical_and", "LogicalAndOp").tensorMethods("__and__")
            .hwConfigNames(LOGICALAND).build();
    public static final OperatorMetatype LOGICAL_NOT = simple("logical_not", "LogicalNotOp")
            .tensorMethods("logical_not_").hwConfigNames(LOGICALNOT).build();

    // ==================== Groups ====================

    public static final Set<OperatorMetatype> INPUT_NOOP_METATYPES = Set.of(INPUT_NOOP);

    public static final Set<OperatorMetatype> OUTPUT_NOOP_METATYPES = Set.of(OUTPUT_NOOP);

    public static final Set<OperatorMetatype> NOOP_METATYPES = Set.of(NOOP);

    public static final Set<OperatorMetatype> OPERATORS_WITH_WEIGHTS = orderedSet(
            MODULE_CONV1D, MODULE_CONV2D, MODULE_CONV3D,
            DEPTHWISE_CONV1D, DEPTHWISE_CONV2D, DEPTHWISE_CONV3D,
            MODULE_LINEAR, MODULE_BATCH_NORM, MODULE_GROUP_NORM, MODULE_LAYER_NORM,
            MODULE_CONV_TRANSPOSE1D, MODULE_CONV_TRANSPOSE2D, MODULE_CONV_TRANSPOSE3D,
            MODULE_EMBEDDING, MODULE_EMBEDDING_BAG);

    public static final Set<OperatorMetatype> UNIFICATION_PRODUCING = orderedSet(
            MODULE_CONV1D, MODULE_CONV2D, MODULE_CONV3D,
            DEPTHWISE_CONV1D, DEPTHWISE_CONV2D, DEPTHWISE_CONV3D,
            MODULE_CONV_TRANSPOSE1D, MODULE_CONV_TRANSPOSE2D, MODULE_CONV_TRANSPOSE3D,
            MODULE_LINEAR);

    public static final Set<OperatorMetatype> OPERATORS_WITH_BIAS = orderedSet(
            MODULE_CONV1D, MODULE_CONV2D, MODULE_CONV3D,
            DEPTHWISE_CONV1D, DEPTHWISE_CONV2D, DEPTHWISE_CONV3D,
            MODULE_CONV_TRANSPOSE1D, MODULE_CONV_TRANSPOSE2D, MODULE_CONV_TRANSPOSE3D);

    public static final Set<OperatorMetatype> OPERATORS_FUSED = Set.of(MODULE_BATCH_NORM);

    /** Operator names of quantizer insertions, never part of a traced model's own graph. */
    public static final List<String> QUANTIZE_OPERATOR_NAMES = List.of("symmetric_quantize", "asymmetric_quantize");

    /**
     * Root metatypes in declaration order. Subtypes are reached through their roots.
     */
    public static final List<OperatorMetatype> ROOTS = List.of(
            INPUT_NOOP, OUTPUT_NOOP, NOOP,
            CONV1D, CONV2D, CONV3D,
            CONV_TRANSPOSE1D, CONV_TRANSPOSE2D, CONV_TRANSPOSE3D, DEFORM_CONV2D,
            LINEAR, MATMUL_OP, BADDBMM,
            HARDTANH, HARDSWISH, HARDSIGMOID, TANH, ELU, PRELU, LEAKY_RELU, GELU_OP, SILU, SIGMOID,
            RELU, RELU6, THRESHOLD, SOFTMAX,
            LAYER_NORM, GROUP_NORM, BATCH_NORM,
            ADD_OP, SUB, MUL, DIV, FLOOR_DIV, EXP, LOG, ABS, ERF, ROUND, POWER_OP, SQRT, MAX, MIN,
            MEAN, SUM, REDUCE_L2,
            AVG_POOL2D, AVG_POOL3D, MAX_POOL2D, MAX_POOL3D,
            MAX_UNPOOL1D, MAX_UNPOOL2D, MAX_UNPOOL3D,
            PAD, CAT, TRANSPOSE_OP, GATHER, SCATTER, RESHAPE_OP, SQUEEZE_OP, SPLIT_OP,
            EXPAND, EXPAND_AS, INTERPOLATE_OP, REPEAT, PIXEL_SHUFFLE, DROPOUT,
            EMBEDDING_OP, EMBEDDING_BAG,
            LESS_OP, LESS_EQUAL, GREATER_OP, GREATER_EQUAL, MOD, EQUALS, NOT_EQUAL,
            LOGICAL_OR, LOGICAL_XOR, LOGICAL_AND, LOGICAL_NOT);

    /**
     * Builds a new frozen registry containing every root metatype and its subtypes.
     *
     * @return a new registry
     * @throws MetatypeRegistrationException if the declarations above overlap
     */
    public static MetatypeRegistry createRegistry() {
        MetatypeRegistry registry = new MetatypeRegistry("pytorch", UNKNOWN);
        for (OperatorMetatype root : ROOTS) {
            registry.register(root);
        }
        return registry.freeze();
    }

    /**
     * The shared registry, created on first use.
     */
    public static MetatypeRegistry registry() {
        return RegistryHolder.INSTANCE;
    }

    /**
     * Operator names of every metatype that carries weights.
     */
    public static Set<String> opNamesWithWeights() {
        Set<String> names = new LinkedHashSet<>();
        for (OperatorMetatype metatype : OPERATORS_WITH_WEIGHTS) {
            names.addAll(metatype.aliases());
        }
        return names;
    }

    // ==================== Internal Helpers ====================

    private static final class RegistryHolder {
        static final MetatypeRegistry INSTANCE = createRegistry();
    }

    private static OperatorMetatype.Builder simple(String id, String name) {
        return OperatorMetatype.builder(id, name);
    }

    private static OperatorMetatype.Builder moduleBound(String id, String name) {
        return OperatorMetatype.builder(id, name).matcher(SubtypeMatcher.MODULE_CALL);
    }

    private static OperatorMetatype depthwiseConv(String id, String name, String functionName) {
        return OperatorMetatype.builder(id, name)
                .functional(functionName)
                .hwConfigNames(DEPTHWISECONVOLUTION)
                .matcher(SubtypeMatcher.DEPTHWISE_CONVOLUTION)
                .outputChannelAxis(1)
                .build();
    }

    private static OperatorMetatype moduleConv(String id, String name, String functionName,
                                               OperatorMetatype... subtypes) {
        return OperatorMetatype.builder(id, name)
                .functional(functionName)
                .hwConfigNames(CONVOLUTION)
                .matcher(SubtypeMatcher.MODULE_CALL)
                .subtypes(subtypes)
                .outputChannelAxis(1)
                .build();
    }

    private static OperatorMetatype conv(String id, String name, String functionName,
                                         OperatorMetatype moduleSubtype) {
        return OperatorMetatype.builder(id, name)
                .functional(functionName)
                .hwConfigNames(CONVOLUTION)
                .subtypes(moduleSubtype)
                .outputChannelAxis(1)
                .build();
    }

    private static Set<OperatorMetatype> orderedSet(OperatorMetatype... metatypes) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(metatypes)));
    }
}
