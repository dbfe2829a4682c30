package io.surfworks.tracegraph.core.tensor;

import java.util.Locale;

/**
 * Element types of traced tensors.
 *
 * <p>Parses both the short names used in serialized traces ({@code f32}, {@code i64})
 * and PyTorch dtype names ({@code float32}, {@code torch.int64}).
 */
public enum ScalarType {
    // Floating point
    F16(2, false, true, "f16"),
    BF16(2, false, true, "bf16"),
    F32(4, false, true, "f32"),
    F64(8, false, true, "f64"),

    // Integer types
    I8(1, true, false, "i8"),
    I16(2, true, false, "i16"),
    I32(4, true, false, "i32"),
    I64(8, true, false, "i64"),
    BOOL(1, false, false, "bool");

    private final int byteSize;
    private final boolean isInteger;
    private final boolean isFloating;
    private final String shortName;

    ScalarType(int byteSize, boolean isInteger, boolean isFloating, String shortName) {
        this.byteSize = byteSize;
        this.isInteger = isInteger;
        this.isFloating = isFloating;
        this.shortName = shortName;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isInteger() {
        return isInteger;
    }

    public boolean isFloating() {
        return isFloating;
    }

    /**
     * Short name used in serialized traces and graph dumps.
     */
    public String shortName() {
        return shortName;
    }

    /**
     * Parse a dtype name.
     *
     * @param name short name ("f32"), PyTorch name ("float32") or qualified PyTorch name ("torch.float32")
     * @return the scalar type
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static ScalarType fromName(String name) {
        String typeStr = name.toLowerCase(Locale.ROOT);
        if (typeStr.startsWith("torch.")) {
            typeStr = typeStr.substring("torch.".length());
        }

        return switch (typeStr) {
            case "f16", "float16", "half" -> F16;
            case "bf16", "bfloat16" -> BF16;
            case "f32", "float32", "float" -> F32;
            case "f64", "float64", "double" -> F64;
            case "i8", "int8", "uint8" -> I8;
            case "i16", "int16", "short" -> I16;
            case "i32", "int32", "int" -> I32;
            case "i64", "int64", "long" -> I64;
            case "bool", "i1" -> BOOL;
            default -> throw new IllegalArgumentException("Unknown scalar type: " + name);
        };
    }
}
