package io.surfworks.tracegraph.core.metatype;

/**
 * Namespaces from which traced operator names originate.
 */
public enum NamespaceTarget {
    TORCH_NN_FUNCTIONAL("torch.nn.functional"),
    TORCH_TENSOR("torch.tensor"),
    TORCH("torch"),
    EXTERNAL("external_function");

    private final String qualifiedName;

    NamespaceTarget(String qualifiedName) {
        this.qualifiedName = qualifiedName;
    }

    public String qualifiedName() {
        return qualifiedName;
    }
}
