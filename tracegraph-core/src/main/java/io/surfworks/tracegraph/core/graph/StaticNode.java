package io.surfworks.tracegraph.core.graph;

import java.util.Objects;
import java.util.Set;

import io.surfworks.tracegraph.core.attributes.LayerAttributes;
import io.surfworks.tracegraph.core.metatype.OperatorMetatype;

/**
 * A node of a {@link StaticGraph}.
 *
 * <p>The id is taken from the originating trace node and never reassigned. Layer attributes
 * are the only mutable state; attribute derivation passes replace them in place.
 */
public final class StaticNode {

    private final int id;
    private final String name;
    private final String nodeType;
    private final OperatorMetatype metatype;
    private LayerAttributes layerAttributes;
    private final String layerName;
    private final boolean shared;
    private final boolean integerInput;
    private final boolean inIterationScope;
    private final Set<String> ignoredAlgorithms;

    private StaticNode(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name cannot be null");
        this.nodeType = Objects.requireNonNull(builder.nodeType, "nodeType cannot be null");
        this.metatype = Objects.requireNonNull(builder.metatype, "metatype cannot be null");
        this.layerAttributes = builder.layerAttributes;
        this.layerName = Objects.requireNonNull(builder.layerName, "layerName cannot be null");
        this.shared = builder.shared;
        this.integerInput = builder.integerInput;
        this.inIterationScope = builder.inIterationScope;
        this.ignoredAlgorithms = Set.copyOf(builder.ignoredAlgorithms);
    }

    public static Builder builder(int id, String nodeType, OperatorMetatype metatype) {
        return new Builder(id, nodeType, metatype);
    }

    public int id() {
        return id;
    }

    /**
     * Human-readable name, the operation address of the traced call.
     */
    public String name() {
        return name;
    }

    /**
     * Key used in structure dumps: {@code "<id> <name>"}.
     */
    public String key() {
        return id + " " + name;
    }

    /**
     * The traced operator name.
     */
    public String nodeType() {
        return nodeType;
    }

    public OperatorMetatype metatype() {
        return metatype;
    }

    /**
     * Layer attributes, or null if none were captured or derived.
     */
    public LayerAttributes layerAttributes() {
        return layerAttributes;
    }

    public void setLayerAttributes(LayerAttributes layerAttributes) {
        this.layerAttributes = layerAttributes;
    }

    /**
     * Canonical scope of the module that issued the call.
     */
    public String layerName() {
        return layerName;
    }

    /**
     * True when the owning module was invoked from more than one scope.
     */
    public boolean isShared() {
        return shared;
    }

    /**
     * True for model input nodes whose declared input is integer-valued.
     */
    public boolean isIntegerInput() {
        return integerInput;
    }

    public boolean isInIterationScope() {
        return inIterationScope;
    }

    public Set<String> ignoredAlgorithms() {
        return ignoredAlgorithms;
    }

    @Override
    public String toString() {
        return String.format("StaticNode[%s, type=%s, metatype=%s]", key(), nodeType, metatype.id());
    }

    public static final class Builder {
        private final int id;
        private final String nodeType;
        private final OperatorMetatype metatype;
        private String name;
        private LayerAttributes layerAttributes;
        private String layerName = "";
        private boolean shared;
        private boolean integerInput;
        private boolean inIterationScope;
        private Set<String> ignoredAlgorithms = Set.of();

        private Builder(int id, String nodeType, OperatorMetatype metatype) {
            this.id = id;
            this.nodeType = nodeType;
            this.metatype = metatype;
            this.name = String.valueOf(id);
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder layerAttributes(LayerAttributes layerAttributes) {
            this.layerAttributes = layerAttributes;
            return this;
        }

        public Builder layerName(String layerName) {
            this.layerName = layerName;
            return this;
        }

        public Builder shared(boolean shared) {
            this.shared = shared;
            return this;
        }

        public Builder integerInput(boolean integerInput) {
            this.integerInput = integerInput;
            return this;
        }

        public Builder inIterationScope(boolean inIterationScope) {
            this.inIterationScope = inIterationScope;
            return this;
        }

        public Builder ignoredAlgorithms(Set<String> ignoredAlgorithms) {
            this.ignoredAlgorithms = ignoredAlgorithms == null ? Set.of() : ignoredAlgorithms;
            return this;
        }

        public StaticNode build() {
            return new StaticNode(this);
        }
    }
}
