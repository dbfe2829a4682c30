package io.surfworks.tracegraph.core.metatype;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

import io.surfworks.tracegraph.core.attributes.LayerAttributes;

/**
 * Semantic classification of a traced operator.
 *
 * <p>A metatype groups operator names that share a meaning: the addition metatype
 * covers {@code add}, {@code __add__}, {@code __iadd__} and {@code __radd__}. A metatype
 * may declare subtypes, each a narrower metatype carrying a {@link SubtypeMatcher}. The
 * subtypes form a tree that is resolved top-down by {@link #determineSubtype}:
 *
 * <pre>{@code
 * conv2d                      (root, no matcher)
 *   └── module_conv2d         (matches calls inside a module)
 *         └── depthwise_conv2d (matches groups == in_channels > 1)
 * }</pre>
 *
 * <p>Instances are immutable. Equality is by {@link #id()}.
 */
public final class OperatorMetatype {

    private final String id;
    private final String name;
    private final Map<NamespaceTarget, List<String>> functionNames;
    private final List<OperatorMetatype> subtypes;
    private final SubtypeMatcher matcher;
    private final Integer outputChannelAxis;
    private final Set<Integer> ignoredInputPorts;
    private final List<HwConfigOpName> hwConfigNames;

    private OperatorMetatype(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        Map<NamespaceTarget, List<String>> names = new EnumMap<>(NamespaceTarget.class);
        builder.functionNames.forEach((target, list) -> names.put(target, List.copyOf(list)));
        this.functionNames = Collections.unmodifiableMap(names);
        this.subtypes = List.copyOf(builder.subtypes);
        this.matcher = builder.matcher;
        this.outputChannelAxis = builder.outputChannelAxis;
        this.ignoredInputPorts = Collections.unmodifiableSet(new TreeSet<>(builder.ignoredInputPorts));
        this.hwConfigNames = List.copyOf(builder.hwConfigNames);
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    /**
     * Unique identifier within a registry.
     */
    public String id() {
        return id;
    }

    /**
     * Canonical operator name. Several metatypes in one subtype tree share the same name.
     */
    public String name() {
        return name;
    }

    /**
     * Operator names per namespace that this metatype is registered under.
     */
    public Map<NamespaceTarget, List<String>> functionNames() {
        return functionNames;
    }

    /**
     * All operator names this metatype is registered under, across namespaces.
     */
    public Set<String> aliases() {
        Set<String> aliases = new LinkedHashSet<>();
        for (List<String> names : functionNames.values()) {
            aliases.addAll(names);
        }
        return Collections.unmodifiableSet(aliases);
    }

    public List<OperatorMetatype> subtypes() {
        return subtypes;
    }

    public boolean hasSubtypes() {
        return !subtypes.isEmpty();
    }

    /**
     * The match predicate, present only for subtypes.
     */
    public Optional<SubtypeMatcher> matcher() {
        return Optional.ofNullable(matcher);
    }

    public boolean isSubtype() {
        return matcher != null;
    }

    public OptionalInt outputChannelAxis() {
        return outputChannelAxis == null ? OptionalInt.empty() : OptionalInt.of(outputChannelAxis);
    }

    /**
     * Input ports whose producers must not be treated as consumers of this operator,
     * such as the bias operand of {@code baddbmm}.
     */
    public Set<Integer> ignoredInputPorts() {
        return ignoredInputPorts;
    }

    public List<HwConfigOpName> hwConfigNames() {
        return hwConfigNames;
    }

    /**
     * Returns true if this subtype's predicate accepts the call. Root metatypes never match.
     */
    public boolean matches(LayerAttributes attributes, CallContext context) {
        return matcher != null && matcher.matches(attributes, context);
    }

    /**
     * Finds the most specific subtype that matches the call.
     *
     * <p>Every direct subtype is tested. With no match the result is empty and this
     * metatype stands. With exactly one match the search continues below it, and the
     * deepest match is returned. Two or more matches at the same level mean the
     * declarations overlap.
     *
     * @param attributes layer attributes of the node, may be null
     * @param context    call context of the node, may be null
     * @return the deepest matching subtype, or empty if none matches
     * @throws AmbiguousSubtypeException if sibling subtypes both match
     */
    public Optional<OperatorMetatype> determineSubtype(LayerAttributes attributes, CallContext context) {
        OperatorMetatype current = this;
        OperatorMetatype deepest = null;
        while (current.hasSubtypes()) {
            List<OperatorMetatype> matches = new ArrayList<>();
            for (OperatorMetatype subtype : current.subtypes) {
                if (subtype.matches(attributes, context)) {
                    matches.add(subtype);
                }
            }
            if (matches.size() > 1) {
                throw new AmbiguousSubtypeException(current, matches);
            }
            if (matches.isEmpty()) {
                break;
            }
            deepest = matches.get(0);
            current = deepest;
        }
        return Optional.ofNullable(deepest);
    }

    /**
     * Returns true if {@code other} is this metatype or lies anywhere in its subtype tree.
     */
    public boolean contains(OperatorMetatype other) {
        if (this.equals(other)) {
            return true;
        }
        for (OperatorMetatype subtype : subtypes) {
            if (subtype.contains(other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * This metatype followed by all of its subtypes, depth first.
     */
    public List<OperatorMetatype> subtree() {
        List<OperatorMetatype> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(OperatorMetatype metatype, List<OperatorMetatype> out) {
        out.add(metatype);
        for (OperatorMetatype subtype : metatype.subtypes) {
            collect(subtype, out);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperatorMetatype that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }

    /**
     * Builder for {@link OperatorMetatype}. Subtypes must be built before their parent.
     */
    public static final class Builder {
        private final String id;
        private final String name;
        private final Map<NamespaceTarget, List<String>> functionNames = new EnumMap<>(NamespaceTarget.class);
        private final List<OperatorMetatype> subtypes = new ArrayList<>();
        private SubtypeMatcher matcher;
        private Integer outputChannelAxis;
        private final Set<Integer> ignoredInputPorts = new TreeSet<>();
        private final List<HwConfigOpName> hwConfigNames = new ArrayList<>();

        private Builder(String id, String name) {
            this.id = Objects.requireNonNull(id, "id cannot be null");
            this.name = Objects.requireNonNull(name, "name cannot be null");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id cannot be blank");
            }
        }

        public Builder functionNames(NamespaceTarget target, String... names) {
            functionNames.computeIfAbsent(target, k -> new ArrayList<>()).addAll(Arrays.asList(names));
            return this;
        }

        /** Names from {@code torch.nn.functional}. */
        public Builder functional(String... names) {
            return functionNames(NamespaceTarget.TORCH_NN_FUNCTIONAL, names);
        }

        /** Method names on {@code torch.Tensor}. */
        public Builder tensorMethods(String... names) {
            return functionNames(NamespaceTarget.TORCH_TENSOR, names);
        }

        /** Names from the top-level {@code torch} namespace. */
        public Builder torch(String... names) {
            return functionNames(NamespaceTarget.TORCH, names);
        }

        /** Names of operators registered outside the framework namespaces. */
        public Builder external(String... names) {
            return functionNames(NamespaceTarget.EXTERNAL, names);
        }

        public Builder subtypes(OperatorMetatype... subtypes) {
            for (OperatorMetatype subtype : subtypes) {
                if (!subtype.isSubtype()) {
                    throw new IllegalArgumentException(
                            "Metatype '" + subtype.id() + "' has no matcher and cannot be a subtype of '" + id + "'");
                }
                this.subtypes.add(subtype);
            }
            return this;
        }

        public Builder matcher(SubtypeMatcher matcher) {
            this.matcher = Objects.requireNonNull(matcher, "matcher cannot be null");
            return this;
        }

        public Builder outputChannelAxis(int axis) {
            this.outputChannelAxis = axis;
            return this;
        }

        public Builder ignoredInputPorts(Integer... ports) {
            ignoredInputPorts.addAll(Arrays.asList(ports));
            return this;
        }

        public Builder hwConfigNames(HwConfigOpName... names) {
            hwConfigNames.addAll(Arrays.asList(names));
            return this;
        }

        public OperatorMetatype build() {
            return new OperatorMetatype(this);
        }
    }
}
