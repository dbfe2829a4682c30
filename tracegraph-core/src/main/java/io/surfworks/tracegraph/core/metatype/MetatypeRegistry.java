package io.surfworks.tracegraph.core.metatype;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

import io.surfworks.tracegraph.core.attributes.LayerAttributes;

/**
 * Catalog mapping traced operator names to their root {@link OperatorMetatype}.
 *
 * <p>Registering a metatype catalogs it and its whole subtype tree by id, and maps each
 * of its aliases to it. Metatypes in one subtype tree usually share aliases ({@code conv2d}
 * is an alias of the plain, module-bound and depthwise convolution metatypes); such overlaps
 * are tolerated and the outermost metatype owns the alias. Any other alias overlap is a
 * declaration error.
 *
 * <p>A registry is populated once and then frozen. A frozen registry is read-only and may
 * be shared between threads.
 *
 * <p>Example:
 * <pre>{@code
 * MetatypeRegistry registry = new MetatypeRegistry("torch", PyTorchMetatypes.UNKNOWN)
 *     .register(PyTorchMetatypes.CONV2D)
 *     .register(PyTorchMetatypes.DROPOUT)
 *     .freeze();
 *
 * OperatorMetatype root = registry.lookupByOperatorName("conv2d");
 * OperatorMetatype resolved = registry.resolve("conv2d", attributes, CallContext.MODULE_CALL);
 * }</pre>
 */
public final class MetatypeRegistry {

    private static final Logger LOG = Logger.getLogger(MetatypeRegistry.class.getName());

    private final String name;
    private final OperatorMetatype fallback;
    private final Map<String, OperatorMetatype> metatypesById = new LinkedHashMap<>();
    private final Map<String, OperatorMetatype> metatypesByOperatorName = new HashMap<>();
    private boolean frozen;

    /**
     * Creates an empty registry.
     *
     * @param name     registry name, used in messages
     * @param fallback metatype returned for unregistered operator names
     */
    public MetatypeRegistry(String name, OperatorMetatype fallback) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.fallback = Objects.requireNonNull(fallback, "fallback cannot be null");
        metatypesById.put(fallback.id(), fallback);
    }

    /**
     * Adds a metatype and its subtype tree.
     *
     * <p>The registry is left unchanged when registration fails.
     *
     * @param metatype the metatype to register
     * @return this registry for chaining
     * @throws MetatypeRegistrationException if an id is already taken by a different metatype,
     *                                       or an alias is already owned by an unrelated metatype
     * @throws IllegalStateException         if the registry is frozen
     */
    public MetatypeRegistry register(OperatorMetatype metatype) {
        if (frozen) {
            throw new IllegalStateException("Registry '" + name + "' is frozen");
        }

        List<OperatorMetatype> tree = metatype.subtree();
        for (OperatorMetatype member : tree) {
            OperatorMetatype existing = metatypesById.get(member.id());
            if (existing != null && existing != member) {
                throw new MetatypeRegistrationException(String.format(
                        "Metatype id '%s' is already registered in '%s'", member.id(), name));
            }
        }

        Map<String, OperatorMetatype> aliasUpdates = new HashMap<>();
        for (String alias : metatype.aliases()) {
            OperatorMetatype existing = metatypesByOperatorName.get(alias);
            if (existing == null || metatype.contains(existing)) {
                aliasUpdates.put(alias, metatype);
            } else if (!existing.contains(metatype)) {
                throw new MetatypeRegistrationException(String.format(
                        "Operator name '%s' of metatype '%s' is already registered to unrelated metatype '%s' in '%s'",
                        alias, metatype.id(), existing.id(), name));
            }
        }

        for (OperatorMetatype member : tree) {
            metatypesById.putIfAbsent(member.id(), member);
        }
        metatypesByOperatorName.putAll(aliasUpdates);
        return this;
    }

    /**
     * Makes the registry read-only.
     *
     * @return this registry
     */
    public MetatypeRegistry freeze() {
        if (!frozen) {
            frozen = true;
            LOG.fine(() -> String.format("Registry '%s' frozen with %d metatypes and %d operator names",
                    name, metatypesById.size(), metatypesByOperatorName.size()));
        }
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Returns the root metatype registered for an operator name.
     *
     * <p>Operator names come from arbitrary model code, so an unknown name is not an error:
     * the registry's fallback metatype is returned instead.
     *
     * @param operatorName the traced operator name
     * @return the registered metatype, or the fallback
     */
    public OperatorMetatype lookupByOperatorName(String operatorName) {
        OperatorMetatype metatype = metatypesByOperatorName.get(operatorName);
        return metatype != null ? metatype : fallback;
    }

    /**
     * Looks up any registered metatype, root or subtype, by id.
     */
    public Optional<OperatorMetatype> lookupById(String id) {
        return Optional.ofNullable(metatypesById.get(id));
    }

    /**
     * Finds the most specific subtype of {@code metatype} matching the call.
     *
     * @see OperatorMetatype#determineSubtype(LayerAttributes, CallContext)
     */
    public Optional<OperatorMetatype> determineSubtype(OperatorMetatype metatype,
                                                       LayerAttributes attributes,
                                                       CallContext context) {
        return metatype.determineSubtype(attributes, context);
    }

    /**
     * Looks up the root metatype of an operator name and narrows it to the most specific subtype.
     *
     * @param operatorName traced operator name
     * @param attributes   layer attributes, may be null
     * @param context      call context, may be null
     * @return the resolved metatype, never null
     * @throws AmbiguousSubtypeException if sibling subtypes both match
     */
    public OperatorMetatype resolve(String operatorName, LayerAttributes attributes, CallContext context) {
        OperatorMetatype metatype = lookupByOperatorName(operatorName);
        if (!metatype.hasSubtypes()) {
            return metatype;
        }
        return determineSubtype(metatype, attributes, context).orElse(metatype);
    }

    public boolean isRegistered(String operatorName) {
        return metatypesByOperatorName.containsKey(operatorName);
    }

    public OperatorMetatype fallback() {
        return fallback;
    }

    public String name() {
        return name;
    }

    /**
     * All registered metatypes, roots and subtypes, in registration order.
     */
    public List<OperatorMetatype> metatypes() {
        return Collections.unmodifiableList(new ArrayList<>(metatypesById.values()));
    }

    /**
     * All registered operator names, sorted.
     */
    public Set<String> operatorNames() {
        return Collections.unmodifiableSet(new TreeSet<>(metatypesByOperatorName.keySet()));
    }

    @Override
    public String toString() {
        return String.format("MetatypeRegistry[name=%s, metatypes=%d, operatorNames=%d]",
                name, metatypesById.size(), metatypesByOperatorName.size());
    }
}
