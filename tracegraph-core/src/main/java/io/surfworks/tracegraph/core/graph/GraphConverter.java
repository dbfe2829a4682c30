package io.surfworks.tracegraph.core.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.tracegraph.core.metatype.CallContext;
import io.surfworks.tracegraph.core.metatype.MetatypeRegistry;
import io.surfworks.tracegraph.core.metatype.OperatorMetatype;
import io.surfworks.tracegraph.core.metatype.PyTorchMetatypes;
import io.surfworks.tracegraph.core.trace.ModelInputSpec;
import io.surfworks.tracegraph.core.trace.Scope;
import io.surfworks.tracegraph.core.trace.Trace;
import io.surfworks.tracegraph.core.trace.TraceEdge;
import io.surfworks.tracegraph.core.trace.TraceNode;

/**
 * Converts a captured {@link Trace} into a {@link StaticGraph}.
 *
 * <p>For every trace node the converter:
 * <ol>
 *   <li>picks the canonical scope of the owning module: the lexicographically least of all
 *       scopes the module was called from (a module called from several scopes is shared);</li>
 *   <li>resolves the metatype from the operator name, narrowed to the most specific subtype
 *       for the node's attributes and call context;</li>
 *   <li>tags model inputs whose declared input is integer-valued.</li>
 * </ol>
 * Edges are copied verbatim. Finally the configured {@link AttributeDerivationPass} runs.
 *
 * <p>Conversion is a pure function of the trace and input specs. The only failure is an
 * {@link io.surfworks.tracegraph.core.metatype.AmbiguousSubtypeException} from overlapping
 * subtype declarations.
 *
 * <p>Example:
 * <pre>{@code
 * StaticGraph graph = GraphConverter.defaults().convert(trace, inputSpecs);
 * }</pre>
 */
public final class GraphConverter {

    private static final Logger LOG = Logger.getLogger(GraphConverter.class.getName());

    private final MetatypeRegistry registry;
    private final AttributeDerivationPass attributeDerivation;

    public GraphConverter(MetatypeRegistry registry, AttributeDerivationPass attributeDerivation) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.attributeDerivation = Objects.requireNonNull(attributeDerivation, "attributeDerivation cannot be null");
    }

    public GraphConverter(MetatypeRegistry registry) {
        this(registry, AttributeDerivationPass.NONE);
    }

    /**
     * Converter over the shared PyTorch registry with no attribute derivation.
     */
    public static GraphConverter defaults() {
        return new GraphConverter(PyTorchMetatypes.registry());
    }

    /**
     * Converts a trace.
     *
     * @param trace      the captured trace
     * @param inputSpecs declared model inputs by position, or null if unknown
     * @return a new graph holding one node per trace node and one edge per trace edge
     */
    public StaticGraph convert(Trace trace, List<ModelInputSpec> inputSpecs) {
        Map<Long, List<Scope>> scopesByModule = sortedScopesByModule(trace.nodes());

        StaticGraph graph = new StaticGraph();
        for (TraceNode traceNode : trace.nodes()) {
            OperatorMetatype metatype = resolveMetatype(traceNode);

            Scope canonicalScope = traceNode.scope();
            boolean shared = false;
            if (traceNode.hasOwningModule()) {
                List<Scope> moduleScopes = scopesByModule.get(traceNode.owningModuleId());
                canonicalScope = moduleScopes.get(0);
                shared = moduleScopes.size() > 1;
            }

            graph.addNode(StaticNode.builder(traceNode.id(), traceNode.operatorName(), metatype)
                    .name(traceNode.address().toString())
                    .layerAttributes(traceNode.layerAttributes())
                    .layerName(canonicalScope.toString())
                    .shared(shared)
                    .integerInput(isIntegerInput(traceNode, metatype, inputSpecs))
                    .inIterationScope(traceNode.inIterationScope())
                    .ignoredAlgorithms(traceNode.ignoredAlgorithms())
                    .build());
        }

        for (TraceEdge traceEdge : trace.edges()) {
            graph.addEdge(new StaticEdge(
                    traceEdge.fromNodeId(),
                    traceEdge.toNodeId(),
                    traceEdge.tensorShape(),
                    traceEdge.dtype(),
                    traceEdge.inputPortId(),
                    traceEdge.outputPortId(),
                    traceEdge.parallelInputPortIds()));
        }

        attributeDerivation.apply(graph);

        LOG.fine(() -> String.format("Converted %s into %s (%d owning modules)",
                trace, graph, scopesByModule.size()));
        return graph;
    }

    // ==================== Internal Helpers ====================

    /**
     * Distinct call scopes per owning module, sorted by their string form.
     */
    private static Map<Long, List<Scope>> sortedScopesByModule(List<TraceNode> nodes) {
        Map<Long, Set<Scope>> scopes = new HashMap<>();
        for (TraceNode node : nodes) {
            if (node.hasOwningModule()) {
                scopes.computeIfAbsent(node.owningModuleId(), k -> new LinkedHashSet<>()).add(node.scope());
            }
        }

        Map<Long, List<Scope>> sorted = new HashMap<>();
        for (Map.Entry<Long, Set<Scope>> entry : scopes.entrySet()) {
            List<Scope> list = new ArrayList<>(entry.getValue());
            list.sort(Comparator.comparing(Scope::toString));
            sorted.put(entry.getKey(), list);
        }
        return sorted;
    }

    private OperatorMetatype resolveMetatype(TraceNode node) {
        OperatorMetatype metatype = registry.lookupByOperatorName(node.operatorName());
        if (metatype.hasSubtypes()) {
            metatype = registry.determineSubtype(metatype, node.layerAttributes(), CallContext.of(node))
                    .orElse(metatype);
        }
        return metatype;
    }

    private static boolean isIntegerInput(TraceNode node, OperatorMetatype metatype,
                                          List<ModelInputSpec> inputSpecs) {
        if (inputSpecs == null || !PyTorchMetatypes.INPUT_NOOP_METATYPES.contains(metatype)) {
            return false;
        }
        int inputIndex = node.callOrder();
        if (inputIndex < 0 || inputIndex >= inputSpecs.size()) {
            return false;
        }
        return inputSpecs.get(inputIndex).isIntegerInput();
    }
}
