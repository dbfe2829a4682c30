package io.surfworks.tracegraph.core.metatype;

import java.util.List;

import io.surfworks.tracegraph.core.TraceGraphException;

/**
 * Thrown when more than one sibling subtype matches the same operator call.
 */
public class AmbiguousSubtypeException extends TraceGraphException {

    private final OperatorMetatype parent;
    private final List<OperatorMetatype> matches;

    public AmbiguousSubtypeException(OperatorMetatype parent, List<OperatorMetatype> matches) {
        super(String.format("Multiple subtypes of %s match operator call - cannot determine single subtype: %s",
                parent.id(), matches.stream().map(OperatorMetatype::id).toList()));
        this.parent = parent;
        this.matches = List.copyOf(matches);
    }

    public OperatorMetatype getParent() {
        return parent;
    }

    public List<OperatorMetatype> getMatches() {
        return matches;
    }
}
