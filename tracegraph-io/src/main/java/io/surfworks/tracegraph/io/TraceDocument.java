package io.surfworks.tracegraph.io;

import java.util.List;
import java.util.Objects;

import io.surfworks.tracegraph.core.trace.ModelInputSpec;
import io.surfworks.tracegraph.core.trace.Trace;

/**
 * A trace read from disk together with the declared model inputs.
 *
 * @param trace  the captured trace
 * @param inputs declared model inputs by position, or null when the document declares none
 */
public record TraceDocument(Trace trace, List<ModelInputSpec> inputs) {

    public TraceDocument {
        Objects.requireNonNull(trace, "trace cannot be null");
        inputs = inputs == null ? null : List.copyOf(inputs);
    }

    public boolean hasInputs() {
        return inputs != null;
    }
}
