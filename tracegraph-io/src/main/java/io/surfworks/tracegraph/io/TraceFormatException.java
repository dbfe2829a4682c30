package io.surfworks.tracegraph.io;

import io.surfworks.tracegraph.core.TraceGraphException;

/**
 * Thrown when a trace document is structurally invalid.
 */
public class TraceFormatException extends TraceGraphException {

    private final String location;

    public TraceFormatException(String location, String message) {
        super(location + ": " + message);
        this.location = location;
    }

    public TraceFormatException(String location, String message, Throwable cause) {
        super(location + ": " + message, cause);
        this.location = location;
    }

    /**
     * Path of the offending element, e.g. {@code nodes[3].operator}.
     */
    public String getLocation() {
        return location;
    }
}
