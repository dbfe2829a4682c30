package io.surfworks.tracegraph.core;

/**
 * Base exception for invariant violations raised while converting or rewriting graphs.
 *
 * <p>These are not recoverable runtime conditions: they indicate a defect in the trace
 * producer, the metatype declarations, or the caller's choice of rewrite targets.
 */
public class TraceGraphException extends RuntimeException {

    public TraceGraphException(String message) {
        super(message);
    }

    public TraceGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
