package io.surfworks.tracegraph.core.metatype;

import io.surfworks.tracegraph.core.TraceGraphException;

/**
 * Thrown when a metatype cannot be added to a {@link MetatypeRegistry}
 * because its id or one of its aliases collides with an existing entry.
 */
public class MetatypeRegistrationException extends TraceGraphException {

    public MetatypeRegistrationException(String message) {
        super(message);
    }
}
