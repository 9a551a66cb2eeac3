package com.registry.depgraph.api;

/** The interface description lacks the structure needed to identify references. */
public class MalformedInterfaceException extends DependencyGraphException {
    public MalformedInterfaceException(String message) {
        super(message);
    }

    public MalformedInterfaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
