package com.pipedef.publisher.discovery;

/**
 * Thrown when a definition method cannot be invoked reflectively, or fails with a checked exception other
 * than {@link java.io.IOException}.
 */
public final class DefinitionInvocationException extends RuntimeException {

    public DefinitionInvocationException(String message) {
        super(message);
    }

    public DefinitionInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
