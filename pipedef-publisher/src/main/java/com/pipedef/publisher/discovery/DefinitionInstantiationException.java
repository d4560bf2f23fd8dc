package com.pipedef.publisher.discovery;

/**
 * Thrown when a discovered definition type cannot be instantiated through its no-arg constructor.
 * Fatal for the run: the module contains a malformed definition.
 */
public final class DefinitionInstantiationException extends RuntimeException {

    private final String typeName;

    public DefinitionInstantiationException(String typeName, String message, Throwable cause) {
        super(message, cause);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
