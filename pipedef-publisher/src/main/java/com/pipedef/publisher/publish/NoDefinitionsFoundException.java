package com.pipedef.publisher.publish;

/**
 * Thrown when a module contains no definitions, which usually means the wrong module was given.
 */
public final class NoDefinitionsFoundException extends RuntimeException {

    public NoDefinitionsFoundException(String source, String contractTypeName) {
        super("No definitions deriving from " + contractTypeName + " found in " + source);
    }
}
