package com.pipedef.publisher.loader;

/**
 * Thrown when the definitions module or one of its dependencies cannot be loaded. Fatal for the run.
 */
public final class ModuleLoadException extends RuntimeException {

    public ModuleLoadException(String message) {
        super(message);
    }

    public ModuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
