package com.pipedef.publisher.discovery;

import java.io.IOException;

/**
 * What the publisher needs from a discovered definition: where it renders to, a self check, and the render
 * itself. Implemented over a definition instance by {@link DirectDefinitionDescriptor} or
 * {@link ReflectiveDefinitionDescriptor}.
 */
public interface DefinitionDescriptor {

    /** Simple name of the definition type, used in log lines. */
    String getName();

    /** Fully-qualified name of the definition type. */
    String getQualifiedName();

    /** Path the definition publishes to; may be null or blank when the definition is misconfigured. */
    String getTargetPath();

    /** Throws when the definition's configuration is invalid. */
    void validate();

    /** Renders the definition and writes it to {@link #getTargetPath()}. */
    void publish() throws IOException;
}
