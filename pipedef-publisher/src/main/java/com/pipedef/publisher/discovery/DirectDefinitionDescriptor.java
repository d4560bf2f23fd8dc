package com.pipedef.publisher.discovery;

import com.pipedef.definitions.DefinitionBase;

import java.io.IOException;
import java.util.Objects;

/**
 * Descriptor for a definition whose {@link DefinitionBase} is the publisher's own, so it is called directly.
 */
public final class DirectDefinitionDescriptor implements DefinitionDescriptor {

    private final DefinitionBase definition;

    public DirectDefinitionDescriptor(DefinitionBase definition) {
        this.definition = Objects.requireNonNull(definition, "definition");
    }

    @Override
    public String getName() {
        return definition.getClass().getSimpleName();
    }

    @Override
    public String getQualifiedName() {
        return definition.getClass().getName();
    }

    @Override
    public String getTargetPath() {
        return definition.getTargetPath();
    }

    @Override
    public void validate() {
        definition.validate();
    }

    @Override
    public void publish() throws IOException {
        definition.publish();
    }
}
