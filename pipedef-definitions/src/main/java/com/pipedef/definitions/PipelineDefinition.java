package com.pipedef.definitions;

import com.pipedef.definitions.model.Pipeline;
import com.pipedef.definitions.serialization.YamlSerializer;
import com.pipedef.definitions.validation.PipelineValidator;
import com.pipedef.definitions.validation.ValidationResult;

/**
 * Definition of one pipeline. Subclasses name the target file and build the {@link Pipeline} model;
 * validation and YAML rendering are provided.
 *
 * <pre>{@code
 * public class BuildPipeline extends PipelineDefinition {
 *     public String getTargetFile() { return "eng/pipelines/build.yml"; }
 *     public Pipeline getPipeline() {
 *         return new Pipeline().steps(new InlineBashTask("./build.sh").displayName("Build"));
 *     }
 * }
 * }</pre>
 */
public abstract class PipelineDefinition extends DefinitionBase {

    private static final PipelineValidator VALIDATOR = new PipelineValidator();

    /** Builds the in-memory pipeline. Called on every validate and publish. */
    public abstract Pipeline getPipeline();

    @Override
    protected ValidationResult validateDefinition() {
        return VALIDATOR.validate(getPipeline());
    }

    @Override
    public String serialize() {
        return YamlSerializer.serialize(getPipeline());
    }
}
