package com.pipedef.publisher.publish;

import java.util.Objects;

/**
 * Outcome of one definition in a run. Immutable.
 */
public final class DefinitionResult {

    private final String definitionName;
    private final String targetPath;
    private final PublishOutcome outcome;
    private final String message;

    public DefinitionResult(String definitionName, String targetPath, PublishOutcome outcome, String message) {
        this.definitionName = Objects.requireNonNull(definitionName, "definitionName");
        this.targetPath = targetPath;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.message = message;
    }

    public static DefinitionResult published(String definitionName, String targetPath, PublishOutcome outcome) {
        return new DefinitionResult(definitionName, targetPath, outcome, null);
    }

    public static DefinitionResult validationFailed(String definitionName, String targetPath, String message) {
        return new DefinitionResult(definitionName, targetPath, PublishOutcome.VALIDATION_FAILED, message);
    }

    public static DefinitionResult publishError(String definitionName, String targetPath, String message) {
        return new DefinitionResult(definitionName, targetPath, PublishOutcome.PUBLISH_ERROR, message);
    }

    public String getDefinitionName() {
        return definitionName;
    }

    /** Resolved target path; null when resolution failed. */
    public String getTargetPath() {
        return targetPath;
    }

    public PublishOutcome getOutcome() {
        return outcome;
    }

    /** Error detail for failed outcomes; null otherwise. */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return definitionName + "=" + outcome + (message != null ? " (" + message + ")" : "");
    }
}
