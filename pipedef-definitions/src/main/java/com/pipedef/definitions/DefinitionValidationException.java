package com.pipedef.definitions;

import com.pipedef.definitions.validation.ValidationResult;

/**
 * Thrown by {@link DefinitionBase#validate()} when a definition's configuration is invalid.
 * Carries every error found so a single run reports all of them.
 */
public final class DefinitionValidationException extends RuntimeException {

    private final String definitionName;
    private final ValidationResult validationResult;

    public DefinitionValidationException(String definitionName, ValidationResult validationResult) {
        super(buildMessage(definitionName, validationResult));
        this.definitionName = definitionName;
        this.validationResult = validationResult;
    }

    public DefinitionValidationException(String definitionName, String error) {
        this(definitionName, ValidationResult.failure(error));
    }

    public String getDefinitionName() {
        return definitionName;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    private static String buildMessage(String definitionName, ValidationResult result) {
        if (result == null || result.getErrors().isEmpty()) {
            return "Definition " + definitionName + " is invalid";
        }
        return String.join("; ", result.getErrors());
    }
}
