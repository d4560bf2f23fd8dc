/**
 * Validation of definitions: {@link com.pipedef.definitions.validation.ValidationResult} collects errors,
 * {@link com.pipedef.definitions.validation.PipelineValidator} holds the structural rules for pipelines.
 */
package com.pipedef.definitions.validation;
