/**
 * Pipeline definitions base library.
 * <ul>
 *   <li>{@link com.pipedef.definitions.DefinitionBase} – contract discovered by the publisher: target path, validate, publish</li>
 *   <li>{@link com.pipedef.definitions.PipelineDefinition} – typed pipeline definition rendered to YAML</li>
 *   <li>{@link com.pipedef.definitions.model} – pipeline and step model</li>
 *   <li>{@link com.pipedef.definitions.serialization} – YAML rendering</li>
 *   <li>{@link com.pipedef.definitions.validation} – validation rules and results</li>
 * </ul>
 */
package com.pipedef.definitions;
